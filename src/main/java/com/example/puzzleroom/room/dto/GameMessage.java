package com.example.puzzleroom.room.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 서버 → 클라이언트 이벤트 공통 포맷
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GameMessage {

    private MessageType type;
    private String roomCode;
    private String username;
    private String content;
    private Long timestamp;

    private Map<String, Object> data;

    public static GameMessage of(MessageType type, String roomCode, Map<String, Object> data) {
        return GameMessage.builder()
                .type(type)
                .roomCode(roomCode)
                .data(data)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public static GameMessage error(String content) {
        return GameMessage.builder()
                .type(MessageType.ERROR)
                .content(content)
                .timestamp(System.currentTimeMillis())
                .build();
    }
}

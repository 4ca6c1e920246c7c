package com.example.puzzleroom.room.service;

import com.example.puzzleroom.room.domain.Player;
import com.example.puzzleroom.room.domain.Room;
import com.example.puzzleroom.room.dto.GameMessage;
import com.example.puzzleroom.room.dto.MessageType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 방/연결 단위 메시지 전송
 *
 * 방 락을 잡은 채로 호출된다. 브로커 채널에 넣기만 하고 네트워크 전송을 기다리지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomEventBroadcaster {

    private static final String ROOM_TOPIC_PREFIX = "/topic/room.";
    private static final String PRIVATE_QUEUE = "/queue/private";

    private final SimpMessagingTemplate messagingTemplate;

    /**
     * 방 전체에 전송
     */
    public void broadcastToRoom(String roomCode, GameMessage message) {
        messagingTemplate.convertAndSend(ROOM_TOPIC_PREFIX + roomCode, message);
    }

    public void broadcast(String roomCode, MessageType type, Map<String, Object> data) {
        broadcastToRoom(roomCode, GameMessage.of(type, roomCode, data));
    }

    // ================== 개인 메시지 ================== //

    /**
     * 특정 연결에만 전송 (Principal 이름 = STOMP 세션 id)
     */
    public void sendToConnection(String connectionId, GameMessage message) {
        try {
            messagingTemplate.convertAndSendToUser(connectionId, PRIVATE_QUEUE, message);
        } catch (Exception e) {
            log.error("개인 메시지 전송 실패: connectionId={}, type={}", connectionId, message.getType(), e);
        }
    }

    /**
     * 보낸 사람을 제외한 방 인원에게 전송
     */
    public void sendToOthers(Room room, String excludedConnectionId, GameMessage message) {
        for (Player player : room.getPlayers()) {
            if (!player.getConnectionId().equals(excludedConnectionId)) {
                sendToConnection(player.getConnectionId(), message);
            }
        }
    }

    /**
     * 에러 메시지 전송. 고정 문구만 보낸다.
     */
    public void sendError(String connectionId, String safeMessage) {
        sendToConnection(connectionId, GameMessage.error(safeMessage));
    }
}

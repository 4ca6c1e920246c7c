package com.example.puzzleroom.global.dto;

/**
 * REST 응답 포맷. timestamp는 STOMP 이벤트(GameMessage)와 같은 서버 시각(ms)이다.
 */
public record CommonResponse<T>(
        boolean success,
        T data,
        String message,
        long timestamp
) {
    public static <T> CommonResponse<T> success(T data, String message) {
        return new CommonResponse<>(true, data, message, System.currentTimeMillis());
    }
}

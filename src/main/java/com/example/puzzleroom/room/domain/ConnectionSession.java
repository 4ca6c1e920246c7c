package com.example.puzzleroom.room.domain;

import java.time.Instant;

/**
 * 연결 → 방 라우팅 정보. roomCode는 소유하지 않는 역참조이며 연결 해제 정리에만 쓴다.
 */
public record ConnectionSession(
        String connectionId,
        String username,
        String roomCode,
        Instant connectedAt) {

    public static ConnectionSession connected(String connectionId) {
        return new ConnectionSession(connectionId, null, null, Instant.now());
    }

    public ConnectionSession joined(String username, String roomCode) {
        return new ConnectionSession(connectionId, username, roomCode, connectedAt);
    }

    public ConnectionSession left() {
        return new ConnectionSession(connectionId, null, null, connectedAt);
    }

    public boolean inRoom() {
        return roomCode != null;
    }
}

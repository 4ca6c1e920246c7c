package com.example.puzzleroom.room.repository;

import com.example.puzzleroom.global.store.GuardedStore;
import com.example.puzzleroom.room.domain.ConnectionSession;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * 연결 id → 세션 레지스트리
 */
@Repository
public class SessionRepository {

    private final GuardedStore<String, ConnectionSession> sessions = new GuardedStore<>();

    public Optional<ConnectionSession> findById(String connectionId) {
        return sessions.get(connectionId);
    }

    public void save(ConnectionSession session) {
        sessions.set(session.connectionId(), session);
    }

    /**
     * 세션이 읽은 그대로일 때만 교체. 그 사이 끊겼거나 다른 방에 들어갔으면 false.
     */
    public boolean replace(ConnectionSession expected, ConnectionSession replacement) {
        return sessions.replace(expected.connectionId(), expected, replacement);
    }

    /**
     * 세션이 아직 roomCode 방을 가리키면 방 없는 세션으로 되돌린다. 연결은 살아 있으므로 지우지 않는다.
     */
    public void detach(String connectionId, String roomCode) {
        findById(connectionId)
                .filter(session -> roomCode.equals(session.roomCode()))
                .ifPresent(session -> replace(session, session.left()));
    }

    public Optional<ConnectionSession> delete(String connectionId) {
        return sessions.delete(connectionId);
    }

    public int count() {
        return sessions.size();
    }
}

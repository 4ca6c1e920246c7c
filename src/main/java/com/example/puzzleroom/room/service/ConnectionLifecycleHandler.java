package com.example.puzzleroom.room.service;

import com.example.puzzleroom.room.domain.ConnectionSession;
import com.example.puzzleroom.room.repository.SessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 연결 수립/종료 처리
 *
 * 끊긴 연결의 플레이어 제거는 명시적 퇴장과 같은 방 락 경로를 탄다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionLifecycleHandler {

    private final SessionRepository sessionRepository;
    private final RoomService roomService;

    public void onConnect(String connectionId) {
        sessionRepository.save(ConnectionSession.connected(connectionId));
        log.debug("연결 등록: {}", connectionId);
    }

    /**
     * 세션을 먼저 원자적으로 지운다. 지운 시점에 방에 있었으면 방에서도 뺀다.
     * 입장이 방 락을 기다리는 중이었다면 그 입장은 세션 교체에 실패해 취소된다.
     */
    public void onDisconnect(String connectionId) {
        Optional<ConnectionSession> removed = sessionRepository.delete(connectionId);
        if (removed.isEmpty()) {
            log.debug("세션 없는 연결 종료: {}", connectionId);
            return;
        }
        if (removed.get().inRoom()) {
            roomService.departRoom(removed.get(), false);
        }
        log.debug("연결 해제: {}", connectionId);
    }
}

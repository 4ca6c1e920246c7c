package com.example.puzzleroom.room.service;

import com.example.puzzleroom.global.concurrency.LockStrategy;
import com.example.puzzleroom.global.concurrency.LockStrategyFactory;
import com.example.puzzleroom.global.concurrency.LockTimeoutException;
import com.example.puzzleroom.global.config.RoomProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * 방 단위 락 헬퍼
 *
 * 방을 읽고-고치고-쓰는 모든 경로는 이 클래스를 거친다.
 * 락 안에서 퍼즐 생성 같은 느린 작업을 하지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomLocks {

    private static final String ROOM_PREFIX = "room:";
    private static final String CREATION_PREFIX = "room_creation:";

    private final LockStrategyFactory lockStrategyFactory;
    private final RoomProperties roomProperties;

    public static String roomKey(String roomCode) {
        return ROOM_PREFIX + roomCode;
    }

    public static String creationKey(String roomCode) {
        return CREATION_PREFIX + roomCode;
    }

    public <T> T withRoomLock(String roomCode, Supplier<T> action) {
        return strategy().executeWithLock(roomKey(roomCode), roomProperties.getLockTimeout(), action);
    }

    public void withRoomLock(String roomCode, Runnable action) {
        strategy().executeWithLock(roomKey(roomCode), roomProperties.getLockTimeout(), action);
    }

    public <T> T withCreationLock(String roomCode, Supplier<T> action) {
        return strategy().executeWithLock(creationKey(roomCode), roomProperties.getCreationLockTimeout(), action);
    }

    /**
     * 기다리지 않고 한 번만 시도. 누가 잡고 있으면 건너뛴다.
     *
     * @return 실행했으면 true
     */
    public boolean tryWithRoomLock(String roomCode, Runnable action) {
        try {
            strategy().executeWithLock(roomKey(roomCode), Duration.ZERO, action);
            return true;
        } catch (LockTimeoutException e) {
            log.debug("사용 중인 방 건너뜀: {}", roomCode);
            return false;
        }
    }

    private LockStrategy strategy() {
        return lockStrategyFactory.getConfiguredStrategy();
    }
}

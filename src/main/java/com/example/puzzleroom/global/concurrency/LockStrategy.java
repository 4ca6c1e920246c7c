package com.example.puzzleroom.global.concurrency;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * 이름 기반 자원 락 인터페이스
 * 구현체를 교체해도 호출부(acquire/release by name)는 그대로 유지된다.
 *
 * 사용법:
 * - 방 변경: "room:" + roomCode
 * - 방 코드 선점: "room_creation:" + roomCode
 */
public interface LockStrategy {

    /**
     * 락 획득
     *
     * @param resourceName 락을 식별하는 이름 (예: "room:123456")
     * @param timeout      최대 대기 시간
     * @return 해제 시 제시해야 하는 토큰
     * @throws LockTimeoutException 대기 시간 안에 획득하지 못한 경우
     */
    LockToken acquire(String resourceName, Duration timeout);

    /**
     * 락 해제. 토큰이 현재 보유자와 다르면 아무것도 하지 않는다.
     *
     * @return 실제로 해제했으면 true
     */
    boolean release(String resourceName, LockToken token);

    boolean isLocked(String resourceName);

    /**
     * 현재 보유 중인 락 목록 (모니터링용)
     */
    List<LockInfo> heldLocks();

    /**
     * 락을 획득하고 비즈니스 로직을 실행. 예외가 나도 락은 반드시 해제된다.
     */
    default <T> T executeWithLock(String resourceName, Duration timeout, Supplier<T> action) {
        LockToken token = acquire(resourceName, timeout);
        try {
            return action.get();
        } finally {
            release(resourceName, token);
        }
    }

    /**
     * 반환값 없는 로직용 오버로드
     */
    default void executeWithLock(String resourceName, Duration timeout, Runnable action) {
        executeWithLock(resourceName, timeout, () -> {
            action.run();
            return null;
        });
    }

    /**
     * 전략 이름 반환 (로깅/설정 매핑용)
     */
    String getStrategyName();
}

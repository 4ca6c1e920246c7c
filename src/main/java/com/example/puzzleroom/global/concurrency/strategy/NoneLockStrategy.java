package com.example.puzzleroom.global.concurrency.strategy;

import com.example.puzzleroom.global.concurrency.LockInfo;
import com.example.puzzleroom.global.concurrency.LockStrategy;
import com.example.puzzleroom.global.concurrency.LockToken;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * 락 없음 전략 (대조군)
 * 토큰만 발급하고 실제로는 아무것도 막지 않는다 - 정원 초과, 중복 시작 발생 가능
 *
 * 동시성 테스트의 baseline으로 사용
 */
@Component
public class NoneLockStrategy implements LockStrategy {

    @Override
    public LockToken acquire(String resourceName, Duration timeout) {
        return LockToken.issue(resourceName);
    }

    @Override
    public boolean release(String resourceName, LockToken token) {
        return token != null;
    }

    @Override
    public boolean isLocked(String resourceName) {
        return false;
    }

    @Override
    public List<LockInfo> heldLocks() {
        return List.of();
    }

    @Override
    public String getStrategyName() {
        return "NONE";
    }
}

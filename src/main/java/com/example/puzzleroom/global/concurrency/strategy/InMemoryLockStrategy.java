package com.example.puzzleroom.global.concurrency.strategy;

import com.example.puzzleroom.global.concurrency.LockInfo;
import com.example.puzzleroom.global.concurrency.LockStrategy;
import com.example.puzzleroom.global.concurrency.LockTimeoutException;
import com.example.puzzleroom.global.concurrency.LockToken;
import com.example.puzzleroom.global.config.RoomProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 단일 JVM 토큰 락 전략
 *
 * 동작 방식:
 * - 자원 이름별로 {토큰, 획득 시각, 보유 스레드}를 기록
 * - 이미 잡혀 있으면 해제 신호(Condition) 또는 타임아웃까지 대기
 * - 보유 시간이 staleThreshold를 넘은 락은 보유자가 죽은 것으로 보고 회수
 *
 * 주의:
 * - 권고(advisory) 락이다. 방을 바꾸는 모든 경로가 이 락을 거쳐야 의미가 있다.
 * - 재진입을 지원하지 않는다. 같은 스레드가 같은 이름을 두 번 잡으면 타임아웃(또는 stale 회수)까지 막힌다.
 */
@Slf4j
@Component
public class InMemoryLockStrategy implements LockStrategy {

    private final Duration staleThreshold;

    private final ReentrantLock mutex = new ReentrantLock();
    private final Condition released = mutex.newCondition();
    private final Map<String, LockToken> locks = new HashMap<>();

    @Autowired
    public InMemoryLockStrategy(RoomProperties roomProperties) {
        this(roomProperties.getStaleLockThreshold());
    }

    public InMemoryLockStrategy(Duration staleThreshold) {
        this.staleThreshold = staleThreshold;
    }

    @Override
    public LockToken acquire(String resourceName, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();

        mutex.lock();
        try {
            while (true) {
                LockToken holder = locks.get(resourceName);
                if (holder == null) {
                    LockToken token = LockToken.issue(resourceName);
                    locks.put(resourceName, token);
                    return token;
                }

                Duration heldFor = Duration.between(holder.acquiredAt(), Instant.now());
                if (heldFor.compareTo(staleThreshold) > 0) {
                    log.warn("stale 락 회수: resource={}, heldFor={}ms, ownerThread={}",
                            resourceName, heldFor.toMillis(), holder.ownerThreadId());
                    locks.remove(resourceName);
                    continue;
                }

                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    log.warn("락 획득 타임아웃: resource={}, timeout={}ms", resourceName, timeout.toMillis());
                    throw new LockTimeoutException(resourceName);
                }

                // stale 판정 시점이 먼저 오면 그때 다시 깨어나서 확인
                long untilStale = staleThreshold.minus(heldFor).toNanos();
                long waitNanos = Math.max(1L, Math.min(remaining, untilStale));
                released.await(waitNanos, TimeUnit.NANOSECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockTimeoutException(resourceName);
        } finally {
            mutex.unlock();
        }
    }

    @Override
    public boolean release(String resourceName, LockToken token) {
        if (token == null) {
            return false;
        }
        mutex.lock();
        try {
            LockToken holder = locks.get(resourceName);
            if (holder == null || !holder.id().equals(token.id())) {
                log.debug("락 해제 무시 (보유자 아님): resource={}", resourceName);
                return false;
            }
            locks.remove(resourceName);
            released.signalAll();
            return true;
        } finally {
            mutex.unlock();
        }
    }

    @Override
    public boolean isLocked(String resourceName) {
        mutex.lock();
        try {
            return locks.containsKey(resourceName);
        } finally {
            mutex.unlock();
        }
    }

    @Override
    public List<LockInfo> heldLocks() {
        mutex.lock();
        try {
            Instant now = Instant.now();
            List<LockInfo> result = new ArrayList<>(locks.size());
            for (LockToken token : locks.values()) {
                result.add(new LockInfo(
                        token.resourceName(),
                        Duration.between(token.acquiredAt(), now).toMillis(),
                        token.ownerThreadId()));
            }
            return result;
        } finally {
            mutex.unlock();
        }
    }

    @Override
    public String getStrategyName() {
        return "IN_MEMORY";
    }
}

package com.example.puzzleroom.global.concurrency;

import java.time.Instant;
import java.util.UUID;

/**
 * 락 획득 시 발급되는 토큰. 해제할 때 같은 토큰을 제시해야 한다.
 */
public record LockToken(
        String resourceName,
        String id,
        Instant acquiredAt,
        long ownerThreadId) {

    public static LockToken issue(String resourceName) {
        return new LockToken(
                resourceName,
                UUID.randomUUID().toString(),
                Instant.now(),
                Thread.currentThread().getId());
    }
}

package com.example.puzzleroom.global.concurrency;

public enum LockType {
    NONE, // 락 없음 (대조군)
    IN_MEMORY // 단일 JVM 토큰 락 + stale 회수
}

package com.example.puzzleroom.global.concurrency;

public record LockInfo(
        String resource,
        long heldForMillis,
        long ownerThreadId) {
}

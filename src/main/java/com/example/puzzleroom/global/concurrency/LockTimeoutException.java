package com.example.puzzleroom.global.concurrency;

import lombok.Getter;

/**
 * 제한 시간 안에 락을 얻지 못했을 때 발생. 호출자는 "방이 바쁨, 재시도"로 취급한다.
 */
@Getter
public class LockTimeoutException extends RuntimeException {

    private final String resourceName;

    public LockTimeoutException(String resourceName) {
        super("락 획득 실패 (타임아웃): " + resourceName);
        this.resourceName = resourceName;
    }
}

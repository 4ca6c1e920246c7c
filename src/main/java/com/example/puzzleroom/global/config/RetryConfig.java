package com.example.puzzleroom.global.config;

import com.example.puzzleroom.global.concurrency.LockTimeoutException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

/**
 * Spring Retry 설정
 *
 * 방 생성 중 락 타임아웃이 나면 유휴 방을 정리하고 한 번만 더 시도한다.
 * 그래도 실패하면 RecoveryCallback에서 CAPACITY_EXCEEDED로 바꾼다.
 */
@Configuration
public class RetryConfig {

    @Bean
    public RetryTemplate roomCreationRetryTemplate() {
        return RetryTemplate.builder()
                .maxAttempts(2)
                .fixedBackoff(100)
                .retryOn(LockTimeoutException.class)
                .build();
    }
}

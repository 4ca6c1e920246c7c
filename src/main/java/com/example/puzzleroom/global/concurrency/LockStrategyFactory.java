package com.example.puzzleroom.global.concurrency;

import com.example.puzzleroom.global.config.RoomProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import jakarta.annotation.PostConstruct;

/**
 * 락 전략 팩토리
 * LockType에 따라 적절한 LockStrategy 구현체를 반환하고,
 * room.lock-strategy 설정으로 방 변경에 쓸 기본 전략을 결정한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LockStrategyFactory {

    private final List<LockStrategy> strategies;
    private final RoomProperties roomProperties;
    private final Map<LockType, LockStrategy> strategyMap = new EnumMap<>(LockType.class);

    @PostConstruct
    public void init() {
        for (LockStrategy strategy : strategies) {
            LockType type = LockType.valueOf(strategy.getStrategyName());
            if (strategyMap.putIfAbsent(type, strategy) != null) {
                throw new IllegalStateException("락 전략 중복 등록: " + type);
            }
        }
        if (roomProperties.getLockStrategy() == LockType.NONE) {
            log.warn("room.lock-strategy=NONE: 방 변경이 동기화되지 않습니다. 진단용으로만 사용하세요.");
        }
    }

    /**
     * LockType에 해당하는 전략 반환
     *
     * @param type 락 타입
     * @return 해당 락 전략 구현체
     * @throws IllegalArgumentException 지원하지 않는 락 타입인 경우
     */
    public LockStrategy getStrategy(LockType type) {
        LockStrategy strategy = strategyMap.get(type);
        if (strategy == null) {
            throw new IllegalArgumentException("지원하지 않는 락 타입: " + type);
        }
        return strategy;
    }

    /**
     * 설정된 기본 전략
     */
    public LockStrategy getConfiguredStrategy() {
        return getStrategy(roomProperties.getLockStrategy());
    }
}

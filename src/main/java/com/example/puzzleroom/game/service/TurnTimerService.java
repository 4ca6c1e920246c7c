package com.example.puzzleroom.game.service;

import com.example.puzzleroom.global.config.RoomProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * 턴 제한 시간 타이머 (room.turn-timeout, 0이면 비활성)
 *
 * 방마다 예약 작업은 하나뿐이다. 새로 예약하면 이전 작업은 취소된다.
 */
@Slf4j
@Service
public class TurnTimerService {

    private final TaskScheduler taskScheduler;
    private final RoomProperties roomProperties;

    // 방별 예약 작업 (roomCode -> ScheduledFuture)
    private final Map<String, ScheduledFuture<?>> scheduledTasks = new ConcurrentHashMap<>();

    public TurnTimerService(@Qualifier("taskScheduler") TaskScheduler taskScheduler, RoomProperties roomProperties) {
        this.taskScheduler = taskScheduler;
        this.roomProperties = roomProperties;
    }

    public boolean isEnabled() {
        Duration timeout = roomProperties.getTurnTimeout();
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }

    /**
     * 지금부터 turn-timeout 뒤에 task 실행
     */
    public void schedule(String roomCode, Runnable task) {
        if (!isEnabled()) {
            return;
        }
        cancel(roomCode);

        Instant executionTime = Instant.now().plus(roomProperties.getTurnTimeout());
        ScheduledFuture<?> future = taskScheduler.schedule(() -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("턴 타이머 작업 실행 중 오류 발생: room={}", roomCode, e);
            }
        }, executionTime);

        scheduledTasks.put(roomCode, future);
        log.debug("턴 타이머 설정됨: room={}, time={}", roomCode, executionTime);
    }

    public void cancel(String roomCode) {
        ScheduledFuture<?> future = scheduledTasks.remove(roomCode);
        if (future != null) {
            future.cancel(false);
        }
    }

    public boolean isScheduled(String roomCode) {
        ScheduledFuture<?> future = scheduledTasks.get(roomCode);
        return future != null && !future.isDone();
    }
}

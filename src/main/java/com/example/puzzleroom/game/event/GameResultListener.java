package com.example.puzzleroom.game.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * 게임 결과 기록 (fire-and-forget)
 *
 * 방 처리 스레드와 분리되어 실행되며, 실패해도 게임 진행에는 영향이 없다.
 */
@Slf4j
@Component
public class GameResultListener {

    @Async
    @EventListener
    public void onGameEnded(GameEndedEvent event) {
        try {
            log.info("게임 결과 기록: room={}, mode={}, winner={}, players={}, endedAt={}",
                    event.roomCode(), event.gameMode(), event.winner(), event.results().size(), event.endedAt());
            event.results().forEach(result -> log.debug("  {}위 {} score={} time={} eliminated={}",
                    result.rank(), result.username(), result.score(), result.time(), result.eliminated()));
        } catch (Exception e) {
            log.error("게임 결과 기록 실패: room={}", event.roomCode(), e);
        }
    }
}

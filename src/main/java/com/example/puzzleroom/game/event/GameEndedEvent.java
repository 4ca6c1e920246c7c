package com.example.puzzleroom.game.event;

import com.example.puzzleroom.game.domain.RankedResult;
import com.example.puzzleroom.room.domain.GameMode;

import java.time.Instant;
import java.util.List;

/**
 * 라운드 종료 요약. 리더보드 저장소로 넘어간다.
 *
 * @param winner 동시 탈락 등으로 승자가 없으면 null
 */
public record GameEndedEvent(
        String roomCode,
        GameMode gameMode,
        String winner,
        List<RankedResult> results,
        Instant endedAt) {
}

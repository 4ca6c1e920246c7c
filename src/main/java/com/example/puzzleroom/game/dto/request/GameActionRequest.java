package com.example.puzzleroom.game.dto.request;

import com.example.puzzleroom.game.domain.GameAction;

/**
 * 범위 밖 좌표나 모르는 action은 검증 오류가 아니라 조용히 버려진다 (GameService).
 */
public record GameActionRequest(
        GameAction action,
        Integer row,
        Integer col,
        Integer clicks) {
}

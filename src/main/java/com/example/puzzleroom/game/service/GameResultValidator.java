package com.example.puzzleroom.game.service;

import com.example.puzzleroom.global.config.RoomProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 클라이언트가 보고한 값은 믿지 않고 범위 안으로 잘라낸다.
 */
@Component
@RequiredArgsConstructor
public class GameResultValidator {

    private final RoomProperties roomProperties;

    public int clampScore(Integer score) {
        return clamp(score, roomProperties.getMaxScore());
    }

    public int clampTime(Integer time) {
        return clamp(time, roomProperties.getMaxTimeSeconds());
    }

    public int clampClicks(Integer clicks) {
        return clamp(clicks, roomProperties.getMaxClicks());
    }

    public boolean isCoordinateInRange(Integer row, Integer col) {
        return inRange(row) && inRange(col);
    }

    private boolean inRange(Integer value) {
        return value != null && value >= 0 && value <= roomProperties.getMaxCoordinate();
    }

    private static int clamp(Integer value, int max) {
        if (value == null || value < 0) {
            return 0;
        }
        return Math.min(value, max);
    }
}

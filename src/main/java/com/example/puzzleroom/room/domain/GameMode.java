package com.example.puzzleroom.room.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum GameMode {
    RACE("race"),             // 각자 독립적으로 풀고 점수/시간으로 순위
    TURN_BASED("turn-based"); // 한 번에 한 명씩, 탈락하지 않은 마지막 1인이 승리 (Luck 모드)

    private final String value;

    GameMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static GameMode from(String raw) {
        if (raw == null) {
            return null;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "race", "standard" -> RACE;
            case "turn-based", "turn_based", "turn", "luck" -> TURN_BASED;
            default -> throw new IllegalArgumentException("지원하지 않는 게임 모드: " + raw);
        };
    }
}

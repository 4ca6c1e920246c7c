package com.example.puzzleroom.game.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum GameAction {
    REVEAL,     // 칸 열기, 턴제에서는 턴을 소모
    FLAG,       // 깃발, 턴을 소모하지 않음
    ELIMINATED; // 지뢰를 밟아 탈락

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 모르는 값은 null. 호출부에서 조용히 버린다.
     */
    @JsonCreator
    public static GameAction from(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (GameAction action : values()) {
            if (action.name().equals(normalized)) {
                return action;
            }
        }
        return null;
    }

    public boolean needsCell() {
        return this != ELIMINATED;
    }
}

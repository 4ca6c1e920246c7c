package com.example.puzzleroom.room.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Difficulty {
    EASY("Easy"),
    MEDIUM("Medium"),
    HARD("Hard"),
    EXPERT("Expert"),
    EVIL("Evil");

    private final String label;

    Difficulty(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * 알 수 없는 값은 MEDIUM으로 처리
     */
    @JsonCreator
    public static Difficulty from(String raw) {
        if (raw == null) {
            return MEDIUM;
        }
        for (Difficulty difficulty : values()) {
            if (difficulty.label.equalsIgnoreCase(raw.trim())) {
                return difficulty;
            }
        }
        return MEDIUM;
    }
}

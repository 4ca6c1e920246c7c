package com.example.puzzleroom.room.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MessageType {
    ROOM_CREATED,
    ROOM_JOINED,
    PLAYER_JOINED,
    PLAYER_LEFT,
    LEFT_ROOM,
    PLAYER_READY_UPDATE,
    GAME_START,
    PLAYER_ACTION,
    TURN_CHANGED,
    PLAYER_ELIMINATED,
    PLAYER_FINISHED,
    CELL_UPDATE,
    MISTAKE,
    HINT_PROVIDED,
    GAME_ENDED,
    ERROR;

    /**
     * 클라이언트에는 소문자 snake_case로 나간다 (예: game_start)
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.example.puzzleroom.room.dto.request;

import com.example.puzzleroom.room.domain.Difficulty;
import com.example.puzzleroom.room.domain.GameMode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateRoomRequest(
        @NotBlank @Size(max = 50) String username,
        @Min(2) @Max(10) Integer maxPlayers,
        GameMode gameMode,
        Difficulty difficulty) {

    private static final int DEFAULT_MAX_PLAYERS = 3;

    public int maxPlayersOrDefault() {
        return maxPlayers != null ? maxPlayers : DEFAULT_MAX_PLAYERS;
    }

    public GameMode gameModeOrDefault() {
        return gameMode != null ? gameMode : GameMode.RACE;
    }

    public Difficulty difficultyOrDefault() {
        return difficulty != null ? difficulty : Difficulty.MEDIUM;
    }
}

package com.example.puzzleroom.room.dto.request;

import com.example.puzzleroom.room.domain.GameMode;
import jakarta.validation.constraints.NotNull;

public record ChangeModeRequest(@NotNull GameMode gameMode) {
}

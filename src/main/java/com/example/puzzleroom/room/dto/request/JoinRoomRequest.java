package com.example.puzzleroom.room.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record JoinRoomRequest(
        @NotBlank String roomCode,
        @NotBlank @Size(max = 50) String username) {
}

package com.example.puzzleroom.room.dto.response;

import com.example.puzzleroom.room.domain.Difficulty;
import com.example.puzzleroom.room.domain.GameMode;
import com.example.puzzleroom.room.domain.Room;
import com.example.puzzleroom.room.domain.RoomStatus;

public record RoomListResponse(
        String roomCode,
        String host,
        Difficulty difficulty,
        GameMode gameMode,
        int players,
        int maxPlayers,
        RoomStatus status) {

    public static RoomListResponse from(Room room) {
        return new RoomListResponse(
                room.getCode(),
                room.getHost(),
                room.getDifficulty(),
                room.getGameMode(),
                room.getPlayers().size(),
                room.getMaxPlayers(),
                room.getStatus());
    }
}

package com.example.puzzleroom.room.dto.response;

import com.example.puzzleroom.room.domain.Difficulty;
import com.example.puzzleroom.room.domain.GameMode;
import com.example.puzzleroom.room.domain.Room;
import com.example.puzzleroom.room.domain.RoomStatus;

import java.util.List;

public record RoomResponse(
        String roomCode,
        String host,
        Difficulty difficulty,
        GameMode gameMode,
        RoomStatus status,
        int maxPlayers,
        String currentTurn,
        List<PlayerView> players) {

    public static RoomResponse from(Room room) {
        return new RoomResponse(
                room.getCode(),
                room.getHost(),
                room.getDifficulty(),
                room.getGameMode(),
                room.getStatus(),
                room.getMaxPlayers(),
                room.getCurrentTurn(),
                PlayerView.listOf(room));
    }
}

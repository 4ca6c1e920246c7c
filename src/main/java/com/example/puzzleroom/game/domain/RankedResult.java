package com.example.puzzleroom.game.domain;

import com.example.puzzleroom.room.domain.Player;

public record RankedResult(
        int rank,
        String username,
        int score,
        int time,
        boolean eliminated) {

    public static RankedResult of(int rank, Player player) {
        return new RankedResult(rank, player.getUsername(), player.getScore(), player.getTime(), player.isEliminated());
    }
}

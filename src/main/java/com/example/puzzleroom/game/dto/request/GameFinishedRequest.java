package com.example.puzzleroom.game.dto.request;

public record GameFinishedRequest(
        Integer score,
        Integer time) {
}

package com.example.puzzleroom.game.dto.request;

/**
 * number 0은 칸 지우기, 1~9는 입력
 */
public record PlaceNumberRequest(
        Integer row,
        Integer col,
        Integer number) {
}

package com.example.puzzleroom.game.puzzle;

public record SudokuHint(int row, int col, int number) {
}

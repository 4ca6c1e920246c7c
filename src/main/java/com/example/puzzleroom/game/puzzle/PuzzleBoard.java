package com.example.puzzleroom.game.puzzle;

import com.example.puzzleroom.room.domain.Difficulty;

/**
 * 퍼즐 엔진이 발급한 보드 핸들
 *
 * 지뢰판은 클라이언트가 seed로 복원하고, 스도쿠는 sudoku의 문제 칸이 그대로 나간다.
 */
public record PuzzleBoard(
        long seed,
        Difficulty difficulty,
        int rows,
        int cols,
        int mines,
        SudokuGrid sudoku) {

    public boolean contains(int row, int col) {
        return row >= 0 && row < rows && col >= 0 && col < cols;
    }
}

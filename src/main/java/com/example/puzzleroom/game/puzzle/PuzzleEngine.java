package com.example.puzzleroom.game.puzzle;

import com.example.puzzleroom.room.domain.Difficulty;

import java.util.Optional;

/**
 * 보드 생성/수 검증. 방에 대해 아무것도 모르는 순수 함수 집합이다.
 *
 * generate는 느릴 수 있으므로 방 락을 잡은 상태에서 호출하면 안 된다.
 * 나머지는 칸 몇 개를 보는 정도라 락 안에서 불러도 된다.
 */
public interface PuzzleEngine {

    PuzzleBoard generate(Difficulty difficulty);

    /**
     * reveal/flag 좌표가 보드 위에 있는지
     */
    boolean isOnBoard(PuzzleBoard board, int row, int col);

    /**
     * 스도쿠 칸에 value를 놓는 수가 정답인지. 0(지우기)은 항상 맞다.
     */
    boolean validateMove(SudokuGrid grid, int row, int col, int value);

    boolean isComplete(SudokuGrid grid, int[][] cells);

    /**
     * 비어 있는 칸 하나의 정답. 다 채워졌으면 empty.
     */
    Optional<SudokuHint> hint(SudokuGrid grid, int[][] cells);
}

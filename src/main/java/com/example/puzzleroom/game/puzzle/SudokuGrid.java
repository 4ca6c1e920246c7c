package com.example.puzzleroom.game.puzzle;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * 9x9 스도쿠 문제와 정답. 0은 빈 칸이다.
 *
 * 정답은 서버 밖으로 나가지 않는다.
 */
public record SudokuGrid(
        int[][] givens,
        @JsonIgnore int[][] solution) {

    public static final int SIZE = 9;

    public SudokuGrid {
        givens = copy(givens);
        solution = copy(solution);
    }

    @Override
    public int[][] givens() {
        return copy(givens);
    }

    @JsonIgnore
    @Override
    public int[][] solution() {
        return copy(solution);
    }

    public boolean isGiven(int row, int col) {
        return givens[row][col] != 0;
    }

    public int solutionAt(int row, int col) {
        return solution[row][col];
    }

    public int givenCount() {
        int count = 0;
        for (int[] line : givens) {
            for (int value : line) {
                if (value != 0) {
                    count++;
                }
            }
        }
        return count;
    }

    public static boolean contains(int row, int col) {
        return row >= 0 && row < SIZE && col >= 0 && col < SIZE;
    }

    static int[][] copy(int[][] source) {
        int[][] target = new int[source.length][];
        for (int i = 0; i < source.length; i++) {
            target[i] = source[i].clone();
        }
        return target;
    }
}

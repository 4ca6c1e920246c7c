package com.example.puzzleroom.game.domain;

import com.example.puzzleroom.game.puzzle.SudokuGrid;
import lombok.Getter;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 한 라운드 동안 방이 함께 채우는 스도쿠 판과 플레이어별 실수/힌트/입력 기록
 *
 * 방 락 안에서만 읽고 쓴다. 라운드가 시작될 때마다 새로 만든다.
 */
public class SudokuProgress {

    @Getter
    private final SudokuGrid grid;
    private final int[][] cells;
    private final Map<String, Integer> mistakes = new LinkedHashMap<>();
    private final Map<String, Integer> hintsUsed = new LinkedHashMap<>();
    /** username → (칸 번호 → 숫자) */
    private final Map<String, Map<Integer, Integer>> placements = new HashMap<>();

    public SudokuProgress(SudokuGrid grid) {
        this.grid = grid;
        this.cells = grid.givens();
    }

    /**
     * 칸을 덮어쓴다. 0이면 지운다. 같은 칸에 대한 그 사람의 이전 입력은 사라진다.
     */
    public void place(String username, int row, int col, int number) {
        cells[row][col] = number;
        int cell = row * SudokuGrid.SIZE + col;
        Map<Integer, Integer> own = placements.computeIfAbsent(username, key -> new HashMap<>());
        if (number == 0) {
            own.remove(cell);
        } else {
            own.put(cell, number);
        }
    }

    public int recordMistake(String username) {
        return mistakes.merge(username, 1, Integer::sum);
    }

    public int recordHint(String username) {
        return hintsUsed.merge(username, 1, Integer::sum);
    }

    public int placementsOf(String username) {
        return placements.getOrDefault(username, Map.of()).size();
    }

    public int[][] cells() {
        int[][] copy = new int[cells.length][];
        for (int i = 0; i < cells.length; i++) {
            copy[i] = cells[i].clone();
        }
        return copy;
    }

    public Map<String, Integer> mistakes() {
        return Map.copyOf(mistakes);
    }

    public Map<String, Integer> hintsUsed() {
        return Map.copyOf(hintsUsed);
    }
}

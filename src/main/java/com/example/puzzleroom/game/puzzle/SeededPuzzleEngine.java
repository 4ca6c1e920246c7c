package com.example.puzzleroom.game.puzzle;

import com.example.puzzleroom.room.domain.Difficulty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 시드 기반 지뢰판 + 백트래킹 스도쿠 발급기
 *
 * 지뢰판 칸 배치는 클라이언트가 seed로 결정한다.
 */
@Slf4j
@Component
public class SeededPuzzleEngine implements PuzzleEngine {

    private static final int BOX = 3;

    private final SecureRandom random = new SecureRandom();

    @Override
    public PuzzleBoard generate(Difficulty difficulty) {
        long seed;
        do {
            seed = random.nextLong() & Long.MAX_VALUE;
        } while (seed == 0L);

        SudokuGrid sudoku = generateSudoku(cluesFor(difficulty));
        PuzzleBoard board = switch (difficulty) {
            case EASY -> new PuzzleBoard(seed, difficulty, 9, 9, 10, sudoku);
            case MEDIUM -> new PuzzleBoard(seed, difficulty, 16, 16, 40, sudoku);
            case HARD -> new PuzzleBoard(seed, difficulty, 16, 30, 99, sudoku);
            case EXPERT -> new PuzzleBoard(seed, difficulty, 24, 30, 180, sudoku);
            case EVIL -> new PuzzleBoard(seed, difficulty, 30, 30, 225, sudoku);
        };
        log.debug("보드 생성: difficulty={}, {}x{}, clues={}", difficulty, board.rows(), board.cols(), sudoku.givenCount());
        return board;
    }

    /**
     * 남겨 둘 스도쿠 힌트 칸 수
     */
    static int cluesFor(Difficulty difficulty) {
        return switch (difficulty) {
            case EASY -> 40;
            case MEDIUM -> 30;
            case HARD -> 25;
            case EXPERT -> 22;
            case EVIL -> 17;
        };
    }

    @Override
    public boolean isOnBoard(PuzzleBoard board, int row, int col) {
        return board != null && board.contains(row, col);
    }

    @Override
    public boolean validateMove(SudokuGrid grid, int row, int col, int value) {
        if (value == 0) {
            return true;
        }
        return grid.solutionAt(row, col) == value;
    }

    @Override
    public boolean isComplete(SudokuGrid grid, int[][] cells) {
        for (int row = 0; row < SudokuGrid.SIZE; row++) {
            for (int col = 0; col < SudokuGrid.SIZE; col++) {
                if (cells[row][col] != grid.solutionAt(row, col)) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public Optional<SudokuHint> hint(SudokuGrid grid, int[][] cells) {
        List<int[]> empty = new ArrayList<>();
        for (int row = 0; row < SudokuGrid.SIZE; row++) {
            for (int col = 0; col < SudokuGrid.SIZE; col++) {
                if (cells[row][col] == 0) {
                    empty.add(new int[]{row, col});
                }
            }
        }
        if (empty.isEmpty()) {
            return Optional.empty();
        }
        int[] cell = empty.get(random.nextInt(empty.size()));
        return Optional.of(new SudokuHint(cell[0], cell[1], grid.solutionAt(cell[0], cell[1])));
    }

    // ================== 스도쿠 생성 ================== //

    private SudokuGrid generateSudoku(int clues) {
        int[][] solution = new int[SudokuGrid.SIZE][SudokuGrid.SIZE];
        fill(solution, 0);

        int[][] givens = SudokuGrid.copy(solution);
        List<Integer> cells = new ArrayList<>();
        for (int i = 0; i < SudokuGrid.SIZE * SudokuGrid.SIZE; i++) {
            cells.add(i);
        }
        Collections.shuffle(cells, random);
        int toRemove = SudokuGrid.SIZE * SudokuGrid.SIZE - clues;
        for (int i = 0; i < toRemove; i++) {
            int cell = cells.get(i);
            givens[cell / SudokuGrid.SIZE][cell % SudokuGrid.SIZE] = 0;
        }
        return new SudokuGrid(givens, solution);
    }

    /**
     * 칸 번호 순서대로 무작위 숫자를 넣어 보고, 막히면 되돌린다.
     */
    private boolean fill(int[][] board, int cell) {
        if (cell == SudokuGrid.SIZE * SudokuGrid.SIZE) {
            return true;
        }
        int row = cell / SudokuGrid.SIZE;
        int col = cell % SudokuGrid.SIZE;

        List<Integer> numbers = new ArrayList<>(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9));
        Collections.shuffle(numbers, random);
        for (int number : numbers) {
            if (canPlace(board, row, col, number)) {
                board[row][col] = number;
                if (fill(board, cell + 1)) {
                    return true;
                }
                board[row][col] = 0;
            }
        }
        return false;
    }

    private boolean canPlace(int[][] board, int row, int col, int number) {
        for (int i = 0; i < SudokuGrid.SIZE; i++) {
            if (board[row][i] == number || board[i][col] == number) {
                return false;
            }
        }
        int boxRow = row - row % BOX;
        int boxCol = col - col % BOX;
        for (int r = boxRow; r < boxRow + BOX; r++) {
            for (int c = boxCol; c < boxCol + BOX; c++) {
                if (board[r][c] == number) {
                    return false;
                }
            }
        }
        return true;
    }
}

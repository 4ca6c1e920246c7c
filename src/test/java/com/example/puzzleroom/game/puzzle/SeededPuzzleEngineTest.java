package com.example.puzzleroom.game.puzzle;

import com.example.puzzleroom.room.domain.Difficulty;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SeededPuzzleEngineTest {

    private final SeededPuzzleEngine engine = new SeededPuzzleEngine();

    @ParameterizedTest
    @EnumSource(Difficulty.class)
    @DisplayName("정답은 모든 행/열/박스에 1~9가 한 번씩이고, 문제 칸은 난이도별 개수만큼 정답과 일치한다")
    void generatesSolvableSudoku(Difficulty difficulty) {
        SudokuGrid grid = engine.generate(difficulty).sudoku();
        int[][] solution = grid.solution();

        for (int i = 0; i < SudokuGrid.SIZE; i++) {
            Set<Integer> row = new HashSet<>();
            Set<Integer> col = new HashSet<>();
            Set<Integer> box = new HashSet<>();
            for (int j = 0; j < SudokuGrid.SIZE; j++) {
                row.add(solution[i][j]);
                col.add(solution[j][i]);
                box.add(solution[(i / 3) * 3 + j / 3][(i % 3) * 3 + j % 3]);
            }
            assertThat(row).containsExactlyInAnyOrder(1, 2, 3, 4, 5, 6, 7, 8, 9);
            assertThat(col).containsExactlyInAnyOrder(1, 2, 3, 4, 5, 6, 7, 8, 9);
            assertThat(box).containsExactlyInAnyOrder(1, 2, 3, 4, 5, 6, 7, 8, 9);
        }

        assertThat(grid.givenCount()).isEqualTo(SeededPuzzleEngine.cluesFor(difficulty));
        int[][] givens = grid.givens();
        for (int r = 0; r < SudokuGrid.SIZE; r++) {
            for (int c = 0; c < SudokuGrid.SIZE; c++) {
                if (givens[r][c] != 0) {
                    assertThat(givens[r][c]).isEqualTo(solution[r][c]);
                }
            }
        }
    }

    @Test
    @DisplayName("정답과 같은 숫자와 지우기(0)만 맞는 수다")
    void validateMove() {
        SudokuGrid grid = engine.generate(Difficulty.MEDIUM).sudoku();
        int answer = grid.solutionAt(4, 4);

        assertThat(engine.validateMove(grid, 4, 4, answer)).isTrue();
        assertThat(engine.validateMove(grid, 4, 4, answer % 9 + 1)).isFalse();
        assertThat(engine.validateMove(grid, 4, 4, 0)).isTrue();
    }

    @Test
    @DisplayName("문제 상태는 미완성, 정답으로 다 채우면 완성")
    void isComplete() {
        SudokuGrid grid = engine.generate(Difficulty.EASY).sudoku();

        assertThat(engine.isComplete(grid, grid.givens())).isFalse();
        assertThat(engine.isComplete(grid, grid.solution())).isTrue();
    }

    @Test
    @DisplayName("힌트는 빈 칸 하나의 정답이고, 빈 칸이 없으면 없다")
    void hint() {
        SudokuGrid grid = engine.generate(Difficulty.HARD).sudoku();
        int[][] cells = grid.givens();

        Optional<SudokuHint> hint = engine.hint(grid, cells);

        assertThat(hint).hasValueSatisfying(h -> {
            assertThat(cells[h.row()][h.col()]).isZero();
            assertThat(h.number()).isEqualTo(grid.solutionAt(h.row(), h.col()));
        });
        assertThat(engine.hint(grid, grid.solution())).isEmpty();
    }

    @Test
    @DisplayName("문제/정답 배열은 밖에서 고쳐도 격자에 반영되지 않는다")
    void gridIsNotMutableFromOutside() {
        SudokuGrid grid = engine.generate(Difficulty.EASY).sudoku();
        int original = grid.solutionAt(0, 0);

        grid.solution()[0][0] = 0;

        assertThat(grid.solutionAt(0, 0)).isEqualTo(original);
    }

    @Test
    @DisplayName("reveal/flag 좌표는 난이도별 보드 크기 안이어야 한다")
    void isOnBoard() {
        PuzzleBoard board = engine.generate(Difficulty.EASY);

        assertThat(engine.isOnBoard(board, 8, 8)).isTrue();
        assertThat(engine.isOnBoard(board, 9, 0)).isFalse();
        assertThat(engine.isOnBoard(board, -1, 0)).isFalse();
        assertThat(engine.isOnBoard(null, 0, 0)).isFalse();
    }
}

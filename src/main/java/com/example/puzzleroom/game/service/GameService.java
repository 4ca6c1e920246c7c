package com.example.puzzleroom.game.service;

import com.example.puzzleroom.game.coordinator.GameCoordinatorFactory;
import com.example.puzzleroom.game.domain.GameAction;
import com.example.puzzleroom.game.domain.RoundOutcome;
import com.example.puzzleroom.game.domain.SudokuProgress;
import com.example.puzzleroom.game.dto.request.GameActionRequest;
import com.example.puzzleroom.game.dto.request.GameFinishedRequest;
import com.example.puzzleroom.game.dto.request.PlaceNumberRequest;
import com.example.puzzleroom.game.puzzle.PuzzleBoard;
import com.example.puzzleroom.game.puzzle.PuzzleEngine;
import com.example.puzzleroom.game.puzzle.SudokuGrid;
import com.example.puzzleroom.global.error.ErrorCode;
import com.example.puzzleroom.room.domain.ConnectionSession;
import com.example.puzzleroom.room.domain.Player;
import com.example.puzzleroom.room.domain.Room;
import com.example.puzzleroom.room.dto.GameMessage;
import com.example.puzzleroom.room.dto.MessageType;
import com.example.puzzleroom.room.repository.RoomRepository;
import com.example.puzzleroom.room.repository.SessionRepository;
import com.example.puzzleroom.room.service.RoomEventBroadcaster;
import com.example.puzzleroom.room.service.RoomLocks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * 게임 진행 이벤트 진입점
 *
 * 방 락 안에서 모드별 코디네이터에 위임하고, 라운드가 끝나면 락을 놓은 뒤 다음 보드를 준비한다.
 * 잘못되었거나 늦게 도착한 지뢰판 제안은 에러 없이 버린다. 스도쿠 입력 형식 오류만 에러로 돌려준다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameService {

    private static final int MAX_NUMBER = 9;

    private final SessionRepository sessionRepository;
    private final RoomRepository roomRepository;
    private final RoomLocks roomLocks;
    private final GameCoordinatorFactory coordinatorFactory;
    private final GameResultValidator resultValidator;
    private final PuzzleEngine puzzleEngine;
    private final BoardPreparer boardPreparer;
    private final RoomEventBroadcaster broadcaster;

    public void handleAction(String connectionId, GameActionRequest request) {
        GameAction action = request.action();
        if (action == null) {
            log.debug("알 수 없는 action 무시: connection={}", connectionId);
            return;
        }
        Optional<String> roomCode = currentRoomCode(connectionId);
        if (roomCode.isEmpty()) {
            log.debug("방 밖에서 온 action 무시: connection={}", connectionId);
            return;
        }
        String code = roomCode.get();

        RoundOutcome outcome;
        if (!action.needsCell()) {
            int clicks = resultValidator.clampClicks(request.clicks());
            outcome = inRoom(code, connectionId,
                    (room, player) -> coordinatorFactory.getCoordinator(room.getGameMode()).eliminate(room, player, clicks));
        } else {
            Integer row = request.row();
            Integer col = request.col();
            if (!resultValidator.isCoordinateInRange(row, col)) {
                log.debug("범위 밖 좌표 무시: room={}, row={}, col={}", code, row, col);
                return;
            }
            // 보드 검증은 락 밖에서. 락 안에서는 같은 보드인지만 다시 본다.
            PuzzleBoard board = roomRepository.findByCode(code).map(Room::getBoard).orElse(null);
            if (!puzzleEngine.isOnBoard(board, row, col)) {
                log.debug("보드 밖 좌표 무시: room={}, row={}, col={}", code, row, col);
                return;
            }
            outcome = inRoom(code, connectionId, (room, player) -> {
                if (room.getBoard() != board) {
                    log.debug("지난 라운드 action 무시: room={}, user={}", code, player.getUsername());
                    return RoundOutcome.CONTINUE;
                }
                return coordinatorFactory.getCoordinator(room.getGameMode()).act(room, player, action, row, col);
            });
        }
        afterOutcome(code, outcome);
    }

    public void handleFinished(String connectionId, GameFinishedRequest request) {
        Optional<String> roomCode = currentRoomCode(connectionId);
        if (roomCode.isEmpty()) {
            log.debug("방 밖에서 온 완주 보고 무시: connection={}", connectionId);
            return;
        }
        int score = resultValidator.clampScore(request.score());
        int time = resultValidator.clampTime(request.time());

        RoundOutcome outcome = inRoom(roomCode.get(), connectionId,
                (room, player) -> coordinatorFactory.getCoordinator(room.getGameMode()).finish(room, player, score, time));
        afterOutcome(roomCode.get(), outcome);
    }

    // ================== 스도쿠 ================== //

    /**
     * 스도쿠 칸 입력. 방 밖이거나 진행 중이 아니면 버리고, 잘못된 좌표/숫자/고정 칸은 에러로 돌려준다.
     */
    public void placeNumber(String connectionId, PlaceNumberRequest request) {
        Optional<String> roomCode = currentRoomCode(connectionId);
        if (roomCode.isEmpty()) {
            log.debug("방 밖에서 온 스도쿠 입력 무시: connection={}", connectionId);
            return;
        }
        RoundOutcome outcome = inRoom(roomCode.get(), connectionId, (room, player) -> placeUnderLock(room, player, request));
        afterOutcome(roomCode.get(), outcome);
    }

    private RoundOutcome placeUnderLock(Room room, Player player, PlaceNumberRequest request) {
        SudokuProgress sudoku = room.getSudoku();
        if (!room.isPlaying() || sudoku == null || player.isEliminated()) {
            log.debug("스도쿠 입력 무시: room={}, user={}, status={}", room.getCode(), player.getUsername(), room.getStatus());
            return RoundOutcome.CONTINUE;
        }
        int row = request.row() == null ? -1 : request.row();
        int col = request.col() == null ? -1 : request.col();
        int number = request.number() == null ? 0 : request.number();
        if (!SudokuGrid.contains(row, col)) {
            throw ErrorCode.INVALID_CELL.commonException("row=" + row + ", col=" + col);
        }
        if (number < 0 || number > MAX_NUMBER) {
            throw ErrorCode.INVALID_NUMBER.commonException("number=" + number);
        }
        if (sudoku.getGrid().isGiven(row, col)) {
            throw ErrorCode.INITIAL_CELL.commonException("row=" + row + ", col=" + col);
        }

        String username = player.getUsername();
        // 0(지우기)은 항상 정답으로 본다
        boolean correct = puzzleEngine.validateMove(sudoku.getGrid(), row, col, number);
        if (!correct) {
            int count = sudoku.recordMistake(username);
            broadcaster.broadcast(room.getCode(), MessageType.MISTAKE, Map.of("username", username, "count", count));
        }
        sudoku.place(username, row, col, number);

        Map<String, Object> data = new HashMap<>();
        data.put("username", username);
        data.put("row", row);
        data.put("col", col);
        data.put("number", number);
        data.put("isCorrect", correct);
        broadcaster.broadcast(room.getCode(), MessageType.CELL_UPDATE, data);

        if (puzzleEngine.isComplete(sudoku.getGrid(), sudoku.cells())) {
            log.info("스도쿠 완성: room={}, user={}", room.getCode(), username);
            return coordinatorFactory.getCoordinator(room.getGameMode()).solved(room, player, sudoku.placementsOf(username));
        }
        return RoundOutcome.CONTINUE;
    }

    /**
     * 빈 칸 하나의 정답을 요청한 사람에게만 보낸다. 힌트 사용 횟수는 비어 있는 칸이 없어도 센다.
     */
    public void requestHint(String connectionId) {
        Optional<String> roomCode = currentRoomCode(connectionId);
        if (roomCode.isEmpty()) {
            log.debug("방 밖에서 온 힌트 요청 무시: connection={}", connectionId);
            return;
        }
        String code = roomCode.get();
        inRoom(code, connectionId, (room, player) -> {
            SudokuProgress sudoku = room.getSudoku();
            if (!room.isPlaying() || sudoku == null) {
                return RoundOutcome.CONTINUE;
            }
            int used = sudoku.recordHint(player.getUsername());
            puzzleEngine.hint(sudoku.getGrid(), sudoku.cells()).ifPresentOrElse(
                    hint -> broadcaster.sendToConnection(connectionId, GameMessage.of(MessageType.HINT_PROVIDED, code, Map.of(
                            "row", hint.row(),
                            "col", hint.col(),
                            "number", hint.number(),
                            "hintsUsed", used))),
                    () -> log.debug("빈 칸 없음, 힌트 없음: room={}", code));
            return RoundOutcome.CONTINUE;
        });
    }

    private Optional<String> currentRoomCode(String connectionId) {
        return sessionRepository.findById(connectionId)
                .filter(ConnectionSession::inRoom)
                .map(ConnectionSession::roomCode);
    }

    private RoundOutcome inRoom(String roomCode, String connectionId, BiFunction<Room, Player, RoundOutcome> action) {
        return roomLocks.withRoomLock(roomCode, () -> {
            Optional<Room> room = roomRepository.findByCode(roomCode);
            if (room.isEmpty()) {
                return RoundOutcome.CONTINUE;
            }
            Optional<Player> player = room.get().findByConnection(connectionId);
            if (player.isEmpty()) {
                return RoundOutcome.CONTINUE;
            }
            room.get().touch();
            return action.apply(room.get(), player.get());
        });
    }

    private void afterOutcome(String roomCode, RoundOutcome outcome) {
        if (outcome == RoundOutcome.ENDED) {
            boardPreparer.prepareNextBoard(roomCode);
        }
    }
}

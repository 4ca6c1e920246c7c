package com.example.puzzleroom.room.service;

import com.example.puzzleroom.game.coordinator.GameCoordinatorFactory;
import com.example.puzzleroom.game.domain.RoundOutcome;
import com.example.puzzleroom.game.puzzle.PuzzleBoard;
import com.example.puzzleroom.game.puzzle.PuzzleEngine;
import com.example.puzzleroom.game.service.BoardPreparer;
import com.example.puzzleroom.game.service.TurnTimerService;
import com.example.puzzleroom.global.concurrency.LockTimeoutException;
import com.example.puzzleroom.global.config.RoomProperties;
import com.example.puzzleroom.global.error.CommonException;
import com.example.puzzleroom.global.error.ErrorCode;
import com.example.puzzleroom.room.domain.ConnectionSession;
import com.example.puzzleroom.room.domain.Difficulty;
import com.example.puzzleroom.room.domain.GameMode;
import com.example.puzzleroom.room.domain.Player;
import com.example.puzzleroom.room.domain.Room;
import com.example.puzzleroom.room.domain.RoomStatus;
import com.example.puzzleroom.room.dto.GameMessage;
import com.example.puzzleroom.room.dto.MessageType;
import com.example.puzzleroom.room.dto.request.ChangeModeRequest;
import com.example.puzzleroom.room.dto.request.CreateRoomRequest;
import com.example.puzzleroom.room.dto.request.JoinRoomRequest;
import com.example.puzzleroom.room.dto.response.PlayerView;
import com.example.puzzleroom.room.dto.response.RoomListResponse;
import com.example.puzzleroom.room.dto.response.RoomResponse;
import com.example.puzzleroom.room.repository.RoomRepository;
import com.example.puzzleroom.room.repository.SessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * 방 생명주기 (WAITING ↔ PLAYING)
 *
 * 방을 바꾸는 모든 연산은 "room:{code}" 락 안에서 읽고-고치고-쓴다.
 * 보드 생성은 항상 락 밖에서 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoomService {

    private static final int MIN_PLAYERS_TO_START = 2;
    private static final int MAX_READY_ATTEMPTS = 3;

    private final RoomRepository roomRepository;
    private final SessionRepository sessionRepository;
    private final RoomLocks roomLocks;
    private final RoomCodeGenerator roomCodeGenerator;
    private final RoomValidator roomValidator;
    private final RoomEventBroadcaster broadcaster;
    private final RoomProperties roomProperties;
    private final PuzzleEngine puzzleEngine;
    private final BoardPreparer boardPreparer;
    private final GameCoordinatorFactory coordinatorFactory;
    private final TurnTimerService turnTimerService;
    private final IdleRoomReaper idleRoomReaper;
    private final RetryTemplate roomCreationRetryTemplate;

    // ================== 생성 / 입장 ================== //

    public RoomResponse createRoom(String connectionId, CreateRoomRequest request) {
        String username = roomValidator.validateUsername(request.username());
        int maxPlayers = request.maxPlayersOrDefault();
        roomValidator.validateMaxPlayers(maxPlayers);
        GameMode gameMode = request.gameModeOrDefault();
        Difficulty difficulty = request.difficultyOrDefault();

        ConnectionSession session = currentSession(connectionId);
        if (session.inRoom()) {
            throw ErrorCode.ALREADY_IN_ROOM.commonException();
        }
        ensureRoomCapacity();

        PuzzleBoard board = puzzleEngine.generate(difficulty);

        Room room = roomCreationRetryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                log.warn("방 생성 락 타임아웃, 유휴 방 정리 후 재시도");
                idleRoomReaper.reclaimIdleRooms();
            }
            return allocateRoom(code -> {
                Room created = new Room(code, username, maxPlayers, gameMode, difficulty);
                created.addPlayer(new Player(username, connectionId));
                created.installPendingBoard(board);
                return created;
            });
        }, context -> {
            Throwable last = context.getLastThrowable();
            if (last instanceof CommonException commonException) {
                throw commonException;
            }
            if (last instanceof LockTimeoutException) {
                log.error("방 생성 재시도 실패: 서버 용량 초과로 처리");
                throw new CommonException(ErrorCode.CAPACITY_EXCEEDED, last);
            }
            throw new IllegalStateException("방 생성 실패", last);
        });

        RoomResponse response = roomLocks.withRoomLock(room.getCode(), () -> {
            // 방이 공개된 뒤 끊겼거나 다른 방에 들어갔으면 만든 방을 되돌린다
            if (!sessionRepository.replace(session, session.joined(username, room.getCode()))) {
                roomRepository.delete(room);
                throw sessionChanged(connectionId, room.getCode());
            }
            Map<String, Object> data = new HashMap<>();
            data.put("roomCode", room.getCode());
            data.put("difficulty", room.getDifficulty());
            data.put("maxPlayers", room.getMaxPlayers());
            data.put("gameMode", room.getGameMode());
            data.put("host", room.getHost());
            data.put("players", PlayerView.listOf(room));
            broadcaster.sendToConnection(connectionId, GameMessage.of(MessageType.ROOM_CREATED, room.getCode(), data));
            return RoomResponse.from(room);
        });
        log.info("방 생성: code={}, host={}, mode={}, maxPlayers={}", room.getCode(), username, gameMode, maxPlayers);
        return response;
    }

    public RoomResponse joinRoom(String connectionId, JoinRoomRequest request) {
        String code = roomValidator.normalizeRoomCode(request.roomCode());
        String username = roomValidator.validateUsername(request.username());

        ConnectionSession session = currentSession(connectionId);
        if (session.inRoom()) {
            throw ErrorCode.ALREADY_IN_ROOM.commonException();
        }
        ensureConnectionCapacity(connectionId);

        return roomLocks.withRoomLock(code, () -> {
            Room room = roomRepository.findByCode(code)
                    .orElseThrow(() -> ErrorCode.ROOM_NOT_FOUND.commonException("room=" + code));
            if (room.isPlaying()) {
                throw ErrorCode.GAME_IN_PROGRESS.commonException("room=" + code);
            }
            if (room.isFull()) {
                throw ErrorCode.ROOM_FULL.commonException("room=" + code + ", max=" + room.getMaxPlayers());
            }
            if (room.hasUsername(username)) {
                throw ErrorCode.ALREADY_IN_ROOM.commonException("room=" + code + ", duplicate username");
            }

            // 락을 기다리는 동안 끊긴 연결은 방에 넣지 않는다
            if (!sessionRepository.replace(session, session.joined(username, code))) {
                throw sessionChanged(connectionId, code);
            }
            room.addPlayer(new Player(username, connectionId));

            List<PlayerView> players = PlayerView.listOf(room);
            Map<String, Object> joined = new HashMap<>();
            joined.put("roomCode", code);
            joined.put("difficulty", room.getDifficulty());
            joined.put("gameMode", room.getGameMode());
            joined.put("maxPlayers", room.getMaxPlayers());
            joined.put("host", room.getHost());
            joined.put("players", players);
            broadcaster.sendToConnection(connectionId, GameMessage.of(MessageType.ROOM_JOINED, code, joined));

            GameMessage notice = GameMessage.builder()
                    .type(MessageType.PLAYER_JOINED)
                    .roomCode(code)
                    .username(username)
                    .data(Map.of("username", username, "players", players))
                    .timestamp(System.currentTimeMillis())
                    .build();
            broadcaster.sendToOthers(room, connectionId, notice);

            log.info("방 입장: code={}, user={}, players={}/{}", code, username, room.getPlayers().size(), room.getMaxPlayers());
            return RoomResponse.from(room);
        });
    }

    // ================== 퇴장 ================== //

    public void leaveRoom(String connectionId) {
        ConnectionSession session = sessionRepository.findById(connectionId)
                .filter(ConnectionSession::inRoom)
                .orElseThrow(ErrorCode.NOT_IN_ROOM::commonException);
        try {
            departRoom(session, true);
        } finally {
            sessionRepository.detach(connectionId, session.roomCode());
        }
    }

    /**
     * 방에서 플레이어를 빼고 남은 인원에게 알린다. 비면 방을 지운다.
     * 명시적 퇴장과 연결 끊김이 같은 경로를 쓴다.
     *
     * @param acknowledge 나간 사람에게 left_room 응답을 보낼지
     */
    public void departRoom(ConnectionSession session, boolean acknowledge) {
        String code = session.roomCode();
        RoundOutcome outcome = roomLocks.withRoomLock(code, () -> {
            Optional<Room> found = roomRepository.findByCode(code);
            if (found.isEmpty()) {
                return RoundOutcome.CONTINUE;
            }
            Room room = found.get();
            Optional<Player> leaving = room.findByConnection(session.connectionId());
            if (leaving.isEmpty()) {
                return RoundOutcome.CONTINUE;
            }
            Player player = leaving.get();
            int index = room.removePlayer(player);

            if (acknowledge) {
                broadcaster.sendToConnection(session.connectionId(),
                        GameMessage.of(MessageType.LEFT_ROOM, code, Map.of("success", true)));
            }

            if (room.isEmpty()) {
                roomRepository.delete(room);
                turnTimerService.cancel(code);
                log.info("빈 방 삭제: code={}", code);
                return RoundOutcome.ENDED;
            }

            boolean hostChanged = room.reassignHostIfMissing();
            Map<String, Object> data = new HashMap<>();
            data.put("username", player.getUsername());
            data.put("playersRemaining", room.getPlayers().size());
            data.put("players", PlayerView.listOf(room));
            data.put("host", room.getHost());
            data.put("hostChanged", hostChanged);
            broadcaster.broadcast(code, MessageType.PLAYER_LEFT, data);
            log.info("방 퇴장: code={}, user={}, remaining={}", code, player.getUsername(), room.getPlayers().size());

            if (room.isPlaying()) {
                return coordinatorFactory.getCoordinator(room.getGameMode()).onPlayerRemoved(room, player, index);
            }
            return RoundOutcome.CONTINUE;
        });

        if (outcome == RoundOutcome.ENDED) {
            boardPreparer.prepareNextBoard(code);
        }
    }

    // ================== 준비 / 시작 ================== //

    /**
     * 준비 완료. 두 명 이상이 모두 준비되면 같은 임계 구역 안에서 바로 시작한다.
     * 동시에 마지막 준비가 두 번 들어와도 시작은 한 번뿐이다.
     */
    public void markReady(String connectionId) {
        String code = requireRoomCode(connectionId);

        for (int attempt = 0; attempt < MAX_READY_ATTEMPTS; attempt++) {
            ReadyResult result = roomLocks.withRoomLock(code, () -> readyUnderLock(code, connectionId));
            if (result != ReadyResult.NEED_BOARD) {
                return;
            }
            boardPreparer.prepareNextBoard(code);
        }
        log.warn("보드 준비 경합으로 시작 실패: room={}", code);
        throw ErrorCode.ROOM_BUSY.commonException();
    }

    private ReadyResult readyUnderLock(String code, String connectionId) {
        Room room = roomRepository.findByCode(code)
                .orElseThrow(ErrorCode.ROOM_NOT_FOUND::commonException);
        Player player = room.findByConnection(connectionId)
                .orElseThrow(ErrorCode.NOT_IN_ROOM::commonException);
        if (room.isPlaying()) {
            log.debug("이미 진행 중, 준비 무시: room={}, user={}", code, player.getUsername());
            return ReadyResult.IGNORED;
        }

        player.setReady(true);
        room.touch();
        boolean allReady = room.allReady();
        boolean startable = allReady && room.getPlayers().size() >= MIN_PLAYERS_TO_START;

        Optional<PuzzleBoard> board = startable ? room.takePendingBoard() : Optional.empty();
        if (startable && board.isEmpty()) {
            return ReadyResult.NEED_BOARD;
        }

        broadcaster.broadcast(code, MessageType.PLAYER_READY_UPDATE, Map.of(
                "username", player.getUsername(),
                "players", PlayerView.listOf(room),
                "allReady", allReady));

        if (board.isPresent()) {
            startRound(room, board.get());
            return ReadyResult.STARTED;
        }
        return ReadyResult.READY;
    }

    /**
     * 호스트 전용: 모드 변경 후 전원 자동 준비 + 즉시 재시작 (진행 중이어도)
     */
    public void changeMode(String connectionId, ChangeModeRequest request) {
        String code = requireRoomCode(connectionId);
        Room snapshot = roomRepository.findByCode(code)
                .orElseThrow(ErrorCode.ROOM_NOT_FOUND::commonException);
        PuzzleBoard board = puzzleEngine.generate(snapshot.getDifficulty());

        roomLocks.withRoomLock(code, () -> {
            Room room = roomRepository.findByCode(code)
                    .orElseThrow(ErrorCode.ROOM_NOT_FOUND::commonException);
            Player player = room.findByConnection(connectionId)
                    .orElseThrow(ErrorCode.NOT_IN_ROOM::commonException);
            if (!room.isHost(player.getUsername())) {
                throw ErrorCode.NOT_HOST.commonException("room=" + code + ", user=" + player.getUsername());
            }
            turnTimerService.cancel(code);
            room.setGameMode(request.gameMode());
            room.getPlayers().forEach(p -> p.setReady(true));
            log.info("모드 변경 후 재시작: room={}, mode={}, by={}", code, request.gameMode(), player.getUsername());
            startRound(room, board);
        });
    }

    private void startRound(Room room, PuzzleBoard board) {
        room.startRound(board);

        Map<String, Object> data = new HashMap<>();
        data.put("difficulty", room.getDifficulty());
        data.put("board", board);
        data.put("gameMode", room.getGameMode());
        data.put("currentTurn", room.getCurrentTurn());
        data.put("players", PlayerView.listOf(room));
        broadcaster.broadcast(room.getCode(), MessageType.GAME_START, data);

        coordinatorFactory.getCoordinator(room.getGameMode()).onRoundStarted(room);
        log.info("게임 시작: room={}, mode={}, players={}", room.getCode(), room.getGameMode(), room.getPlayers().size());
    }

    // ================== 조회 ================== //

    /**
     * 대기 중인 방 목록. 누가 락을 잡고 있는 방은 기다리지 않고 이번 목록에서 뺀다.
     */
    public List<RoomListResponse> getWaitingRooms() {
        List<RoomListResponse> listed = new ArrayList<>();
        for (Room room : roomRepository.findAllByStatus(RoomStatus.WAITING)) {
            roomLocks.tryWithRoomLock(room.getCode(), () -> {
                if (room.getStatus() == RoomStatus.WAITING && !room.isEmpty()) {
                    listed.add(RoomListResponse.from(room));
                }
            });
        }
        return listed;
    }

    public RoomResponse getRoom(String rawCode) {
        String code = roomValidator.normalizeRoomCode(rawCode);
        return roomLocks.withRoomLock(code, () -> roomRepository.findByCode(code)
                .map(RoomResponse::from)
                .orElseThrow(ErrorCode.ROOM_NOT_FOUND::commonException));
    }

    // ================== 헬퍼 ================== //

    private Room allocateRoom(Function<String, Room> roomFactory) {
        return roomCodeGenerator.allocate(roomFactory)
                .or(() -> {
                    log.warn("방 코드 충돌 반복, 유휴 방 정리 후 재시도");
                    idleRoomReaper.reclaimIdleRooms();
                    return roomCodeGenerator.allocate(roomFactory);
                })
                .orElseThrow(ErrorCode.CAPACITY_EXCEEDED::commonException);
    }

    private void ensureRoomCapacity() {
        if (roomRepository.count() < roomProperties.getMaxRooms()) {
            return;
        }
        idleRoomReaper.reclaimIdleRooms();
        if (roomRepository.count() >= roomProperties.getMaxRooms()) {
            log.warn("방 수 한도 초과: {}", roomProperties.getMaxRooms());
            throw ErrorCode.CAPACITY_EXCEEDED.commonException();
        }
    }

    private void ensureConnectionCapacity(String connectionId) {
        int others = sessionRepository.count() - (sessionRepository.findById(connectionId).isPresent() ? 1 : 0);
        if (others >= roomProperties.getMaxConnections()) {
            log.warn("연결 수 한도 초과: {}", roomProperties.getMaxConnections());
            throw ErrorCode.CAPACITY_EXCEEDED.commonException();
        }
    }

    private ConnectionSession currentSession(String connectionId) {
        return sessionRepository.findById(connectionId)
                .orElseThrow(() -> ErrorCode.NOT_CONNECTED.commonException("connection=" + connectionId));
    }

    private CommonException sessionChanged(String connectionId, String code) {
        boolean inOtherRoom = sessionRepository.findById(connectionId)
                .filter(ConnectionSession::inRoom)
                .isPresent();
        log.info("락 대기 중 세션 변경, 입장 취소: code={}, connection={}, inOtherRoom={}", code, connectionId, inOtherRoom);
        ErrorCode errorCode = inOtherRoom ? ErrorCode.ALREADY_IN_ROOM : ErrorCode.NOT_CONNECTED;
        return errorCode.commonException("room=" + code + ", connection=" + connectionId);
    }

    private String requireRoomCode(String connectionId) {
        return sessionRepository.findById(connectionId)
                .filter(ConnectionSession::inRoom)
                .map(ConnectionSession::roomCode)
                .orElseThrow(ErrorCode.NOT_IN_ROOM::commonException);
    }

    private enum ReadyResult {
        READY,
        STARTED,
        IGNORED,
        NEED_BOARD
    }
}

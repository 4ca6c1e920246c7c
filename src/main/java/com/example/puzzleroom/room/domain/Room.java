package com.example.puzzleroom.room.domain;

import com.example.puzzleroom.game.domain.SudokuProgress;
import com.example.puzzleroom.game.puzzle.PuzzleBoard;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 게임 방. 플레이어 목록을 독점 소유한다.
 *
 * 불변식: players.size() <= maxPlayers.
 * 모든 변경은 "room:{code}" 락을 잡은 상태에서만 한다.
 */
@Getter
public class Room {

    private final String code;
    private final int maxPlayers;
    private final Difficulty difficulty;
    private final Instant createdAt;

    @Setter
    private String host;

    @Setter
    private GameMode gameMode;

    private RoomStatus status = RoomStatus.WAITING;

    /** 입장 순서 = 턴 순서 */
    private final List<Player> players = new ArrayList<>();

    /** 턴제 + PLAYING 일 때만 의미 있음 */
    private String currentTurn;

    /** 진행 중인 라운드의 보드. 락 밖에서 좌표 사전 검증용으로 읽는다. */
    private volatile PuzzleBoard board;

    /** 진행 중인 라운드의 스도쿠 판. PLAYING일 때만 있다. */
    private SudokuProgress sudoku;

    /** 다음 라운드용으로 미리 받아 둔 보드 */
    private PuzzleBoard pendingBoard;

    private volatile Instant lastActivityAt;

    public Room(String code, String host, int maxPlayers, GameMode gameMode, Difficulty difficulty) {
        this.code = code;
        this.host = host;
        this.maxPlayers = maxPlayers;
        this.gameMode = gameMode;
        this.difficulty = difficulty;
        this.createdAt = Instant.now();
        this.lastActivityAt = this.createdAt;
    }

    public void touch() {
        this.lastActivityAt = Instant.now();
    }

    public boolean isFull() {
        return players.size() >= maxPlayers;
    }

    public boolean isEmpty() {
        return players.isEmpty();
    }

    public boolean isPlaying() {
        return status == RoomStatus.PLAYING;
    }

    public boolean isHost(String username) {
        return host != null && host.equals(username);
    }

    public void addPlayer(Player player) {
        if (isFull()) {
            throw new IllegalStateException("정원 초과: " + code);
        }
        players.add(player);
        touch();
    }

    public Optional<Player> findByConnection(String connectionId) {
        return players.stream()
                .filter(p -> p.getConnectionId().equals(connectionId))
                .findFirst();
    }

    public Optional<Player> findByUsername(String username) {
        return players.stream()
                .filter(p -> p.getUsername().equals(username))
                .findFirst();
    }

    public boolean hasUsername(String username) {
        return findByUsername(username).isPresent();
    }

    public int indexOf(Player player) {
        return players.indexOf(player);
    }

    /**
     * @return 제거된 플레이어의 원래 위치, 없으면 -1
     */
    public int removePlayer(Player player) {
        int index = players.indexOf(player);
        if (index >= 0) {
            players.remove(index);
            touch();
        }
        return index;
    }

    /**
     * 호스트가 빠졌으면 가장 먼저 들어온 플레이어에게 넘긴다.
     *
     * @return 호스트가 바뀌었으면 true
     */
    public boolean reassignHostIfMissing() {
        if (players.isEmpty() || hasUsername(host)) {
            return false;
        }
        host = players.get(0).getUsername();
        return true;
    }

    public boolean allReady() {
        return players.stream().allMatch(Player::isReady);
    }

    public boolean allFinished() {
        return !players.isEmpty() && players.stream().allMatch(Player::isFinished);
    }

    public List<Player> activePlayers() {
        return players.stream().filter(Player::isActive).toList();
    }

    public void setCurrentTurn(String currentTurn) {
        this.currentTurn = currentTurn;
    }

    public void installPendingBoard(PuzzleBoard board) {
        this.pendingBoard = board;
    }

    /**
     * 미리 받아 둔 보드를 꺼낸다. 한 보드는 한 라운드에만 쓴다.
     */
    public Optional<PuzzleBoard> takePendingBoard() {
        PuzzleBoard taken = pendingBoard;
        pendingBoard = null;
        return Optional.ofNullable(taken);
    }

    /**
     * WAITING/PLAYING → PLAYING. 라운드 필드를 비우고 턴제면 첫 플레이어부터 시작.
     */
    public void startRound(PuzzleBoard board) {
        this.board = board;
        this.sudoku = board.sudoku() != null ? new SudokuProgress(board.sudoku()) : null;
        this.status = RoomStatus.PLAYING;
        players.forEach(Player::prepareForRound);
        this.currentTurn = (gameMode == GameMode.TURN_BASED && !players.isEmpty())
                ? players.get(0).getUsername()
                : null;
        touch();
    }

    /**
     * PLAYING → WAITING. 어떤 식으로 끝났든 모든 플레이어의 ready/score/finished/eliminated를 초기화.
     */
    public void resetToWaiting() {
        this.status = RoomStatus.WAITING;
        this.currentTurn = null;
        this.board = null;
        this.sudoku = null;
        players.forEach(Player::resetRound);
        touch();
    }
}

package com.example.puzzleroom.game.coordinator;

import com.example.puzzleroom.game.domain.GameAction;
import com.example.puzzleroom.game.domain.RankedResult;
import com.example.puzzleroom.game.domain.RoundOutcome;
import com.example.puzzleroom.game.event.GameEndedEvent;
import com.example.puzzleroom.room.domain.Player;
import com.example.puzzleroom.room.domain.Room;
import com.example.puzzleroom.room.dto.GameMessage;
import com.example.puzzleroom.room.dto.MessageType;
import com.example.puzzleroom.room.dto.response.PlayerView;
import com.example.puzzleroom.room.service.RoomEventBroadcaster;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 두 모드가 공유하는 탈락/완주/종료 처리
 */
@Slf4j
public abstract class AbstractGameCoordinator implements GameCoordinator {

    /** 점수 내림차순 → 시간 오름차순 */
    static final Comparator<Player> BY_SCORE_THEN_TIME = Comparator
            .comparing(Player::getScore, Comparator.reverseOrder())
            .thenComparingInt(Player::getTime);

    /** 생존자 우선 → 점수 → 시간. 마지막 생존자가 이긴 라운드는 모드와 상관없이 이 순서다. */
    static final Comparator<Player> SURVIVOR_FIRST = Comparator
            .comparing(Player::isEliminated)
            .thenComparing(BY_SCORE_THEN_TIME);

    protected final RoomEventBroadcaster broadcaster;
    private final ApplicationEventPublisher eventPublisher;

    protected AbstractGameCoordinator(RoomEventBroadcaster broadcaster, ApplicationEventPublisher eventPublisher) {
        this.broadcaster = broadcaster;
        this.eventPublisher = eventPublisher;
    }

    @Override
    public RoundOutcome eliminate(Room room, Player player, int clicks) {
        if (!room.isPlaying() || player.isEliminated()) {
            log.debug("탈락 무시: room={}, user={}, status={}", room.getCode(), player.getUsername(), room.getStatus());
            return RoundOutcome.CONTINUE;
        }
        player.setEliminated(true);
        player.setFinished(true);
        player.setScore(clicks);

        List<Player> active = room.activePlayers();
        if (active.size() == 1) {
            Player winner = active.get(0);
            winner.setFinished(true);
            broadcaster.broadcast(room.getCode(), MessageType.PLAYER_ELIMINATED, Map.of(
                    "username", player.getUsername(),
                    "winner", winner.getUsername()));
            return endRound(room, winner.getUsername(), SURVIVOR_FIRST);
        }
        if (active.isEmpty()) {
            log.info("전원 탈락: room={}", room.getCode());
            return endRound(room, null);
        }

        broadcaster.broadcast(room.getCode(), MessageType.PLAYER_ELIMINATED, Map.of("username", player.getUsername()));
        return afterElimination(room, player);
    }

    /**
     * 생존자가 둘 이상 남은 탈락 이후 모드별 처리
     */
    protected abstract RoundOutcome afterElimination(Room room, Player eliminated);

    @Override
    public RoundOutcome finish(Room room, Player player, int score, int time) {
        if (!room.isPlaying() || player.isFinished()) {
            log.debug("완주 무시: room={}, user={}", room.getCode(), player.getUsername());
            return RoundOutcome.CONTINUE;
        }
        player.setScore(score);
        player.setTime(time);
        player.setFinished(true);

        broadcaster.broadcast(room.getCode(), MessageType.PLAYER_FINISHED, Map.of(
                "username", player.getUsername(),
                "score", score,
                "time", time,
                "players", PlayerView.listOf(room)));

        if (room.allFinished()) {
            return endRound(room, rank(room).get(0).username());
        }
        return RoundOutcome.CONTINUE;
    }

    @Override
    public RoundOutcome solved(Room room, Player solver, int placements) {
        if (!room.isPlaying()) {
            return RoundOutcome.CONTINUE;
        }
        solver.setFinished(true);
        solver.setScore(placements);
        Comparator<Player> solverFirst = Comparator.comparing((Player p) -> p != solver).thenComparing(ranking());
        return endRound(room, solver.getUsername(), solverFirst);
    }

    /**
     * 모드별 최종 순위 기준
     */
    protected abstract Comparator<Player> ranking();

    protected List<RankedResult> rank(Room room) {
        return rank(room, ranking());
    }

    private List<RankedResult> rank(Room room, Comparator<Player> order) {
        List<Player> sorted = new ArrayList<>(room.getPlayers());
        sorted.sort(order);
        List<RankedResult> results = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            results.add(RankedResult.of(i + 1, sorted.get(i)));
        }
        return results;
    }

    /**
     * 순위 전송 → 결과 이벤트 발행 → WAITING 복귀. 어떤 경로로 끝나든 여기로 모인다.
     */
    protected RoundOutcome endRound(Room room, String winner) {
        return endRound(room, winner, ranking());
    }

    protected RoundOutcome endRound(Room room, String winner, Comparator<Player> order) {
        List<RankedResult> results = rank(room, order);

        Map<String, Object> data = new HashMap<>();
        data.put("results", results);
        data.put("winner", winner);
        data.put("gameMode", room.getGameMode());
        if (room.getSudoku() != null) {
            data.put("mistakes", room.getSudoku().mistakes());
            data.put("hintsUsed", room.getSudoku().hintsUsed());
        }
        broadcaster.broadcast(room.getCode(), MessageType.GAME_ENDED, data);

        eventPublisher.publishEvent(new GameEndedEvent(room.getCode(), room.getGameMode(), winner, results, Instant.now()));

        onRoundEnded(room);
        room.resetToWaiting();
        log.info("게임 종료: room={}, mode={}, winner={}", room.getCode(), room.getGameMode(), winner);
        return RoundOutcome.ENDED;
    }

    protected void onRoundEnded(Room room) {
    }

    /**
     * 행동을 보낸 사람을 뺀 나머지에게 중계
     */
    protected void relayAction(Room room, Player player, GameAction action, int row, int col) {
        GameMessage message = GameMessage.builder()
                .type(MessageType.PLAYER_ACTION)
                .roomCode(room.getCode())
                .username(player.getUsername())
                .data(Map.of("action", action, "row", row, "col", col))
                .timestamp(System.currentTimeMillis())
                .build();
        broadcaster.sendToOthers(room, player.getConnectionId(), message);
    }
}

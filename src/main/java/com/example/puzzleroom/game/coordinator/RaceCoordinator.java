package com.example.puzzleroom.game.coordinator;

import com.example.puzzleroom.game.domain.GameAction;
import com.example.puzzleroom.game.domain.RoundOutcome;
import com.example.puzzleroom.room.domain.GameMode;
import com.example.puzzleroom.room.domain.Player;
import com.example.puzzleroom.room.domain.Room;
import com.example.puzzleroom.room.service.RoomEventBroadcaster;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Comparator;

/**
 * 레이스 모드. 턴 제한 없이 각자 풀고, 전원이 끝나면 점수 → 시간 순으로 순위를 매긴다.
 */
@Slf4j
@Component
public class RaceCoordinator extends AbstractGameCoordinator {

    public RaceCoordinator(RoomEventBroadcaster broadcaster, ApplicationEventPublisher eventPublisher) {
        super(broadcaster, eventPublisher);
    }

    @Override
    public GameMode getGameMode() {
        return GameMode.RACE;
    }

    @Override
    public void onRoundStarted(Room room) {
        log.debug("레이스 시작: room={}, players={}", room.getCode(), room.getPlayers().size());
    }

    /**
     * 탈락 여부와 상관없이 점수 → 시간. 탈락자의 점수는 탈락 시점 클릭 수다.
     */
    @Override
    protected Comparator<Player> ranking() {
        return BY_SCORE_THEN_TIME;
    }

    @Override
    public RoundOutcome act(Room room, Player player, GameAction action, int row, int col) {
        if (!room.isPlaying() || player.isEliminated() || player.isFinished()) {
            log.debug("행동 무시: room={}, user={}", room.getCode(), player.getUsername());
            return RoundOutcome.CONTINUE;
        }
        relayAction(room, player, action, row, col);
        return RoundOutcome.CONTINUE;
    }

    @Override
    protected RoundOutcome afterElimination(Room room, Player eliminated) {
        return endIfAllFinished(room);
    }

    @Override
    public RoundOutcome onPlayerRemoved(Room room, Player removed, int removedIndex) {
        return endIfAllFinished(room);
    }

    private RoundOutcome endIfAllFinished(Room room) {
        if (room.allFinished()) {
            return endRound(room, rank(room).get(0).username());
        }
        return RoundOutcome.CONTINUE;
    }
}

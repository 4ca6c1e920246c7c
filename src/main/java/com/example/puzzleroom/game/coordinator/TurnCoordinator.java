package com.example.puzzleroom.game.coordinator;

import com.example.puzzleroom.game.domain.GameAction;
import com.example.puzzleroom.game.domain.RoundOutcome;
import com.example.puzzleroom.game.service.TurnTimerService;
import com.example.puzzleroom.room.domain.GameMode;
import com.example.puzzleroom.room.domain.Player;
import com.example.puzzleroom.room.domain.Room;
import com.example.puzzleroom.room.dto.MessageType;
import com.example.puzzleroom.room.repository.RoomRepository;
import com.example.puzzleroom.room.service.RoomEventBroadcaster;
import com.example.puzzleroom.room.service.RoomLocks;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 턴제(Luck) 모드
 *
 * 불변식: PLAYING이고 생존자가 있으면 currentTurn은 항상 생존자 중 한 명이다.
 * 턴 순서는 입장 순서이며, 탈락자는 건너뛴다.
 */
@Slf4j
@Component
public class TurnCoordinator extends AbstractGameCoordinator {

    private final TurnTimerService turnTimerService;
    private final RoomLocks roomLocks;
    private final RoomRepository roomRepository;

    public TurnCoordinator(RoomEventBroadcaster broadcaster,
                           ApplicationEventPublisher eventPublisher,
                           TurnTimerService turnTimerService,
                           RoomLocks roomLocks,
                           RoomRepository roomRepository) {
        super(broadcaster, eventPublisher);
        this.turnTimerService = turnTimerService;
        this.roomLocks = roomLocks;
        this.roomRepository = roomRepository;
    }

    @Override
    public GameMode getGameMode() {
        return GameMode.TURN_BASED;
    }

    /**
     * 생존자(승자)가 먼저, 그다음 점수 → 시간
     */
    @Override
    protected Comparator<Player> ranking() {
        return SURVIVOR_FIRST;
    }

    @Override
    public void onRoundStarted(Room room) {
        scheduleForcePass(room.getCode(), room.getCurrentTurn());
    }

    @Override
    public RoundOutcome act(Room room, Player player, GameAction action, int row, int col) {
        if (!room.isPlaying() || player.isEliminated()) {
            log.debug("행동 무시: room={}, user={}, status={}", room.getCode(), player.getUsername(), room.getStatus());
            return RoundOutcome.CONTINUE;
        }
        if (!player.getUsername().equals(room.getCurrentTurn())) {
            log.debug("차례 아님: room={}, user={}, currentTurn={}", room.getCode(), player.getUsername(), room.getCurrentTurn());
            return RoundOutcome.CONTINUE;
        }

        relayAction(room, player, action, row, col);

        if (action == GameAction.REVEAL) {
            advanceTurn(room, room.indexOf(player), null);
        }
        return RoundOutcome.CONTINUE;
    }

    @Override
    protected RoundOutcome afterElimination(Room room, Player eliminated) {
        if (eliminated.getUsername().equals(room.getCurrentTurn())) {
            advanceTurn(room, room.indexOf(eliminated), null);
        }
        return RoundOutcome.CONTINUE;
    }

    @Override
    public RoundOutcome onPlayerRemoved(Room room, Player removed, int removedIndex) {
        List<Player> active = room.activePlayers();
        if (active.size() == 1) {
            Player winner = active.get(0);
            winner.setFinished(true);
            return endRound(room, winner.getUsername(), SURVIVOR_FIRST);
        }
        if (active.isEmpty()) {
            return endRound(room, null);
        }
        if (removed.getUsername().equals(room.getCurrentTurn())) {
            // 목록이 한 칸 당겨졌으므로 removedIndex 자리가 다음 후보
            advanceTurn(room, removedIndex - 1, null);
        }
        return RoundOutcome.CONTINUE;
    }

    /**
     * 제한 시간 초과로 턴을 강제로 넘긴다. 그 사이 턴이 바뀌었으면 아무것도 하지 않는다.
     */
    public void forcePass(Room room, String expectedTurn) {
        if (!room.isPlaying() || room.getGameMode() != GameMode.TURN_BASED
                || expectedTurn == null || !expectedTurn.equals(room.getCurrentTurn())) {
            log.debug("강제 턴 넘김 취소: room={}, expected={}, current={}", room.getCode(), expectedTurn, room.getCurrentTurn());
            return;
        }
        room.findByUsername(expectedTurn).ifPresent(holder -> {
            log.info("턴 시간 초과: room={}, user={}", room.getCode(), expectedTurn);
            advanceTurn(room, room.indexOf(holder), "timeout");
        });
    }

    /**
     * 제한 시간이 지나도 같은 사람이 턴을 잡고 있으면 넘긴다. 타이머 스레드에서 방 락을 잡고 실행된다.
     */
    private void scheduleForcePass(String roomCode, String turnHolder) {
        if (turnHolder == null) {
            return;
        }
        turnTimerService.schedule(roomCode, () -> roomLocks.withRoomLock(roomCode,
                () -> roomRepository.findByCode(roomCode).ifPresent(room -> forcePass(room, turnHolder))));
    }

    @Override
    protected void onRoundEnded(Room room) {
        turnTimerService.cancel(room.getCode());
    }

    /**
     * fromIndex 다음 자리부터 원형으로 생존자를 찾는다. 최대 players.size()번만 본다.
     *
     * @return 다음 턴을 찾았으면 true
     */
    boolean advanceTurn(Room room, int fromIndex, String reason) {
        List<Player> players = room.getPlayers();
        int size = players.size();
        for (int step = 1; step <= size; step++) {
            Player candidate = players.get(Math.floorMod(fromIndex + step, size));
            if (candidate.isActive()) {
                String previous = room.getCurrentTurn();
                room.setCurrentTurn(candidate.getUsername());

                Map<String, Object> data = new HashMap<>();
                data.put("currentTurn", candidate.getUsername());
                data.put("previousTurn", previous);
                if (reason != null) {
                    data.put("reason", reason);
                }
                broadcaster.broadcast(room.getCode(), MessageType.TURN_CHANGED, data);
                scheduleForcePass(room.getCode(), candidate.getUsername());
                return true;
            }
        }
        log.warn("다음 턴 없음: room={}", room.getCode());
        return false;
    }
}

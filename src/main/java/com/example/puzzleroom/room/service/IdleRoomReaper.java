package com.example.puzzleroom.room.service;

import com.example.puzzleroom.game.service.TurnTimerService;
import com.example.puzzleroom.global.config.RoomProperties;
import com.example.puzzleroom.room.domain.Player;
import com.example.puzzleroom.room.domain.Room;
import com.example.puzzleroom.room.repository.RoomRepository;
import com.example.puzzleroom.room.repository.SessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 유휴 방 회수
 *
 * 마지막 활동 후 room.idle-room-ttl이 지난 방을 지우고, 남아 있던 플레이어의 세션은 방 없는 상태로 되돌린다.
 * 누가 락을 잡고 있는 방은 이번 회차에서 건너뛴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdleRoomReaper {

    static final String CLOSED_MESSAGE = "Room closed due to inactivity";

    private final RoomRepository roomRepository;
    private final SessionRepository sessionRepository;
    private final RoomLocks roomLocks;
    private final RoomEventBroadcaster broadcaster;
    private final RoomProperties roomProperties;
    private final TurnTimerService turnTimerService;

    @Scheduled(
            initialDelayString = "#{@roomProperties.reaperInterval.isZero() ? 60000 : @roomProperties.reaperInterval.toMillis()}",
            fixedDelayString = "#{@roomProperties.reaperInterval.isZero() ? 60000 : @roomProperties.reaperInterval.toMillis()}")
    public void scheduledSweep() {
        if (roomProperties.getReaperInterval().isZero()) {
            return;
        }
        try {
            int reclaimed = reclaimIdleRooms();
            if (reclaimed > 0) {
                log.info("유휴 방 정리: {}개 회수, 남은 방 {}개", reclaimed, roomRepository.count());
            }
        } catch (Exception e) {
            log.error("유휴 방 정리 중 오류", e);
        }
    }

    /**
     * @return 회수한 방 수
     */
    public int reclaimIdleRooms() {
        Instant cutoff = Instant.now().minus(roomProperties.getIdleRoomTtl());
        AtomicInteger reclaimed = new AtomicInteger();

        for (Room room : roomRepository.findAll()) {
            if (!room.getLastActivityAt().isBefore(cutoff)) {
                continue;
            }
            roomLocks.tryWithRoomLock(room.getCode(), () -> {
                // 락을 기다리는 사이 활동이 있었거나 이미 지워졌으면 그대로 둔다
                if (!room.getLastActivityAt().isBefore(cutoff) || !roomRepository.delete(room)) {
                    return;
                }
                turnTimerService.cancel(room.getCode());
                for (Player player : room.getPlayers()) {
                    sessionRepository.detach(player.getConnectionId(), room.getCode());
                    broadcaster.sendError(player.getConnectionId(), CLOSED_MESSAGE);
                }
                reclaimed.incrementAndGet();
                log.info("유휴 방 회수: code={}, idleSince={}", room.getCode(), room.getLastActivityAt());
            });
        }
        return reclaimed.get();
    }
}

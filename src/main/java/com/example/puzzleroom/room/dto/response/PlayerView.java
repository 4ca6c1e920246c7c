package com.example.puzzleroom.room.dto.response;

import com.example.puzzleroom.room.domain.Player;
import com.example.puzzleroom.room.domain.Room;

import java.util.List;

/**
 * 전송 시점의 플레이어 상태 스냅샷. 이후 라운드 초기화의 영향을 받지 않는다.
 */
public record PlayerView(
        String username,
        boolean ready,
        int score,
        int time,
        boolean finished,
        boolean eliminated) {

    public static PlayerView from(Player player) {
        return new PlayerView(
                player.getUsername(),
                player.isReady(),
                player.getScore(),
                player.getTime(),
                player.isFinished(),
                player.isEliminated());
    }

    public static List<PlayerView> listOf(Room room) {
        return room.getPlayers().stream()
                .map(PlayerView::from)
                .toList();
    }
}

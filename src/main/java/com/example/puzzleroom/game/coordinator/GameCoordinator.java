package com.example.puzzleroom.game.coordinator;

import com.example.puzzleroom.game.domain.GameAction;
import com.example.puzzleroom.game.domain.RoundOutcome;
import com.example.puzzleroom.room.domain.GameMode;
import com.example.puzzleroom.room.domain.Player;
import com.example.puzzleroom.room.domain.Room;

/**
 * 게임 모드별 라운드 진행 규칙
 *
 * 모든 메서드는 호출자가 "room:{code}" 락을 잡은 상태에서 호출한다.
 * ENDED를 반환했다면 종료 이벤트 전송과 WAITING 복귀까지 끝난 상태다.
 */
public interface GameCoordinator {

    GameMode getGameMode();

    /**
     * 방이 막 PLAYING으로 전환된 직후
     */
    void onRoundStarted(Room room);

    /**
     * reveal/flag. 조건에 맞지 않는 제안은 상태 변경 없이 버린다.
     */
    RoundOutcome act(Room room, Player player, GameAction action, int row, int col);

    /**
     * @param clicks 탈락 시점 점수 (범위 보정 완료)
     */
    RoundOutcome eliminate(Room room, Player player, int clicks);

    RoundOutcome finish(Room room, Player player, int score, int time);

    /**
     * 스도쿠 판이 정답으로 다 채워짐. 마지막 칸을 채운 사람이 이긴다.
     *
     * @param placements 그 사람이 남긴 입력 칸 수 (점수)
     */
    RoundOutcome solved(Room room, Player solver, int placements);

    /**
     * 진행 중 플레이어가 나감 (이미 목록에서 제거된 뒤 호출)
     *
     * @param removedIndex 제거 전 목록에서의 위치
     */
    RoundOutcome onPlayerRemoved(Room room, Player removed, int removedIndex);
}

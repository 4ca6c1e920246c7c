package com.example.puzzleroom.game.coordinator;

import com.example.puzzleroom.game.domain.RankedResult;
import com.example.puzzleroom.room.domain.GameMode;
import com.example.puzzleroom.room.domain.Room;
import com.example.puzzleroom.room.domain.RoomStatus;
import com.example.puzzleroom.room.dto.GameMessage;
import com.example.puzzleroom.room.dto.MessageType;
import com.example.puzzleroom.support.RoomTestFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class RaceCoordinatorTest {

    private final RoomTestFixture fixture = new RoomTestFixture();

    @AfterEach
    void tearDown() {
        fixture.shutdown();
    }

    private String startRace(String... usernames) {
        String roomCode = fixture.createRoom("c1", usernames[0], usernames.length, GameMode.RACE);
        String[] connections = new String[usernames.length];
        connections[0] = "c1";
        for (int i = 1; i < usernames.length; i++) {
            connections[i] = "c" + (i + 1);
            fixture.join(connections[i], roomCode, usernames[i]);
        }
        fixture.readyAll(connections);
        return roomCode;
    }

    @SuppressWarnings("unchecked")
    private static List<RankedResult> results(GameMessage ended) {
        return (List<RankedResult>) ended.getData().get("results");
    }

    @Test
    @DisplayName("레이스: 둘 다 완주하면 점수 같을 때 시간이 짧은 쪽이 1등")
    void bothFinish() {
        // given
        String code = startRace("P1", "P2");

        // when
        fixture.finish("c1", 500, 30);
        assertThat(fixture.room(code).isPlaying()).isTrue();
        fixture.finish("c2", 500, 45);

        // then
        assertThat(fixture.broadcaster.roomMessages(code, MessageType.PLAYER_FINISHED)).hasSize(2);
        List<GameMessage> ended = fixture.broadcaster.roomMessages(code, MessageType.GAME_ENDED);
        assertThat(ended).hasSize(1);
        assertThat(ended.get(0).getData()).containsEntry("winner", "P1");
        assertThat(results(ended.get(0)))
                .extracting(RankedResult::rank, RankedResult::username, RankedResult::score, RankedResult::time)
                .containsExactly(tuple(1, "P1", 500, 30), tuple(2, "P2", 500, 45));

        Room room = fixture.room(code);
        assertThat(room.getStatus()).isEqualTo(RoomStatus.WAITING);
        assertThat(room.getPlayers()).noneMatch(p -> p.isFinished() || p.isReady());
    }

    @Test
    @DisplayName("점수가 높으면 시간이 길어도 앞선다")
    void higherScoreWins() {
        String code = startRace("P1", "P2");

        fixture.finish("c1", 300, 10);
        fixture.finish("c2", 800, 99);

        assertThat(results(fixture.broadcaster.lastRoomMessage(code, MessageType.GAME_ENDED)))
                .extracting(RankedResult::username)
                .containsExactly("P2", "P1");
    }

    @Test
    @DisplayName("보고된 점수와 시간은 허용 범위로 잘린다")
    void clampsReportedValues() {
        String code = startRace("P1", "P2");

        fixture.finish("c1", -5, -1);
        fixture.finish("c2", 999_999_999, 999_999_999);

        assertThat(results(fixture.broadcaster.lastRoomMessage(code, MessageType.GAME_ENDED)))
                .extracting(RankedResult::username, RankedResult::score, RankedResult::time)
                .containsExactly(tuple("P2", 100_000, 172_800), tuple("P1", 0, 0));
    }

    @Test
    @DisplayName("같은 사람의 두 번째 완주 보고는 무시된다")
    void duplicateFinishIgnored() {
        String code = startRace("P1", "P2");

        fixture.finish("c1", 100, 10);
        fixture.finish("c1", 900, 1);

        assertThat(fixture.broadcaster.roomMessages(code, MessageType.PLAYER_FINISHED)).hasSize(1);
        assertThat(fixture.room(code).findByUsername("P1")).hasValueSatisfying(p -> assertThat(p.getScore()).isEqualTo(100));
    }

    @Test
    @DisplayName("레이스에는 턴이 없어 누구의 행동이든 중계된다")
    void actionsRelayedWithoutTurns() {
        String code = startRace("P1", "P2");

        fixture.reveal("c1", 0, 0);
        fixture.reveal("c2", 1, 1);

        assertThat(fixture.room(code).getCurrentTurn()).isNull();
        assertThat(fixture.broadcaster.privateMessages("c1", MessageType.PLAYER_ACTION)).hasSize(1);
        assertThat(fixture.broadcaster.privateMessages("c2", MessageType.PLAYER_ACTION)).hasSize(1);
        assertThat(fixture.broadcaster.roomMessages(code, MessageType.TURN_CHANGED)).isEmpty();
    }

    @Test
    @DisplayName("전원 완주로 끝나면 탈락 여부와 상관없이 점수 → 시간 순이다")
    void eliminatedRankedByScore() {
        String code = startRace("P1", "P2", "P3");

        fixture.eliminated("c1", 900);
        assertThat(fixture.room(code).isPlaying()).isTrue();
        fixture.finish("c2", 500, 30);
        fixture.finish("c3", 400, 20);

        GameMessage ended = fixture.broadcaster.lastRoomMessage(code, MessageType.GAME_ENDED);
        assertThat(ended.getData()).containsEntry("winner", "P1");
        assertThat(results(ended))
                .extracting(RankedResult::username, RankedResult::score, RankedResult::eliminated)
                .containsExactly(tuple("P1", 900, true), tuple("P2", 500, false), tuple("P3", 400, false));
    }

    @Test
    @DisplayName("탈락으로 한 명만 남으면 그 생존자가 점수와 상관없이 1위로 끝난다")
    void lastSurvivorRankedFirst() {
        String code = startRace("P1", "P2", "P3");

        fixture.eliminated("c1", 900);
        fixture.eliminated("c2", 700);

        GameMessage ended = fixture.broadcaster.lastRoomMessage(code, MessageType.GAME_ENDED);
        assertThat(ended.getData()).containsEntry("winner", "P3");
        assertThat(results(ended))
                .extracting(RankedResult::username)
                .containsExactly("P3", "P1", "P2");
    }

    @Test
    @DisplayName("완주한 사람이 남은 상태에서 미완주자가 나가면 그 자리에서 종료")
    void leaveEndsWhenOthersFinished() {
        String code = startRace("P1", "P2", "P3");
        fixture.finish("c1", 100, 10);
        fixture.finish("c2", 100, 20);

        fixture.roomService.leaveRoom("c3");

        assertThat(fixture.broadcaster.roomMessages(code, MessageType.GAME_ENDED)).hasSize(1);
        assertThat(fixture.room(code).getStatus()).isEqualTo(RoomStatus.WAITING);
        assertThat(fixture.room(code).getPendingBoard()).isNotNull();
    }

    @Test
    @DisplayName("대기 중에 들어온 완주 보고는 버려진다")
    void finishWhileWaitingIgnored() {
        String code = fixture.createRoom("c1", "P1", 2, GameMode.RACE);

        fixture.finish("c1", 100, 10);

        assertThat(fixture.broadcaster.roomMessages(code, MessageType.PLAYER_FINISHED)).isEmpty();
    }
}

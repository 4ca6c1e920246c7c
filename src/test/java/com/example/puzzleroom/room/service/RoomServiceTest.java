package com.example.puzzleroom.room.service;

import com.example.puzzleroom.global.concurrency.LockStrategy;
import com.example.puzzleroom.global.concurrency.LockToken;
import com.example.puzzleroom.global.error.CommonException;
import com.example.puzzleroom.global.error.ErrorCode;
import com.example.puzzleroom.room.domain.GameMode;
import com.example.puzzleroom.room.domain.Room;
import com.example.puzzleroom.room.domain.RoomStatus;
import com.example.puzzleroom.room.dto.GameMessage;
import com.example.puzzleroom.room.dto.MessageType;
import com.example.puzzleroom.room.dto.request.ChangeModeRequest;
import com.example.puzzleroom.room.dto.request.CreateRoomRequest;
import com.example.puzzleroom.room.dto.request.JoinRoomRequest;
import com.example.puzzleroom.room.dto.response.RoomListResponse;
import com.example.puzzleroom.support.RoomTestFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoomServiceTest {

    private RoomTestFixture fixture = new RoomTestFixture();

    @AfterEach
    void tearDown() {
        fixture.shutdown();
    }

    private static void assertError(Executable call, ErrorCode expected) {
        assertThatThrownBy(call::execute)
                .isInstanceOf(CommonException.class)
                .extracting("errorCode")
                .isEqualTo(expected);
    }

    @Nested
    @DisplayName("방 생성")
    class Create {

        @Test
        @DisplayName("6자리 코드의 방이 만들어지고 생성자는 호스트가 된다")
        void createRoom() {
            // when
            String code = fixture.createRoom("c1", "alice", 4, GameMode.RACE);

            // then
            assertThat(code).matches("\\d{6}");
            Room room = fixture.room(code);
            assertThat(room.getHost()).isEqualTo("alice");
            assertThat(room.getStatus()).isEqualTo(RoomStatus.WAITING);
            assertThat(room.getPlayers()).extracting("username").containsExactly("alice");
            assertThat(room.getPendingBoard()).isNotNull();
            assertThat(fixture.sessions.findById("c1")).hasValueSatisfying(s -> assertThat(s.roomCode()).isEqualTo(code));

            GameMessage created = fixture.broadcaster.privateMessages("c1", MessageType.ROOM_CREATED).get(0);
            assertThat(created.getRoomCode()).isEqualTo(code);
            assertThat(created.getData()).containsEntry("host", "alice").containsEntry("maxPlayers", 4);
        }

        @Test
        @DisplayName("기본값: 3명, RACE")
        void defaults() {
            fixture.connect("c1");

            String code = fixture.roomService.createRoom("c1", new CreateRoomRequest("alice", null, null, null)).roomCode();

            Room room = fixture.room(code);
            assertThat(room.getMaxPlayers()).isEqualTo(3);
            assertThat(room.getGameMode()).isEqualTo(GameMode.RACE);
        }

        @Test
        @DisplayName("이미 방에 있는 연결은 새 방을 만들 수 없다")
        void alreadyInRoom() {
            fixture.createRoom("c1", "alice", 4, GameMode.RACE);

            assertError(() -> fixture.roomService.createRoom("c1", new CreateRoomRequest("alice", 4, GameMode.RACE, null)),
                    ErrorCode.ALREADY_IN_ROOM);
            assertThat(fixture.rooms.count()).isEqualTo(1);
        }

        @Test
        @DisplayName("정원 범위 밖이거나 이름이 비어 있으면 INVALID_REQUEST")
        void invalidRequest() {
            fixture.connect("c1");

            assertError(() -> fixture.roomService.createRoom("c1", new CreateRoomRequest("alice", 1, null, null)),
                    ErrorCode.INVALID_REQUEST);
            assertError(() -> fixture.roomService.createRoom("c1", new CreateRoomRequest("alice", 11, null, null)),
                    ErrorCode.INVALID_REQUEST);
            assertError(() -> fixture.roomService.createRoom("c1", new CreateRoomRequest("   ", 4, null, null)),
                    ErrorCode.INVALID_REQUEST);
            assertThat(fixture.rooms.count()).isZero();
        }

        @Test
        @DisplayName("방 수 한도에 닿으면 CAPACITY_EXCEEDED")
        void roomCapacity() {
            fixture.shutdown();
            fixture = new RoomTestFixture(props -> props.setMaxRooms(1));
            fixture.createRoom("c1", "alice", 4, GameMode.RACE);

            assertError(() -> fixture.createRoom("c2", "bob", 4, GameMode.RACE), ErrorCode.CAPACITY_EXCEEDED);
        }

        @Test
        @DisplayName("방 수 한도에 닿아도 유휴 방을 정리해서 자리가 나면 생성된다")
        void roomCapacityReclaimsIdleRooms() throws InterruptedException {
            fixture.shutdown();
            fixture = new RoomTestFixture(props -> {
                props.setMaxRooms(1);
                props.setIdleRoomTtl(Duration.ofMillis(10));
            });
            String stale = fixture.createRoom("c1", "alice", 4, GameMode.RACE);
            Thread.sleep(50);

            String fresh = fixture.createRoom("c2", "bob", 4, GameMode.RACE);

            assertThat(fixture.rooms.findByCode(fresh)).isPresent();
            assertThat(fixture.rooms.findByCode(stale).filter(r -> r.getHost().equals("alice"))).isEmpty();
            assertThat(fixture.sessions.findById("c1"))
                    .hasValueSatisfying(session -> assertThat(session.inRoom()).isFalse());
        }

        @Test
        @DisplayName("코드 후보가 전부 충돌하고 정리할 방도 없으면 CAPACITY_EXCEEDED")
        void codeSpaceExhausted() {
            fixture.shutdown();
            fixture = new RoomTestFixture(props -> props.setCodeAttempts(3), () -> "111111");
            fixture.createRoom("c1", "alice", 4, GameMode.RACE);

            assertError(() -> fixture.createRoom("c2", "bob", 4, GameMode.RACE), ErrorCode.CAPACITY_EXCEEDED);
            assertThat(fixture.room("111111").getHost()).isEqualTo("alice");
        }

        @Test
        @DisplayName("코드가 전부 충돌해도 유휴 방을 회수하면 그 코드로 새 방이 생긴다")
        void codeSpaceExhaustedThenReclaimed() throws InterruptedException {
            fixture.shutdown();
            fixture = new RoomTestFixture(props -> {
                props.setCodeAttempts(3);
                props.setIdleRoomTtl(Duration.ofMillis(10));
            }, () -> "111111");
            fixture.createRoom("c1", "alice", 4, GameMode.RACE);
            Thread.sleep(50);

            String code = fixture.createRoom("c2", "bob", 4, GameMode.RACE);

            assertThat(code).isEqualTo("111111");
            assertThat(fixture.room(code).getHost()).isEqualTo("bob");
            assertThat(fixture.broadcaster.privateMessages("c1", MessageType.ERROR))
                    .extracting(GameMessage::getContent)
                    .containsExactly(IdleRoomReaper.CLOSED_MESSAGE);
        }
    }

    @Nested
    @DisplayName("방 입장")
    class Join {

        @Test
        @DisplayName("입장하면 본인은 room_joined, 나머지는 player_joined를 받는다")
        void joinRoom() {
            String code = fixture.createRoom("c1", "alice", 4, GameMode.RACE);

            fixture.join("c2", code, "bob");

            assertThat(fixture.room(code).getPlayers()).extracting("username").containsExactly("alice", "bob");
            assertThat(fixture.broadcaster.privateMessages("c2", MessageType.ROOM_JOINED)).hasSize(1);
            assertThat(fixture.broadcaster.privateMessages("c2", MessageType.PLAYER_JOINED)).isEmpty();
            assertThat(fixture.broadcaster.privateMessages("c1", MessageType.PLAYER_JOINED))
                    .singleElement()
                    .extracting(GameMessage::getUsername)
                    .isEqualTo("bob");
        }

        @Test
        @DisplayName("앞자리 0이 빠진 코드도 같은 방으로 정규화된다")
        void normalizesCode() {
            fixture.shutdown();
            fixture = new RoomTestFixture(props -> {
            }, () -> "000042");
            fixture.createRoom("c1", "alice", 4, GameMode.RACE);

            fixture.join("c2", "42", "bob");

            assertThat(fixture.room("000042").getPlayers()).hasSize(2);
        }

        @Test
        @DisplayName("잘못된 코드 형식은 INVALID_ROOM_CODE, 없는 방은 ROOM_NOT_FOUND")
        void invalidOrMissingCode() {
            fixture.connect("c1");

            assertError(() -> fixture.roomService.joinRoom("c1", new JoinRoomRequest("abc", "bob")), ErrorCode.INVALID_ROOM_CODE);
            assertError(() -> fixture.roomService.joinRoom("c1", new JoinRoomRequest("1234567", "bob")), ErrorCode.INVALID_ROOM_CODE);
            assertError(() -> fixture.roomService.joinRoom("c1", new JoinRoomRequest("999999", "bob")), ErrorCode.ROOM_NOT_FOUND);
        }

        @Test
        @DisplayName("정원이 찬 방은 ROOM_FULL")
        void roomFull() {
            String code = fixture.createRoom("c1", "alice", 2, GameMode.RACE);
            fixture.join("c2", code, "bob");

            assertError(() -> fixture.join("c3", code, "carol"), ErrorCode.ROOM_FULL);
            assertThat(fixture.room(code).getPlayers()).hasSize(2);
        }

        @Test
        @DisplayName("같은 이름이 이미 있으면 ALREADY_IN_ROOM")
        void duplicateUsername() {
            String code = fixture.createRoom("c1", "alice", 4, GameMode.RACE);

            assertError(() -> fixture.join("c2", code, "alice"), ErrorCode.ALREADY_IN_ROOM);
        }

        @Test
        @DisplayName("진행 중인 방에 들어가려 하면 GAME_IN_PROGRESS, 방은 변하지 않는다")
        void joinWhilePlaying() {
            // given
            String code = fixture.createRoom("c1", "alice", 4, GameMode.RACE);
            fixture.join("c2", code, "bob");
            fixture.readyAll("c1", "c2");
            assertThat(fixture.room(code).isPlaying()).isTrue();

            // when & then
            assertError(() -> fixture.join("c3", code, "carol"), ErrorCode.GAME_IN_PROGRESS);
            assertThat(fixture.room(code).getPlayers()).extracting("username").containsExactly("alice", "bob");
        }

        @Test
        @DisplayName("연결 수 한도에 닿으면 CAPACITY_EXCEEDED")
        void connectionCapacity() {
            fixture.shutdown();
            fixture = new RoomTestFixture(props -> props.setMaxConnections(1));
            String code = fixture.createRoom("c1", "alice", 4, GameMode.RACE);

            assertError(() -> fixture.join("c2", code, "bob"), ErrorCode.CAPACITY_EXCEEDED);
        }
    }

    @Nested
    @DisplayName("준비 / 시작")
    class Ready {

        @Test
        @DisplayName("혼자 준비하면 시작하지 않는다")
        void singlePlayerDoesNotStart() {
            String code = fixture.createRoom("c1", "alice", 4, GameMode.RACE);

            fixture.roomService.markReady("c1");

            assertThat(fixture.room(code).isPlaying()).isFalse();
            assertThat(fixture.broadcaster.roomMessages(code, MessageType.PLAYER_READY_UPDATE)).hasSize(1);
        }

        @Test
        @DisplayName("전원 준비되면 game_start가 정확히 한 번 나가고 보드가 설치된다")
        void allReadyStarts() {
            String code = fixture.createRoom("c1", "alice", 4, GameMode.RACE);
            fixture.join("c2", code, "bob");

            fixture.roomService.markReady("c1");
            assertThat(fixture.room(code).isPlaying()).isFalse();
            fixture.roomService.markReady("c2");

            Room room = fixture.room(code);
            assertThat(room.isPlaying()).isTrue();
            assertThat(room.getBoard()).isNotNull();
            assertThat(room.getPendingBoard()).isNull();
            assertThat(room.getCurrentTurn()).isNull();
            assertThat(fixture.broadcaster.roomMessages(code, MessageType.GAME_START)).hasSize(1);
        }

        @Test
        @DisplayName("진행 중에 준비를 다시 보내면 무시된다")
        void readyWhilePlayingIgnored() {
            String code = fixture.createRoom("c1", "alice", 4, GameMode.RACE);
            fixture.join("c2", code, "bob");
            fixture.readyAll("c1", "c2");

            fixture.roomService.markReady("c1");

            assertThat(fixture.broadcaster.roomMessages(code, MessageType.GAME_START)).hasSize(1);
        }

        @Test
        @DisplayName("방 밖에서 준비하면 NOT_IN_ROOM")
        void readyOutsideRoom() {
            fixture.connect("c1");

            assertError(() -> fixture.roomService.markReady("c1"), ErrorCode.NOT_IN_ROOM);
        }
    }

    @Nested
    @DisplayName("퇴장")
    class Leave {

        @Test
        @DisplayName("나가면 left_room 응답, 남은 사람에게 player_left, 세션은 방 없는 상태로")
        void leaveRoom() {
            String code = fixture.createRoom("c1", "alice", 4, GameMode.RACE);
            fixture.join("c2", code, "bob");

            fixture.roomService.leaveRoom("c2");

            assertThat(fixture.room(code).getPlayers()).extracting("username").containsExactly("alice");
            assertThat(fixture.broadcaster.privateMessages("c2", MessageType.LEFT_ROOM)).hasSize(1);
            GameMessage left = fixture.broadcaster.lastRoomMessage(code, MessageType.PLAYER_LEFT);
            assertThat(left.getData()).containsEntry("username", "bob").containsEntry("playersRemaining", 1);
            assertThat(fixture.sessions.findById("c2"))
                    .hasValueSatisfying(session -> assertThat(session.inRoom()).isFalse());
        }

        @Test
        @DisplayName("나간 연결은 다시 연결하지 않고도 새 방을 만들 수 있다")
        void createAfterLeave() {
            String first = fixture.createRoom("c1", "alice", 4, GameMode.RACE);
            fixture.join("c2", first, "bob");
            fixture.roomService.leaveRoom("c2");

            String second = fixture.roomService.createRoom("c2", new CreateRoomRequest("bob", 4, GameMode.RACE, null)).roomCode();

            assertThat(second).isNotEqualTo(first);
            assertThat(fixture.sessions.findById("c2")).hasValueSatisfying(s -> assertThat(s.roomCode()).isEqualTo(second));
        }

        @Test
        @DisplayName("호스트가 나가면 가장 먼저 들어온 사람이 호스트가 된다")
        void hostHandOver() {
            String code = fixture.createRoom("c1", "alice", 4, GameMode.RACE);
            fixture.join("c2", code, "bob");
            fixture.join("c3", code, "carol");

            fixture.roomService.leaveRoom("c1");

            assertThat(fixture.room(code).getHost()).isEqualTo("bob");
            assertThat(fixture.broadcaster.lastRoomMessage(code, MessageType.PLAYER_LEFT).getData())
                    .containsEntry("host", "bob")
                    .containsEntry("hostChanged", true);
        }

        @Test
        @DisplayName("마지막 사람이 나가면 방이 삭제된다")
        void lastLeaveDeletesRoom() {
            String code = fixture.createRoom("c1", "alice", 4, GameMode.RACE);

            fixture.roomService.leaveRoom("c1");

            assertThat(fixture.rooms.findByCode(code)).isEmpty();
            assertError(() -> fixture.join("c2", code, "bob"), ErrorCode.ROOM_NOT_FOUND);
        }

        @Test
        @DisplayName("방 밖에서 나가기를 보내면 NOT_IN_ROOM")
        void leaveOutsideRoom() {
            fixture.connect("c1");

            assertError(() -> fixture.roomService.leaveRoom("c1"), ErrorCode.NOT_IN_ROOM);
        }
    }

    @Nested
    @DisplayName("모드 변경")
    class ChangeMode {

        @Test
        @DisplayName("호스트가 아니면 NOT_HOST")
        void notHost() {
            String code = fixture.createRoom("c1", "alice", 4, GameMode.RACE);
            fixture.join("c2", code, "bob");

            assertError(() -> fixture.roomService.changeMode("c2", new ChangeModeRequest(GameMode.TURN_BASED)),
                    ErrorCode.NOT_HOST);
            assertThat(fixture.room(code).getGameMode()).isEqualTo(GameMode.RACE);
        }

        @Test
        @DisplayName("호스트가 바꾸면 전원 준비 상태로 바로 재시작하고 첫 턴은 입장 순서 첫 번째")
        void changeModeRestarts() {
            String code = fixture.createRoom("c1", "alice", 4, GameMode.RACE);
            fixture.join("c2", code, "bob");

            fixture.roomService.changeMode("c1", new ChangeModeRequest(GameMode.TURN_BASED));

            Room room = fixture.room(code);
            assertThat(room.isPlaying()).isTrue();
            assertThat(room.getGameMode()).isEqualTo(GameMode.TURN_BASED);
            assertThat(room.getCurrentTurn()).isEqualTo("alice");
            assertThat(room.getPlayers()).allMatch(p -> p.isReady());
            assertThat(fixture.broadcaster.lastRoomMessage(code, MessageType.GAME_START).getData())
                    .containsEntry("currentTurn", "alice")
                    .containsEntry("gameMode", GameMode.TURN_BASED);
        }
    }

    @Test
    @DisplayName("대기 중인 방만 목록에 나온다")
    void waitingRooms() {
        String waiting = fixture.createRoom("c1", "alice", 4, GameMode.RACE);
        String playing = fixture.createRoom("c2", "bob", 4, GameMode.RACE);
        fixture.join("c3", playing, "carol");
        fixture.readyAll("c2", "c3");

        assertThat(fixture.roomService.getWaitingRooms())
                .extracting(RoomListResponse::roomCode)
                .containsExactly(waiting);
    }

    @Test
    @DisplayName("락이 잡힌 방은 기다리지 않고 목록에서 빠진다")
    void waitingRoomsSkipBusyRoom() {
        String idle = fixture.createRoom("c1", "alice", 4, GameMode.RACE);
        String busy = fixture.createRoom("c2", "bob", 4, GameMode.RACE);
        LockStrategy locks = fixture.lockStrategyFactory.getConfiguredStrategy();
        LockToken held = locks.acquire(RoomLocks.roomKey(busy), Duration.ofSeconds(1));
        try {
            long startedAt = System.nanoTime();

            List<RoomListResponse> rooms = fixture.roomService.getWaitingRooms();

            assertThat(Duration.ofNanos(System.nanoTime() - startedAt)).isLessThan(Duration.ofSeconds(1));
            assertThat(rooms).extracting(RoomListResponse::roomCode).containsExactly(idle);
        } finally {
            locks.release(RoomLocks.roomKey(busy), held);
        }

        assertThat(fixture.roomService.getWaitingRooms())
                .extracting(RoomListResponse::roomCode)
                .containsExactlyInAnyOrder(idle, busy);
    }
}

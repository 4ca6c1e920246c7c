package com.example.puzzleroom.global.config;

import com.example.puzzleroom.global.concurrency.LockType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 방/락/게임 관련 설정 (prefix: room)
 *
 * application.yml 또는 환경 변수로 덮어쓸 수 있다.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "room")
public class RoomProperties {

    /** 동시에 존재할 수 있는 최대 방 수 */
    private int maxRooms = 1000;

    /** 동시에 등록될 수 있는 최대 연결(세션) 수 */
    private int maxConnections = 10000;

    private int minPlayers = 2;
    private int maxPlayers = 10;

    /** 방 락 대기 시간 */
    private Duration lockTimeout = Duration.ofSeconds(5);

    /** 방 코드 선점 락 대기 시간 */
    private Duration creationLockTimeout = Duration.ofSeconds(5);

    /** 이 시간보다 오래 잡힌 락은 보유자가 죽은 것으로 보고 회수 */
    private Duration staleLockThreshold = Duration.ofSeconds(30);

    private LockType lockStrategy = LockType.IN_MEMORY;

    /** 방 코드 생성 1회차 시도 횟수 (소진 시 유휴 방 정리 후 한 번 더) */
    private int codeAttempts = 100;

    /** 마지막 활동 이후 이 시간이 지나면 회수 대상 */
    private Duration idleRoomTtl = Duration.ofMinutes(30);

    /** 주기적 유휴 방 정리 간격, 0이면 비활성 */
    private Duration reaperInterval = Duration.ofMinutes(5);

    /** 턴제 강제 턴 넘김, 0이면 비활성 */
    private Duration turnTimeout = Duration.ZERO;

    private int maxScore = 100000;
    private int maxTimeSeconds = 172800;
    private int maxClicks = 100000;

    /** 좌표 허용 범위 (0 ~ maxCoordinate) */
    private int maxCoordinate = 100;
}

package com.example.puzzleroom.room.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;
import lombok.Setter;

/**
 * 방에 속한 플레이어. 항상 정확히 하나의 Room 안에만 존재한다.
 * 방 락을 잡은 상태에서만 변경한다.
 */
@Getter
@Setter
public class Player {

    private final String username;

    @JsonIgnore
    private final String connectionId;

    private boolean ready;
    private int score;
    private int time;
    private boolean finished;
    private boolean eliminated;

    public Player(String username, String connectionId) {
        this.username = username;
        this.connectionId = connectionId;
    }

    public boolean isActive() {
        return !eliminated;
    }

    /**
     * 라운드 시작 시 초기화. ready는 그대로 둔다.
     */
    public void prepareForRound() {
        this.score = 0;
        this.time = 0;
        this.finished = false;
        this.eliminated = false;
    }

    /**
     * 대기 상태로 돌아갈 때 라운드 한정 필드 전체 초기화
     */
    public void resetRound() {
        prepareForRound();
        this.ready = false;
    }
}

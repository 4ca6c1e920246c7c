package com.example.puzzleroom.room.domain;

public enum RoomStatus {
    WAITING, // 대기 중 (입장/준비 가능)
    PLAYING  // 게임 진행 중 (입장 불가)
}

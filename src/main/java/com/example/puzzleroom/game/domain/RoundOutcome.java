package com.example.puzzleroom.game.domain;

public enum RoundOutcome {
    CONTINUE, // 라운드 계속
    ENDED     // 종료 이벤트 전송 + 방 WAITING 복귀 완료
}

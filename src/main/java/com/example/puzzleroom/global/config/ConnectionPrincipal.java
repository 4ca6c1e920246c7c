package com.example.puzzleroom.global.config;

import java.security.Principal;

/**
 * STOMP 세션 id를 이름으로 쓰는 Principal. convertAndSendToUser의 대상이 곧 연결 하나가 된다.
 */
public record ConnectionPrincipal(String connectionId) implements Principal {

    @Override
    public String getName() {
        return connectionId;
    }
}

package com.example.puzzleroom.global.config;

import com.example.puzzleroom.room.service.ConnectionLifecycleHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * STOMP 연결 처리
 *
 * CONNECT 시 세션 id를 Principal로 묶고, 연결/해제 이벤트를 ConnectionLifecycleHandler로 넘긴다.
 */
@Slf4j
@Component
public class StompHandler implements ChannelInterceptor {

    private final ConnectionLifecycleHandler connectionLifecycleHandler;

    // 브로커 설정 → 인터셉터 → 방 서비스 → SimpMessagingTemplate 순환을 끊는다
    public StompHandler(@Lazy ConnectionLifecycleHandler connectionLifecycleHandler) {
        this.connectionLifecycleHandler = connectionLifecycleHandler;
    }

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor != null && StompCommand.CONNECT.equals(accessor.getCommand())) {
            String sessionId = accessor.getSessionId();
            if (sessionId != null) {
                accessor.setUser(new ConnectionPrincipal(sessionId));
            } else {
                log.error("StompHandler: CONNECT 프레임에 세션 id가 없습니다.");
            }
        }
        return message;
    }

    @EventListener
    public void handleWebSocketConnectListener(SessionConnectEvent event) {
        StompHeaderAccessor headerAccessor = StompHeaderAccessor.wrap(event.getMessage());
        String sessionId = headerAccessor.getSessionId();
        if (sessionId == null) {
            log.warn("세션 id 없는 연결 이벤트");
            return;
        }
        connectionLifecycleHandler.onConnect(sessionId);
    }

    @EventListener
    public void handleWebSocketDisconnectListener(SessionDisconnectEvent event) {
        try {
            connectionLifecycleHandler.onDisconnect(event.getSessionId());
        } catch (Exception e) {
            log.error("연결 해제 처리 중 오류: sessionId={}", event.getSessionId(), e);
        }
    }
}

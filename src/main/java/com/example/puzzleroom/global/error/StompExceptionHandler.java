package com.example.puzzleroom.global.error;

import com.example.puzzleroom.global.concurrency.LockTimeoutException;
import com.example.puzzleroom.room.dto.GameMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.converter.MessageConversionException;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.support.MethodArgumentNotValidException;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.web.bind.annotation.ControllerAdvice;

/**
 * STOMP 메시지 처리 중 예외 → 보낸 연결에만 error 이벤트
 *
 * 클라이언트에는 ErrorCode의 고정 문구만 나간다. 예외 메시지, 자원 이름은 로그에만 남긴다.
 */
@Slf4j
@ControllerAdvice
public class StompExceptionHandler {

    private static final String ERROR_DESTINATION = "/queue/private";

    @MessageExceptionHandler(CommonException.class)
    @SendToUser(destinations = ERROR_DESTINATION, broadcast = false)
    public GameMessage handleCommonException(CommonException e) {
        log.info("요청 거부: {} {}", e.getErrorCode().getCode(), e.getDetail() == null ? "" : e.getDetail());
        return GameMessage.error(e.getErrorCode().getMessage());
    }

    @MessageExceptionHandler(LockTimeoutException.class)
    @SendToUser(destinations = ERROR_DESTINATION, broadcast = false)
    public GameMessage handleLockTimeout(LockTimeoutException e) {
        log.warn("락 타임아웃: {}", e.getResourceName());
        return GameMessage.error(ErrorCode.ROOM_BUSY.getMessage());
    }

    @MessageExceptionHandler({MethodArgumentNotValidException.class, MessageConversionException.class})
    @SendToUser(destinations = ERROR_DESTINATION, broadcast = false)
    public GameMessage handleInvalidPayload(Exception e) {
        log.debug("잘못된 payload: {}", e.getMessage());
        return GameMessage.error(ErrorCode.INVALID_REQUEST.getMessage());
    }

    @MessageExceptionHandler(Exception.class)
    @SendToUser(destinations = ERROR_DESTINATION, broadcast = false)
    public GameMessage handleException(Exception e) {
        log.error("Unhandled STOMP Exception: ", e);
        return GameMessage.error(ErrorCode.INTERNAL_ERROR.getMessage());
    }
}

package com.example.puzzleroom.global.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 클라이언트에 노출되는 메시지는 항상 여기 정의된 고정 문구뿐이다.
 */
@Getter
public enum ErrorCode {
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Invalid data"),
    INVALID_ROOM_CODE(HttpStatus.BAD_REQUEST, "INVALID_ROOM_CODE", "Invalid room code format - must be 6 digits"),
    ROOM_NOT_FOUND(HttpStatus.NOT_FOUND, "ROOM_NOT_FOUND", "Room not found"),
    ROOM_FULL(HttpStatus.CONFLICT, "ROOM_FULL", "Room is full"),
    GAME_IN_PROGRESS(HttpStatus.CONFLICT, "GAME_IN_PROGRESS", "Game already in progress"),
    ALREADY_IN_ROOM(HttpStatus.CONFLICT, "ALREADY_IN_ROOM", "Already in room"),
    NOT_IN_ROOM(HttpStatus.BAD_REQUEST, "NOT_IN_ROOM", "You are not in a room"),
    NOT_CONNECTED(HttpStatus.BAD_REQUEST, "NOT_CONNECTED", "Connection is closed"),
    INVALID_CELL(HttpStatus.BAD_REQUEST, "INVALID_CELL", "Invalid cell coordinates"),
    INVALID_NUMBER(HttpStatus.BAD_REQUEST, "INVALID_NUMBER", "Invalid number"),
    INITIAL_CELL(HttpStatus.BAD_REQUEST, "INITIAL_CELL", "Cannot modify initial cells"),
    NOT_HOST(HttpStatus.FORBIDDEN, "NOT_HOST", "Only host can change game mode"),
    ROOM_BUSY(HttpStatus.SERVICE_UNAVAILABLE, "ROOM_BUSY", "Room is busy, please retry"),
    CAPACITY_EXCEEDED(HttpStatus.SERVICE_UNAVAILABLE, "CAPACITY_EXCEEDED", "Server at capacity. Please try again later."),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "Internal Server Error"),
    ;
    private final String code;
    private final String message;
    private final HttpStatus status;

    ErrorCode(HttpStatus status, String code, String message) {
        this.status = status;
        this.message = message;
        this.code = code;
    }

    public CommonException commonException() {return new CommonException(this);}

    public CommonException commonException(String detail) {return new CommonException(this, detail);}
}

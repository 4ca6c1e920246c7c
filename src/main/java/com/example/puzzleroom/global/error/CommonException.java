package com.example.puzzleroom.global.error;

import lombok.Getter;

/**
 * 클라이언트에는 errorCode의 고정 문구만, detail(방 코드 등)은 로그에만 남긴다.
 */
@Getter
public class CommonException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String detail;

    public CommonException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
        this.detail = null;
    }

    public CommonException(ErrorCode errorCode, String detail) {
        super(errorCode.getMessage() + " (" + detail + ")");
        this.errorCode = errorCode;
        this.detail = detail;
    }

    public CommonException(ErrorCode errorCode, Throwable cause) {
        super(errorCode.getMessage(), cause);
        this.errorCode = errorCode;
        this.detail = cause.getMessage();
    }
}

package com.example.puzzleroom.global.error;

import lombok.Builder;

@Builder
public record ErrorResponse(
        String code,
        String message) {

    public static ErrorResponse of(ErrorCode errorCode) {
        return new ErrorResponse(errorCode.getCode(), errorCode.getMessage());
    }
}

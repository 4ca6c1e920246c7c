package com.example.puzzleroom.room.service;

import com.example.puzzleroom.global.config.RoomProperties;
import com.example.puzzleroom.global.error.CommonException;
import com.example.puzzleroom.global.error.ErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RoomValidator {

    private static final int MAX_USERNAME_LENGTH = 50;

    private final RoomProperties roomProperties;

    /**
     * "42" → "000042". 숫자가 아니거나 0~999999 밖이면 거부.
     */
    public String normalizeRoomCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw ErrorCode.INVALID_ROOM_CODE.commonException();
        }
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new CommonException(ErrorCode.INVALID_ROOM_CODE, e);
        }
        if (value < 0 || value > 999_999) {
            throw ErrorCode.INVALID_ROOM_CODE.commonException();
        }
        return String.format("%06d", value);
    }

    public String validateUsername(String username) {
        if (username == null || username.isBlank() || username.trim().length() > MAX_USERNAME_LENGTH) {
            throw ErrorCode.INVALID_REQUEST.commonException();
        }
        return username.trim();
    }

    public void validateMaxPlayers(int maxPlayers) {
        if (maxPlayers < roomProperties.getMinPlayers() || maxPlayers > roomProperties.getMaxPlayers()) {
            throw ErrorCode.INVALID_REQUEST.commonException();
        }
    }
}

package com.example.puzzleroom.room.controller;

import com.example.puzzleroom.room.dto.request.ChangeModeRequest;
import com.example.puzzleroom.room.dto.request.CreateRoomRequest;
import com.example.puzzleroom.room.dto.request.JoinRoomRequest;
import com.example.puzzleroom.room.service.RoomService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Controller;

import java.security.Principal;

/**
 * 방 관련 STOMP 진입점. Principal 이름 = 연결 id.
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class RoomController {

    private final RoomService roomService;

    @MessageMapping("/room.create")
    public void createRoom(@Valid @Payload CreateRoomRequest request, Principal principal) {
        if (principal == null) {
            log.error("createRoom 실패: Principal 객체를 찾을 수 없습니다.");
            return;
        }
        roomService.createRoom(principal.getName(), request);
    }

    @MessageMapping("/room.join")
    public void joinRoom(@Valid @Payload JoinRoomRequest request, Principal principal) {
        if (principal == null) {
            log.error("joinRoom 실패: Principal 객체를 찾을 수 없습니다.");
            return;
        }
        roomService.joinRoom(principal.getName(), request);
    }

    @MessageMapping("/room.leave")
    public void leaveRoom(Principal principal) {
        if (principal == null) {
            log.error("leaveRoom 실패: Principal 객체를 찾을 수 없습니다.");
            return;
        }
        roomService.leaveRoom(principal.getName());
    }

    @MessageMapping("/room.ready")
    public void ready(Principal principal) {
        if (principal == null) {
            log.error("ready 실패: Principal 객체를 찾을 수 없습니다.");
            return;
        }
        roomService.markReady(principal.getName());
    }

    /*
     * 호스트 전용 모드 변경 + 즉시 재시작
     */
    @MessageMapping("/room.changeMode")
    public void changeMode(@Valid @Payload ChangeModeRequest request, Principal principal) {
        if (principal == null) {
            log.error("changeMode 실패: Principal 객체를 찾을 수 없습니다.");
            return;
        }
        roomService.changeMode(principal.getName(), request);
    }
}

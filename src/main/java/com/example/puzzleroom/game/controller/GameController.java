package com.example.puzzleroom.game.controller;

import com.example.puzzleroom.game.dto.request.GameActionRequest;
import com.example.puzzleroom.game.dto.request.GameFinishedRequest;
import com.example.puzzleroom.game.dto.request.PlaceNumberRequest;
import com.example.puzzleroom.game.service.GameService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Controller;

import java.security.Principal;

@Slf4j
@Controller
@RequiredArgsConstructor
public class GameController {

    private final GameService gameService;

    @MessageMapping("/game.action")
    public void action(@Payload GameActionRequest request, Principal principal) {
        if (principal == null) {
            log.error("action 실패: Principal 객체를 찾을 수 없습니다.");
            return;
        }
        gameService.handleAction(principal.getName(), request);
    }

    @MessageMapping("/game.finished")
    public void finished(@Payload GameFinishedRequest request, Principal principal) {
        if (principal == null) {
            log.error("finished 실패: Principal 객체를 찾을 수 없습니다.");
            return;
        }
        gameService.handleFinished(principal.getName(), request);
    }

    @MessageMapping("/game.place")
    public void placeNumber(@Payload PlaceNumberRequest request, Principal principal) {
        if (principal == null) {
            log.error("place 실패: Principal 객체를 찾을 수 없습니다.");
            return;
        }
        gameService.placeNumber(principal.getName(), request);
    }

    @MessageMapping("/game.hint")
    public void hint(Principal principal) {
        if (principal == null) {
            log.error("hint 실패: Principal 객체를 찾을 수 없습니다.");
            return;
        }
        gameService.requestHint(principal.getName());
    }
}

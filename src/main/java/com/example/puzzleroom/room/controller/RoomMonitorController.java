package com.example.puzzleroom.room.controller;

import com.example.puzzleroom.global.concurrency.LockInfo;
import com.example.puzzleroom.global.concurrency.LockStrategy;
import com.example.puzzleroom.global.concurrency.LockStrategyFactory;
import com.example.puzzleroom.global.dto.CommonResponse;
import com.example.puzzleroom.room.repository.RoomRepository;
import com.example.puzzleroom.room.repository.SessionRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Tag(name = "RoomMonitorController", description = "락/방 상태 모니터링 API")
@RestController
@RequestMapping("/api/monitor")
@RequiredArgsConstructor
public class RoomMonitorController {

    private final LockStrategyFactory lockStrategyFactory;
    private final RoomRepository roomRepository;
    private final SessionRepository sessionRepository;

    @Operation(summary = "보유 중인 락 목록", description = "자원 이름, 보유 시간(ms), 보유 스레드")
    @GetMapping("/locks")
    public ResponseEntity<CommonResponse<List<LockInfo>>> getLocks() {
        LockStrategy strategy = lockStrategyFactory.getConfiguredStrategy();
        return ResponseEntity.ok(CommonResponse.success(strategy.heldLocks(), strategy.getStrategyName()));
    }

    @Operation(summary = "방/연결 수")
    @GetMapping("/stats")
    public ResponseEntity<CommonResponse<Map<String, Object>>> getStats() {
        Map<String, Object> stats = Map.of(
                "rooms", roomRepository.count(),
                "connections", sessionRepository.count(),
                "lockStrategy", lockStrategyFactory.getConfiguredStrategy().getStrategyName());
        return ResponseEntity.ok(CommonResponse.success(stats, "통계 조회 성공"));
    }
}

package com.example.puzzleroom.room.controller;

import com.example.puzzleroom.global.dto.CommonResponse;
import com.example.puzzleroom.room.dto.response.RoomListResponse;
import com.example.puzzleroom.room.dto.response.RoomResponse;
import com.example.puzzleroom.room.service.RoomService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Tag(name = "RoomRestController", description = "방 조회 API")
@RestController
@RequestMapping("/api/rooms")
@RequiredArgsConstructor
public class RoomRestController {

    private final RoomService roomService;

    @Operation(summary = "대기 중인 방 목록", description = "입장 가능한(WAITING) 방만 반환합니다.")
    @GetMapping
    public ResponseEntity<CommonResponse<List<RoomListResponse>>> getWaitingRooms() {
        return ResponseEntity.ok(CommonResponse.success(roomService.getWaitingRooms(), "방 목록 조회 성공"));
    }

    @Operation(summary = "방 단건 조회", description = "방 코드로 현재 상태 스냅샷을 반환합니다. 없으면 404.")
    @GetMapping("/{roomCode}")
    public ResponseEntity<CommonResponse<RoomResponse>> getRoom(@PathVariable String roomCode) {
        return ResponseEntity.ok(CommonResponse.success(roomService.getRoom(roomCode), "방 조회 성공"));
    }
}

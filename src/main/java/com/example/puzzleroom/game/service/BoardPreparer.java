package com.example.puzzleroom.game.service;

import com.example.puzzleroom.game.puzzle.PuzzleBoard;
import com.example.puzzleroom.game.puzzle.PuzzleEngine;
import com.example.puzzleroom.room.domain.Room;
import com.example.puzzleroom.room.repository.RoomRepository;
import com.example.puzzleroom.room.service.RoomLocks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 다음 라운드 보드를 미리 받아 둔다.
 *
 * 생성은 락 밖에서, 설치만 락 안에서 한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BoardPreparer {

    private final PuzzleEngine puzzleEngine;
    private final RoomRepository roomRepository;
    private final RoomLocks roomLocks;

    public void prepareNextBoard(String roomCode) {
        Optional<Room> snapshot = roomRepository.findByCode(roomCode);
        if (snapshot.isEmpty()) {
            return;
        }
        PuzzleBoard board = puzzleEngine.generate(snapshot.get().getDifficulty());

        roomLocks.withRoomLock(roomCode, () -> roomRepository.findByCode(roomCode)
                .filter(room -> room.getPendingBoard() == null)
                .ifPresent(room -> {
                    room.installPendingBoard(board);
                    log.debug("다음 보드 준비 완료: room={}", roomCode);
                }));
    }
}

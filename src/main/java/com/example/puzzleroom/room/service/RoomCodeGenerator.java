package com.example.puzzleroom.room.service;

import com.example.puzzleroom.global.config.RoomProperties;
import com.example.puzzleroom.room.domain.Room;
import com.example.puzzleroom.room.repository.RoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Optional;
import java.util.function.Function;

/**
 * 6자리 방 코드 발급 + 선점
 *
 * 후보 코드마다 "room_creation:{code}" 락 안에서 존재 여부를 다시 확인하고 등록한다.
 * 두 생성자가 같은 후보를 뽑아도 한쪽만 등록된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomCodeGenerator {

    private final RoomRepository roomRepository;
    private final RoomLocks roomLocks;
    private final RoomProperties roomProperties;
    private final SecureRandom random = new SecureRandom();

    public String nextCandidate() {
        return String.format("%06d", random.nextInt(1_000_000));
    }

    /**
     * 비어 있는 코드를 찾아 roomFactory로 만든 방을 등록한다.
     *
     * @return 시도 횟수 안에 못 찾으면 empty
     */
    public Optional<Room> allocate(Function<String, Room> roomFactory) {
        int attempts = roomProperties.getCodeAttempts();
        for (int i = 0; i < attempts; i++) {
            String code = nextCandidate();
            if (roomRepository.existsByCode(code)) {
                continue;
            }
            Room claimed = roomLocks.withCreationLock(code, () -> {
                if (roomRepository.existsByCode(code)) {
                    return null;
                }
                Room room = roomFactory.apply(code);
                roomRepository.save(room);
                return room;
            });
            if (claimed != null) {
                return Optional.of(claimed);
            }
            log.debug("방 코드 선점 경합 패배: {}", code);
        }
        log.warn("방 코드 발급 실패: {}회 시도 모두 충돌", attempts);
        return Optional.empty();
    }
}

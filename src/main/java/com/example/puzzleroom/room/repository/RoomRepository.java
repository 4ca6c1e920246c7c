package com.example.puzzleroom.room.repository;

import com.example.puzzleroom.global.store.GuardedStore;
import com.example.puzzleroom.room.domain.Room;
import com.example.puzzleroom.room.domain.RoomStatus;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * 방 코드 → 방 레지스트리 (프로세스 메모리, 재시작 시 소멸)
 */
@Repository
public class RoomRepository {

    private final GuardedStore<String, Room> rooms = new GuardedStore<>();

    public Optional<Room> findByCode(String code) {
        return rooms.get(code);
    }

    public boolean existsByCode(String code) {
        return rooms.contains(code);
    }

    public void save(Room room) {
        rooms.set(room.getCode(), room);
    }

    /**
     * 같은 인스턴스일 때만 삭제. 같은 코드로 새로 만들어진 방은 건드리지 않는다.
     */
    public boolean delete(Room room) {
        return rooms.delete(room.getCode(), room);
    }

    public List<Room> findAll() {
        return rooms.values();
    }

    public List<Room> findAllByStatus(RoomStatus status) {
        return rooms.values().stream()
                .filter(room -> room.getStatus() == status)
                .toList();
    }

    public int count() {
        return rooms.size();
    }
}

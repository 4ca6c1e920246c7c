package com.example.puzzleroom.game.coordinator;

import com.example.puzzleroom.room.domain.GameMode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 게임 모드별 코디네이터를 제공하는 Factory
 */
@Component
@RequiredArgsConstructor
public class GameCoordinatorFactory {

    private final TurnCoordinator turnCoordinator;
    private final RaceCoordinator raceCoordinator;

    public GameCoordinator getCoordinator(GameMode mode) {
        return switch (mode) {
            case TURN_BASED -> turnCoordinator;
            case RACE -> raceCoordinator;
        };
    }
}

package com.example.mimimi.DTO;

import com.example.mimimi.Domain.GameStatus;
import com.example.mimimi.Entity.Game;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
public class GameResponseDTO {
    private Long id;
    private GameStatus state;
    private int roundsCount;
    private int cluesInterval;
    private int gridSize;
    private String hostUserId;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    // 대기 중일 때만 (유효한 초대 코드)
    private String shortCode;
    private Long currentRoundId;
    private Integer currentRoundPosition;
    private boolean timerRunning;
    private List<PlayerResponseDTO> players = new ArrayList<>();

    public GameResponseDTO(Game game) {
        this.id = game.getId();
        this.state = game.getState();
        this.roundsCount = game.getRoundsCount();
        this.cluesInterval = game.getCluesInterval();
        this.gridSize = game.getGridSize();
        this.hostUserId = game.getHostUserId();
        this.createdAt = game.getCreatedAt();
        this.startedAt = game.getStartedAt();
    }
}

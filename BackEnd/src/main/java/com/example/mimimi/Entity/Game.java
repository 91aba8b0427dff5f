package com.example.mimimi.Entity;

import com.example.mimimi.Domain.GameStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "games", indexes = @Index(name = "idx_games_state", columnList = "state"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Game {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private int roundsCount;

    // 키워드 공개 간격(초)
    @Column(nullable = false)
    private int cluesInterval;

    @Column(nullable = false)
    private int gridSize;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private GameStatus state;

    @Column(nullable = false, length = 50)
    private String hostUserId;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime startedAt;

    private LocalDateTime updatedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = LocalDateTime.now();
        if (state == null) state = GameStatus.WAITING_FOR_PLAYERS;
        updatedAt = createdAt;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}

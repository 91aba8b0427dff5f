package com.example.mimimi.Entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 한 라운드에서 한 플레이어가 고른 답. 저장 이후 변경하지 않는다.
 */
@Entity
@Table(name = "picks",
        uniqueConstraints = @UniqueConstraint(name = "uk_picks_round_player", columnNames = {"round_id", "player_id"}),
        indexes = @Index(name = "idx_picks_round_correct", columnList = "round_id, correct"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Pick {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "round_id", nullable = false)
    private Long roundId;

    @Column(name = "player_id", nullable = false)
    private Long playerId;

    // 라운드 시작부터 선택까지 걸린 시간(ms)
    @Column(name = "pick_time", nullable = false)
    private long time;

    @Column(nullable = false)
    private int keywordsShown;

    @Column(nullable = false)
    private boolean correct;

    // 플레이어가 고른 단어
    @Column(nullable = false)
    private Long wordId;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = LocalDateTime.now();
    }
}

package com.example.mimimi.Entity;

import com.example.mimimi.Domain.RoundState;
import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "rounds",
        uniqueConstraints = @UniqueConstraint(name = "uk_rounds_game_position", columnNames = {"game_id", "position"}),
        indexes = @Index(name = "idx_rounds_game_id", columnList = "game_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Round {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "game_id", nullable = false)
    private Long gameId;

    // 정답 단어
    @Column(nullable = false)
    private Long wordId;

    // 공개 순서대로의 키워드 목록. 게임 서버가 라운드 시작 시 개수를 읽는다
    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "round_keywords", joinColumns = @JoinColumn(name = "round_id"))
    @OrderColumn(name = "keyword_order")
    @Column(name = "keyword_id", nullable = false)
    private List<Long> keywordIds = new ArrayList<>();

    // 보기 그리드 (정답 + 오답)
    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "round_possible_words", joinColumns = @JoinColumn(name = "round_id"))
    @OrderColumn(name = "grid_order")
    @Column(name = "word_id", nullable = false)
    private List<Long> possibleWordIds = new ArrayList<>();

    @Column(nullable = false)
    private int position;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RoundState state;

    public int getKeywordCount() {
        return keywordIds.size();
    }
}

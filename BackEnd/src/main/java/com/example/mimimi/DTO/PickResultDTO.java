package com.example.mimimi.DTO;

import com.example.mimimi.Domain.PickResult;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
public class PickResultDTO {
    private Long roundId;
    private Long wordId;
    private boolean correct;
    private int keywordsShown;
    private int pointsAwarded;
    private boolean allPicked;

    public PickResultDTO(PickResult result) {
        this.roundId = result.getPick().getRoundId();
        this.wordId = result.getPick().getWordId();
        this.correct = result.getPick().isCorrect();
        this.keywordsShown = result.getPick().getKeywordsShown();
        this.pointsAwarded = result.getPointsAwarded();
        this.allPicked = result.isAllPicked();
    }
}

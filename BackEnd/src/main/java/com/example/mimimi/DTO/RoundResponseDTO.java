package com.example.mimimi.DTO;

import com.example.mimimi.Domain.RoundState;
import com.example.mimimi.Entity.Round;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
public class RoundResponseDTO {
    private Long id;
    private int position;
    private RoundState state;
    // 정답은 끝난 라운드만 공개
    private Long wordId;

    public RoundResponseDTO(Round round) {
        this.id = round.getId();
        this.position = round.getPosition();
        this.state = round.getState();
        this.wordId = round.getState() == RoundState.FINISHED ? round.getWordId() : null;
    }
}

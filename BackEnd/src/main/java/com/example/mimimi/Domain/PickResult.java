package com.example.mimimi.Domain;

import com.example.mimimi.Entity.Pick;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class PickResult {
    private final Pick pick;
    private final int pointsAwarded;
    // 이 선택으로 라운드의 모든 플레이어가 골랐는지
    private final boolean allPicked;
}

package com.example.mimimi.DTO;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class CreateGameDTO {
    private String hostUserId;
    // 비어 있으면 기본값 사용
    private Integer roundsCount;
    private Integer cluesInterval;
    private Integer gridSize;
}

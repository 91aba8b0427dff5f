package com.example.mimimi.DTO;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class PickRequestDTO {
    private String userId;
    private Long wordId;
    // 라운드 시작부터 선택까지 걸린 시간 (ms)
    private long time;
}

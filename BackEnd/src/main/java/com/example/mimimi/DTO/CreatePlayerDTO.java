package com.example.mimimi.DTO;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class CreatePlayerDTO {
    private String userId;
    private String nickname;
    private String avatar;
}

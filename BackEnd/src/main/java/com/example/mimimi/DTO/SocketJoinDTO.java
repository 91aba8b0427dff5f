package com.example.mimimi.DTO;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class SocketJoinDTO {
    private String userId;
}

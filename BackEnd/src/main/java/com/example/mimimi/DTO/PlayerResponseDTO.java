package com.example.mimimi.DTO;

import com.example.mimimi.Entity.Player;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
public class PlayerResponseDTO {
    private Long id;
    private String userId;
    private String nickname;
    private String avatar;
    private int points;

    public PlayerResponseDTO(Player player) {
        this.id = player.getId();
        this.userId = player.getUserId();
        this.nickname = player.getNickname();
        this.avatar = player.getAvatar();
        this.points = player.getPoints();
    }
}

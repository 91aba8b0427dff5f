package com.example.mimimi.Domain;

import java.util.EnumSet;
import java.util.Set;

public enum GameStatus {
    WAITING_FOR_PLAYERS,
    GAME_RUNNING,
    GAME_OVER,
    LOBBY_TIMEOUT,
    HOST_DISCONNECTED;

    // 호스트 접속 여부가 의미 있는 상태 (= 정리 대상)
    public static final Set<GameStatus> ACTIVE = EnumSet.of(WAITING_FOR_PLAYERS, GAME_RUNNING);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }
}

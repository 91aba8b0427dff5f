package com.example.mimimi.Domain;

public enum GameEventType {
    // 게임 서버 (타이머)
    KEYWORD_REVEALED,
    ROUND_TIMEOUT,

    // 라운드 진행
    GAME_STARTED,
    ROUND_GENERATION_FAILED,
    ROUND_STARTED,
    PLAYER_PICKED,
    ALL_PICKED,
    ROUND_FINISHED,
    GAME_FINISHED,
    GAME_STOPPED_BY_HOST,
    HOST_DISCONNECTED,
    NEW_GAME_STARTED,

    // 로비
    PLAYER_JOINED,
    PLAYER_LEFT,
    GAME_CANCELLED,
    LOBBY_TIMEOUT,
    GAME_COUNT_CHANGED,

    // presence
    PRESENCE_DIFF
}

package com.example.mimimi.Domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 게임 서버 내부 카운터의 스냅샷 (진단용).
 */
@Getter
@Builder
@ToString
public class GameServerState {

    public enum TimerPhase {
        IDLE,
        PLAYING
    }

    private final Long gameId;
    private final Long roundId;
    private final int cluesInterval;
    private final int elapsedSeconds;
    private final int keywordsRevealed;
    private final int keywordsTotal;
    private final TimerPhase phase;
    private final boolean timeoutScheduled;
    private final boolean paused;
    private final long generation;
}

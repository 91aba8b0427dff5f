package com.example.mimimi.Socket;

import com.example.mimimi.Config.MimimiProperties;
import com.example.mimimi.Domain.GameStatus;
import com.example.mimimi.Entity.Game;
import com.example.mimimi.Service.GameService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PresenceMonitorTest {

    private static final Long GAME_ID = 1L;
    private static final String HOST_TOPIC = GameTopics.host(GAME_ID);

    private GameEventBus eventBus;
    private GamePresence presence;
    private GameService gameService;
    private MimimiProperties properties;
    private PresenceMonitor monitor;

    @BeforeEach
    void setUp() {
        eventBus = new GameEventBus(mock(SimpMessagingTemplate.class));
        presence = new GamePresence(eventBus);
        gameService = mock(GameService.class);
        when(gameService.findGame(GAME_ID)).thenReturn(Optional.of(game(GameStatus.GAME_RUNNING)));

        properties = new MimimiProperties();
        properties.getPresence().setHostDisconnectDebounce(Duration.ofMillis(100));
        monitor = new PresenceMonitor(eventBus, presence, gameService, properties);
    }

    @AfterEach
    void tearDown() {
        monitor.shutdown();
    }

    @Test
    void monitoringTwiceSubscribesOnce() {
        monitor.monitorGameHost(GAME_ID);
        monitor.monitorGameHost(GAME_ID);

        assertTrue(monitor.isMonitoring(GAME_ID));
        assertTrue(eventBus.isSubscribed(HOST_TOPIC, monitor));
        assertEquals(1, monitor.getMonitoredGames().size());
    }

    @Test
    void hostLeavingCleansUpOnceAfterDebounce() {
        monitor.monitorGameHost(GAME_ID);
        presence.track(HOST_TOPIC, "host", "s1");

        presence.untrack(HOST_TOPIC, "host", "s1");
        verify(gameService, never()).cleanupGameOnHostDisconnect(GAME_ID);
        verify(gameService, timeout(2000)).cleanupGameOnHostDisconnect(GAME_ID);

        // 정리 후 다시 들어왔다 나가도 두 번 정리하지 않는다
        presence.track(HOST_TOPIC, "host", "s2");
        presence.untrack(HOST_TOPIC, "host", "s2");
        verify(gameService, after(400).times(1)).cleanupGameOnHostDisconnect(GAME_ID);
        assertFalse(monitor.isMonitoring(GAME_ID));
    }

    @Test
    void hostReconnectingWithinDebounceKeepsGame() {
        properties.getPresence().setHostDisconnectDebounce(Duration.ofMillis(300));
        monitor.monitorGameHost(GAME_ID);
        presence.track(HOST_TOPIC, "host", "s1");

        presence.untrackSession("s1");
        presence.track(HOST_TOPIC, "host", "s2");

        verify(gameService, after(700).never()).cleanupGameOnHostDisconnect(GAME_ID);
        assertTrue(monitor.isMonitoring(GAME_ID));
    }

    @Test
    void leavesOnOtherTopicsAreIgnored() {
        monitor.monitorGameHost(GAME_ID);
        presence.track(GameTopics.players(GAME_ID), "player_1", "p1");
        presence.untrack(GameTopics.players(GAME_ID), "player_1", "p1");

        verify(gameService, after(300).never()).cleanupGameOnHostDisconnect(anyLong());
    }

    @Test
    void finishedGameStopsMonitoringWithoutCleanup() {
        when(gameService.findGame(GAME_ID)).thenReturn(Optional.of(game(GameStatus.GAME_OVER)));
        monitor.monitorGameHost(GAME_ID);

        monitor.checkHostDisconnect(GAME_ID);

        verify(gameService, never()).cleanupGameOnHostDisconnect(anyLong());
        assertFalse(monitor.isMonitoring(GAME_ID));
        assertFalse(eventBus.isSubscribed(HOST_TOPIC, monitor));
    }

    @Test
    void missingGameStopsMonitoringWithoutCleanup() {
        when(gameService.findGame(GAME_ID)).thenReturn(Optional.empty());
        monitor.monitorGameHost(GAME_ID);

        monitor.checkHostDisconnect(GAME_ID);

        verify(gameService, never()).cleanupGameOnHostDisconnect(anyLong());
        assertFalse(monitor.isMonitoring(GAME_ID));
    }

    @Test
    void failedCleanupStillStopsMonitoring() {
        doThrow(new IllegalStateException("db down")).when(gameService).cleanupGameOnHostDisconnect(GAME_ID);
        monitor.monitorGameHost(GAME_ID);

        assertThrows(IllegalStateException.class, () -> monitor.checkHostDisconnect(GAME_ID));
        assertFalse(monitor.isMonitoring(GAME_ID));
    }

    @Test
    void unmonitoredGameIsNeverCleaned() {
        monitor.checkHostDisconnect(GAME_ID);

        verify(gameService, never()).findGame(anyLong());
        verify(gameService, never()).cleanupGameOnHostDisconnect(anyLong());
    }

    private static Game game(GameStatus state) {
        return Game.builder()
                .id(GAME_ID)
                .hostUserId("host-user")
                .roundsCount(3)
                .cluesInterval(3)
                .gridSize(9)
                .state(state)
                .build();
    }
}

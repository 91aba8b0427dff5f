package com.example.mimimi.Socket;

import com.example.mimimi.Domain.GameEvent;
import com.example.mimimi.Domain.GameEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class GameEventBusTest {

    private SimpMessagingTemplate messagingTemplate;
    private GameEventBus eventBus;

    @BeforeEach
    void setUp() {
        messagingTemplate = mock(SimpMessagingTemplate.class);
        eventBus = new GameEventBus(messagingTemplate);
    }

    @Test
    void deliversToSubscribersOfTheTopicOnly() {
        List<GameEvent> received = new ArrayList<>();
        eventBus.subscribe(GameTopics.game(1L), (topic, event) -> received.add(event));
        eventBus.subscribe(GameTopics.game(2L), (topic, event) -> fail("다른 게임 토픽으로 전달됨"));

        eventBus.broadcastToGame(1L, GameEvent.of(GameEventType.GAME_STARTED, 1L));

        assertEquals(1, received.size());
        assertEquals(GameEventType.GAME_STARTED, received.get(0).getType());
        verify(messagingTemplate).convertAndSend(eq("/topic/game/1"), any(Object.class));
    }

    @Test
    void unsubscribedListenerStopsReceiving() {
        List<GameEvent> received = new ArrayList<>();
        GameEventListener listener = (topic, event) -> received.add(event);
        eventBus.subscribe(GameTopics.host(1L), listener);
        assertTrue(eventBus.isSubscribed(GameTopics.host(1L), listener));

        eventBus.unsubscribe(GameTopics.host(1L), listener);
        eventBus.broadcast(GameTopics.host(1L), GameEvent.of(GameEventType.PLAYER_PICKED, 1L));

        assertTrue(received.isEmpty());
        assertFalse(eventBus.isSubscribed(GameTopics.host(1L), listener));
    }

    @Test
    void failingListenerDoesNotBlockOthersOrStomp() {
        List<GameEvent> received = new ArrayList<>();
        eventBus.subscribe(GameTopics.game(1L), (topic, event) -> {
            throw new IllegalStateException("boom");
        });
        eventBus.subscribe(GameTopics.game(1L), (topic, event) -> received.add(event));

        eventBus.broadcastToGame(1L, GameEvent.roundTimeout(1L, 7L));

        assertEquals(1, received.size());
        verify(messagingTemplate).convertAndSend(eq("/topic/game/1"), any(Object.class));
    }

    @Test
    void stompFailureIsNotPropagated() {
        doThrow(new MessageDeliveryException("broker down"))
                .when(messagingTemplate).convertAndSend(anyString(), any(Object.class));

        assertDoesNotThrow(() -> eventBus.broadcastToGame(1L, GameEvent.of(GameEventType.GAME_FINISHED, 1L)));
    }

    @Test
    void payloadCarriesTypeAndGameId() {
        Map<String, Object> payload = GameEvent.keywordRevealed(3L, 2, 6).toPayload();

        assertEquals("KEYWORD_REVEALED", payload.get("type"));
        assertEquals(3L, payload.get("gameId"));
        assertEquals(2, payload.get("revealCount"));
        assertEquals(6, payload.get("elapsedSeconds"));
    }
}

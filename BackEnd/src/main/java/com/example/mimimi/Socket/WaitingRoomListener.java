package com.example.mimimi.Socket;

import com.example.mimimi.Domain.GameEvent;
import com.example.mimimi.Domain.GameEventType;
import com.example.mimimi.Domain.GameStatus;
import com.example.mimimi.Entity.Game;
import com.example.mimimi.Service.GameService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 대기실 플레이어 접속 감시.
 * <p>
 * 시작 전에 연결이 끊긴 플레이어는 게임에서 빼서 아바타를 다른 사람이 쓸 수 있게 한다.
 * 게임이 시작됐거나 없어졌으면 구독을 푼다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WaitingRoomListener implements GameEventListener {

    public static final String PLAYER_KEY_PREFIX = "player_";

    private final GameEventBus eventBus;
    private final GameService gameService;

    private final Set<Long> watchedGames = ConcurrentHashMap.newKeySet();

    public static String playerKey(String userId) {
        return PLAYER_KEY_PREFIX + userId;
    }

    // "player_alice" -> "alice", 플레이어 key 가 아니면 null
    public static String userIdOf(String key) {
        if (key == null || !key.startsWith(PLAYER_KEY_PREFIX)) return null;
        return key.substring(PLAYER_KEY_PREFIX.length());
    }

    public void watch(Long gameId) {
        if (watchedGames.add(gameId)) {
            eventBus.subscribe(GameTopics.players(gameId), this);
            log.debug("[WaitingRoom] 대기실 감시 시작: game={}", gameId);
        }
    }

    @Override
    public void onEvent(String topic, GameEvent event) {
        if (event.getType() != GameEventType.PRESENCE_DIFF || event.getLeaves().isEmpty()) return;

        Long gameId = GameTopics.gameIdOf(topic);
        if (gameId == null) return;

        Optional<Game> game = gameService.findGame(gameId);
        if (game.isEmpty() || game.get().getState() != GameStatus.WAITING_FOR_PLAYERS) {
            unwatch(gameId);
            return;
        }

        for (String key : event.getLeaves()) {
            String userId = userIdOf(key);
            if (userId == null) continue;
            try {
                gameService.removePlayerOnDisconnect(gameId, userId);
            } catch (RuntimeException e) {
                log.error("[WaitingRoom] 플레이어 제거 실패: game={}, user={}", gameId, userId, e);
            }
        }
    }

    private void unwatch(Long gameId) {
        if (watchedGames.remove(gameId)) {
            eventBus.unsubscribe(GameTopics.players(gameId), this);
            log.debug("[WaitingRoom] 대기실 감시 종료: game={}", gameId);
        }
    }
}

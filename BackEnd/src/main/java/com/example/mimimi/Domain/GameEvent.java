package com.example.mimimi.Domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 이벤트 버스로 흘러가는 메시지. STOMP 로는 {@link #toPayload()} 형태(type + 데이터)로 나간다.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GameEvent {

    private final GameEventType type;
    private final Long gameId;
    private final Map<String, Object> data;

    public static GameEvent of(GameEventType type, Long gameId) {
        return new GameEvent(type, gameId, Map.of());
    }

    public static GameEvent of(GameEventType type, Long gameId, Map<String, Object> data) {
        return new GameEvent(type, gameId, Collections.unmodifiableMap(new LinkedHashMap<>(data)));
    }

    public static GameEvent keywordRevealed(Long gameId, int revealCount, int elapsedSeconds) {
        return of(GameEventType.KEYWORD_REVEALED, gameId, Map.of(
                "revealCount", revealCount,
                "elapsedSeconds", elapsedSeconds
        ));
    }

    public static GameEvent roundTimeout(Long gameId, Long roundId) {
        return of(GameEventType.ROUND_TIMEOUT, gameId, Map.of("roundId", roundId));
    }

    public static GameEvent presenceDiff(Long gameId, Set<String> joins, Set<String> leaves) {
        return of(GameEventType.PRESENCE_DIFF, gameId, Map.of(
                "joins", Set.copyOf(joins),
                "leaves", Set.copyOf(leaves)
        ));
    }

    public int getInt(String key) {
        Object value = data.get(key);
        return value instanceof Number ? ((Number) value).intValue() : 0;
    }

    public Long getLong(String key) {
        Object value = data.get(key);
        return value instanceof Number ? ((Number) value).longValue() : null;
    }

    @SuppressWarnings("unchecked")
    public Set<String> getLeaves() {
        Object value = data.get("leaves");
        return value instanceof Set ? (Set<String>) value : Set.of();
    }

    @SuppressWarnings("unchecked")
    public Set<String> getJoins() {
        Object value = data.get("joins");
        return value instanceof Set ? (Set<String>) value : Set.of();
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new HashMap<>(data);
        payload.put("type", type.name());
        if (gameId != null) {
            payload.put("gameId", gameId);
        }
        return payload;
    }
}

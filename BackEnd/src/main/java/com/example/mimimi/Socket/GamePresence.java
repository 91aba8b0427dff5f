package com.example.mimimi.Socket;

import com.example.mimimi.Domain.GameEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 토픽별 접속 현황 (key -> STOMP session id 들).
 * <p>
 * key 가 처음 생기면 joins, 마지막 세션이 빠지면 leaves 로 PRESENCE_DIFF 를 같은 토픽에 보낸다.
 * 같은 key 로 여러 탭이 붙어 있으면 마지막 탭이 끊길 때만 leave 가 나간다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GamePresence {

    private final GameEventBus eventBus;

    // topic -> (key -> sessionIds)
    private final Map<String, Map<String, Set<String>>> topics = new HashMap<>();
    // sessionId -> [topic, key] 목록 (disconnect 시 역추적)
    private final Map<String, List<String[]>> sessionIndex = new HashMap<>();

    /* =========================
       입장
    ========================= */
    public void track(String topic, String key, String sessionId) {
        boolean joined;
        synchronized (this) {
            Map<String, Set<String>> entries = topics.computeIfAbsent(topic, t -> new HashMap<>());
            Set<String> sessions = entries.computeIfAbsent(key, k -> new HashSet<>());
            joined = sessions.isEmpty();
            if (!sessions.add(sessionId)) {
                return;
            }
            sessionIndex.computeIfAbsent(sessionId, s -> new ArrayList<>()).add(new String[]{topic, key});
        }

        if (joined) {
            log.debug("[Presence] join topic={} key={}", topic, key);
            eventBus.broadcast(topic, GameEvent.presenceDiff(GameTopics.gameIdOf(topic), Set.of(key), Set.of()));
        }
    }

    /* =========================
       명시적 퇴장
    ========================= */
    public void untrack(String topic, String key, String sessionId) {
        boolean left;
        synchronized (this) {
            left = removeSession(topic, key, sessionId);
            List<String[]> refs = sessionIndex.get(sessionId);
            if (refs != null) {
                refs.removeIf(ref -> ref[0].equals(topic) && ref[1].equals(key));
                if (refs.isEmpty()) sessionIndex.remove(sessionId);
            }
        }

        if (left) {
            log.debug("[Presence] leave topic={} key={}", topic, key);
            eventBus.broadcast(topic, GameEvent.presenceDiff(GameTopics.gameIdOf(topic), Set.of(), Set.of(key)));
        }
    }

    /* =========================
       연결 끊김 (세션 단위)
    ========================= */
    public void untrackSession(String sessionId) {
        List<String[]> leaves = new ArrayList<>();
        synchronized (this) {
            List<String[]> refs = sessionIndex.remove(sessionId);
            if (refs == null) return;

            for (String[] ref : refs) {
                if (removeSession(ref[0], ref[1], sessionId)) {
                    leaves.add(ref);
                }
            }
        }

        for (String[] ref : leaves) {
            log.debug("[Presence] disconnect leave topic={} key={}", ref[0], ref[1]);
            eventBus.broadcast(ref[0], GameEvent.presenceDiff(GameTopics.gameIdOf(ref[0]), Set.of(), Set.of(ref[1])));
        }
    }

    /* =========================
       현재 접속 목록
    ========================= */
    public synchronized Map<String, Set<String>> list(String topic) {
        Map<String, Set<String>> entries = topics.get(topic);
        if (entries == null) return Map.of();

        Map<String, Set<String>> copy = new HashMap<>();
        entries.forEach((key, sessions) -> copy.put(key, Set.copyOf(sessions)));
        return copy;
    }

    // 반환값: key 의 마지막 세션이 빠졌으면 true
    private boolean removeSession(String topic, String key, String sessionId) {
        Map<String, Set<String>> entries = topics.get(topic);
        if (entries == null) return false;

        Set<String> sessions = entries.get(key);
        if (sessions == null || !sessions.remove(sessionId)) return false;

        if (!sessions.isEmpty()) return false;

        entries.remove(key);
        if (entries.isEmpty()) topics.remove(topic);
        return true;
    }
}

package com.example.mimimi.Socket;

import com.example.mimimi.Domain.GameEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * 게임 단위 토픽 pub/sub.
 * <p>
 * 서버 내부 구독자(presence monitor, 라운드 진행 로직)에게 동기로 전달한 뒤,
 * 같은 토픽 이름의 STOMP destination 으로 브라우저 구독자에게도 내보낸다.
 * 브라우저 쪽 전달은 best-effort 이다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GameEventBus {

    private final SimpMessagingTemplate messagingTemplate;

    private final Map<String, Set<GameEventListener>> listeners = new ConcurrentHashMap<>();

    public void subscribe(String topic, GameEventListener listener) {
        listeners.computeIfAbsent(topic, t -> new CopyOnWriteArraySet<>()).add(listener);
    }

    public void unsubscribe(String topic, GameEventListener listener) {
        listeners.computeIfPresent(topic, (t, set) -> {
            set.remove(listener);
            return set.isEmpty() ? null : set;
        });
    }

    public boolean isSubscribed(String topic, GameEventListener listener) {
        Set<GameEventListener> set = listeners.get(topic);
        return set != null && set.contains(listener);
    }

    public void broadcast(String topic, GameEvent event) {
        Set<GameEventListener> set = listeners.get(topic);
        if (set != null) {
            for (GameEventListener listener : set) {
                try {
                    listener.onEvent(topic, event);
                } catch (RuntimeException e) {
                    // 구독자 하나의 실패가 다른 구독자 / 브라우저 전송을 막지 않게 한다
                    log.error("[EventBus] 구독자 처리 실패 topic={} type={}", topic, event.getType(), e);
                }
            }
        }

        try {
            messagingTemplate.convertAndSend(topic, event.toPayload());
        } catch (MessagingException e) {
            log.warn("[EventBus] STOMP 전송 실패 topic={} type={}: {}", topic, event.getType(), e.getMessage());
        }
    }

    public void broadcastToGame(Long gameId, GameEvent event) {
        broadcast(GameTopics.game(gameId), event);
    }
}

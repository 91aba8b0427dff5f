package com.example.mimimi.Socket;

import com.example.mimimi.Config.MimimiProperties;
import com.example.mimimi.Domain.GameEvent;
import com.example.mimimi.Domain.GameEventType;
import com.example.mimimi.Entity.Game;
import com.example.mimimi.Service.GameService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 호스트 접속 감시.
 * <p>
 * 감시 중인 게임의 호스트 토픽에서 leave 가 오면 바로 정리하지 않고 잠깐 기다린 뒤
 * 접속 목록을 다시 본다. 새로고침처럼 금방 다시 붙는 경우는 정리하지 않는다.
 * 게임 하나당 정리는 최대 한 번이고, 정리 후에는 감시를 멈춘다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PresenceMonitor implements GameEventListener {

    private final GameEventBus eventBus;
    private final GamePresence gamePresence;
    private final GameService gameService;
    private final MimimiProperties properties;

    private final Set<Long> monitoredGames = ConcurrentHashMap.newKeySet();

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "presence-monitor");
        t.setDaemon(true);
        return t;
    });

    /* =========================
       감시 시작 (여러 번 불러도 한 번만 구독)
    ========================= */
    public void monitorGameHost(Long gameId) {
        if (monitoredGames.add(gameId)) {
            eventBus.subscribe(GameTopics.host(gameId), this);
            log.info("[PresenceMonitor] 호스트 감시 시작: game={}", gameId);
        }
    }

    public boolean isMonitoring(Long gameId) {
        return monitoredGames.contains(gameId);
    }

    public Set<Long> getMonitoredGames() {
        return Set.copyOf(monitoredGames);
    }

    @Override
    public void onEvent(String topic, GameEvent event) {
        if (event.getType() != GameEventType.PRESENCE_DIFF) return;

        Long gameId = GameTopics.gameIdOfHostTopic(topic);
        if (gameId == null || !monitoredGames.contains(gameId)) return;
        if (event.getLeaves().isEmpty()) return;

        long debounce = properties.getPresence().getHostDisconnectDebounce().toMillis();
        log.debug("[PresenceMonitor] 호스트 leave 감지, {}ms 후 재확인: game={}", debounce, gameId);

        try {
            scheduler.schedule(() -> checkSafely(gameId), debounce, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("[PresenceMonitor] 종료 중이라 재확인 생략: game={}", gameId);
        }
    }

    /* =========================
       지연 재확인
    ========================= */
    public void checkHostDisconnect(Long gameId) {
        if (!monitoredGames.contains(gameId)) return;

        if (!gamePresence.list(GameTopics.host(gameId)).isEmpty()) {
            log.debug("[PresenceMonitor] 호스트 재접속 확인, 정리 안 함: game={}", gameId);
            return;
        }

        Optional<Game> game = gameService.findGame(gameId);
        if (game.isEmpty() || !game.get().getState().isActive()) {
            // 이미 끝난 게임은 정리할 것 없이 감시만 푼다
            stopMonitoring(gameId);
            return;
        }

        log.info("[PresenceMonitor] 호스트 연결 끊김, 게임 정리: game={}", gameId);
        try {
            gameService.cleanupGameOnHostDisconnect(gameId);
        } finally {
            stopMonitoring(gameId);
        }
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }

    private void stopMonitoring(Long gameId) {
        if (monitoredGames.remove(gameId)) {
            eventBus.unsubscribe(GameTopics.host(gameId), this);
            log.info("[PresenceMonitor] 호스트 감시 종료: game={}", gameId);
        }
    }

    private void checkSafely(Long gameId) {
        try {
            checkHostDisconnect(gameId);
        } catch (RuntimeException e) {
            log.error("[PresenceMonitor] 호스트 이탈 정리 실패: game={}", gameId, e);
        }
    }
}

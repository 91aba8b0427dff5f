package com.example.mimimi.Domain;

import com.example.mimimi.Config.MimimiProperties;
import com.example.mimimi.Handler.GlobalExceptionHandler.GameServerNotRunningException;
import com.example.mimimi.Repository.RoundRepository;
import com.example.mimimi.Socket.GameEventBus;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * gameId -> 게임 서버. 처음 쓰일 때 만들고 게임이 끝나면 회수한다. 재사용하지 않는다.
 * <p>
 * 한 번 회수된 게임에는 다시 서버를 만들지 않는다. 라운드 전환 도중 호스트 이탈 정리가 끼어들어도
 * 주인 없는 타이머 스레드가 남지 않게 하기 위함이다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GameServerRegistry {

    private final RoundRepository roundRepository;
    private final GameEventBus eventBus;
    private final MimimiProperties properties;

    private final Map<Long, GameServer> servers = new ConcurrentHashMap<>();
    // 회수된 게임 id (game id 는 재사용되지 않는다)
    private final Set<Long> reclaimedGames = ConcurrentHashMap.newKeySet();

    // 이미 회수된 게임이면 empty
    public Optional<GameServer> startRoundTimer(Long gameId, Long roundId, int cluesInterval) {
        GameServer server = servers.compute(gameId, (id, existing) -> {
            if (existing != null) return existing;
            if (reclaimedGames.contains(id)) return null;
            return createServer(id);
        });

        if (server == null) {
            log.info("[GameServer] 회수된 게임이라 타이머를 시작하지 않음: game={}, round={}", gameId, roundId);
            return Optional.empty();
        }

        server.startRoundTimer(roundId, cluesInterval);
        return Optional.of(server);
    }

    public void stopRoundTimer(Long gameId) {
        find(gameId).ifPresent(GameServer::stopRoundTimer);
    }

    public void pauseTimer(Long gameId) {
        find(gameId).ifPresent(GameServer::pauseTimer);
    }

    public Optional<GameServer> find(Long gameId) {
        return Optional.ofNullable(servers.get(gameId));
    }

    public boolean isRunning(Long gameId) {
        return find(gameId).map(GameServer::isRunning).orElse(false);
    }

    // 실행 중이 아니면 empty
    public Optional<GameServerState> getState(Long gameId) {
        GameServer server = servers.get(gameId);
        if (server == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(server.getState());
        } catch (GameServerNotRunningException e) {
            return Optional.empty();
        }
    }

    public void stopGameServer(Long gameId) {
        reclaimedGames.add(gameId);
        GameServer server = servers.remove(gameId);
        if (server != null) {
            server.shutdown();
            log.info("[GameServer] 게임 서버 종료: game={}", gameId);
        }
    }

    public int size() {
        return servers.size();
    }

    @PreDestroy
    public void shutdownAll() {
        servers.keySet().forEach(this::stopGameServer);
    }

    protected GameServer createServer(Long gameId) {
        log.info("[GameServer] 게임 서버 생성: game={}", gameId);
        return new GameServer(gameId, roundRepository, eventBus, properties.getGameServer().getTickPeriod());
    }
}

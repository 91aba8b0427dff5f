package com.example.mimimi.Service;

import com.example.mimimi.Config.MimimiProperties;
import com.example.mimimi.Domain.GameEvent;
import com.example.mimimi.Domain.GameEventType;
import com.example.mimimi.Domain.GameServerRegistry;
import com.example.mimimi.Domain.GameServerState;
import com.example.mimimi.Domain.GameStatus;
import com.example.mimimi.Domain.PickResult;
import com.example.mimimi.Entity.Game;
import com.example.mimimi.Entity.Player;
import com.example.mimimi.Entity.Round;
import com.example.mimimi.Socket.GameEventBus;
import com.example.mimimi.Socket.GameEventListener;
import com.example.mimimi.Socket.GameTopics;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 게임 진행 (시작 → 라운드 → 선택 → 다음 라운드 → 종료).
 * <p>
 * 게임 토픽을 구독해서 게임 서버가 보내는 ROUND_TIMEOUT 을 받는다.
 * DB 작업은 게임 서버 스레드가 아니라 이 서비스의 스케줄러에서 돈다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameFlowService implements GameEventListener {

    private final GameService gameService;
    private final RoundService roundService;
    private final GameServerRegistry gameServerRegistry;
    private final GameEventBus eventBus;
    private final MimimiProperties properties;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "game-flow");
        t.setDaemon(true);
        return t;
    });

    /* =========================
       게임 시작
    ========================= */
    public Round startGame(Long gameId) {
        Game game = gameService.markGameStarted(gameId);
        eventBus.broadcastToGame(gameId, GameEvent.of(GameEventType.GAME_STARTED, gameId));

        try {
            roundService.generateRounds(game);
        } catch (RuntimeException e) {
            log.error("[Flow] 라운드 생성 실패, 게임 종료: game={}", gameId, e);
            gameService.markGameState(gameId, GameStatus.GAME_OVER);
            eventBus.broadcastToGame(gameId, GameEvent.of(GameEventType.ROUND_GENERATION_FAILED, gameId));
            throw e;
        }

        eventBus.subscribe(GameTopics.game(gameId), this);

        Round first = roundService.activateNextRound(gameId)
                .orElseThrow(() -> new IllegalStateException("시작할 라운드가 없습니다: game=" + gameId));
        startRound(game, first);
        return first;
    }

    /* =========================
       플레이어 선택
    ========================= */
    public PickResult submitPick(Long gameId, String userId, Long wordId, long timeMillis) {
        Player player = gameService.getPlayer(gameId, userId);
        Round round = roundService.getPlayingRound(gameId)
                .orElseThrow(() -> new IllegalStateException("진행 중인 라운드가 없습니다: game=" + gameId));

        // 지금까지 공개된 키워드 수는 게임 서버가 알고 있다
        int keywordsShown = gameServerRegistry.getState(gameId)
                .filter(state -> round.getId().equals(state.getRoundId()))
                .map(GameServerState::getKeywordsRevealed)
                .orElse(1);

        PickResult result = roundService.createPick(round.getId(), player.getId(), wordId, timeMillis, keywordsShown);

        eventBus.broadcast(GameTopics.host(gameId), GameEvent.of(GameEventType.PLAYER_PICKED, gameId, Map.of(
                "roundId", round.getId(),
                "playerId", player.getId()
        )));

        if (result.isAllPicked()) {
            gameServerRegistry.pauseTimer(gameId);
            eventBus.broadcastToGame(gameId, GameEvent.of(GameEventType.ALL_PICKED, gameId, Map.of("roundId", round.getId())));

            long delay = properties.getRound().getResultsDelay().toMillis();
            scheduler.schedule(() -> advanceSafely(gameId, round.getId()), delay, TimeUnit.MILLISECONDS);
        }
        return result;
    }

    /* =========================
       라운드 넘기기 (타임아웃 / 전원 선택 / 호스트)
       expectedRoundId 가 이미 끝났으면 아무것도 안 한다
    ========================= */
    public void advanceRound(Long gameId, Long expectedRoundId) {
        if (!roundService.finishRound(expectedRoundId)) {
            log.debug("[Flow] 이미 넘어간 라운드: game={}, round={}", gameId, expectedRoundId);
            return;
        }

        Round finished = roundService.getRound(expectedRoundId);
        eventBus.broadcastToGame(gameId, GameEvent.of(GameEventType.ROUND_FINISHED, gameId, Map.of(
                "roundId", expectedRoundId,
                "wordId", finished.getWordId(),
                "scores", scoreboard(gameId)
        )));

        Game game = gameService.getGame(gameId);
        if (game.getState() != GameStatus.GAME_RUNNING) {
            log.info("[Flow] 진행 중이 아닌 게임이라 다음 라운드 생략: game={}, state={}", gameId, game.getState());
            return;
        }

        roundService.activateNextRound(gameId).ifPresentOrElse(
                next -> startRound(game, next),
                () -> finishGame(gameId)
        );
    }

    // 호스트가 "다음" 을 누른 경우
    public void advanceCurrentRound(Long gameId) {
        Round playing = roundService.getPlayingRound(gameId)
                .orElseThrow(() -> new IllegalStateException("진행 중인 라운드가 없습니다: game=" + gameId));
        advanceRound(gameId, playing.getId());
    }

    public void stopGame(Long gameId) {
        gameService.stopGameManually(gameId);
        eventBus.unsubscribe(GameTopics.game(gameId), this);
    }

    /* =========================
       게임 토픽 이벤트
    ========================= */
    @Override
    public void onEvent(String topic, GameEvent event) {
        GameEventType type = event.getType();

        if (type == GameEventType.ROUND_TIMEOUT) {
            Long gameId = event.getGameId();
            Long roundId = event.getLong("roundId");
            log.info("[Flow] 라운드 타임아웃 수신: game={}, round={}", gameId, roundId);
            scheduler.execute(() -> advanceSafely(gameId, roundId));
            return;
        }

        // 끝난 게임은 더 들을 필요 없음
        if (type == GameEventType.HOST_DISCONNECTED
                || type == GameEventType.GAME_STOPPED_BY_HOST
                || type == GameEventType.GAME_FINISHED) {
            eventBus.unsubscribe(topic, this);
        }
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }

    /* =========================
       내부
    ========================= */
    private void startRound(Game game, Round round) {
        // 그 사이 호스트 이탈/수동 종료로 회수됐으면 타이머도 방송도 없다
        if (gameServerRegistry.startRoundTimer(game.getId(), round.getId(), game.getCluesInterval()).isEmpty()) {
            log.info("[Flow] 이미 정리된 게임이라 라운드 시작 생략: game={}, round={}", game.getId(), round.getId());
            return;
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("roundId", round.getId());
        data.put("position", round.getPosition());
        data.put("roundsCount", game.getRoundsCount());
        data.put("cluesInterval", game.getCluesInterval());
        data.put("keywordIds", List.copyOf(round.getKeywordIds()));
        data.put("possibleWordIds", List.copyOf(round.getPossibleWordIds()));
        eventBus.broadcastToGame(game.getId(), GameEvent.of(GameEventType.ROUND_STARTED, game.getId(), data));
    }

    private void finishGame(Long gameId) {
        gameServerRegistry.stopGameServer(gameId);
        if (!gameService.markGameState(gameId, GameStatus.GAME_OVER)) {
            log.info("[Flow] 다른 경로로 이미 끝난 게임: game={}", gameId);
            return;
        }

        log.info("[Flow] 게임 종료: game={}", gameId);
        eventBus.broadcastToGame(gameId, GameEvent.of(GameEventType.GAME_FINISHED, gameId, Map.of(
                "scores", scoreboard(gameId)
        )));
    }

    private List<Map<String, Object>> scoreboard(Long gameId) {
        List<Map<String, Object>> scores = new ArrayList<>();
        for (Player player : gameService.getLeaderboard(gameId)) {
            scores.add(Map.of(
                    "playerId", player.getId(),
                    "nickname", String.valueOf(player.getNickname()),
                    "points", player.getPoints()
            ));
        }
        return scores;
    }

    private void advanceSafely(Long gameId, Long roundId) {
        try {
            advanceRound(gameId, roundId);
        } catch (RuntimeException e) {
            log.error("[Flow] 라운드 전환 실패: game={}, round={}", gameId, roundId, e);
        }
    }
}

package com.example.mimimi.Domain;

import com.example.mimimi.Entity.Round;
import com.example.mimimi.Handler.GlobalExceptionHandler.GameServerNotRunningException;
import com.example.mimimi.Repository.RoundRepository;
import com.example.mimimi.Socket.GameEventBus;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 게임 하나의 라운드 타이머.
 * <p>
 * 게임마다 전용 스레드 하나(mailbox)를 갖고, 모든 상태 변경은 그 스레드에서만 일어난다.
 * 외부에서는 startRoundTimer / stopRoundTimer / pauseTimer 로 메시지를 넣기만 한다.
 * <p>
 * 예약되는 틱과 타임아웃 메시지에는 (roundId, generation) 태그가 붙는다.
 * 도착 시점에 태그가 현재 값과 다르면 버린다. 취소는 다음 예약 하나만 지울 뿐이고
 * 이미 큐에 들어간 메시지는 태그 검사로만 무효화된다.
 */
@Slf4j
public class GameServer {

    private static final long STATE_CALL_TIMEOUT_SECONDS = 5;

    @Value
    static class TimerTag {
        Long roundId;
        long generation;
    }

    private final Long gameId;
    private final RoundRepository roundRepository;
    private final GameEventBus eventBus;
    private final ScheduledExecutorService mailbox;
    private final long tickMillis;

    /* ===== mailbox 스레드 전용 상태 ===== */
    private Long roundId;
    private int cluesInterval;
    private int elapsedSeconds;
    private int keywordsRevealed;
    private int keywordsTotal;
    private GameServerState.TimerPhase phase = GameServerState.TimerPhase.IDLE;
    private boolean timeoutScheduled;
    private boolean timeoutDelivered;
    private boolean paused;
    private long generation;
    private ScheduledFuture<?> timer;

    public GameServer(Long gameId, RoundRepository roundRepository, GameEventBus eventBus, Duration tickPeriod) {
        this(gameId, roundRepository, eventBus, tickPeriod,
                Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "game-server-" + gameId);
                    t.setDaemon(true);
                    return t;
                }));
    }

    GameServer(Long gameId,
               RoundRepository roundRepository,
               GameEventBus eventBus,
               Duration tickPeriod,
               ScheduledExecutorService mailbox) {
        this.gameId = gameId;
        this.roundRepository = roundRepository;
        this.eventBus = eventBus;
        this.tickMillis = tickPeriod.toMillis();
        this.mailbox = mailbox;
    }

    public Long getGameId() {
        return gameId;
    }

    /* =========================
       외부 API (비동기 메시지)
    ========================= */
    public void startRoundTimer(Long roundId, int cluesIntervalSeconds) {
        if (roundId == null) {
            throw new IllegalArgumentException("roundId is required");
        }
        if (cluesIntervalSeconds <= 0) {
            throw new IllegalArgumentException("clues interval must be positive: " + cluesIntervalSeconds);
        }
        send(() -> handleStart(roundId, cluesIntervalSeconds));
    }

    public void stopRoundTimer() {
        send(this::handleStop);
    }

    public void pauseTimer() {
        send(this::handlePause);
    }

    public GameServerState getState() {
        try {
            return mailbox.submit(this::snapshot).get(STATE_CALL_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (RejectedExecutionException e) {
            throw new GameServerNotRunningException("게임 서버가 실행 중이 아닙니다: " + gameId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while reading game server state: " + gameId, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("failed to read game server state: " + gameId, e);
        }
    }

    public boolean isRunning() {
        return !mailbox.isShutdown();
    }

    public void shutdown() {
        mailbox.shutdownNow();
    }

    // 테스트에서 틱/타임아웃 도착을 직접 흉내낼 때 사용
    void deliverTick(TimerTag tag) {
        send(() -> handleTick(tag));
    }

    void deliverRoundTimeout(TimerTag tag) {
        send(() -> handleRoundTimeout(tag));
    }

    private void send(Runnable message) {
        try {
            mailbox.execute(() -> runSafely(message));
        } catch (RejectedExecutionException e) {
            log.debug("[GameServer] 이미 종료된 게임 서버로 온 메시지 무시: game={}", gameId);
        }
    }

    private void runSafely(Runnable message) {
        try {
            message.run();
        } catch (RuntimeException e) {
            log.error("[GameServer] 메시지 처리 실패: game={}", gameId, e);
        }
    }

    /* =========================
       메시지 처리
    ========================= */
    private void handleStart(Long newRoundId, int interval) {
        // 전원 선택으로 멈춘 같은 라운드면 카운터를 유지한 채 이어간다
        if (paused && phase == GameServerState.TimerPhase.PLAYING && newRoundId.equals(roundId)) {
            resume();
            return;
        }

        cancelTimer();
        generation++;
        phase = GameServerState.TimerPhase.IDLE;

        int total = roundRepository.findById(newRoundId)
                .map(Round::getKeywordCount)
                .orElseThrow(() -> new IllegalArgumentException("round not found: " + newRoundId));

        roundId = newRoundId;
        cluesInterval = interval;
        elapsedSeconds = 0;
        keywordsRevealed = 1;
        keywordsTotal = total;
        phase = GameServerState.TimerPhase.PLAYING;
        timeoutScheduled = false;
        timeoutDelivered = false;
        paused = false;

        log.info("[GameServer] 라운드 타이머 시작: game={}, round={}, keywords={}, interval={}s",
                gameId, roundId, keywordsTotal, cluesInterval);

        // 첫 키워드는 바로 공개
        eventBus.broadcastToGame(gameId, GameEvent.keywordRevealed(gameId, 1, 0));
        scheduleTick(currentTag());
    }

    private void resume() {
        generation++;
        paused = false;

        log.info("[GameServer] 타이머 재개: game={}, round={}, elapsed={}", gameId, roundId, elapsedSeconds);

        eventBus.broadcastToGame(gameId, GameEvent.keywordRevealed(gameId, keywordsRevealed, elapsedSeconds));
        if (timeoutScheduled && !timeoutDelivered) {
            scheduleTimeout(currentTag());
        }
        scheduleTick(currentTag());
    }

    private void handleStop() {
        cancelTimer();
        generation++;

        log.info("[GameServer] 타이머 정지: game={}, round={}", gameId, roundId);

        roundId = null;
        phase = GameServerState.TimerPhase.IDLE;
        elapsedSeconds = 0;
        keywordsRevealed = 0;
        keywordsTotal = 0;
        timeoutScheduled = false;
        timeoutDelivered = false;
        paused = false;
    }

    private void handlePause() {
        cancelTimer();
        if (paused) {
            return;
        }
        paused = true;
        log.info("[GameServer] 타이머 일시정지 (전원 선택): game={}, round={}", gameId, roundId);
    }

    private void handleTick(TimerTag tag) {
        if (!isCurrent(tag)) {
            log.debug("[GameServer] 지난 틱 무시: game={}, tag={}, currentRound={}", gameId, tag, roundId);
            return;
        }
        if (paused) {
            log.debug("[GameServer] 일시정지 중 틱 무시: game={}", gameId);
            return;
        }

        elapsedSeconds++;

        boolean reveal = elapsedSeconds > 0
                && elapsedSeconds % cluesInterval == 0
                && keywordsRevealed < keywordsTotal;
        if (reveal) {
            keywordsRevealed++;
            log.debug("[GameServer] 키워드 {} 공개: game={}", keywordsRevealed, gameId);
        }

        // 공개가 없어도 매 틱 보낸다 (클라이언트 진행바)
        eventBus.broadcastToGame(gameId, GameEvent.keywordRevealed(gameId, keywordsRevealed, elapsedSeconds));

        maybeScheduleTimeout(tag);
        scheduleTick(tag);
    }

    private void maybeScheduleTimeout(TimerTag tag) {
        if (timeoutScheduled) return;
        if (keywordsRevealed < keywordsTotal) return;
        if (elapsedSeconds < keywordsTotal * cluesInterval) return;

        log.info("[GameServer] 모든 키워드 카운트다운 종료, 라운드 타임아웃 예약: game={}, round={}", gameId, roundId);
        timeoutScheduled = true;
        scheduleTimeout(tag);
    }

    private void handleRoundTimeout(TimerTag tag) {
        if (!isCurrent(tag)) {
            log.debug("[GameServer] 지난 타임아웃 무시: game={}, tag={}, currentRound={}", gameId, tag, roundId);
            return;
        }
        if (timeoutDelivered) {
            return;
        }
        timeoutDelivered = true;

        log.info("[GameServer] 라운드 타임아웃: game={}, round={}", gameId, roundId);
        // 아직 안 고른 플레이어가 있어도 보낸다. 받는 쪽이 라운드를 강제로 넘긴다
        eventBus.broadcastToGame(gameId, GameEvent.roundTimeout(gameId, roundId));
    }

    /* =========================
       타이머 헬퍼
    ========================= */
    private boolean isCurrent(TimerTag tag) {
        return phase == GameServerState.TimerPhase.PLAYING
                && tag.getRoundId().equals(roundId)
                && tag.getGeneration() == generation;
    }

    private TimerTag currentTag() {
        return new TimerTag(roundId, generation);
    }

    private void scheduleTick(TimerTag tag) {
        if (mailbox.isShutdown()) return;
        timer = mailbox.schedule(() -> runSafely(() -> handleTick(tag)), tickMillis, TimeUnit.MILLISECONDS);
    }

    private void scheduleTimeout(TimerTag tag) {
        if (mailbox.isShutdown()) return;
        mailbox.schedule(() -> runSafely(() -> handleRoundTimeout(tag)), 0, TimeUnit.MILLISECONDS);
    }

    private void cancelTimer() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
    }

    private GameServerState snapshot() {
        return GameServerState.builder()
                .gameId(gameId)
                .roundId(roundId)
                .cluesInterval(cluesInterval)
                .elapsedSeconds(elapsedSeconds)
                .keywordsRevealed(keywordsRevealed)
                .keywordsTotal(keywordsTotal)
                .phase(phase)
                .timeoutScheduled(timeoutScheduled)
                .paused(paused)
                .generation(generation)
                .build();
    }
}

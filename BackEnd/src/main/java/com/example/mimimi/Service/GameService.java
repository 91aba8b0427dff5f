package com.example.mimimi.Service;

import com.example.mimimi.Config.MimimiProperties;
import com.example.mimimi.DTO.CreateGameDTO;
import com.example.mimimi.DTO.CreatePlayerDTO;
import com.example.mimimi.Domain.GameEvent;
import com.example.mimimi.Domain.GameEventType;
import com.example.mimimi.Domain.GameServerRegistry;
import com.example.mimimi.Domain.GameStatus;
import com.example.mimimi.Domain.WordProvider;
import com.example.mimimi.Entity.Game;
import com.example.mimimi.Entity.GameInvite;
import com.example.mimimi.Entity.Player;
import com.example.mimimi.Handler.GlobalExceptionHandler.GameNotFoundException;
import com.example.mimimi.Handler.GlobalExceptionHandler.InviteExpiredException;
import com.example.mimimi.Repository.GameInviteRepository;
import com.example.mimimi.Repository.GameRepository;
import com.example.mimimi.Repository.PlayerRepository;
import com.example.mimimi.Socket.GameEventBus;
import com.example.mimimi.Socket.GameTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class GameService {

    public static final int DEFAULT_ROUNDS_COUNT = 3;
    public static final int DEFAULT_CLUES_INTERVAL = 10;
    public static final int DEFAULT_GRID_SIZE = 9;
    public static final int MAX_ROUNDS_COUNT = 20;
    public static final Set<Integer> CLUES_INTERVALS = Set.of(3, 6, 9, 10, 12, 15, 20, 30, 45, 60);
    public static final Set<Integer> GRID_SIZES = Set.of(2, 4, 9, 16);

    private static final int SHORT_CODE_ATTEMPTS = 10;

    private final GameRepository gameRepository;
    private final PlayerRepository playerRepository;
    private final GameInviteRepository gameInviteRepository;
    private final GameServerRegistry gameServerRegistry;
    private final GameEventBus eventBus;
    private final WordProvider wordProvider;
    private final MimimiProperties properties;

    private final SecureRandom random = new SecureRandom();

    /* ============================================================
       게임 생성
    ============================================================ */
    @Transactional
    public Game createGame(CreateGameDTO dto) {
        if (dto.getHostUserId() == null || dto.getHostUserId().isBlank()) {
            throw new IllegalArgumentException("hostUserId 가 필요합니다.");
        }

        int roundsCount = dto.getRoundsCount() != null ? dto.getRoundsCount() : DEFAULT_ROUNDS_COUNT;
        int cluesInterval = dto.getCluesInterval() != null ? dto.getCluesInterval() : DEFAULT_CLUES_INTERVAL;
        int gridSize = dto.getGridSize() != null ? dto.getGridSize() : DEFAULT_GRID_SIZE;

        if (roundsCount < 1 || roundsCount > MAX_ROUNDS_COUNT) {
            throw new IllegalArgumentException("라운드 수는 1~" + MAX_ROUNDS_COUNT + " 사이여야 합니다: " + roundsCount);
        }
        if (!CLUES_INTERVALS.contains(cluesInterval)) {
            throw new IllegalArgumentException("허용되지 않는 힌트 간격입니다: " + cluesInterval);
        }
        if (!GRID_SIZES.contains(gridSize)) {
            throw new IllegalArgumentException("허용되지 않는 그리드 크기입니다: " + gridSize);
        }

        // 출제 가능한 단어가 모자라면 시작 단계가 아니라 여기서 막는다
        if (wordProvider.targetWordIds(RoundService.MIN_TARGET_KEYWORDS).size() < roundsCount) {
            throw new IllegalArgumentException("라운드 수만큼 출제할 단어가 없습니다: " + roundsCount);
        }
        if (wordProvider.allWordIds().size() < gridSize) {
            throw new IllegalArgumentException("그리드를 채울 단어가 부족합니다: " + gridSize);
        }

        Game game = Game.builder()
                .hostUserId(dto.getHostUserId())
                .roundsCount(roundsCount)
                .cluesInterval(cluesInterval)
                .gridSize(gridSize)
                .state(GameStatus.WAITING_FOR_PLAYERS)
                .build();

        Game saved = gameRepository.save(game);
        GameInvite invite = createGameInvite(saved.getId());
        log.info("[Game] 생성: id={}, host={}, rounds={}, interval={}s, grid={}, code={}",
                saved.getId(), saved.getHostUserId(), roundsCount, cluesInterval, gridSize, invite.getShortCode());

        broadcastGameCount();
        return saved;
    }

    /* ============================================================
       조회
    ============================================================ */
    @Transactional(readOnly = true)
    public Game getGame(Long gameId) {
        return gameRepository.findById(gameId)
                .orElseThrow(() -> new GameNotFoundException("존재하지 않는 게임: " + gameId));
    }

    @Transactional(readOnly = true)
    public Optional<Game> findGame(Long gameId) {
        return gameRepository.findById(gameId);
    }

    @Transactional(readOnly = true)
    public List<Player> getPlayers(Long gameId) {
        return playerRepository.findByGameIdOrderByCreatedAtAsc(gameId);
    }

    @Transactional(readOnly = true)
    public List<Player> getLeaderboard(Long gameId) {
        return playerRepository.findByGameIdOrderByPointsDescCreatedAtAsc(gameId);
    }

    @Transactional(readOnly = true)
    public Player getPlayer(Long gameId, String userId) {
        return playerRepository.findByGameIdAndUserId(gameId, userId)
                .orElseThrow(() -> new IllegalArgumentException("이 게임의 플레이어가 아닙니다: " + userId));
    }

    @Transactional(readOnly = true)
    public long countActiveGames() {
        return gameRepository.countByStateIn(GameStatus.ACTIVE);
    }

    /* ============================================================
       플레이어 입장 (대기 중인 게임만)
    ============================================================ */
    @Transactional
    public Player createPlayer(Long gameId, CreatePlayerDTO dto) {
        Game game = getGame(gameId);

        if (dto.getUserId() == null || dto.getUserId().isBlank()) {
            throw new IllegalArgumentException("userId 가 필요합니다.");
        }

        // 새로고침 등으로 다시 들어온 경우 기존 플레이어 그대로
        Optional<Player> existing = playerRepository.findByGameIdAndUserId(gameId, dto.getUserId());
        if (existing.isPresent()) {
            return existing.get();
        }

        if (game.getState() != GameStatus.WAITING_FOR_PLAYERS) {
            throw new IllegalStateException("이미 시작했거나 끝난 게임입니다: " + game.getState());
        }

        Player player = playerRepository.save(Player.builder()
                .gameId(gameId)
                .userId(dto.getUserId())
                .nickname(dto.getNickname())
                .avatar(dto.getAvatar())
                .points(0)
                .build());

        log.info("[Game] 플레이어 입장: game={}, player={}, nickname={}", gameId, player.getId(), player.getNickname());
        eventBus.broadcast(GameTopics.host(gameId), GameEvent.of(GameEventType.PLAYER_JOINED, gameId, Map.of(
                "playerId", player.getId(),
                "nickname", String.valueOf(player.getNickname())
        )));
        return player;
    }

    /* ============================================================
       상태 전이
    ============================================================ */
    @Transactional
    public Game markGameStarted(Long gameId) {
        Game game = getGame(gameId);
        if (gameRepository.markStarted(gameId, LocalDateTime.now()) == 0) {
            throw new IllegalStateException("대기 중인 게임만 시작할 수 있습니다: " + game.getState());
        }
        log.info("[Game] 시작: id={}", gameId);
        return getGame(gameId);
    }

    /*
        진행 중(대기/진행)인 게임을 종료 상태로. 다른 쪽이 먼저 끝냈으면 false 이고 아무것도 바꾸지 않는다
    */
    @Transactional
    public boolean markGameState(Long gameId, GameStatus state) {
        if (state.isActive()) {
            throw new IllegalArgumentException("종료 상태만 지정할 수 있습니다: " + state);
        }
        getGame(gameId);

        if (gameRepository.transitionStateFrom(gameId, GameStatus.ACTIVE, state, LocalDateTime.now()) == 0) {
            log.debug("[Game] 이미 종료된 게임, 상태 변경 생략: id={}, state={}", gameId, state);
            return false;
        }

        log.info("[Game] 상태 변경: id={}, state={}", gameId, state);
        broadcastGameCount();
        return true;
    }

    /* ============================================================
       호스트가 직접 종료
    ============================================================ */
    @Transactional
    public Game stopGameManually(Long gameId) {
        Game game = getGame(gameId);
        if (gameRepository.transitionStateFrom(gameId, GameStatus.ACTIVE, GameStatus.GAME_OVER, LocalDateTime.now()) == 0) {
            throw new IllegalStateException("이미 끝난 게임입니다: " + game.getState());
        }

        gameServerRegistry.stopGameServer(gameId);

        log.info("[Game] 호스트가 게임 종료: id={}", gameId);
        eventBus.broadcastToGame(gameId, GameEvent.of(GameEventType.GAME_STOPPED_BY_HOST, gameId));
        broadcastGameCount();
        return getGame(gameId);
    }

    /* ============================================================
       호스트 연결 끊김 정리. 없는 게임이나 이미 끝난 게임이면 아무것도 안 한다
    ============================================================ */
    @Transactional
    public boolean cleanupGameOnHostDisconnect(Long gameId) {
        Optional<Game> found = gameRepository.findById(gameId);
        if (found.isEmpty()) {
            log.debug("[Game] 정리 대상 게임 없음: id={}", gameId);
            return false;
        }

        if (gameRepository.transitionStateFrom(gameId, GameStatus.ACTIVE, GameStatus.HOST_DISCONNECTED, LocalDateTime.now()) == 0) {
            log.debug("[Game] 이미 종료된 게임, 정리 생략: id={}, state={}", gameId, found.get().getState());
            return false;
        }

        gameServerRegistry.stopGameServer(gameId);

        log.info("[Game] 호스트 연결 끊김으로 게임 정리: id={}", gameId);
        eventBus.broadcastToGame(gameId, GameEvent.of(GameEventType.HOST_DISCONNECTED, gameId));
        broadcastGameCount();
        return true;
    }

    /* ============================================================
       호스트가 시작 전에 취소 (게임, 플레이어, 초대 코드 삭제)
    ============================================================ */
    @Transactional
    public void cancelGame(Long gameId) {
        Game game = getGame(gameId);
        if (gameRepository.deleteIfWaiting(gameId) == 0) {
            throw new IllegalStateException("대기 중인 게임만 취소할 수 있습니다: " + game.getState());
        }
        playerRepository.deleteAllByGameId(gameId);
        gameInviteRepository.deleteAllByGameId(gameId);

        log.info("[Game] 호스트가 게임 취소: id={}", gameId);
        eventBus.broadcastToGame(gameId, GameEvent.of(GameEventType.GAME_CANCELLED, gameId));
        broadcastGameCount();
    }

    /* ============================================================
       대기 중에 연결이 끊긴 플레이어 제거. 시작 후에는 점수 때문에 남겨 둔다
    ============================================================ */
    @Transactional
    public boolean removePlayerOnDisconnect(Long gameId, String userId) {
        Optional<Game> game = gameRepository.findById(gameId);
        if (game.isEmpty() || game.get().getState() != GameStatus.WAITING_FOR_PLAYERS) {
            return false;
        }

        Optional<Player> player = playerRepository.findByGameIdAndUserId(gameId, userId);
        if (player.isEmpty()) {
            return false;
        }

        playerRepository.delete(player.get());
        log.info("[Game] 대기 중 연결 끊긴 플레이어 제거: game={}, user={}", gameId, userId);
        eventBus.broadcastToGame(gameId, GameEvent.of(GameEventType.PLAYER_LEFT, gameId, Map.of(
                "playerId", player.get().getId()
        )));
        return true;
    }

    /* ============================================================
       같은 설정으로 새 게임 (플레이어 없이)
    ============================================================ */
    @Transactional
    public Game restartGame(Long gameId) {
        Game old = getGame(gameId);
        return createGame(sameSettings(old));
    }

    /* ============================================================
       같은 설정 + 같은 플레이어로 새 게임. onlineUserIds 가 null 이면 전원 복사
    ============================================================ */
    @Transactional
    public Game createNewGameWithPlayers(Long gameId, Collection<String> onlineUserIds) {
        Game old = getGame(gameId);
        Game created = createGame(sameSettings(old));

        int copied = 0;
        for (Player player : playerRepository.findByGameIdOrderByCreatedAtAsc(gameId)) {
            if (onlineUserIds != null && !onlineUserIds.contains(player.getUserId())) {
                continue;
            }
            playerRepository.save(Player.builder()
                    .gameId(created.getId())
                    .userId(player.getUserId())
                    .nickname(player.getNickname())
                    .avatar(player.getAvatar())
                    .points(0)
                    .build());
            copied++;
        }

        log.info("[Game] 같은 플레이어로 새 게임: old={}, new={}, players={}", gameId, created.getId(), copied);
        eventBus.broadcastToGame(gameId, GameEvent.of(GameEventType.NEW_GAME_STARTED, gameId, Map.of(
                "newGameId", created.getId()
        )));
        return created;
    }

    /* ============================================================
       초대 코드
    ============================================================ */
    @Transactional
    public GameInvite createGameInvite(Long gameId) {
        LocalDateTime expiresAt = LocalDateTime.now().plus(properties.getInvite().getExpiration());

        for (int attempt = 0; attempt < SHORT_CODE_ATTEMPTS; attempt++) {
            String shortCode = generateShortCode();
            // insert 실패는 트랜잭션을 망가뜨리므로 먼저 확인한다
            if (gameInviteRepository.existsByShortCode(shortCode)) {
                continue;
            }
            return gameInviteRepository.save(GameInvite.builder()
                    .gameId(gameId)
                    .shortCode(shortCode)
                    .expiresAt(expiresAt)
                    .build());
        }
        throw new IllegalStateException("초대 코드를 만들지 못했습니다: game=" + gameId);
    }

    @Transactional(readOnly = true)
    public Optional<String> getShortCodeForGame(Long gameId) {
        return gameInviteRepository.findFirstByGameIdAndExpiresAtAfterOrderByCreatedAtDesc(gameId, LocalDateTime.now())
                .map(GameInvite::getShortCode);
    }

    /*
        초대 코드로 들어올 수 있는 게임인지 확인. 없는 코드 404, 만료 410, 이미 시작/종료 409
    */
    @Transactional(readOnly = true)
    public Game validateShortCode(String shortCode) {
        GameInvite invite = gameInviteRepository.findByShortCode(shortCode)
                .orElseThrow(() -> new GameNotFoundException("존재하지 않는 초대 코드: " + shortCode));

        if (invite.isExpired(LocalDateTime.now())) {
            throw new InviteExpiredException("만료된 초대 코드입니다: " + shortCode);
        }

        Game game = getGame(invite.getGameId());
        if (game.getState() != GameStatus.WAITING_FOR_PLAYERS) {
            throw new IllegalStateException("참가할 수 없는 게임입니다: " + game.getState());
        }
        return game;
    }

    String generateShortCode() {
        return String.valueOf(100_000 + random.nextInt(900_000));
    }

    /* ============================================================
       오래 대기 중인 로비 정리
    ============================================================ */
    @Transactional
    public int timeoutLobbies() {
        LocalDateTime now = LocalDateTime.now();
        LocalDateTime threshold = now.minus(properties.getLobby().getTimeout());

        int count = 0;
        for (Game game : gameRepository.findAllByStateAndCreatedAtLessThanEqual(GameStatus.WAITING_FOR_PLAYERS, threshold)) {
            // 그 사이 시작된 게임은 건드리지 않는다
            if (gameRepository.transitionState(game.getId(), GameStatus.WAITING_FOR_PLAYERS, GameStatus.LOBBY_TIMEOUT, now) == 0) {
                continue;
            }
            count++;
            log.info("[Game] 로비 타임아웃: id={}", game.getId());
            eventBus.broadcastToGame(game.getId(), GameEvent.of(GameEventType.LOBBY_TIMEOUT, game.getId()));
        }

        if (count > 0) {
            broadcastGameCount();
        }
        return count;
    }

    private static CreateGameDTO sameSettings(Game game) {
        CreateGameDTO dto = new CreateGameDTO();
        dto.setHostUserId(game.getHostUserId());
        dto.setRoundsCount(game.getRoundsCount());
        dto.setCluesInterval(game.getCluesInterval());
        dto.setGridSize(game.getGridSize());
        return dto;
    }

    public void broadcastGameCount() {
        long active = countActiveGames();
        eventBus.broadcast(GameTopics.ACTIVE_GAMES,
                GameEvent.of(GameEventType.GAME_COUNT_CHANGED, null, Map.of("activeGames", active)));
    }
}

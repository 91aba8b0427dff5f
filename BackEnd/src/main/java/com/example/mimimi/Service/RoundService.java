package com.example.mimimi.Service;

import com.example.mimimi.Config.MimimiProperties;
import com.example.mimimi.Domain.PickResult;
import com.example.mimimi.Domain.RoundState;
import com.example.mimimi.Domain.WordProvider;
import com.example.mimimi.Domain.WordProvider.CatalogWord;
import com.example.mimimi.Entity.Game;
import com.example.mimimi.Entity.Pick;
import com.example.mimimi.Entity.Player;
import com.example.mimimi.Entity.Round;
import com.example.mimimi.Handler.GlobalExceptionHandler.PickAlreadySubmittedException;
import com.example.mimimi.Repository.PickRepository;
import com.example.mimimi.Repository.PlayerRepository;
import com.example.mimimi.Repository.RoundRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class RoundService {

    // 출제 단어는 키워드가 최소 이만큼 있어야 한다
    public static final int MIN_TARGET_KEYWORDS = 3;

    private static final List<RoundState> OPEN_STATES = List.of(RoundState.PLAYING, RoundState.ON_HOLD);

    private final RoundRepository roundRepository;
    private final PickRepository pickRepository;
    private final PlayerRepository playerRepository;
    private final WordProvider wordProvider;
    private final MimimiProperties properties;

    /* ============================================================
       라운드 생성 (게임 시작 시 한 번)
    ============================================================ */
    @Transactional
    public List<Round> generateRounds(Game game) {
        List<Long> usedWordIds = roundRepository.findWordIdsByGameId(game.getId());
        Set<Long> used = new HashSet<>(usedWordIds);
        int keywordsPerRound = properties.getRound().getKeywordsPerRound();

        List<Round> rounds = new ArrayList<>();
        for (int position = usedWordIds.size() + 1; position <= game.getRoundsCount(); position++) {
            CatalogWord target = wordProvider.pickUniqueTarget(used, MIN_TARGET_KEYWORDS);
            used.add(target.getId());

            List<Long> grid = wordProvider.pickDistractors(target.getId(), game.getGridSize() - 1);
            grid.add(target.getId());
            Collections.shuffle(grid);

            rounds.add(Round.builder()
                    .gameId(game.getId())
                    .wordId(target.getId())
                    .keywordIds(wordProvider.shuffledKeywords(target, keywordsPerRound))
                    .possibleWordIds(grid)
                    .position(position)
                    .state(RoundState.ON_HOLD)
                    .build());
        }

        List<Round> saved = roundRepository.saveAll(rounds);
        log.info("[Round] 라운드 {}개 생성: game={}", saved.size(), game.getId());
        return saved;
    }

    /* ============================================================
       조회
    ============================================================ */
    @Transactional(readOnly = true)
    public Round getRound(Long roundId) {
        return roundRepository.findById(roundId)
                .orElseThrow(() -> new IllegalArgumentException("존재하지 않는 라운드: " + roundId));
    }

    @Transactional(readOnly = true)
    public List<Round> getRounds(Long gameId) {
        return roundRepository.findAllByGameIdOrderByPositionAsc(gameId);
    }

    // 진행 중인 라운드, 없으면 다음 대기 라운드
    @Transactional(readOnly = true)
    public Optional<Round> getCurrentRound(Long gameId) {
        return roundRepository.findFirstByGameIdAndStateInOrderByPositionAsc(gameId, OPEN_STATES);
    }

    @Transactional(readOnly = true)
    public Optional<Round> getPlayingRound(Long gameId) {
        return roundRepository.findByGameIdAndState(gameId, RoundState.PLAYING);
    }

    /* ============================================================
       다음 라운드 시작 (position 이 가장 낮은 대기 라운드)
       진행 중인 라운드가 남아 있으면 시작하지 않는다
    ============================================================ */
    @Transactional
    public Optional<Round> activateNextRound(Long gameId) {
        Optional<Round> playing = roundRepository.findByGameIdAndState(gameId, RoundState.PLAYING);
        if (playing.isPresent()) {
            log.warn("[Round] 진행 중인 라운드가 있어 다음 라운드를 시작하지 않음: game={}, round={}",
                    gameId, playing.get().getId());
            return Optional.empty();
        }

        Optional<Round> next = roundRepository.findFirstByGameIdAndStateOrderByPositionAsc(gameId, RoundState.ON_HOLD);
        if (next.isEmpty()) {
            return Optional.empty();
        }

        Long roundId = next.get().getId();
        if (roundRepository.transitionState(roundId, RoundState.ON_HOLD, RoundState.PLAYING) == 0) {
            log.debug("[Round] 다른 요청이 먼저 라운드를 시작함: round={}", roundId);
            return Optional.empty();
        }

        log.info("[Round] 라운드 시작: game={}, round={}, position={}", gameId, roundId, next.get().getPosition());
        return roundRepository.findById(roundId);
    }

    /* ============================================================
       라운드 종료. 진행 중일 때만 반영되고, 동시에 여러 번 불려도 한 번만 true
    ============================================================ */
    @Transactional
    public boolean finishRound(Long roundId) {
        boolean finished = roundRepository.transitionState(roundId, RoundState.PLAYING, RoundState.FINISHED) == 1;
        if (finished) {
            log.info("[Round] 라운드 종료: round={}", roundId);
        }
        return finished;
    }

    /* ============================================================
       플레이어 선택 저장
    ============================================================ */
    @Transactional
    public PickResult createPick(Long roundId, Long playerId, Long wordId, long timeMillis, int keywordsShown) {
        Round round = getRound(roundId);
        if (round.getState() != RoundState.PLAYING) {
            throw new IllegalStateException("진행 중인 라운드가 아닙니다: " + round.getState());
        }

        Player player = playerRepository.findById(playerId)
                .orElseThrow(() -> new IllegalArgumentException("존재하지 않는 플레이어: " + playerId));
        if (!player.getGameId().equals(round.getGameId())) {
            throw new IllegalArgumentException("다른 게임의 플레이어입니다: " + playerId);
        }
        if (wordId == null) {
            throw new IllegalArgumentException("wordId 가 필요합니다.");
        }

        if (pickRepository.existsByRoundIdAndPlayerId(roundId, playerId)) {
            throw new PickAlreadySubmittedException("이미 선택한 라운드입니다: round=" + roundId);
        }

        int total = round.getKeywordCount();
        int shown = Math.max(1, Math.min(keywordsShown, total));
        boolean correct = round.getWordId().equals(wordId);

        Pick pick = Pick.builder()
                .roundId(roundId)
                .playerId(playerId)
                .wordId(wordId)
                .time(Math.max(0, timeMillis))
                .keywordsShown(shown)
                .correct(correct)
                .build();

        try {
            pick = pickRepository.saveAndFlush(pick);
        } catch (DataIntegrityViolationException e) {
            // exists 검사와 insert 사이에 같은 플레이어 요청이 먼저 들어온 경우
            throw new PickAlreadySubmittedException("이미 선택한 라운드입니다: round=" + roundId, e);
        }

        int points = correct ? calculatePoints(shown, total) : 0;
        if (points > 0) {
            playerRepository.addPoints(playerId, points);
        }

        boolean allPicked = playersHaveAllPicked(round.getGameId(), roundId);
        log.info("[Round] 선택: round={}, player={}, correct={}, points={}, allPicked={}",
                roundId, playerId, correct, points, allPicked);

        return new PickResult(pick, points, allPicked);
    }

    @Transactional(readOnly = true)
    public boolean playersHaveAllPicked(Long gameId, Long roundId) {
        long players = playerRepository.countByGameId(gameId);
        return players > 0 && pickRepository.countByRoundId(roundId) >= players;
    }

    /*
        키워드를 적게 보고 맞힐수록 높은 점수 (1~5점)
    */
    public static int calculatePoints(int keywordsShown, int keywordsTotal) {
        if (keywordsTotal <= 0) {
            return 1;
        }
        // ceil(shown / total * 5)
        int used = (keywordsShown * 5 + keywordsTotal - 1) / keywordsTotal;
        return Math.max(1, 6 - used);
    }
}

package com.example.mimimi.Service;

import com.example.mimimi.Domain.GameStatus;
import com.example.mimimi.Domain.PickResult;
import com.example.mimimi.Domain.RoundState;
import com.example.mimimi.Domain.WordProvider;
import com.example.mimimi.Entity.Game;
import com.example.mimimi.Entity.Player;
import com.example.mimimi.Entity.Round;
import com.example.mimimi.Handler.GlobalExceptionHandler.PickAlreadySubmittedException;
import com.example.mimimi.Repository.GameRepository;
import com.example.mimimi.Repository.PlayerRepository;
import com.example.mimimi.Repository.RoundRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import({RoundService.class, WordProvider.class})
class RoundServiceTest {

    @Autowired
    private RoundService roundService;

    @Autowired
    private WordProvider wordProvider;

    @Autowired
    private GameRepository gameRepository;

    @Autowired
    private PlayerRepository playerRepository;

    @Autowired
    private RoundRepository roundRepository;

    private Game game;
    private Player alice;
    private Player bob;

    @BeforeEach
    void setUp() {
        game = gameRepository.save(Game.builder()
                .hostUserId("host")
                .roundsCount(5)
                .cluesInterval(3)
                .gridSize(9)
                .state(GameStatus.GAME_RUNNING)
                .build());
        alice = playerRepository.save(Player.builder().gameId(game.getId()).userId("alice").nickname("Alice").build());
        bob = playerRepository.save(Player.builder().gameId(game.getId()).userId("bob").nickname("Bob").build());
    }

    @Test
    void generatesRoundsWithUniqueTargetsAndFullGrid() {
        List<Round> rounds = roundService.generateRounds(game);

        assertEquals(5, rounds.size());
        Set<Long> targets = new HashSet<>();
        for (int i = 0; i < rounds.size(); i++) {
            Round round = rounds.get(i);
            assertEquals(i + 1, round.getPosition());
            assertEquals(RoundState.ON_HOLD, round.getState());
            assertTrue(targets.add(round.getWordId()));

            assertEquals(9, round.getPossibleWordIds().size());
            assertEquals(9, new HashSet<>(round.getPossibleWordIds()).size());
            assertTrue(round.getPossibleWordIds().contains(round.getWordId()));

            List<Long> catalogKeywords = wordProvider.find(round.getWordId()).orElseThrow().getKeywordIds();
            assertTrue(round.getKeywordCount() >= RoundService.MIN_TARGET_KEYWORDS);
            assertTrue(round.getKeywordCount() <= 5);
            assertTrue(catalogKeywords.containsAll(round.getKeywordIds()));
        }
    }

    @Test
    void generatingAgainDoesNotDuplicateRounds() {
        roundService.generateRounds(game);
        List<Round> again = roundService.generateRounds(game);

        assertTrue(again.isEmpty());
        assertEquals(5, roundService.getRounds(game.getId()).size());
    }

    @Test
    void activatesLowestWaitingRoundOneAtATime() {
        roundService.generateRounds(game);

        Round first = roundService.activateNextRound(game.getId()).orElseThrow();
        assertEquals(1, first.getPosition());
        assertEquals(RoundState.PLAYING, first.getState());
        assertEquals(first.getId(), roundService.getCurrentRound(game.getId()).orElseThrow().getId());

        // 진행 중인 라운드가 있으면 다음 라운드는 시작되지 않는다
        assertTrue(roundService.activateNextRound(game.getId()).isEmpty());

        assertTrue(roundService.finishRound(first.getId()));
        assertFalse(roundService.finishRound(first.getId()));

        Round second = roundService.activateNextRound(game.getId()).orElseThrow();
        assertEquals(2, second.getPosition());
    }

    @Test
    void noWaitingRoundMeansGameIsDone() {
        Game single = gameRepository.save(Game.builder()
                .hostUserId("host")
                .roundsCount(1)
                .cluesInterval(3)
                .gridSize(4)
                .state(GameStatus.GAME_RUNNING)
                .build());
        roundService.generateRounds(single);

        Round only = roundService.activateNextRound(single.getId()).orElseThrow();
        roundService.finishRound(only.getId());

        assertEquals(Optional.empty(), roundService.activateNextRound(single.getId()));
        assertTrue(roundService.getCurrentRound(single.getId()).isEmpty());
    }

    @Test
    void correctPickEarnsPointsAndLastPickCompletesRound() {
        roundService.generateRounds(game);
        Round round = roundService.activateNextRound(game.getId()).orElseThrow();
        int total = round.getKeywordCount();
        Long wrongWord = round.getPossibleWordIds().stream()
                .filter(id -> !id.equals(round.getWordId()))
                .findFirst().orElseThrow();

        PickResult first = roundService.createPick(round.getId(), alice.getId(), round.getWordId(), 1500, 1);
        assertTrue(first.getPick().isCorrect());
        assertEquals(RoundService.calculatePoints(1, total), first.getPointsAwarded());
        assertFalse(first.isAllPicked());

        PickResult second = roundService.createPick(round.getId(), bob.getId(), wrongWord, 4000, 2);
        assertFalse(second.getPick().isCorrect());
        assertEquals(0, second.getPointsAwarded());
        assertTrue(second.isAllPicked());
        assertTrue(roundService.playersHaveAllPicked(game.getId(), round.getId()));

        assertEquals(first.getPointsAwarded(), playerRepository.findById(alice.getId()).orElseThrow().getPoints());
        assertEquals(0, playerRepository.findById(bob.getId()).orElseThrow().getPoints());
    }

    @Test
    void secondPickInSameRoundIsRejected() {
        roundService.generateRounds(game);
        Round round = roundService.activateNextRound(game.getId()).orElseThrow();

        roundService.createPick(round.getId(), alice.getId(), round.getWordId(), 1000, 1);

        assertThrows(PickAlreadySubmittedException.class,
                () -> roundService.createPick(round.getId(), alice.getId(), round.getWordId(), 2000, 2));
    }

    @Test
    void pickOnWaitingRoundIsRejected() {
        List<Round> rounds = roundService.generateRounds(game);
        Round waiting = rounds.get(0);

        assertThrows(IllegalStateException.class,
                () -> roundService.createPick(waiting.getId(), alice.getId(), waiting.getWordId(), 1000, 1));
    }

    @Test
    void keywordsShownIsClampedToRoundSize() {
        roundService.generateRounds(game);
        Round round = roundService.activateNextRound(game.getId()).orElseThrow();

        PickResult result = roundService.createPick(round.getId(), alice.getId(), round.getWordId(), 1000, 99);

        assertEquals(round.getKeywordCount(), result.getPick().getKeywordsShown());
        assertEquals(1, result.getPointsAwarded());
    }

    @Test
    void gameWithoutPlayersIsNeverAllPicked() {
        Game empty = gameRepository.save(Game.builder()
                .hostUserId("host")
                .roundsCount(1)
                .cluesInterval(3)
                .gridSize(4)
                .state(GameStatus.GAME_RUNNING)
                .build());
        Round round = roundService.generateRounds(empty).get(0);

        assertFalse(roundService.playersHaveAllPicked(empty.getId(), round.getId()));
    }

    @Test
    void fewerKeywordsSeenMeansMorePoints() {
        assertEquals(5, RoundService.calculatePoints(1, 5));
        assertEquals(4, RoundService.calculatePoints(2, 5));
        assertEquals(1, RoundService.calculatePoints(5, 5));
        assertEquals(4, RoundService.calculatePoints(1, 3));
        assertEquals(3, RoundService.calculatePoints(1, 2));
        assertEquals(1, RoundService.calculatePoints(2, 2));
        assertEquals(1, RoundService.calculatePoints(1, 0));
    }
}

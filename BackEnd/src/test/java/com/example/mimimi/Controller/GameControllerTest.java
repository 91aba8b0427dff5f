package com.example.mimimi.Controller;

import com.example.mimimi.DTO.CreateGameDTO;
import com.example.mimimi.Domain.GameServerRegistry;
import com.example.mimimi.Domain.GameStatus;
import com.example.mimimi.Domain.RoundState;
import com.example.mimimi.Entity.Game;
import com.example.mimimi.Entity.Player;
import com.example.mimimi.Entity.Round;
import com.example.mimimi.Handler.GlobalExceptionHandler.GameNotFoundException;
import com.example.mimimi.Handler.GlobalExceptionHandler.InviteExpiredException;
import com.example.mimimi.Service.GameService;
import com.example.mimimi.Service.RoundService;
import com.example.mimimi.Socket.PresenceMonitor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(GameController.class)
class GameControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GameService gameService;

    @MockBean
    private RoundService roundService;

    @MockBean
    private GameServerRegistry gameServerRegistry;

    @MockBean
    private PresenceMonitor presenceMonitor;

    @Test
    void createGameStartsHostMonitoring() throws Exception {
        when(gameService.createGame(any(CreateGameDTO.class))).thenReturn(game(5L));
        when(gameService.getShortCodeForGame(5L)).thenReturn(Optional.of("482913"));

        mockMvc.perform(post("/games")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"hostUserId\":\"host\",\"roundsCount\":3}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(5))
                .andExpect(jsonPath("$.state").value("WAITING_FOR_PLAYERS"))
                .andExpect(jsonPath("$.shortCode").value("482913"));

        verify(presenceMonitor).monitorGameHost(5L);
    }

    @Test
    void invalidSettingsAreBadRequest() throws Exception {
        when(gameService.createGame(any(CreateGameDTO.class)))
                .thenThrow(new IllegalArgumentException("허용되지 않는 그리드 크기입니다: 5"));

        mockMvc.perform(post("/games")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"hostUserId\":\"host\",\"gridSize\":5}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownGameIsNotFound() throws Exception {
        when(gameService.getGame(9L)).thenThrow(new GameNotFoundException("존재하지 않는 게임: 9"));

        mockMvc.perform(get("/games/9"))
                .andExpect(status().isNotFound());
    }

    @Test
    void gameIncludesPlayers() throws Exception {
        when(gameService.getGame(5L)).thenReturn(game(5L));
        when(gameService.getPlayers(5L)).thenReturn(List.of());

        mockMvc.perform(get("/games/5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.players").isArray());
    }

    @Test
    void runningGameShowsCurrentRoundAndTimer() throws Exception {
        Game running = game(5L);
        running.setState(GameStatus.GAME_RUNNING);
        when(gameService.getGame(5L)).thenReturn(running);
        when(gameService.getPlayers(5L)).thenReturn(List.of());
        when(roundService.getCurrentRound(5L)).thenReturn(Optional.of(round(51L, 2, RoundState.PLAYING)));
        when(gameServerRegistry.isRunning(5L)).thenReturn(true);

        mockMvc.perform(get("/games/5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentRoundId").value(51))
                .andExpect(jsonPath("$.currentRoundPosition").value(2))
                .andExpect(jsonPath("$.timerRunning").value(true))
                .andExpect(jsonPath("$.shortCode").doesNotExist());
    }

    @Test
    void roundsHideAnswerUntilFinished() throws Exception {
        when(gameService.getGame(5L)).thenReturn(game(5L));
        when(roundService.getRounds(5L)).thenReturn(List.of(
                round(50L, 1, RoundState.FINISHED),
                round(51L, 2, RoundState.PLAYING)));

        mockMvc.perform(get("/games/5/rounds"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].wordId").value(7))
                .andExpect(jsonPath("$[1].state").value("PLAYING"))
                .andExpect(jsonPath("$[1].wordId").doesNotExist());
    }

    @Test
    void leaderboardKeepsServiceOrder() throws Exception {
        when(gameService.getGame(5L)).thenReturn(game(5L));
        when(gameService.getLeaderboard(5L)).thenReturn(List.of(
                Player.builder().id(2L).gameId(5L).userId("bob").points(8).build(),
                Player.builder().id(1L).gameId(5L).userId("alice").points(3).build()));

        mockMvc.perform(get("/games/5/leaderboard"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].userId").value("bob"))
                .andExpect(jsonPath("$[1].userId").value("alice"));
    }

    @Test
    void inviteCodeFindsWaitingGame() throws Exception {
        when(gameService.validateShortCode("482913")).thenReturn(game(5L));

        mockMvc.perform(get("/games/invites/482913"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(5))
                .andExpect(jsonPath("$.shortCode").value("482913"));
    }

    @Test
    void expiredInviteIsGone() throws Exception {
        when(gameService.validateShortCode("111111")).thenThrow(new InviteExpiredException("만료된 초대 코드입니다: 111111"));

        mockMvc.perform(get("/games/invites/111111"))
                .andExpect(status().isGone());
    }

    @Test
    void onlyHostCanCancel() throws Exception {
        when(gameService.getGame(5L)).thenReturn(game(5L));

        mockMvc.perform(delete("/games/5").param("hostUserId", "someone"))
                .andExpect(status().isBadRequest());
        verify(gameService, never()).cancelGame(5L);

        mockMvc.perform(delete("/games/5").param("hostUserId", "host"))
                .andExpect(status().isNoContent());
        verify(gameService).cancelGame(5L);
    }

    @Test
    void cancellingStartedGameIsConflict() throws Exception {
        when(gameService.getGame(5L)).thenReturn(game(5L));
        doThrow(new IllegalStateException("대기 중인 게임만 취소할 수 있습니다: GAME_RUNNING"))
                .when(gameService).cancelGame(5L);

        mockMvc.perform(delete("/games/5").param("hostUserId", "host"))
                .andExpect(status().isConflict());
    }

    @Test
    void restartCreatesMonitoredGame() throws Exception {
        when(gameService.restartGame(5L)).thenReturn(game(6L));

        mockMvc.perform(post("/games/5/restart"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(6));

        verify(presenceMonitor).monitorGameHost(6L);
    }

    @Test
    void diagnosticsReportsRegistryAndMonitor() throws Exception {
        when(gameService.countActiveGames()).thenReturn(3L);
        when(gameServerRegistry.size()).thenReturn(2);
        when(presenceMonitor.getMonitoredGames()).thenReturn(Set.of(1L, 2L, 3L));

        mockMvc.perform(get("/games/diagnostics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeGames").value(3))
                .andExpect(jsonPath("$.runningServers").value(2))
                .andExpect(jsonPath("$.monitoredHosts").value(3));
    }

    @Test
    void serverStateOfStoppedGameIsNotFound() throws Exception {
        when(gameServerRegistry.getState(5L)).thenReturn(Optional.empty());

        mockMvc.perform(get("/games/5/server-state"))
                .andExpect(status().isNotFound());
    }

    private static Round round(Long id, int position, RoundState state) {
        return Round.builder()
                .id(id)
                .gameId(5L)
                .wordId(7L)
                .position(position)
                .state(state)
                .build();
    }

    private static Game game(Long id) {
        return Game.builder()
                .id(id)
                .hostUserId("host")
                .roundsCount(3)
                .cluesInterval(10)
                .gridSize(9)
                .state(GameStatus.WAITING_FOR_PLAYERS)
                .build();
    }
}

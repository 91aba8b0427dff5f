package com.example.mimimi.Controller;

import com.example.mimimi.DTO.CreateGameDTO;
import com.example.mimimi.DTO.CreatePlayerDTO;
import com.example.mimimi.DTO.GameResponseDTO;
import com.example.mimimi.DTO.PlayerResponseDTO;
import com.example.mimimi.DTO.RoundResponseDTO;
import com.example.mimimi.Domain.GameServerRegistry;
import com.example.mimimi.Domain.GameServerState;
import com.example.mimimi.Domain.GameStatus;
import com.example.mimimi.Entity.Game;
import com.example.mimimi.Entity.Player;
import com.example.mimimi.Entity.Round;
import com.example.mimimi.Handler.GlobalExceptionHandler.GameServerNotRunningException;
import com.example.mimimi.Service.GameService;
import com.example.mimimi.Service.RoundService;
import com.example.mimimi.Socket.PresenceMonitor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
@RequestMapping("/games")
public class GameController {

    private final GameService gameService;
    private final RoundService roundService;
    private final GameServerRegistry gameServerRegistry;
    private final PresenceMonitor presenceMonitor;

    @PostMapping
    public ResponseEntity<GameResponseDTO> createGame(@RequestBody CreateGameDTO dto) {
        Game game = gameService.createGame(dto);
        presenceMonitor.monitorGameHost(game.getId());
        GameResponseDTO response = new GameResponseDTO(game);
        response.setShortCode(gameService.getShortCodeForGame(game.getId()).orElse(null));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{gameId}")
    public ResponseEntity<GameResponseDTO> getGame(@PathVariable Long gameId) {
        Game game = gameService.getGame(gameId);
        GameResponseDTO response = new GameResponseDTO(game);
        for (Player player : gameService.getPlayers(gameId)) {
            response.getPlayers().add(new PlayerResponseDTO(player));
        }

        if (game.getState() == GameStatus.WAITING_FOR_PLAYERS) {
            response.setShortCode(gameService.getShortCodeForGame(gameId).orElse(null));
        }
        roundService.getCurrentRound(gameId).ifPresent(round -> {
            response.setCurrentRoundId(round.getId());
            response.setCurrentRoundPosition(round.getPosition());
        });
        response.setTimerRunning(gameServerRegistry.isRunning(gameId));
        return ResponseEntity.ok(response);
    }

    // 초대 코드로 입장할 게임 찾기
    @GetMapping("/invites/{shortCode}")
    public ResponseEntity<GameResponseDTO> findByShortCode(@PathVariable String shortCode) {
        GameResponseDTO response = new GameResponseDTO(gameService.validateShortCode(shortCode));
        response.setShortCode(shortCode);
        return ResponseEntity.ok(response);
    }

    // 시작 전 취소 (호스트만)
    @DeleteMapping("/{gameId}")
    public ResponseEntity<Void> cancelGame(@PathVariable Long gameId, @RequestParam String hostUserId) {
        requireHost(gameId, hostUserId);
        gameService.cancelGame(gameId);
        return ResponseEntity.noContent().build();
    }

    // 같은 설정으로 새 게임
    @PostMapping("/{gameId}/restart")
    public ResponseEntity<GameResponseDTO> restartGame(@PathVariable Long gameId) {
        Game game = gameService.restartGame(gameId);
        presenceMonitor.monitorGameHost(game.getId());
        GameResponseDTO response = new GameResponseDTO(game);
        response.setShortCode(gameService.getShortCodeForGame(game.getId()).orElse(null));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{gameId}/leaderboard")
    public ResponseEntity<List<PlayerResponseDTO>> leaderboard(@PathVariable Long gameId) {
        gameService.getGame(gameId);
        List<PlayerResponseDTO> response = new ArrayList<>();
        for (Player player : gameService.getLeaderboard(gameId)) {
            response.add(new PlayerResponseDTO(player));
        }
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{gameId}/rounds")
    public ResponseEntity<List<RoundResponseDTO>> rounds(@PathVariable Long gameId) {
        gameService.getGame(gameId);
        List<RoundResponseDTO> response = new ArrayList<>();
        for (Round round : roundService.getRounds(gameId)) {
            response.add(new RoundResponseDTO(round));
        }
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{gameId}/players")
    public ResponseEntity<PlayerResponseDTO> joinGame(@PathVariable Long gameId, @RequestBody CreatePlayerDTO dto) {
        Player player = gameService.createPlayer(gameId, dto);
        return ResponseEntity.status(HttpStatus.CREATED).body(new PlayerResponseDTO(player));
    }

    // 타이머 상태 (진단용)
    @GetMapping("/{gameId}/server-state")
    public ResponseEntity<GameServerState> getServerState(@PathVariable Long gameId) {
        GameServerState state = gameServerRegistry.getState(gameId)
                .orElseThrow(() -> new GameServerNotRunningException("게임 서버가 실행 중이 아닙니다: " + gameId));
        return ResponseEntity.ok(state);
    }

    @GetMapping("/active-count")
    public ResponseEntity<Map<String, Object>> activeCount() {
        return ResponseEntity.ok(Map.of("activeGames", gameService.countActiveGames()));
    }

    // 운영 확인용: 진행 중 게임 수, 살아 있는 게임 서버 수, 호스트 감시 중인 게임 수
    @GetMapping("/diagnostics")
    public ResponseEntity<Map<String, Object>> diagnostics() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("activeGames", gameService.countActiveGames());
        body.put("runningServers", gameServerRegistry.size());
        body.put("monitoredHosts", presenceMonitor.getMonitoredGames().size());
        return ResponseEntity.ok(body);
    }

    private void requireHost(Long gameId, String userId) {
        Game game = gameService.getGame(gameId);
        if (userId == null || !game.getHostUserId().equals(userId)) {
            throw new IllegalArgumentException("호스트만 할 수 있는 요청입니다.");
        }
    }
}

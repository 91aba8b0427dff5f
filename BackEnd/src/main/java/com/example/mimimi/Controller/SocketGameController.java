package com.example.mimimi.Controller;

import com.example.mimimi.DTO.PickRequestDTO;
import com.example.mimimi.DTO.PickResultDTO;
import com.example.mimimi.DTO.SocketJoinDTO;
import com.example.mimimi.Domain.PickResult;
import com.example.mimimi.Entity.Game;
import com.example.mimimi.Entity.Player;
import com.example.mimimi.Service.GameFlowService;
import com.example.mimimi.Service.GameService;
import com.example.mimimi.Socket.GamePresence;
import com.example.mimimi.Socket.GameTopics;
import com.example.mimimi.Socket.PresenceMonitor;
import com.example.mimimi.Socket.WaitingRoomListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Controller
@RequiredArgsConstructor
public class SocketGameController {

    public static final String HOST_PRESENCE_KEY = "host";

    private final GameService gameService;
    private final GameFlowService gameFlowService;
    private final GamePresence gamePresence;
    private final PresenceMonitor presenceMonitor;
    private final WaitingRoomListener waitingRoomListener;

    /* =========================
       호스트 화면 입장
    ========================= */
    @MessageMapping("/game/{gameId}/host/join")
    public void hostJoin(@DestinationVariable Long gameId, @Payload SocketJoinDTO dto, StompHeaderAccessor accessor) {
        requireHost(gameId, dto);

        gamePresence.track(GameTopics.host(gameId), HOST_PRESENCE_KEY, accessor.getSessionId());
        presenceMonitor.monitorGameHost(gameId);
    }

    /* =========================
       플레이어 화면 입장
    ========================= */
    @MessageMapping("/game/{gameId}/join")
    public void join(@DestinationVariable Long gameId, @Payload SocketJoinDTO dto, StompHeaderAccessor accessor) {
        Player player = gameService.getPlayer(gameId, dto.getUserId());
        gamePresence.track(GameTopics.players(gameId), WaitingRoomListener.playerKey(player.getUserId()), accessor.getSessionId());
        waitingRoomListener.watch(gameId);
    }

    @MessageMapping("/game/{gameId}/start")
    public void start(@DestinationVariable Long gameId, @Payload SocketJoinDTO dto) {
        requireHost(gameId, dto);
        gameFlowService.startGame(gameId);
    }

    @MessageMapping("/game/{gameId}/pick")
    @SendToUser("/queue/pick")
    public PickResultDTO pick(@DestinationVariable Long gameId, @Payload PickRequestDTO dto) {
        PickResult result = gameFlowService.submitPick(gameId, dto.getUserId(), dto.getWordId(), dto.getTime());
        return new PickResultDTO(result);
    }

    @MessageMapping("/game/{gameId}/next")
    public void next(@DestinationVariable Long gameId, @Payload SocketJoinDTO dto) {
        requireHost(gameId, dto);
        gameFlowService.advanceCurrentRound(gameId);
    }

    @MessageMapping("/game/{gameId}/stop")
    public void stop(@DestinationVariable Long gameId, @Payload SocketJoinDTO dto) {
        requireHost(gameId, dto);
        gameFlowService.stopGame(gameId);
    }

    // 시작 전 취소
    @MessageMapping("/game/{gameId}/cancel")
    public void cancel(@DestinationVariable Long gameId, @Payload SocketJoinDTO dto) {
        requireHost(gameId, dto);
        gameService.cancelGame(gameId);
    }

    /* =========================
       한 판 더 (지금 접속해 있는 플레이어만 데려간다)
    ========================= */
    @MessageMapping("/game/{gameId}/play-again")
    public void playAgain(@DestinationVariable Long gameId, @Payload SocketJoinDTO dto) {
        requireHost(gameId, dto);

        Set<String> onlineUserIds = gamePresence.list(GameTopics.players(gameId)).keySet().stream()
                .map(WaitingRoomListener::userIdOf)
                .filter(userId -> userId != null)
                .collect(Collectors.toSet());

        Game created = gameService.createNewGameWithPlayers(gameId, onlineUserIds);
        presenceMonitor.monitorGameHost(created.getId());
    }

    /* =========================
       에러는 보낸 사람에게만
    ========================= */
    @MessageExceptionHandler
    @SendToUser("/queue/errors")
    public Map<String, Object> handleError(RuntimeException e) {
        log.warn("[SocketGame] 요청 처리 실패: {}", e.getMessage());
        return Map.of(
                "type", "ERROR",
                "error", e.getClass().getSimpleName(),
                "message", String.valueOf(e.getMessage())
        );
    }

    private void requireHost(Long gameId, SocketJoinDTO dto) {
        Game game = gameService.getGame(gameId);
        if (dto.getUserId() == null || !game.getHostUserId().equals(dto.getUserId())) {
            throw new IllegalArgumentException("호스트만 할 수 있는 요청입니다.");
        }
    }
}

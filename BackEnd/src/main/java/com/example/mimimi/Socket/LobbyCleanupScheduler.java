package com.example.mimimi.Socket;

import com.example.mimimi.Service.GameService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class LobbyCleanupScheduler {

    private final GameService gameService;

    // 시작하지 않고 오래 대기 중인 게임 정리
    @Scheduled(fixedDelayString = "${mimimi.lobby.cleanup-interval:PT5M}",
            initialDelayString = "${mimimi.lobby.cleanup-interval:PT5M}")
    public void timeoutIdleLobbies() {
        int count = gameService.timeoutLobbies();
        if (count > 0) {
            log.info("[LobbyCleanup] 타임아웃 처리한 로비 {}개", count);
        }
    }
}

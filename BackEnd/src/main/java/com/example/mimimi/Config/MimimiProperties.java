package com.example.mimimi.Config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * application.properties 의 mimimi.* 설정값.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "mimimi")
public class MimimiProperties {

    private final GameServer gameServer = new GameServer();
    private final Presence presence = new Presence();
    private final Round round = new Round();
    private final Lobby lobby = new Lobby();
    private final Invite invite = new Invite();

    @Getter
    @Setter
    public static class GameServer {
        // 키워드 공개 타이머의 틱 간격
        private Duration tickPeriod = Duration.ofSeconds(1);
    }

    @Getter
    @Setter
    public static class Presence {
        // 호스트 leave 이후 재확인까지 기다리는 시간 (새로고침/페이지 이동 흡수)
        private Duration hostDisconnectDebounce = Duration.ofSeconds(2);
    }

    @Getter
    @Setter
    public static class Round {
        // 전원 선택 후 다음 라운드로 넘어가기 전 결과 표시 시간
        private Duration resultsDelay = Duration.ofSeconds(3);
        private int keywordsPerRound = 5;
    }

    @Getter
    @Setter
    public static class Lobby {
        private Duration timeout = Duration.ofMinutes(15);
        private Duration cleanupInterval = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Invite {
        // 6자리 초대 코드 유효 시간
        private Duration expiration = Duration.ofMinutes(15);
    }
}

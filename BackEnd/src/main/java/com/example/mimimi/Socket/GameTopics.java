package com.example.mimimi.Socket;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/*
    토픽 이름 = STOMP destination
*/
public final class GameTopics {

    public static final String ACTIVE_GAMES = "/topic/games";

    private static final Pattern GAME_TOPIC = Pattern.compile("^/topic/game/(\\d+)(/[a-z]+)?$");
    private static final Pattern HOST_TOPIC = Pattern.compile("^/topic/game/(\\d+)/host$");

    private GameTopics() {
    }

    public static String game(Long gameId) {
        return "/topic/game/" + gameId;
    }

    public static String host(Long gameId) {
        return game(gameId) + "/host";
    }

    public static String players(Long gameId) {
        return game(gameId) + "/players";
    }

    // "/topic/game/42", "/topic/game/42/players" -> 42, 게임 토픽이 아니면 null
    public static Long gameIdOf(String topic) {
        if (topic == null) return null;
        Matcher m = GAME_TOPIC.matcher(topic);
        return m.matches() ? Long.valueOf(m.group(1)) : null;
    }

    // "/topic/game/42/host" -> 42, 호스트 토픽이 아니면 null
    public static Long gameIdOfHostTopic(String topic) {
        if (topic == null) return null;
        Matcher m = HOST_TOPIC.matcher(topic);
        return m.matches() ? Long.valueOf(m.group(1)) : null;
    }
}

package com.example.mimimi.Socket;

import com.example.mimimi.Domain.GameEvent;

@FunctionalInterface
public interface GameEventListener {

    void onEvent(String topic, GameEvent event);
}

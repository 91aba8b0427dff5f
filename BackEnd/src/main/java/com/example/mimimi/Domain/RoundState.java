package com.example.mimimi.Domain;

public enum RoundState {
    ON_HOLD,
    PLAYING,
    FINISHED
}

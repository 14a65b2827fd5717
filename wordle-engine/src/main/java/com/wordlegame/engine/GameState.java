package com.wordlegame.engine;

public enum GameState {
    PLAYING("playing"),
    WON("won"),
    LOST("lost");

    private final String wireName;

    GameState(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isFinished() {
        return this != PLAYING;
    }
}

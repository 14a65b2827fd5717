package com.wordlegame.engine;

import java.util.Locale;

/**
 * The three ways a session can pick and evaluate its answer.
 */
public enum GameMode {
    /**
     * One answer committed at start.
     */
    NORMAL("normal"),

    /**
     * The host keeps a candidate pool and narrows it adversarially.
     */
    CHEAT("cheat"),

    /**
     * One answer per UTC day, shared by every player.
     */
    DAILY("daily");

    private final String wireName;

    GameMode(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static GameMode fromWireName(String name) {
        if (name == null) {
            return NORMAL;
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        for (GameMode mode : values()) {
            if (mode.wireName.equals(key)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown game mode: " + name);
    }
}

package com.wordlegame.engine;

/**
 * Evaluation of a single letter of a guess.
 */
public enum Mark {
    /**
     * Right letter, right position.
     */
    HIT("hit", 2),

    /**
     * Letter occurs in the unmatched part of the answer, elsewhere.
     */
    PRESENT("present", 1),

    /**
     * Letter does not occur in the unmatched part of the answer.
     */
    MISS("miss", 0);

    private final String wireName;
    private final int informativeness;

    Mark(String wireName, int informativeness) {
        this.wireName = wireName;
        this.informativeness = informativeness;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Whether this mark tells the player more about a letter than {@code other}.
     * Only used for keyboard hints, never for scoring.
     */
    public boolean isMoreInformativeThan(Mark other) {
        return other == null || informativeness > other.informativeness;
    }
}

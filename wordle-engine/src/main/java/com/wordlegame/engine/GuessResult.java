package com.wordlegame.engine;

/**
 * Outcome of one accepted guess.
 */
public class GuessResult {

    private final String guess;
    private final MarkSequence marks;
    private final int round;
    private final GameState state;

    public GuessResult(String guess, MarkSequence marks, int round, GameState state) {
        this.guess = guess;
        this.marks = marks;
        this.round = round;
        this.state = state;
    }

    public String getGuess() {
        return guess;
    }

    public MarkSequence getMarks() {
        return marks;
    }

    public int getRound() {
        return round;
    }

    public GameState getState() {
        return state;
    }

    @Override
    public String toString() {
        return guess + " " + marks + " (round " + round + ", " + state.getWireName() + ")";
    }
}

package com.wordlegame.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One play-through. Rounds are bounded; the session is won on an all-hit guess and lost when
 * the rounds run out. The mode only decides how a guess is evaluated.
 *
 * <p>Not thread-safe: guesses for one session must be applied one at a time.
 */
public class GameSession {

    public static final int MIN_ROUNDS = 1;
    public static final int MAX_ROUNDS = 10;
    public static final int DEFAULT_ROUNDS = 6;

    private final String id;
    private final GameMode mode;
    private final int maxRounds;
    private final WordDictionary dictionary;
    private final GuessEvaluator evaluator;
    private final boolean enforceDictionary;

    private final List<GuessResult> history = new ArrayList<>();
    private final Map<Character, Mark> keyboard = new TreeMap<>();
    private int round;
    private GameState state = GameState.PLAYING;

    public GameSession(String id, GameMode mode, int maxRounds, WordDictionary dictionary,
                       GuessEvaluator evaluator, boolean enforceDictionary) {
        if (maxRounds < MIN_ROUNDS || maxRounds > MAX_ROUNDS) {
            throw new IllegalArgumentException(
                    "maxRounds must be between " + MIN_ROUNDS + " and " + MAX_ROUNDS + ": " + maxRounds);
        }
        this.id = id;
        this.mode = mode;
        this.maxRounds = maxRounds;
        this.dictionary = dictionary;
        this.evaluator = evaluator;
        this.enforceDictionary = enforceDictionary;
    }

    /**
     * Validate, evaluate and record one guess.
     *
     * @throws InvalidGuessException    malformed guess; no round consumed
     * @throws WordNotAllowedException  guess not in the dictionary; no round consumed
     * @throws SessionFinishedException the session is already won or lost
     */
    public GuessResult submitGuess(String raw) {
        String guess;
        try {
            guess = WordFormat.normalize(raw, dictionary.getWordLength());
        } catch (InvalidWordFormatException e) {
            throw new InvalidGuessException(e.getMessage(), e);
        }
        if (enforceDictionary && !dictionary.isAllowed(guess)) {
            throw new WordNotAllowedException(guess);
        }
        if (state.isFinished()) {
            throw new SessionFinishedException(id);
        }

        round++;
        MarkSequence marks = evaluator.evaluate(guess);

        if (marks.isAllHit()) {
            state = GameState.WON;
        } else if (round >= maxRounds) {
            state = GameState.LOST;
        }

        recordHints(guess, marks);
        GuessResult result = new GuessResult(guess, marks, round, state);
        history.add(result);
        return result;
    }

    private void recordHints(String guess, MarkSequence marks) {
        for (int i = 0; i < guess.length(); i++) {
            char letter = guess.charAt(i);
            Mark mark = marks.get(i);
            if (mark.isMoreInformativeThan(keyboard.get(letter))) {
                keyboard.put(letter, mark);
            }
        }
    }

    public String getId() {
        return id;
    }

    public GameMode getMode() {
        return mode;
    }

    public int getMaxRounds() {
        return maxRounds;
    }

    public int getRound() {
        return round;
    }

    public GameState getState() {
        return state;
    }

    public GuessEvaluator getEvaluator() {
        return evaluator;
    }

    public List<GuessResult> getHistory() {
        return Collections.unmodifiableList(history);
    }

    /**
     * Most informative mark seen so far for each guessed letter.
     */
    public Map<Character, Mark> getKeyboard() {
        return Collections.unmodifiableMap(keyboard);
    }
}

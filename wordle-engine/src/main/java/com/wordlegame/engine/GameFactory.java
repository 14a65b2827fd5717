package com.wordlegame.engine;

import java.security.SecureRandom;
import java.time.LocalDate;
import java.util.HexFormat;

/**
 * Builds sessions of every mode over one shared dictionary.
 */
public class GameFactory {

    private final WordDictionary dictionary;
    private final GuessScorer scorer;
    private final HostSelectionPolicy hostPolicy;
    private final AnswerPicker answerPicker;
    private final String dailySalt;
    private final boolean cheatAcceptsAnyGuess;
    private final SecureRandom idSource = new SecureRandom();

    public GameFactory(WordDictionary dictionary, HostSelectionPolicy hostPolicy, AnswerPicker answerPicker,
                       String dailySalt, boolean cheatAcceptsAnyGuess) {
        this.dictionary = dictionary;
        this.scorer = new GuessScorer(dictionary.getWordLength());
        this.hostPolicy = hostPolicy;
        this.answerPicker = answerPicker;
        this.dailySalt = dailySalt;
        this.cheatAcceptsAnyGuess = cheatAcceptsAnyGuess;
    }

    public WordDictionary getDictionary() {
        return dictionary;
    }

    /**
     * A normal game with a random answer, or a seeded one when {@code seed} is set.
     */
    public GameSession newNormalGame(int maxRounds, String seed) {
        String answer = answerPicker.pick(dictionary, seed);
        return new GameSession(newSessionId(), GameMode.NORMAL, maxRounds, dictionary,
                new FixedAnswerEvaluator(scorer, answer), true);
    }

    /**
     * A cheating-host game whose pool starts as the whole answer list.
     */
    public GameSession newCheatGame(int maxRounds) {
        return new GameSession(newSessionId(), GameMode.CHEAT, maxRounds, dictionary,
                new CheatingHostEvaluator(scorer, hostPolicy, dictionary.getAnswers()), !cheatAcceptsAnyGuess);
    }

    public GameSession newDailyGame(int maxRounds, DailyPuzzle puzzle) {
        return new GameSession(newSessionId(), GameMode.DAILY, maxRounds, dictionary,
                new FixedAnswerEvaluator(scorer, puzzle.getAnswer()), true);
    }

    public DailyPuzzle dailyPuzzle(LocalDate date) {
        int index = DailySeed.wordIndex(date, dailySalt, dictionary.answerCount());
        return new DailyPuzzle(date, index, dictionary.answerAt(index));
    }

    private String newSessionId() {
        byte[] bytes = new byte[8];
        idSource.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}

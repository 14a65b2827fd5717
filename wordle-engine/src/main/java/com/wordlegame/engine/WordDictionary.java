package com.wordlegame.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The word lists a game is played with: an ordered answer list and the set of allowed
 * guesses, which always includes every answer. Built once and shared by all sessions.
 */
public class WordDictionary {

    private final int wordLength;
    private final List<String> answers;
    private final Set<String> allowed;
    private final boolean acceptAnyGuess;

    private WordDictionary(int wordLength, List<String> answers, Set<String> allowed, boolean acceptAnyGuess) {
        this.wordLength = wordLength;
        this.answers = answers;
        this.allowed = allowed;
        this.acceptAnyGuess = acceptAnyGuess;
    }

    /**
     * @param answers      candidate answers, in the order daily indices refer to
     * @param allowedGuesses extra allowed guesses, or {@code null} to accept any well-formed guess
     * @throws IllegalArgumentException if there are no answers
     * @throws InvalidWordFormatException if a word is malformed
     */
    public static WordDictionary of(Collection<String> answers, Collection<String> allowedGuesses) {
        return of(WordFormat.DEFAULT_LENGTH, answers, allowedGuesses);
    }

    public static WordDictionary of(int wordLength, Collection<String> answers, Collection<String> allowedGuesses) {
        Set<String> answerSet = new LinkedHashSet<>();
        for (String word : answers) {
            answerSet.add(WordFormat.normalize(word, wordLength));
        }
        if (answerSet.isEmpty()) {
            throw new IllegalArgumentException("Answer list is empty");
        }

        Set<String> allowed = new LinkedHashSet<>(answerSet);
        if (allowedGuesses != null) {
            for (String word : allowedGuesses) {
                allowed.add(WordFormat.normalize(word, wordLength));
            }
        }

        return new WordDictionary(wordLength,
                Collections.unmodifiableList(new ArrayList<>(answerSet)),
                Collections.unmodifiableSet(allowed),
                allowedGuesses == null);
    }

    public int getWordLength() {
        return wordLength;
    }

    public List<String> getAnswers() {
        return answers;
    }

    public String answerAt(int index) {
        return answers.get(index);
    }

    public int answerCount() {
        return answers.size();
    }

    public int allowedCount() {
        return allowed.size();
    }

    public boolean isAcceptAnyGuess() {
        return acceptAnyGuess;
    }

    /**
     * Whether a normalized word may be guessed.
     */
    public boolean isAllowed(String word) {
        return acceptAnyGuess ? WordFormat.isValid(word, wordLength) : allowed.contains(word);
    }

    public boolean isAnswer(String word) {
        return answers.contains(word);
    }
}

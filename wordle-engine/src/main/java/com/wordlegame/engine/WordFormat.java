package com.wordlegame.engine;

import java.util.Locale;

/**
 * Shape rules for words: fixed length, letters a-z, lower case.
 */
public final class WordFormat {

    public static final int DEFAULT_LENGTH = 5;

    private WordFormat() {
    }

    /**
     * Trim and lower-case {@code raw}, then check its shape.
     *
     * @throws InvalidWordFormatException if the result is not {@code length} letters a-z
     */
    public static String normalize(String raw, int length) {
        if (raw == null) {
            throw new InvalidWordFormatException("Word must not be null");
        }
        String word = raw.trim().toLowerCase(Locale.ROOT);
        if (word.length() != length) {
            throw new InvalidWordFormatException(
                    "Word must be " + length + " letters: '" + raw + "'");
        }
        if (!isAlphabetic(word)) {
            throw new InvalidWordFormatException("Only a-z letters allowed: '" + raw + "'");
        }
        return word;
    }

    /**
     * Whether {@code word} is already normalized and {@code length} letters long.
     */
    public static boolean isValid(String word, int length) {
        return word != null && word.length() == length && isAlphabetic(word);
    }

    private static boolean isAlphabetic(String word) {
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (c < 'a' || c > 'z') {
                return false;
            }
        }
        return true;
    }
}

package com.wordlegame.engine;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Chooses the committed answer of a normal game.
 */
public class AnswerPicker {

    private static final int FNV_OFFSET_BASIS = 0x811c9dc5;
    private static final int FNV_PRIME = 16777619;

    private final Random random;

    public AnswerPicker() {
        this(new SecureRandom());
    }

    public AnswerPicker(Random random) {
        this.random = random;
    }

    /**
     * A uniformly random answer, or a deterministic one when {@code seed} is given.
     */
    public String pick(WordDictionary dictionary, String seed) {
        int count = dictionary.answerCount();
        if (seed == null || seed.isEmpty()) {
            return dictionary.answerAt(random.nextInt(count));
        }
        return dictionary.answerAt(seededIndex(seed, count));
    }

    /**
     * 32-bit FNV-1a over the seed's UTF-16 units, absolute value modulo {@code count}.
     */
    static int seededIndex(String seed, int count) {
        int hash = FNV_OFFSET_BASIS;
        for (int i = 0; i < seed.length(); i++) {
            hash ^= seed.charAt(i);
            hash *= FNV_PRIME;
        }
        return (int) (Math.abs((long) hash) % count);
    }
}

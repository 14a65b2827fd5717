package com.wordlegame.engine;

/**
 * Scores a guess against an answer with the two-pass duplicate-aware rules.
 */
public class GuessScorer {

    private final int wordLength;

    public GuessScorer() {
        this(WordFormat.DEFAULT_LENGTH);
    }

    public GuessScorer(int wordLength) {
        if (wordLength <= 0) {
            throw new IllegalArgumentException("Word length must be positive");
        }
        this.wordLength = wordLength;
    }

    public int getWordLength() {
        return wordLength;
    }

    /**
     * Score {@code guess} against {@code answer}.
     *
     * <p>Pass one marks exact matches and counts the answer letters left unmatched.
     * Pass two walks the remaining guess positions left to right, crediting a letter as
     * present only while unmatched copies of it are left, so a repeated guess letter never
     * earns more credit than the answer has occurrences.
     *
     * @throws InvalidWordFormatException if either word has the wrong length or alphabet
     */
    public MarkSequence score(String answer, String guess) {
        String a = WordFormat.normalize(answer, wordLength);
        String g = WordFormat.normalize(guess, wordLength);

        Mark[] marks = new Mark[wordLength];
        int[] remaining = new int[26];

        for (int i = 0; i < wordLength; i++) {
            if (g.charAt(i) == a.charAt(i)) {
                marks[i] = Mark.HIT;
            } else {
                remaining[a.charAt(i) - 'a']++;
            }
        }

        for (int i = 0; i < wordLength; i++) {
            if (marks[i] == Mark.HIT) {
                continue;
            }
            int letter = g.charAt(i) - 'a';
            if (remaining[letter] > 0) {
                marks[i] = Mark.PRESENT;
                remaining[letter]--;
            } else {
                marks[i] = Mark.MISS;
            }
        }

        return MarkSequence.of(marks);
    }
}

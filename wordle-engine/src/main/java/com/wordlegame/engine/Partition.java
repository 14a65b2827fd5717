package com.wordlegame.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The buckets a guess splits a candidate pool into, in the order each pattern was first seen.
 */
public class Partition {

    private final String guess;
    private final int wordLength;
    private final List<Bucket> buckets;

    public Partition(String guess, int wordLength, List<Bucket> buckets) {
        this.guess = guess;
        this.wordLength = wordLength;
        this.buckets = Collections.unmodifiableList(new ArrayList<>(buckets));
    }

    public String getGuess() {
        return guess;
    }

    public int getWordLength() {
        return wordLength;
    }

    public List<Bucket> getBuckets() {
        return buckets;
    }

    public boolean isEmpty() {
        return buckets.isEmpty();
    }

    public int candidateCount() {
        return buckets.stream().mapToInt(Bucket::size).sum();
    }

    /**
     * Candidates that would all produce the same marks for the guess.
     */
    public static class Bucket {
        private final MarkSequence marks;
        private final List<String> words;

        public Bucket(MarkSequence marks, List<String> words) {
            this.marks = marks;
            this.words = Collections.unmodifiableList(new ArrayList<>(words));
        }

        /**
         * Bucket returned when no candidates remain: all misses, no words.
         */
        public static Bucket exhausted(int wordLength) {
            return new Bucket(MarkSequence.allMiss(wordLength), List.of());
        }

        public MarkSequence getMarks() {
            return marks;
        }

        public List<String> getWords() {
            return words;
        }

        public int size() {
            return words.size();
        }

        @Override
        public String toString() {
            return marks + " " + words;
        }
    }
}

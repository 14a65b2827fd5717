package com.wordlegame.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups a candidate pool by the marks a guess would receive if each candidate were the answer.
 */
public class CandidatePartitioner {

    private final GuessScorer scorer;

    public CandidatePartitioner(GuessScorer scorer) {
        this.scorer = scorer;
    }

    /**
     * Every candidate lands in exactly one bucket. The pool is not modified.
     *
     * @throws InvalidWordFormatException if the guess or a candidate is malformed
     */
    public Partition partition(Collection<String> pool, String guess) {
        Map<MarkSequence, List<String>> grouped = new LinkedHashMap<>();
        for (String candidate : pool) {
            MarkSequence marks = scorer.score(candidate, guess);
            grouped.computeIfAbsent(marks, k -> new ArrayList<>()).add(candidate);
        }

        List<Partition.Bucket> buckets = new ArrayList<>(grouped.size());
        grouped.forEach((marks, words) -> buckets.add(new Partition.Bucket(marks, words)));
        return new Partition(guess, scorer.getWordLength(), buckets);
    }
}

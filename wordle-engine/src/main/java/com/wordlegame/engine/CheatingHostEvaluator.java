package com.wordlegame.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Host that never commits to an answer while it can avoid it. Each guess splits the
 * candidate pool by the marks it would earn, and the selection policy picks which group
 * survives. When a single candidate is left it becomes the answer and later guesses are
 * scored against it directly.
 */
public class CheatingHostEvaluator implements GuessEvaluator {

    private final GuessScorer scorer;
    private final CandidatePartitioner partitioner;
    private final HostSelectionPolicy policy;
    private List<String> candidates;
    private String finalizedAnswer;

    public CheatingHostEvaluator(GuessScorer scorer, HostSelectionPolicy policy, Collection<String> pool) {
        this.scorer = scorer;
        this.partitioner = new CandidatePartitioner(scorer);
        this.policy = policy;
        this.candidates = new ArrayList<>(pool);
        if (candidates.size() == 1) {
            finalizedAnswer = candidates.get(0);
        }
    }

    @Override
    public MarkSequence evaluate(String guess) {
        if (finalizedAnswer != null) {
            return scorer.score(finalizedAnswer, guess);
        }

        Partition.Bucket chosen = policy.select(partitioner.partition(candidates, guess));
        candidates = new ArrayList<>(chosen.getWords());
        if (candidates.size() == 1) {
            finalizedAnswer = candidates.get(0);
        }
        return chosen.getMarks();
    }

    public List<String> getCandidates() {
        return Collections.unmodifiableList(candidates);
    }

    public Optional<String> getFinalizedAnswer() {
        return Optional.ofNullable(finalizedAnswer);
    }

    /**
     * Whether the pool ran dry; the session then plays out its remaining rounds as misses.
     */
    public boolean isExhausted() {
        return candidates.isEmpty();
    }
}

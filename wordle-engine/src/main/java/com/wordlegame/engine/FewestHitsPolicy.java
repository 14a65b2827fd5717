package com.wordlegame.engine;

import java.util.Comparator;

/**
 * Reveals as little as possible: fewest hits, then fewest presents.
 * Ties keep the bucket that appeared first in the partition.
 */
public class FewestHitsPolicy implements HostSelectionPolicy {

    private static final Comparator<Partition.Bucket> LEAST_REVEALING =
            Comparator.<Partition.Bucket>comparingInt(b -> b.getMarks().getHits())
                    .thenComparingInt(b -> b.getMarks().getPresents());

    @Override
    public Partition.Bucket select(Partition partition) {
        Partition.Bucket best = null;
        for (Partition.Bucket bucket : partition.getBuckets()) {
            if (best == null || LEAST_REVEALING.compare(bucket, best) < 0) {
                best = bucket;
            }
        }
        return best != null ? best : Partition.Bucket.exhausted(partition.getWordLength());
    }
}

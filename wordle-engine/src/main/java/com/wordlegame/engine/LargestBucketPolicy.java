package com.wordlegame.engine;

/**
 * Keeps the most candidates alive, regardless of how many hits the bucket's marks show.
 * Ties keep the bucket that appeared first in the partition.
 */
public class LargestBucketPolicy implements HostSelectionPolicy {

    @Override
    public Partition.Bucket select(Partition partition) {
        Partition.Bucket best = null;
        for (Partition.Bucket bucket : partition.getBuckets()) {
            if (best == null || bucket.size() > best.size()) {
                best = bucket;
            }
        }
        return best != null ? best : Partition.Bucket.exhausted(partition.getWordLength());
    }
}

package com.wordlegame.engine;

import java.util.Locale;

/**
 * Decides which bucket of a partition becomes the cheating host's new candidate pool.
 * Implementations never fail on an empty partition; they return
 * {@link Partition.Bucket#exhausted(int)} instead.
 */
public interface HostSelectionPolicy {

    Partition.Bucket select(Partition partition);

    /**
     * Look up a policy by its configuration name: {@code fewest-hits} or {@code largest-bucket}.
     */
    static HostSelectionPolicy forName(String name) {
        String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case "", "fewest-hits" -> new FewestHitsPolicy();
            case "largest-bucket" -> new LargestBucketPolicy();
            default -> throw new IllegalArgumentException("Unknown host selection policy: " + name);
        };
    }
}

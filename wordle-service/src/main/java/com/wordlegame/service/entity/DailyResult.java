package com.wordlegame.service.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A player's winning daily game; at most one per player per day.
 */
@Entity
@Table(name = "daily_results",
        uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "play_date"}),
        indexes = @Index(name = "idx_daily_results_date_time", columnList = "play_date, elapsed_ms"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "play_date", nullable = false, length = 10)
    private String date; // YYYY-MM-DD, UTC

    @Column(name = "word_index", nullable = false)
    private int wordIndex;

    @Column(name = "guesses", nullable = false)
    private int guesses;

    @Column(name = "elapsed_ms", nullable = false)
    private long elapsedMs;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}

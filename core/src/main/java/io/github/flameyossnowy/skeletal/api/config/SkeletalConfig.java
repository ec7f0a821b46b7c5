package io.github.flameyossnowy.skeletal.api.config;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.Objects;

/**
 * Runtime configuration for the storage engine.
 *
 * @param batchSize              relation edges processed per background task invocation, 5 to 100
 * @param changeListThreshold    below this many changed bones, one propagation task per bone is scheduled
 * @param maxTaskAttempts        attempts before a failing background task is dropped
 * @param retryBackoff           initial delay between task attempts, doubled per attempt
 * @param maxTransactionGroups   entity groups a single transaction may touch
 * @param relationKind           kind holding the relation edges of every relational bone
 * @param blobLockKind           kind holding the per-record blob reference bookkeeping
 */
public record SkeletalConfig(
    int batchSize,
    int changeListThreshold,
    int maxTaskAttempts,
    @NotNull Duration retryBackoff,
    int maxTransactionGroups,
    @NotNull String relationKind,
    @NotNull String blobLockKind
) {
    public static final int MIN_BATCH_SIZE = 5;
    public static final int MAX_BATCH_SIZE = 100;

    public SkeletalConfig {
        if (batchSize < MIN_BATCH_SIZE || batchSize > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException("batchSize must be between " + MIN_BATCH_SIZE + " and " + MAX_BATCH_SIZE + ", got " + batchSize);
        }
        if (changeListThreshold < 1) {
            throw new IllegalArgumentException("changeListThreshold must be positive");
        }
        if (maxTaskAttempts < 1) {
            throw new IllegalArgumentException("maxTaskAttempts must be positive");
        }
        Objects.requireNonNull(retryBackoff, "retryBackoff");
        if (retryBackoff.isNegative()) {
            throw new IllegalArgumentException("retryBackoff must not be negative");
        }
        if (maxTransactionGroups < 1) {
            throw new IllegalArgumentException("maxTransactionGroups must be positive");
        }
        if (relationKind == null || relationKind.isBlank()) {
            throw new IllegalArgumentException("relationKind must not be blank");
        }
        if (blobLockKind == null || blobLockKind.isBlank()) {
            throw new IllegalArgumentException("blobLockKind must not be blank");
        }
    }

    @Contract(" -> new")
    public static @NotNull SkeletalConfig defaults() {
        return builder().build();
    }

    @Contract(" -> new")
    public static @NotNull Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int batchSize = 5;
        private int changeListThreshold = 5;
        private int maxTaskAttempts = 5;
        private Duration retryBackoff = Duration.ofSeconds(10);
        private int maxTransactionGroups = 25;
        private String relationKind = "relations";
        private String blobLockKind = "blob-locks";

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder changeListThreshold(int changeListThreshold) {
            this.changeListThreshold = changeListThreshold;
            return this;
        }

        public Builder maxTaskAttempts(int maxTaskAttempts) {
            this.maxTaskAttempts = maxTaskAttempts;
            return this;
        }

        public Builder retryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
            return this;
        }

        public Builder maxTransactionGroups(int maxTransactionGroups) {
            this.maxTransactionGroups = maxTransactionGroups;
            return this;
        }

        public Builder relationKind(String relationKind) {
            this.relationKind = relationKind;
            return this;
        }

        public Builder blobLockKind(String blobLockKind) {
            this.blobLockKind = blobLockKind;
            return this;
        }

        public SkeletalConfig build() {
            return new SkeletalConfig(batchSize, changeListThreshold, maxTaskAttempts, retryBackoff,
                maxTransactionGroups, relationKind, blobLockKind);
        }
    }
}

/*
 * Copyright 2024 Amazon.com, Inc. or its affiliates.
 * Licensed under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package software.amazon.eventstream.checkpoint;

import java.time.Duration;

import com.google.common.base.Preconditions;

import lombok.Data;
import lombok.NonNull;
import lombok.experimental.Accessors;
import software.amazon.eventstream.processor.CheckpointListener;
import software.amazon.eventstream.processor.CheckpointStore;

/**
 * Used to configure when and how partition checkpoints are written.
 */
@Data
@Accessors(fluent = true)
public class CheckpointConfig {
    /**
     * Largest value accepted for {@link #checkpointMessageCount}.
     */
    public static final int MAX_CHECKPOINT_MESSAGE_COUNT = 0xFFFF;

    @NonNull
    private final CheckpointStore checkpointStore;

    /**
     * Maximum staleness of a persisted position. A partition with unflushed completions is checkpointed once this
     * much time has passed since its last successful write.
     *
     * <p>Default value: 1 minute</p>
     */
    private Duration checkpointInterval = Duration.ofMinutes(1);

    /**
     * Maximum number of completed but unflushed messages per partition.
     *
     * <p>Default value: 1000</p>
     */
    private int checkpointMessageCount = 1000;

    /**
     * How often open partitions are scanned for an elapsed {@link #checkpointInterval}. Never longer than the
     * checkpoint interval itself.
     *
     * <p>Default value: 1 second</p>
     */
    private Duration intervalCheckPeriod = Duration.ofSeconds(1);

    /**
     * Attempts made by a count or interval triggered flush before a checkpoint failure is reported.
     *
     * <p>Default value: 3</p>
     */
    private int flushMaxAttempts = 3;

    /**
     * Delay between flush attempts.
     *
     * <p>Default value: 500 milliseconds</p>
     */
    private Duration flushBackoff = Duration.ofMillis(500L);

    /**
     * Time allowed for a single write to the checkpoint store.
     *
     * <p>Default value: 10 seconds</p>
     */
    private Duration flushTimeout = Duration.ofSeconds(10);

    /**
     * Attempts made to drain a pending checkpoint while a partition is closing.
     *
     * <p>Default value: 1</p>
     */
    private int closeFlushMaxAttempts = 1;

    /**
     * Time allowed for each drain attempt while a partition is closing, and for a flush already in flight to finish
     * before the drain starts. The closing notification is held for at most {@link #closeBudget()}.
     *
     * <p>Default value: 5 seconds</p>
     */
    private Duration closeFlushTimeout = Duration.ofSeconds(5);

    /**
     * Time in-flight flushes are given to finish once shutdown begins.
     *
     * <p>Default value: 10 seconds</p>
     */
    private Duration shutdownGracePeriod = Duration.ofSeconds(10);

    /**
     * Notified of every checkpoint written or given up on.
     *
     * <p>Default value: {@link NoOpCheckpointListener}</p>
     */
    @NonNull
    private CheckpointListener checkpointListener = new NoOpCheckpointListener();

    public CheckpointConfig checkpointInterval(@NonNull Duration checkpointInterval) {
        Preconditions.checkArgument(
                isPositive(checkpointInterval), "checkpointInterval must be positive: %s", checkpointInterval);
        this.checkpointInterval = checkpointInterval;
        return this;
    }

    public CheckpointConfig checkpointMessageCount(int checkpointMessageCount) {
        Preconditions.checkArgument(
                checkpointMessageCount > 0 && checkpointMessageCount <= MAX_CHECKPOINT_MESSAGE_COUNT,
                "checkpointMessageCount must be between 1 and %s: %s",
                MAX_CHECKPOINT_MESSAGE_COUNT,
                checkpointMessageCount);
        this.checkpointMessageCount = checkpointMessageCount;
        return this;
    }

    public CheckpointConfig intervalCheckPeriod(@NonNull Duration intervalCheckPeriod) {
        Preconditions.checkArgument(
                isPositive(intervalCheckPeriod), "intervalCheckPeriod must be positive: %s", intervalCheckPeriod);
        this.intervalCheckPeriod = intervalCheckPeriod;
        return this;
    }

    public CheckpointConfig flushMaxAttempts(int flushMaxAttempts) {
        Preconditions.checkArgument(flushMaxAttempts > 0, "flushMaxAttempts must be positive: %s", flushMaxAttempts);
        this.flushMaxAttempts = flushMaxAttempts;
        return this;
    }

    public CheckpointConfig flushBackoff(@NonNull Duration flushBackoff) {
        Preconditions.checkArgument(!flushBackoff.isNegative(), "flushBackoff must not be negative: %s", flushBackoff);
        this.flushBackoff = flushBackoff;
        return this;
    }

    public CheckpointConfig flushTimeout(@NonNull Duration flushTimeout) {
        Preconditions.checkArgument(isPositive(flushTimeout), "flushTimeout must be positive: %s", flushTimeout);
        this.flushTimeout = flushTimeout;
        return this;
    }

    public CheckpointConfig closeFlushMaxAttempts(int closeFlushMaxAttempts) {
        Preconditions.checkArgument(
                closeFlushMaxAttempts > 0, "closeFlushMaxAttempts must be positive: %s", closeFlushMaxAttempts);
        this.closeFlushMaxAttempts = closeFlushMaxAttempts;
        return this;
    }

    public CheckpointConfig closeFlushTimeout(@NonNull Duration closeFlushTimeout) {
        Preconditions.checkArgument(
                isPositive(closeFlushTimeout), "closeFlushTimeout must be positive: %s", closeFlushTimeout);
        this.closeFlushTimeout = closeFlushTimeout;
        return this;
    }

    public CheckpointConfig shutdownGracePeriod(@NonNull Duration shutdownGracePeriod) {
        Preconditions.checkArgument(
                !shutdownGracePeriod.isNegative(), "shutdownGracePeriod must not be negative: %s", shutdownGracePeriod);
        this.shutdownGracePeriod = shutdownGracePeriod;
        return this;
    }

    /**
     * @return the period actually used by the interval timer
     */
    public Duration effectiveIntervalCheckPeriod() {
        return intervalCheckPeriod.compareTo(checkpointInterval) <= 0 ? intervalCheckPeriod : checkpointInterval;
    }

    /**
     * @return longest time a close drain holds the closing notification: the wait for an in-flight flush, every
     *         drain attempt and the backoff between them
     */
    public Duration closeBudget() {
        return closeFlushTimeout.multipliedBy(closeFlushMaxAttempts + 1L)
                .plus(flushBackoff.multipliedBy(closeFlushMaxAttempts - 1L));
    }

    private static boolean isPositive(Duration duration) {
        return !duration.isNegative() && !duration.isZero();
    }
}

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

import lombok.extern.slf4j.Slf4j;

/**
 * Decides, for a single partition, whether accumulated completions must be written now. The message count is
 * checked on every completion; the interval is only checked from the background timer, which keeps clock reads off
 * the per-message path.
 *
 * <p>Callers must hold the partition's exclusive section.</p>
 */
@Slf4j
class CheckpointBatcher {
    private final int checkpointMessageCount;
    private final long checkpointIntervalMillis;

    CheckpointBatcher(int checkpointMessageCount, long checkpointIntervalMillis) {
        this.checkpointMessageCount = checkpointMessageCount;
        this.checkpointIntervalMillis = checkpointIntervalMillis;
    }

    CheckpointBatcher(CheckpointConfig config) {
        this(config.checkpointMessageCount(), config.checkpointInterval().toMillis());
    }

    /**
     * Records a fully processed message against the partition.
     *
     * @param lock lock of the partition the message was delivered from
     * @param sequenceNumber sequence number of the processed message
     * @return {@link FlushDecision#FLUSH} once the count threshold is reached, {@link FlushDecision#DROPPED} if the
     *         partition is closing, {@link FlushDecision#REJECTED} if the sequence number is behind the pending one
     */
    FlushDecision recordCompletion(PartitionLock lock, long sequenceNumber) {
        if (lock.isClosing()) {
            if (log.isDebugEnabled()) {
                log.debug(
                        "Partition {}: dropping completion at {} received while {}",
                        lock.partitionId(),
                        sequenceNumber,
                        lock.state());
            }
            return FlushDecision.DROPPED;
        }
        final Long pendingPosition = lock.pendingPosition();
        if (pendingPosition != null && sequenceNumber < pendingPosition) {
            log.error(
                    "Partition {}: rejecting completion at {} which is behind the pending position {}."
                            + " Events are being completed out of order.",
                    lock.partitionId(),
                    sequenceNumber,
                    pendingPosition);
            return FlushDecision.REJECTED;
        }

        lock.recordCompletion(sequenceNumber);
        return lock.pendingCount() >= checkpointMessageCount ? FlushDecision.FLUSH : FlushDecision.NONE;
    }

    /**
     * Checks whether completions recorded while a flush was writing have reached the count threshold again.
     *
     * @param lock lock of the partition to check
     * @return {@link FlushDecision#FLUSH} if the partition is open and the threshold is reached
     */
    FlushDecision checkCount(PartitionLock lock) {
        if (lock.isClosing()) {
            return FlushDecision.NONE;
        }
        return lock.pendingCount() >= checkpointMessageCount ? FlushDecision.FLUSH : FlushDecision.NONE;
    }

    /**
     * Checks whether the partition has gone too long without a checkpoint.
     *
     * @param lock lock of the partition to check
     * @param nowMillis current time
     * @return {@link FlushDecision#FLUSH} if there are unflushed completions and the interval has elapsed
     */
    FlushDecision checkInterval(PartitionLock lock, long nowMillis) {
        if (lock.isClosing() || lock.pendingCount() == 0) {
            return FlushDecision.NONE;
        }
        return nowMillis - lock.lastFlushAtMillis() >= checkpointIntervalMillis
                ? FlushDecision.FLUSH
                : FlushDecision.NONE;
    }
}

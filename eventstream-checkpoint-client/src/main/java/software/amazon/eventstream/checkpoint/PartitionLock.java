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
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Checkpoint state of a single owned partition.
 *
 * <p>Not thread safe on its own. Every read and write must happen while holding {@link #lock()}, which is the
 * partition's exclusive section; {@link ProcessorLockContext} is the only owner. The exclusive section is never held
 * across a store write. {@link #state()} and {@link #outstandingWrite()} may also be read without it.</p>
 */
@Getter
@Accessors(fluent = true)
@ToString(exclude = { "mutex", "flushFinished", "removed", "outstandingWrite" })
public class PartitionLock {
    private final String partitionId;

    /**
     * Most recently completed sequence number, or null if nothing has been completed or seeded.
     */
    private Long pendingPosition;

    /**
     * Completions recorded since the last successful write.
     */
    private int pendingCount;

    private long lastFlushAtMillis;

    /**
     * Last sequence number known to be persisted by this lock, or null.
     */
    private Long lastFlushedPosition;

    private volatile PartitionLockState state = PartitionLockState.ACTIVE;

    /**
     * Set from the moment a count or interval flush is handed to the flush executor until it has finished.
     */
    @Setter(AccessLevel.PACKAGE)
    private boolean flushScheduled;

    /**
     * Set while a count or interval flush is writing a snapshot of this lock.
     */
    @Setter(AccessLevel.PACKAGE)
    private boolean flushInFlight;

    /**
     * Most recent store call for this partition, possibly still running after its attempt was abandoned.
     */
    @Setter(AccessLevel.PACKAGE)
    @Getter(AccessLevel.PACKAGE)
    private volatile StoreWrite outstandingWrite;

    @Getter(AccessLevel.NONE)
    private final ReentrantLock mutex = new ReentrantLock();
    @Getter(AccessLevel.NONE)
    private final Condition flushFinished = mutex.newCondition();
    @Getter(AccessLevel.NONE)
    private final CountDownLatch removed = new CountDownLatch(1);

    /**
     * @param partitionId partition the lock is created for
     * @param startingPosition sequence number to use as the ordering floor, or null
     * @param createdAtMillis creation time, which counts as the last flush for the interval check
     */
    PartitionLock(@NonNull String partitionId, Long startingPosition, long createdAtMillis) {
        this.partitionId = partitionId;
        this.pendingPosition = startingPosition;
        this.lastFlushAtMillis = createdAtMillis;
    }

    public boolean isClosing() {
        return state != PartitionLockState.ACTIVE;
    }

    void recordCompletion(long sequenceNumber) {
        pendingPosition = sequenceNumber;
        pendingCount++;
    }

    /**
     * @param sequenceNumber position that was written
     * @param flushedAtMillis time of the write
     * @param flushedCount completions covered by the write; completions recorded while it ran stay pending
     */
    void markFlushed(long sequenceNumber, long flushedAtMillis, int flushedCount) {
        lastFlushedPosition = sequenceNumber;
        lastFlushAtMillis = flushedAtMillis;
        pendingCount = Math.max(0, pendingCount - flushedCount);
    }

    void state(PartitionLockState state) {
        this.state = state;
        if (state == PartitionLockState.REMOVED) {
            removed.countDown();
        }
    }

    /**
     * Waits for the in-flight flush to signal completion. The caller must hold the lock.
     *
     * @return the remaining nanoseconds, zero or less once the wait timed out
     */
    long awaitFlushFinished(long timeoutNanos) throws InterruptedException {
        return flushFinished.awaitNanos(timeoutNanos);
    }

    /**
     * The caller must hold the lock.
     */
    void signalFlushFinished() {
        flushFinished.signalAll();
    }

    boolean awaitRemoved(Duration timeout) throws InterruptedException {
        return removed.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    void lock() {
        mutex.lock();
    }

    boolean tryLock() {
        return mutex.tryLock();
    }

    void unlock() {
        mutex.unlock();
    }

    /**
     * @return an immutable copy of the current state; the caller must hold the lock
     */
    PartitionLockSnapshot snapshot() {
        return new PartitionLockSnapshot(
                partitionId, pendingPosition, pendingCount, lastFlushAtMillis, lastFlushedPosition, state);
    }
}

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
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import software.amazon.eventstream.common.FutureUtils;
import software.amazon.eventstream.exceptions.CheckpointStoreException;
import software.amazon.eventstream.metrics.MetricsFactory;
import software.amazon.eventstream.metrics.MetricsLevel;
import software.amazon.eventstream.metrics.MetricsScope;
import software.amazon.eventstream.metrics.MetricsUtil;
import software.amazon.eventstream.processor.CheckpointListener;
import software.amazon.eventstream.processor.CheckpointStore;

/**
 * Owns the {@link PartitionLock} of every partition currently held by this consumer and decides when their
 * positions are written to the {@link CheckpointStore}.
 *
 * <p>Each partition has its own exclusive section guarding its bookkeeping. A flush snapshots the pending position
 * inside it and writes outside it, so completions are never held up by store I/O. At most one flush per partition is
 * scheduled or in flight, and a store write is only started once the previous write for the partition has finished,
 * so writes for a partition never overlap and are issued in non-decreasing position order. Partitions never wait on
 * each other.</p>
 *
 * <p>Count triggered flushes are decided on the completing thread and written on the flush executor. Interval
 * triggered flushes are found by a single periodic scan of the open partitions. The close drain runs on the thread
 * delivering the close notification and returns within {@link CheckpointConfig#closeBudget()}.</p>
 */
@Slf4j
public class ProcessorLockContext {
    static final String COUNT_FLUSH_OPERATION = "CountFlush";
    static final String INTERVAL_FLUSH_OPERATION = "IntervalFlush";
    static final String CLOSE_DRAIN_OPERATION = "CloseDrain";
    static final String DROPPED_COMPLETIONS_METRIC = "DroppedCompletions";
    static final String REJECTED_COMPLETIONS_METRIC = "RejectedCompletions";
    static final String DUPLICATE_INITIALIZATIONS_METRIC = "DuplicateInitializations";
    private static final String COMPLETE_MESSAGE_OPERATION = "CompleteMessage";
    private static final String ADD_PARTITION_OPERATION = "AddPartition";

    private final ConcurrentMap<String, PartitionLock> partitionLocks = new ConcurrentHashMap<>();
    private final CheckpointConfig config;
    private final CheckpointStore checkpointStore;
    private final CheckpointListener checkpointListener;
    private final CheckpointBatcher batcher;
    private final MetricsFactory metricsFactory;
    private final Supplier<Long> currentTimeSupplier;
    private final ExecutorService flushExecutor;
    private final ExecutorService storeExecutor;
    private final ScheduledExecutorService intervalScheduler;

    private final Object lifecycleLock = new Object();
    private boolean started = false;
    private volatile boolean shuttingDown = false;

    /**
     * Factory method creating a context backed by daemon thread pools.
     *
     * @param config checkpoint thresholds, flush budgets and the store to write to
     * @param metricsFactory factory for flush metrics
     * @return a context that still has to be {@link #start() started}
     */
    public static ProcessorLockContext create(@NonNull CheckpointConfig config, @NonNull MetricsFactory metricsFactory) {
        return new ProcessorLockContext(
                config,
                metricsFactory,
                System::currentTimeMillis,
                Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                        .setNameFormat("CheckpointFlush-%04d")
                        .setDaemon(true)
                        .build()),
                Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                        .setNameFormat("CheckpointStoreWrite-%04d")
                        .setDaemon(true)
                        .build()),
                Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                        .setNameFormat("CheckpointIntervalCheck-%04d")
                        .setDaemon(true)
                        .build()));
    }

    /**
     * @param config checkpoint thresholds, flush budgets and the store to write to
     * @param metricsFactory factory for flush metrics
     * @param currentTimeSupplier clock in epoch milliseconds
     * @param flushExecutor runs count and interval triggered flushes
     * @param storeExecutor runs individual store writes so that each attempt can be timed out
     * @param intervalScheduler runs the periodic interval scan
     */
    @VisibleForTesting
    ProcessorLockContext(
            @NonNull CheckpointConfig config,
            @NonNull MetricsFactory metricsFactory,
            @NonNull Supplier<Long> currentTimeSupplier,
            @NonNull ExecutorService flushExecutor,
            @NonNull ExecutorService storeExecutor,
            @NonNull ScheduledExecutorService intervalScheduler) {
        this.config = config;
        this.checkpointStore = config.checkpointStore();
        this.checkpointListener = config.checkpointListener();
        this.batcher = new CheckpointBatcher(config);
        this.metricsFactory = metricsFactory;
        this.currentTimeSupplier = currentTimeSupplier;
        this.flushExecutor = flushExecutor;
        this.storeExecutor = storeExecutor;
        this.intervalScheduler = intervalScheduler;
    }

    /**
     * Starts the periodic interval scan. Calling it more than once has no further effect.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (shuttingDown) {
                throw new IllegalStateException("Processor lock context cannot be started after shutdown.");
            }
            if (started) {
                log.info("Checkpoint interval check already running, no need to start.");
                return;
            }
            final long periodMillis = config.effectiveIntervalCheckPeriod().toMillis();
            log.info(
                    "Starting checkpoint interval check every {} ms (interval {}, message count {}).",
                    periodMillis,
                    config.checkpointInterval(),
                    config.checkpointMessageCount());
            intervalScheduler.scheduleAtFixedRate(
                    this::runIntervalCheck, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
            started = true;
        }
    }

    /**
     * Creates the lock for a partition this consumer now owns. If the previous lock of the partition is still being
     * drained, waits for that close to finish, up to {@link CheckpointConfig#closeBudget()}, and then replaces it.
     *
     * @param partitionId partition being initialized
     * @param startingSequenceNumber position processing resumes from, used as the ordering floor; may be null
     * @return false if an open lock already existed, which means the initialization notification was duplicated
     */
    public boolean addPartition(@NonNull String partitionId, Long startingSequenceNumber) {
        final PartitionLock existing = partitionLocks.get(partitionId);
        if (existing != null && existing.isClosing()) {
            return replaceClosingLock(existing, startingSequenceNumber);
        }
        final PartitionLock lock = new PartitionLock(partitionId, startingSequenceNumber, currentTimeSupplier.get());
        if (partitionLocks.putIfAbsent(partitionId, lock) != null) {
            log.warn(
                    "Partition {}: initialization received while a checkpoint lock already exists."
                            + " Ignoring the duplicate notification.",
                    partitionId);
            addCount(partitionId, ADD_PARTITION_OPERATION, DUPLICATE_INITIALIZATIONS_METRIC);
            return false;
        }
        log.debug("Partition {}: checkpoint lock created at starting position {}", partitionId, startingSequenceNumber);
        return true;
    }

    private boolean replaceClosingLock(PartitionLock closing, Long startingSequenceNumber) {
        final String partitionId = closing.partitionId();
        log.info(
                "Partition {}: initialization received while the previous checkpoint lock is {}."
                        + " Waiting for its close to finish.",
                partitionId,
                closing.state());
        try {
            if (!closing.awaitRemoved(config.closeBudget())) {
                log.warn(
                        "Partition {}: previous checkpoint lock still {} after {}, replacing it.",
                        partitionId,
                        closing.state(),
                        config.closeBudget());
            }
        } catch (InterruptedException e) {
            log.warn("Partition {}: interrupted while waiting for the previous checkpoint lock, replacing it.", partitionId);
            Thread.currentThread().interrupt();
        }

        final PartitionLock lock = new PartitionLock(partitionId, startingSequenceNumber, currentTimeSupplier.get());
        // The first write of the new lock waits for the last write of the old one.
        lock.outstandingWrite(closing.outstandingWrite());
        if (partitionLocks.replace(partitionId, closing, lock) || partitionLocks.putIfAbsent(partitionId, lock) == null) {
            log.info(
                    "Partition {}: checkpoint lock re-created after close at starting position {}",
                    partitionId,
                    startingSequenceNumber);
            return true;
        }
        log.warn(
                "Partition {}: another initialization created a checkpoint lock while the previous one was closing."
                        + " Ignoring the duplicate notification.",
                partitionId);
        addCount(partitionId, ADD_PARTITION_OPERATION, DUPLICATE_INITIALIZATIONS_METRIC);
        return false;
    }

    /**
     * Records that the event at the given position has been fully processed. A no-op for partitions that are not
     * owned, and for partitions that have started closing.
     *
     * @param partitionId partition the event was delivered from
     * @param sequenceNumber sequence number of the processed event
     * @return what was decided for the completion
     */
    public FlushDecision completeMessage(@NonNull String partitionId, long sequenceNumber) {
        final PartitionLock lock = partitionLocks.get(partitionId);
        if (lock == null) {
            if (log.isDebugEnabled()) {
                log.debug("Partition {}: not owned, ignoring completion at {}", partitionId, sequenceNumber);
            }
            return FlushDecision.DROPPED;
        }

        final FlushDecision decision;
        final boolean scheduleFlush;
        lock.lock();
        try {
            decision = batcher.recordCompletion(lock, sequenceNumber);
            scheduleFlush = decision == FlushDecision.FLUSH && claimFlush(lock);
        } finally {
            lock.unlock();
        }

        if (decision == FlushDecision.DROPPED) {
            addCount(partitionId, COMPLETE_MESSAGE_OPERATION, DROPPED_COMPLETIONS_METRIC);
        } else if (decision == FlushDecision.REJECTED) {
            addCount(partitionId, COMPLETE_MESSAGE_OPERATION, REJECTED_COMPLETIONS_METRIC);
        }
        if (scheduleFlush) {
            submitFlush(lock, COUNT_FLUSH_OPERATION);
        }
        return decision;
    }

    /**
     * Closes the lock of a partition this consumer is relinquishing. Completions arriving from now on are dropped.
     * A flush already in flight is given {@link CheckpointConfig#closeFlushTimeout()} to finish, then whatever is
     * still pending is written before the lock is removed. Returns within {@link CheckpointConfig#closeBudget()}.
     *
     * @param partitionId partition being closed
     * @return true if nothing was left unpersisted
     */
    public boolean closePartition(@NonNull String partitionId) {
        final PartitionLock lock = partitionLocks.get(partitionId);
        if (lock == null) {
            log.warn("Partition {}: close received without a checkpoint lock, nothing to drain.", partitionId);
            return true;
        }

        final boolean flushStillRunning;
        final int count;
        final long sequenceNumber;
        lock.lock();
        try {
            if (lock.isClosing()) {
                log.warn("Partition {}: close received while the lock is already {}", partitionId, lock.state());
                return lock.pendingCount() == 0;
            }
            lock.state(PartitionLockState.CLOSING);
            flushStillRunning = awaitInFlightFlush(lock);
            count = lock.pendingCount();
            sequenceNumber = count > 0 ? lock.pendingPosition() : 0L;
        } finally {
            lock.unlock();
        }

        boolean drained = true;
        try {
            if (count > 0 && flushStillRunning) {
                log.error(
                        "Partition {}: flush still in progress after {}. Releasing the partition with {} unpersisted"
                                + " completion(s) up to {}.",
                        partitionId,
                        config.closeFlushTimeout(),
                        count,
                        sequenceNumber);
                notifyFailed(
                        partitionId,
                        sequenceNumber,
                        new CheckpointStoreException(
                                partitionId,
                                String.format(
                                        "Checkpoint flush still in progress after %s while closing",
                                        config.closeFlushTimeout())));
                drained = false;
            } else if (count > 0) {
                log.debug("Partition {}: draining {} pending completion(s) up to {}", partitionId, count, sequenceNumber);
                drained = writeCheckpoint(
                        lock,
                        CLOSE_DRAIN_OPERATION,
                        sequenceNumber,
                        count,
                        config.closeFlushMaxAttempts(),
                        config.closeFlushTimeout(),
                        false);
            }
            final StoreWrite outstanding = lock.outstandingWrite();
            if (outstanding != null && !outstanding.isFinished()) {
                log.warn(
                        "Partition {}: checkpoint write at {} is still running while the partition is released.",
                        partitionId,
                        outstanding.sequenceNumber());
            }
        } finally {
            lock.lock();
            try {
                lock.state(PartitionLockState.REMOVED);
            } finally {
                lock.unlock();
            }
            partitionLocks.remove(partitionId, lock);
        }
        log.debug("Partition {}: checkpoint lock removed", partitionId);
        return drained;
    }

    /**
     * Waits up to the close flush timeout for an in-flight flush. The caller must hold the lock.
     *
     * @return true if a flush is still in flight
     */
    private boolean awaitInFlightFlush(PartitionLock lock) {
        long remainingNanos = config.closeFlushTimeout().toNanos();
        try {
            while (lock.flushInFlight() && remainingNanos > 0) {
                remainingNanos = lock.awaitFlushFinished(remainingNanos);
            }
        } catch (InterruptedException e) {
            log.warn("Partition {}: interrupted while waiting for an in-flight flush", lock.partitionId());
            Thread.currentThread().interrupt();
        }
        return lock.flushInFlight();
    }

    /**
     * @return identifiers of the partitions that currently have a lock
     */
    public Set<String> ownedPartitions() {
        return ImmutableSet.copyOf(partitionLocks.keySet());
    }

    /**
     * @param partitionId partition to look up
     * @return the current state of the partition's lock, or empty if the partition is not owned
     */
    public Optional<PartitionLockSnapshot> lockSnapshot(@NonNull String partitionId) {
        final PartitionLock lock = partitionLocks.get(partitionId);
        if (lock == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return Optional.of(lock.snapshot());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the interval scan and gives in-flight flushes the configured grace period before abandoning them.
     * Flushes still running afterwards are interrupted and report their own failure; nothing is retried. Every
     * partition left with unflushed completions is reported to the listener once, and no flush is scheduled after
     * this call.
     */
    public void shutdown() {
        synchronized (lifecycleLock) {
            if (shuttingDown) {
                log.warn("Processor lock context shutdown requested a second time.");
                return;
            }
            shuttingDown = true;
        }
        log.info("Shutting down processor lock context with {} owned partition(s).", partitionLocks.size());
        intervalScheduler.shutdownNow();
        flushExecutor.shutdown();

        final Duration gracePeriod = config.shutdownGracePeriod();
        try {
            if (!flushExecutor.awaitTermination(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                final List<Runnable> neverStarted = flushExecutor.shutdownNow();
                log.warn(
                        "Flushes still running after a grace period of {}. Abandoning them and {} queued flush(es).",
                        gracePeriod,
                        neverStarted.size());
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for in-flight flushes, abandoning them.", e);
            flushExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            storeExecutor.shutdownNow();
        }

        for (PartitionLock lock : partitionLocks.values()) {
            reportAbandoned(lock);
        }
    }

    private void reportAbandoned(PartitionLock lock) {
        lock.lock();
        try {
            if (lock.flushInFlight()) {
                return;
            }
            lock.flushScheduled(false);
            if (lock.pendingCount() == 0 || lock.isClosing()) {
                return;
            }
            log.warn(
                    "Partition {}: shut down with {} unflushed completion(s) up to {}; last checkpoint {}.",
                    lock.partitionId(),
                    lock.pendingCount(),
                    lock.pendingPosition(),
                    lock.lastFlushedPosition());
            notifyFailed(
                    lock.partitionId(),
                    lock.pendingPosition(),
                    new CheckpointStoreException(
                            lock.partitionId(),
                            String.format("Shut down with %d unflushed completion(s)", lock.pendingCount())));
        } finally {
            lock.unlock();
        }
    }

    public boolean isShutdown() {
        return shuttingDown;
    }

    /**
     * Scans a snapshot of the open partitions and schedules a flush for each one whose interval has elapsed.
     * Partitions busy in their exclusive section are skipped until the next scan.
     */
    @VisibleForTesting
    void checkIntervals() {
        final long nowMillis = currentTimeSupplier.get();
        for (String partitionId : ImmutableList.copyOf(partitionLocks.keySet())) {
            final PartitionLock lock = partitionLocks.get(partitionId);
            if (lock == null || !lock.tryLock()) {
                continue;
            }
            final boolean scheduleFlush;
            try {
                scheduleFlush = batcher.checkInterval(lock, nowMillis) == FlushDecision.FLUSH && claimFlush(lock);
            } finally {
                lock.unlock();
            }
            if (scheduleFlush) {
                submitFlush(lock, INTERVAL_FLUSH_OPERATION);
            }
        }
    }

    private void runIntervalCheck() {
        try {
            checkIntervals();
        } catch (Exception e) {
            log.error("Error while checking checkpoint intervals", e);
        }
    }

    /**
     * The caller must hold the lock.
     *
     * @return true if the caller now owns the single flush slot of the partition
     */
    private boolean claimFlush(PartitionLock lock) {
        if (lock.flushScheduled() || shuttingDown) {
            return false;
        }
        lock.flushScheduled(true);
        return true;
    }

    private void submitFlush(PartitionLock lock, String operation) {
        try {
            flushExecutor.execute(() -> flush(lock, operation));
        } catch (RejectedExecutionException e) {
            // Only happens once shutdown has begun; the shutdown sweep reports what is left.
            log.warn("Partition {}: flush executor is shut down, {} not scheduled.", lock.partitionId(), operation);
            lock.lock();
            try {
                lock.flushScheduled(false);
            } finally {
                lock.unlock();
            }
        }
    }

    private void flush(PartitionLock lock, String operation) {
        final long sequenceNumber;
        final int count;
        lock.lock();
        try {
            // Abandoned by shutdown, or drained by closePartition itself.
            if (!lock.flushScheduled() || lock.isClosing() || lock.pendingCount() == 0) {
                lock.flushScheduled(false);
                return;
            }
            lock.flushInFlight(true);
            sequenceNumber = lock.pendingPosition();
            count = lock.pendingCount();
        } finally {
            lock.unlock();
        }

        boolean written = false;
        try {
            written = writeCheckpoint(
                    lock, operation, sequenceNumber, count, config.flushMaxAttempts(), config.flushTimeout(), true);
        } catch (RuntimeException e) {
            log.error("Partition {}: unexpected error during {}", lock.partitionId(), operation, e);
        } finally {
            finishFlush(lock, written);
        }
    }

    private void finishFlush(PartitionLock lock, boolean written) {
        final boolean scheduleFlush;
        lock.lock();
        try {
            lock.flushInFlight(false);
            lock.flushScheduled(false);
            lock.signalFlushFinished();
            // Completions recorded during the write may have reached the threshold again.
            scheduleFlush = written && batcher.checkCount(lock) == FlushDecision.FLUSH && claimFlush(lock);
        } finally {
            lock.unlock();
        }
        if (scheduleFlush) {
            submitFlush(lock, COUNT_FLUSH_OPERATION);
        }
    }

    /**
     * Writes a snapshot of a partition's pending position, retrying with backoff. Must be called outside the
     * partition's exclusive section.
     *
     * @param count completions covered by the snapshot
     * @param yieldToClose whether to stop retrying once the partition starts closing, leaving the write to the drain
     * @return true if the position was persisted
     */
    private boolean writeCheckpoint(
            PartitionLock lock,
            String operation,
            long sequenceNumber,
            int count,
            int maxAttempts,
            Duration attemptTimeout,
            boolean yieldToClose) {
        final String partitionId = lock.partitionId();
        final MetricsScope scope = MetricsUtil.createMetricsWithOperation(metricsFactory, operation);
        MetricsUtil.addPartitionId(scope, partitionId);
        final long startTime = System.currentTimeMillis();
        boolean success = false;
        Throwable lastFailure = null;
        try {
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                if (attempt > 1) {
                    if (shuttingDown) {
                        log.warn(
                                "Partition {}: shutdown in progress, not retrying checkpoint at {}",
                                partitionId,
                                sequenceNumber);
                        break;
                    }
                    if (!backoff(partitionId)) {
                        break;
                    }
                }
                if (yieldToClose && lock.isClosing()) {
                    log.debug(
                            "Partition {}: closing, leaving checkpoint at {} to the close drain",
                            partitionId,
                            sequenceNumber);
                    return false;
                }
                try {
                    runAttempt(lock, sequenceNumber, attemptTimeout);

                    lock.lock();
                    try {
                        lock.markFlushed(sequenceNumber, currentTimeSupplier.get(), count);
                    } finally {
                        lock.unlock();
                    }
                    success = true;
                    if (log.isDebugEnabled()) {
                        log.debug("Partition {}: {} wrote checkpoint at {}", partitionId, operation, sequenceNumber);
                    }
                    notifyWritten(partitionId, sequenceNumber);
                    return true;
                } catch (ExecutionException e) {
                    lastFailure = e.getCause();
                    log.warn(
                            "Partition {}: attempt {} of {} to checkpoint at {} failed",
                            partitionId,
                            attempt,
                            maxAttempts,
                            sequenceNumber,
                            lastFailure);
                } catch (TimeoutException e) {
                    lastFailure = new CheckpointStoreException(
                            partitionId,
                            String.format("Timed out after %s writing checkpoint at %d", attemptTimeout, sequenceNumber),
                            e);
                    log.warn(
                            "Partition {}: attempt {} of {} to checkpoint at {} timed out after {}: {}",
                            partitionId,
                            attempt,
                            maxAttempts,
                            sequenceNumber,
                            attemptTimeout,
                            e.getMessage());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    lastFailure = e;
                    log.warn("Partition {}: interrupted while writing checkpoint at {}", partitionId, sequenceNumber);
                    break;
                } catch (RejectedExecutionException e) {
                    lastFailure = e;
                    log.warn(
                            "Partition {}: checkpoint store writer is shut down, abandoning checkpoint at {}",
                            partitionId,
                            sequenceNumber);
                    break;
                }
            }

            log.error(
                    "Partition {}: unable to checkpoint at {} during {}.",
                    partitionId,
                    sequenceNumber,
                    operation,
                    lastFailure);
            notifyFailed(partitionId, sequenceNumber, lastFailure);
            return false;
        } finally {
            MetricsUtil.addSuccessAndLatency(scope, success, startTime, MetricsLevel.SUMMARY);
            MetricsUtil.endScope(scope);
        }
    }

    /**
     * Runs a single store write within the attempt timeout. A write is only started once the previous write for the
     * partition has finished; if it does not finish in time the attempt times out without starting a new one.
     */
    private void runAttempt(PartitionLock lock, long sequenceNumber, Duration attemptTimeout)
            throws ExecutionException, InterruptedException, TimeoutException {
        final long deadline = System.nanoTime() + attemptTimeout.toNanos();
        final StoreWrite previous = lock.outstandingWrite();
        if (previous != null && !previous.awaitFinished(attemptTimeout.toNanos())) {
            throw new TimeoutException(
                    String.format("previous checkpoint write at %d is still running", previous.sequenceNumber()));
        }
        final long remainingNanos = deadline - System.nanoTime();
        if (remainingNanos <= 0) {
            throw new TimeoutException("no time left after the previous checkpoint write finished");
        }

        final StoreWrite write = new StoreWrite(checkpointStore, lock.partitionId(), sequenceNumber);
        lock.outstandingWrite(write);
        final Future<Void> future;
        try {
            future = storeExecutor.submit(write);
        } catch (RejectedExecutionException e) {
            write.abandon();
            throw e;
        }
        try {
            FutureUtils.resolveOrCancelFuture(future, Duration.ofNanos(remainingNanos));
        } finally {
            if (future.isCancelled()) {
                write.abandon();
            }
        }
    }

    private boolean backoff(String partitionId) {
        try {
            Thread.sleep(config.flushBackoff().toMillis());
            return true;
        } catch (InterruptedException e) {
            log.debug("Partition {}: interrupted during checkpoint backoff", partitionId, e);
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void notifyWritten(String partitionId, long sequenceNumber) {
        try {
            checkpointListener.checkpointWritten(partitionId, sequenceNumber);
        } catch (RuntimeException e) {
            log.error("Partition {}: checkpoint listener failed on written checkpoint {}", partitionId, sequenceNumber, e);
        }
    }

    private void notifyFailed(String partitionId, long sequenceNumber, Throwable cause) {
        try {
            checkpointListener.checkpointFailed(partitionId, sequenceNumber, cause);
        } catch (RuntimeException e) {
            log.error("Partition {}: checkpoint listener failed on failed checkpoint {}", partitionId, sequenceNumber, e);
        }
    }

    private void addCount(String partitionId, String operation, String metricName) {
        final MetricsScope scope = MetricsUtil.createMetricsWithOperation(metricsFactory, operation);
        MetricsUtil.addPartitionId(scope, partitionId);
        MetricsUtil.addCount(scope, metricName, 1, MetricsLevel.DETAILED);
        MetricsUtil.endScope(scope);
    }
}

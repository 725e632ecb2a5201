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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import com.google.common.util.concurrent.MoreExecutors;

import software.amazon.awssdk.services.cloudwatch.model.StandardUnit;
import software.amazon.eventstream.exceptions.CheckpointStoreException;
import software.amazon.eventstream.metrics.MetricsFactory;
import software.amazon.eventstream.metrics.MetricsLevel;
import software.amazon.eventstream.metrics.MetricsScope;
import software.amazon.eventstream.metrics.NullMetricsFactory;
import software.amazon.eventstream.processor.CheckpointListener;
import software.amazon.eventstream.processor.CheckpointStore;

@RunWith(MockitoJUnitRunner.class)
public class ProcessorLockContextTest {
    private static final String PARTITION_ID = "0";
    private static final String OTHER_PARTITION_ID = "1";

    private final AtomicLong now = new AtomicLong(0L);
    private final InMemoryCheckpointStore store = new InMemoryCheckpointStore();
    private final List<ExecutorService> pools = new ArrayList<>();

    @Mock
    private ScheduledExecutorService intervalScheduler;
    @Mock
    private CheckpointListener listener;
    @Mock
    private MetricsFactory metricsFactory;
    @Mock
    private MetricsScope metricsScope;
    @Mock
    private ExecutorService queuingFlushExecutor;

    private CheckpointConfig config;
    private ProcessorLockContext context;

    @Before
    public void setup() {
        config = new CheckpointConfig(store)
                .checkpointMessageCount(3)
                .checkpointInterval(Duration.ofHours(1))
                .flushBackoff(Duration.ZERO)
                .checkpointListener(listener);
        context = directContext(config);
    }

    @After
    public void cleanup() {
        pools.forEach(ExecutorService::shutdownNow);
    }

    @Test
    public void testCountThresholdTriggersFlush() {
        context.addPartition(PARTITION_ID, null);

        assertThat(context.completeMessage(PARTITION_ID, 1L), equalTo(FlushDecision.NONE));
        assertThat(context.completeMessage(PARTITION_ID, 2L), equalTo(FlushDecision.NONE));
        assertThat(store.writes(), empty());

        assertThat(context.completeMessage(PARTITION_ID, 3L), equalTo(FlushDecision.FLUSH));
        assertThat(store.writes(PARTITION_ID), contains(3L));

        final PartitionLockSnapshot snapshot = context.lockSnapshot(PARTITION_ID).get();
        assertThat(snapshot.pendingCount(), equalTo(0));
        assertThat(snapshot.pendingPosition(), equalTo(3L));
        assertThat(snapshot.lastFlushedPosition(), equalTo(3L));
        verify(listener).checkpointWritten(PARTITION_ID, 3L);
    }

    @Test
    public void testIntervalTriggersFlushOnTimerTick() {
        config.checkpointMessageCount(1000).checkpointInterval(Duration.ofSeconds(1));
        context = directContext(config);
        context.addPartition(PARTITION_ID, null);
        context.completeMessage(PARTITION_ID, 5L);

        now.set(999L);
        context.checkIntervals();
        assertThat(store.writes(), empty());

        now.set(1001L);
        context.checkIntervals();
        assertThat(store.writes(PARTITION_ID), contains(5L));
        assertThat(context.lockSnapshot(PARTITION_ID).get().lastFlushAtMillis(), equalTo(1001L));

        now.set(5000L);
        context.checkIntervals();
        assertThat(store.writes(PARTITION_ID), contains(5L));
    }

    @Test
    public void testCloseDrainsPendingCheckpointBeforeRemovingLock() {
        context.addPartition(PARTITION_ID, null);
        context.completeMessage(PARTITION_ID, 10L);

        assertTrue(context.closePartition(PARTITION_ID));

        assertThat(store.writes(PARTITION_ID), contains(10L));
        assertFalse(context.lockSnapshot(PARTITION_ID).isPresent());
        assertFalse(context.ownedPartitions().contains(PARTITION_ID));
    }

    @Test
    public void testLateCompletionAfterCloseNeverFlushed() {
        config.checkpointMessageCount(1);
        context = directContext(config);
        context.addPartition(PARTITION_ID, null);
        context.completeMessage(PARTITION_ID, 1L);
        context.closePartition(PARTITION_ID);

        assertThat(context.completeMessage(PARTITION_ID, 20L), equalTo(FlushDecision.DROPPED));
        now.set(Duration.ofHours(2).toMillis());
        context.checkIntervals();

        assertThat(store.writes(PARTITION_ID), contains(1L));
        assertThat(store.checkpoint(PARTITION_ID), equalTo(1L));
    }

    @Test
    public void testCompletionDuringCloseDrainDropped() {
        final AtomicReference<ProcessorLockContext> contextReference = new AtomicReference<>();
        final List<FlushDecision> decisionsDuringDrain = new ArrayList<>();
        final List<Long> written = new ArrayList<>();
        final CheckpointStore drainingStore = (partitionId, sequenceNumber) -> {
            decisionsDuringDrain.add(contextReference.get().completeMessage(partitionId, 20L));
            written.add(sequenceNumber);
        };
        contextReference.set(directContext(new CheckpointConfig(drainingStore)));
        context = contextReference.get();
        context.addPartition(PARTITION_ID, null);
        context.completeMessage(PARTITION_ID, 10L);

        assertTrue(context.closePartition(PARTITION_ID));

        assertThat(decisionsDuringDrain, contains(FlushDecision.DROPPED));
        assertThat(written, contains(10L));
    }

    @Test
    public void testCompletionForUnknownPartitionIsNoOp() {
        assertThat(context.completeMessage("unknown", 7L), equalTo(FlushDecision.DROPPED));

        assertThat(store.attempts(), equalTo(0));
        assertThat(context.ownedPartitions(), empty());
    }

    @Test
    public void testFailedWritesRetriedUntilSuccess() {
        store.failNextWrites(2);
        context.addPartition(PARTITION_ID, null);
        for (long i = 1; i <= 3; i++) {
            context.completeMessage(PARTITION_ID, i);
        }

        assertThat(store.attempts(), equalTo(3));
        assertThat(store.writes(PARTITION_ID), contains(3L));
        verify(listener).checkpointWritten(PARTITION_ID, 3L);
        verify(listener, never()).checkpointFailed(any(), anyLong(), any());
    }

    @Test
    public void testExhaustedRetriesReportedAndNextThresholdRetries() {
        store.failNextWrites(3);
        context.addPartition(PARTITION_ID, null);
        for (long i = 1; i <= 3; i++) {
            context.completeMessage(PARTITION_ID, i);
        }

        verify(listener).checkpointFailed(eq(PARTITION_ID), eq(3L), any(CheckpointStoreException.class));
        final PartitionLockSnapshot snapshot = context.lockSnapshot(PARTITION_ID).get();
        assertThat(snapshot.pendingCount(), equalTo(3));
        assertThat(snapshot.lastFlushedPosition(), nullValue());

        assertThat(context.completeMessage(PARTITION_ID, 4L), equalTo(FlushDecision.FLUSH));
        assertThat(store.writes(PARTITION_ID), contains(4L));
        assertThat(context.lockSnapshot(PARTITION_ID).get().pendingCount(), equalTo(0));
    }

    @Test
    public void testCloseDrainFailureReportedAndLockRemoved() {
        store.failNextWrites(1);
        context.addPartition(PARTITION_ID, null);
        context.completeMessage(PARTITION_ID, 7L);

        assertFalse(context.closePartition(PARTITION_ID));

        assertThat(store.attempts(), equalTo(config.closeFlushMaxAttempts()));
        assertThat(store.writes(), empty());
        verify(listener).checkpointFailed(eq(PARTITION_ID), eq(7L), any(CheckpointStoreException.class));
        assertFalse(context.lockSnapshot(PARTITION_ID).isPresent());
    }

    @Test
    public void testCloseWithoutPendingCompletionsDoesNotWrite() {
        context.addPartition(PARTITION_ID, null);

        assertTrue(context.closePartition(PARTITION_ID));
        assertThat(store.attempts(), equalTo(0));
    }

    @Test
    public void testCloseForUnknownPartition() {
        assertTrue(context.closePartition("unknown"));
        assertThat(store.attempts(), equalTo(0));
    }

    @Test
    public void testOutOfOrderCompletionRejected() {
        context.addPartition(PARTITION_ID, null);
        context.completeMessage(PARTITION_ID, 10L);

        assertThat(context.completeMessage(PARTITION_ID, 5L), equalTo(FlushDecision.REJECTED));

        final PartitionLockSnapshot snapshot = context.lockSnapshot(PARTITION_ID).get();
        assertThat(snapshot.pendingPosition(), equalTo(10L));
        assertThat(snapshot.pendingCount(), equalTo(1));
    }

    @Test
    public void testStartingSequenceNumberSeedsFloorWithoutWriting() {
        context.addPartition(PARTITION_ID, 100L);

        assertThat(context.completeMessage(PARTITION_ID, 50L), equalTo(FlushDecision.REJECTED));
        now.set(Duration.ofHours(2).toMillis());
        context.checkIntervals();
        assertTrue(context.closePartition(PARTITION_ID));

        assertThat(store.attempts(), equalTo(0));
    }

    @Test
    public void testDuplicateAddPartitionKeepsExistingLock() {
        when(metricsFactory.createMetrics()).thenReturn(metricsScope);
        context = new ProcessorLockContext(
                config,
                metricsFactory,
                now::get,
                MoreExecutors.newDirectExecutorService(),
                MoreExecutors.newDirectExecutorService(),
                intervalScheduler);

        assertTrue(context.addPartition(PARTITION_ID, null));
        context.completeMessage(PARTITION_ID, 1L);
        assertFalse(context.addPartition(PARTITION_ID, 500L));

        final PartitionLockSnapshot snapshot = context.lockSnapshot(PARTITION_ID).get();
        assertThat(snapshot.pendingPosition(), equalTo(1L));
        assertThat(snapshot.pendingCount(), equalTo(1));
        verify(metricsScope).addData(
                ProcessorLockContext.DUPLICATE_INITIALIZATIONS_METRIC, 1, StandardUnit.COUNT, MetricsLevel.DETAILED);
        verify(metricsScope).end();
    }

    @Test
    public void testPartitionsTrackedIndependently() {
        context.addPartition(PARTITION_ID, null);
        context.addPartition(OTHER_PARTITION_ID, null);
        context.completeMessage(PARTITION_ID, 1L);
        context.completeMessage(PARTITION_ID, 2L);
        context.completeMessage(OTHER_PARTITION_ID, 40L);
        context.completeMessage(PARTITION_ID, 3L);

        assertThat(store.writes(PARTITION_ID), contains(3L));
        assertThat(store.writes(OTHER_PARTITION_ID), empty());
        assertThat(context.lockSnapshot(OTHER_PARTITION_ID).get().pendingCount(), equalTo(1));

        context.closePartition(PARTITION_ID);
        assertThat(context.ownedPartitions(), contains(OTHER_PARTITION_ID));
    }

    @Test
    public void testStartSchedulesIntervalCheckOnce() {
        context.start();
        context.start();

        verify(intervalScheduler, times(1))
                .scheduleAtFixedRate(any(Runnable.class), eq(1000L), eq(1000L), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    public void testScheduledIntervalCheckFlushes() {
        context.start();
        final ArgumentCaptor<Runnable> intervalCheck = ArgumentCaptor.forClass(Runnable.class);
        verify(intervalScheduler)
                .scheduleAtFixedRate(intervalCheck.capture(), anyLong(), anyLong(), any(TimeUnit.class));
        context.addPartition(PARTITION_ID, null);
        context.completeMessage(PARTITION_ID, 5L);

        now.set(Duration.ofHours(1).toMillis());
        intervalCheck.getValue().run();

        assertThat(store.writes(PARTITION_ID), contains(5L));
    }

    @Test
    public void testIntervalCheckPeriodCappedByInterval() {
        config.checkpointInterval(Duration.ofMillis(200));
        context = directContext(config);

        context.start();

        verify(intervalScheduler)
                .scheduleAtFixedRate(any(Runnable.class), eq(200L), eq(200L), eq(TimeUnit.MILLISECONDS));
    }

    @Test(expected = IllegalStateException.class)
    public void testStartAfterShutdownFails() {
        context.shutdown();
        context.start();
    }

    @Test
    public void testShutdownIdempotent() {
        context.shutdown();
        context.shutdown();

        assertTrue(context.isShutdown());
        verify(intervalScheduler, times(1)).shutdownNow();
    }

    @Test
    public void testNoRetryOnceShutdownBegins() {
        final AtomicInteger attempts = new AtomicInteger();
        final AtomicReference<ProcessorLockContext> contextReference = new AtomicReference<>();
        final CheckpointStore failingStore = (partitionId, sequenceNumber) -> {
            attempts.incrementAndGet();
            contextReference.get().shutdown();
            throw new CheckpointStoreException(partitionId, "Store unavailable");
        };
        contextReference.set(directContext(new CheckpointConfig(failingStore)
                .checkpointMessageCount(1)
                .flushMaxAttempts(3)
                .flushBackoff(Duration.ZERO)
                .shutdownGracePeriod(Duration.ZERO)
                .checkpointListener(listener)));
        context = contextReference.get();
        context.addPartition(PARTITION_ID, null);

        context.completeMessage(PARTITION_ID, 1L);

        assertThat(attempts.get(), equalTo(1));
        verify(listener).checkpointFailed(eq(PARTITION_ID), eq(1L), any(CheckpointStoreException.class));
    }

    @Test
    public void testFlushesAfterShutdownAbandoned() {
        context.addPartition(PARTITION_ID, null);
        context.completeMessage(PARTITION_ID, 1L);
        context.shutdown();
        verify(listener).checkpointFailed(eq(PARTITION_ID), eq(1L), any(CheckpointStoreException.class));

        context.completeMessage(PARTITION_ID, 2L);
        assertThat(context.completeMessage(PARTITION_ID, 3L), equalTo(FlushDecision.FLUSH));
        assertFalse(context.closePartition(PARTITION_ID));

        assertThat(store.attempts(), equalTo(0));
        verify(listener).checkpointFailed(eq(PARTITION_ID), eq(3L), any());
        verify(listener, times(2)).checkpointFailed(eq(PARTITION_ID), anyLong(), any());
    }

    @Test
    public void testQueuedFlushDroppedByShutdownReportedOnce() throws Exception {
        when(queuingFlushExecutor.awaitTermination(anyLong(), any(TimeUnit.class))).thenReturn(false);
        context = new ProcessorLockContext(
                config,
                new NullMetricsFactory(),
                now::get,
                queuingFlushExecutor,
                MoreExecutors.newDirectExecutorService(),
                intervalScheduler);
        context.addPartition(PARTITION_ID, null);
        for (long i = 1; i <= 3; i++) {
            context.completeMessage(PARTITION_ID, i);
        }
        verify(queuingFlushExecutor).execute(any(Runnable.class));

        context.shutdown();

        verify(queuingFlushExecutor).shutdownNow();
        verify(listener).checkpointFailed(eq(PARTITION_ID), eq(3L), any(CheckpointStoreException.class));
        for (long i = 4; i <= 9; i++) {
            context.completeMessage(PARTITION_ID, i);
        }
        verify(queuingFlushExecutor).execute(any(Runnable.class));
        verify(listener).checkpointFailed(eq(PARTITION_ID), anyLong(), any());
        assertThat(store.attempts(), equalTo(0));
    }

    @Test
    public void testTimedOutWriteReportedAsStoreFailure() {
        store.blockWritesUntil(new CountDownLatch(1));
        config.checkpointMessageCount(1).flushMaxAttempts(1).flushTimeout(Duration.ofMillis(100));
        context = new ProcessorLockContext(
                config,
                new NullMetricsFactory(),
                now::get,
                MoreExecutors.newDirectExecutorService(),
                pool(Executors.newCachedThreadPool()),
                intervalScheduler);
        context.addPartition(PARTITION_ID, null);

        context.completeMessage(PARTITION_ID, 1L);

        final ArgumentCaptor<Throwable> cause = ArgumentCaptor.forClass(Throwable.class);
        verify(listener).checkpointFailed(eq(PARTITION_ID), eq(1L), cause.capture());
        assertThat(cause.getValue(), instanceOf(CheckpointStoreException.class));
        assertThat(cause.getValue().getCause(), instanceOf(TimeoutException.class));
        assertThat(context.lockSnapshot(PARTITION_ID).get().pendingCount(), equalTo(1));
    }

    @Test
    public void testConcurrentPartitionsWriteInOrderWithoutOverlap() throws Exception {
        final int partitions = 4;
        final long completionsPerPartition = 200L;
        store.writeLatencyMillis(1L);
        config.checkpointMessageCount(10);
        context = new ProcessorLockContext(
                config,
                new NullMetricsFactory(),
                now::get,
                pool(Executors.newFixedThreadPool(partitions)),
                pool(Executors.newCachedThreadPool()),
                intervalScheduler);
        final ExecutorService workers = pool(Executors.newFixedThreadPool(partitions));

        final List<Future<?>> results = new ArrayList<>();
        for (int p = 0; p < partitions; p++) {
            final String partitionId = Integer.toString(p);
            context.addPartition(partitionId, null);
            results.add(workers.submit(() -> {
                for (long sequenceNumber = 1; sequenceNumber <= completionsPerPartition; sequenceNumber++) {
                    final FlushDecision decision = context.completeMessage(partitionId, sequenceNumber);
                    assertThat(decision, not(FlushDecision.REJECTED));
                    assertThat(decision, not(FlushDecision.DROPPED));
                }
            }));
        }
        for (Future<?> result : results) {
            result.get(30, TimeUnit.SECONDS);
        }
        for (int p = 0; p < partitions; p++) {
            assertTrue(context.closePartition(Integer.toString(p)));
        }

        assertFalse(store.overlappingWriteSeen());
        for (int p = 0; p < partitions; p++) {
            final List<Long> written = store.writes(Integer.toString(p));
            for (int i = 1; i < written.size(); i++) {
                assertThat(written.get(i), greaterThanOrEqualTo(written.get(i - 1)));
            }
            assertThat(written.get(written.size() - 1), equalTo(completionsPerPartition));
        }
    }

    @Test
    public void testTimedOutWriteStillRunningBlocksNextAttempt() throws Exception {
        store.uninterruptibleLatencyMillis(300L);
        config.checkpointMessageCount(1).flushMaxAttempts(3).flushTimeout(Duration.ofMillis(50));
        context = new ProcessorLockContext(
                config,
                new NullMetricsFactory(),
                now::get,
                MoreExecutors.newDirectExecutorService(),
                pool(Executors.newCachedThreadPool()),
                intervalScheduler);
        context.addPartition(PARTITION_ID, null);

        context.completeMessage(PARTITION_ID, 1L);

        assertThat(store.attempts(), equalTo(1));
        verify(listener).checkpointFailed(eq(PARTITION_ID), eq(1L), any(CheckpointStoreException.class));

        store.uninterruptibleLatencyMillis(0L);
        awaitCondition(() -> store.writes(PARTITION_ID).contains(1L));
        assertThat(context.completeMessage(PARTITION_ID, 2L), equalTo(FlushDecision.FLUSH));

        assertThat(store.writes(PARTITION_ID), contains(1L, 2L));
        assertThat(store.attempts(), equalTo(2));
        assertFalse(store.overlappingWriteSeen());
        verify(listener).checkpointWritten(PARTITION_ID, 2L);
    }

    @Test
    public void testCompletionNotBlockedBySlowFlush() throws Exception {
        final CountDownLatch gate = new CountDownLatch(1);
        store.blockWritesUntil(gate);
        config.checkpointMessageCount(1);
        context = new ProcessorLockContext(
                config,
                new NullMetricsFactory(),
                now::get,
                pool(Executors.newCachedThreadPool()),
                pool(Executors.newCachedThreadPool()),
                intervalScheduler);
        context.addPartition(PARTITION_ID, null);
        context.completeMessage(PARTITION_ID, 1L);
        awaitCondition(() -> store.attempts() == 1);

        final long start = System.nanoTime();
        assertThat(context.completeMessage(PARTITION_ID, 2L), equalTo(FlushDecision.FLUSH));
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), lessThan(200L));
        assertThat(store.attempts(), equalTo(1));

        gate.countDown();
        awaitCondition(() -> store.writes(PARTITION_ID).size() == 2);
        assertThat(store.writes(PARTITION_ID), contains(1L, 2L));
        assertFalse(store.overlappingWriteSeen());
    }

    @Test
    public void testCloseBoundedWhileFlushStuck() throws Exception {
        store.uninterruptibleLatencyMillis(1000L);
        config.checkpointMessageCount(1).closeFlushTimeout(Duration.ofMillis(100));
        context = new ProcessorLockContext(
                config,
                new NullMetricsFactory(),
                now::get,
                pool(Executors.newCachedThreadPool()),
                pool(Executors.newCachedThreadPool()),
                intervalScheduler);
        context.addPartition(PARTITION_ID, null);
        context.completeMessage(PARTITION_ID, 1L);
        awaitCondition(() -> store.attempts() == 1);
        context.completeMessage(PARTITION_ID, 2L);

        final long start = System.nanoTime();
        assertFalse(context.closePartition(PARTITION_ID));
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), lessThan(600L));

        verify(listener).checkpointFailed(eq(PARTITION_ID), eq(2L), any(CheckpointStoreException.class));
        assertFalse(context.ownedPartitions().contains(PARTITION_ID));
        assertThat(store.attempts(), equalTo(1));
    }

    @Test
    public void testCloseWaitsForInFlightFlushThenDrainsRemainder() throws Exception {
        final CountDownLatch gate = new CountDownLatch(1);
        store.blockWritesUntil(gate);
        config.checkpointMessageCount(1);
        context = new ProcessorLockContext(
                config,
                new NullMetricsFactory(),
                now::get,
                pool(Executors.newCachedThreadPool()),
                pool(Executors.newCachedThreadPool()),
                intervalScheduler);
        context.addPartition(PARTITION_ID, null);
        context.completeMessage(PARTITION_ID, 1L);
        awaitCondition(() -> store.attempts() == 1);
        context.completeMessage(PARTITION_ID, 2L);
        final ScheduledExecutorService releaser = Executors.newSingleThreadScheduledExecutor();
        pools.add(releaser);
        releaser.schedule(gate::countDown, 50, TimeUnit.MILLISECONDS);

        assertTrue(context.closePartition(PARTITION_ID));

        assertThat(store.writes(PARTITION_ID), contains(1L, 2L));
        assertFalse(store.overlappingWriteSeen());
        verify(listener).checkpointWritten(PARTITION_ID, 1L);
        verify(listener).checkpointWritten(PARTITION_ID, 2L);
        verify(listener, never()).checkpointFailed(any(), anyLong(), any());
    }

    @Test
    public void testReinitializationDuringCloseDrainReplacesLock() throws Exception {
        final CountDownLatch gate = new CountDownLatch(1);
        store.blockWritesUntil(gate);
        context = new ProcessorLockContext(
                config,
                new NullMetricsFactory(),
                now::get,
                MoreExecutors.newDirectExecutorService(),
                pool(Executors.newCachedThreadPool()),
                intervalScheduler);
        final ExecutorService workers = pool(Executors.newFixedThreadPool(2));
        context.addPartition(PARTITION_ID, null);
        context.completeMessage(PARTITION_ID, 1L);

        final Future<Boolean> closed = workers.submit(() -> context.closePartition(PARTITION_ID));
        awaitCondition(() -> store.attempts() == 1);
        assertThat(context.lockSnapshot(PARTITION_ID).get().state(), equalTo(PartitionLockState.CLOSING));
        final Future<Boolean> added = workers.submit(() -> context.addPartition(PARTITION_ID, 1L));
        gate.countDown();

        assertTrue(closed.get(5, TimeUnit.SECONDS));
        assertTrue(added.get(5, TimeUnit.SECONDS));
        final PartitionLockSnapshot snapshot = context.lockSnapshot(PARTITION_ID).get();
        assertThat(snapshot.state(), equalTo(PartitionLockState.ACTIVE));
        assertThat(snapshot.pendingPosition(), equalTo(1L));
        assertThat(context.completeMessage(PARTITION_ID, 2L), equalTo(FlushDecision.NONE));
        assertThat(context.ownedPartitions(), hasItem(PARTITION_ID));
    }

    @Test
    public void testReinitializationFromDrainingThreadReplacesLockAfterCloseBudget() {
        final AtomicReference<ProcessorLockContext> contextReference = new AtomicReference<>();
        final List<Boolean> addedDuringDrain = new ArrayList<>();
        final CheckpointStore reinitializingStore = (partitionId, sequenceNumber) ->
                addedDuringDrain.add(contextReference.get().addPartition(partitionId, sequenceNumber));
        contextReference.set(directContext(new CheckpointConfig(reinitializingStore)
                .closeFlushTimeout(Duration.ofMillis(20))
                .flushBackoff(Duration.ZERO)));
        context = contextReference.get();
        context.addPartition(PARTITION_ID, null);
        context.completeMessage(PARTITION_ID, 10L);

        assertTrue(context.closePartition(PARTITION_ID));

        assertThat(addedDuringDrain, contains(true));
        final PartitionLockSnapshot snapshot = context.lockSnapshot(PARTITION_ID).get();
        assertThat(snapshot.state(), equalTo(PartitionLockState.ACTIVE));
        assertThat(snapshot.pendingPosition(), equalTo(10L));
        assertThat(context.completeMessage(PARTITION_ID, 11L), equalTo(FlushDecision.NONE));
    }

    private void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within 5 seconds");
            }
            Thread.sleep(5L);
        }
    }

    private ProcessorLockContext directContext(CheckpointConfig checkpointConfig) {
        return new ProcessorLockContext(
                checkpointConfig,
                new NullMetricsFactory(),
                now::get,
                MoreExecutors.newDirectExecutorService(),
                MoreExecutors.newDirectExecutorService(),
                intervalScheduler);
    }

    private ExecutorService pool(ExecutorService pool) {
        pools.add(pool);
        return pool;
    }
}

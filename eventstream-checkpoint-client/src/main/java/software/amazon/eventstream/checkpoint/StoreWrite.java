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

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.Getter;
import lombok.experimental.Accessors;
import software.amazon.eventstream.processor.CheckpointStore;

/**
 * A single {@link CheckpointStore#writeCheckpoint(String, long)} call submitted to the store executor.
 *
 * <p>A cancelled {@link java.util.concurrent.Future} reports itself done while the store call may still be running;
 * this tracks the call itself. It counts as finished once the call returns, or once it is abandoned before it
 * started.</p>
 */
@Accessors(fluent = true)
class StoreWrite implements Callable<Void> {
    private static final int PENDING = 0;
    private static final int RUNNING = 1;
    private static final int ABANDONED = 2;

    private final CheckpointStore checkpointStore;
    @Getter
    private final String partitionId;
    @Getter
    private final long sequenceNumber;

    private final AtomicInteger state = new AtomicInteger(PENDING);
    private final CountDownLatch finished = new CountDownLatch(1);

    StoreWrite(CheckpointStore checkpointStore, String partitionId, long sequenceNumber) {
        this.checkpointStore = checkpointStore;
        this.partitionId = partitionId;
        this.sequenceNumber = sequenceNumber;
    }

    @Override
    public Void call() throws Exception {
        if (!state.compareAndSet(PENDING, RUNNING)) {
            return null;
        }
        try {
            checkpointStore.writeCheckpoint(partitionId, sequenceNumber);
            return null;
        } finally {
            finished.countDown();
        }
    }

    /**
     * Marks a write whose future was given up on. A write that never started will not start any more.
     */
    void abandon() {
        if (state.compareAndSet(PENDING, ABANDONED)) {
            finished.countDown();
        }
    }

    boolean isFinished() {
        return finished.getCount() == 0;
    }

    boolean awaitFinished(long timeoutNanos) throws InterruptedException {
        return finished.await(timeoutNanos, TimeUnit.NANOSECONDS);
    }
}

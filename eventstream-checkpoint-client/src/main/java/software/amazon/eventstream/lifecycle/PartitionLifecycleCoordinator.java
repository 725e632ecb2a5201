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
package software.amazon.eventstream.lifecycle;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import software.amazon.eventstream.checkpoint.ProcessorLockContext;
import software.amazon.eventstream.common.StartingPosition;
import software.amazon.eventstream.exceptions.CustomerApplicationException;
import software.amazon.eventstream.lifecycle.events.PartitionClosingEvent;
import software.amazon.eventstream.lifecycle.events.PartitionInitializingEvent;
import software.amazon.eventstream.metrics.MetricsFactory;
import software.amazon.eventstream.metrics.MetricsLevel;
import software.amazon.eventstream.metrics.MetricsScope;
import software.amazon.eventstream.metrics.MetricsUtil;
import software.amazon.eventstream.processor.PartitionClosingHandler;
import software.amazon.eventstream.processor.PartitionInitializingHandler;

/**
 * Entry point for partition lifecycle notifications. The checkpoint lock is always brought up to date before any
 * application handler runs, and both notifications return only once the lock transition is complete.
 */
@Slf4j
public class PartitionLifecycleCoordinator {
    static final String PARTITION_CLOSING_OPERATION = "PartitionClosing";
    static final String CLOSE_REASON_DIMENSION_NAME = "CloseReason";

    private final ProcessorLockContext lockContext;
    private final LifecycleConfig lifecycleConfig;
    private final MetricsFactory metricsFactory;

    public PartitionLifecycleCoordinator(
            @NonNull ProcessorLockContext lockContext,
            @NonNull LifecycleConfig lifecycleConfig,
            @NonNull MetricsFactory metricsFactory) {
        this.lockContext = lockContext;
        this.lifecycleConfig = lifecycleConfig;
        this.metricsFactory = metricsFactory;
    }

    /**
     * Creates the partition's checkpoint lock, then invokes the registered initializing handler.
     *
     * @throws CustomerApplicationException if the application handler throws; the lock already exists
     */
    public void partitionInitializing(@NonNull PartitionInitializingEvent event) throws CustomerApplicationException {
        final String partitionId = event.partitionId();
        final StartingPosition startingPosition = event.defaultStartingPosition();
        log.info("Partition: {} initializing, starting position: {}", partitionId, startingPosition);

        lockContext.addPartition(partitionId, startingPosition.sequenceNumber().orElse(null));

        if (lifecycleConfig.partitionInitializingHandler().isPresent()) {
            final PartitionInitializingHandler handler =
                    lifecycleConfig.partitionInitializingHandler().get();
            try {
                handler.partitionInitializing(event);
            } catch (Exception e) {
                log.error("Partition: {} application initializing handler failed", partitionId, e);
                throw new CustomerApplicationException(
                        "Partition initializing handler failed for partition " + partitionId, e);
            }
        }
    }

    /**
     * Drains and removes the partition's checkpoint lock, then invokes the registered closing handler. Blocks until
     * the drain has concluded, so the caller must not release ownership of the partition before this returns.
     *
     * @throws CustomerApplicationException if the application handler throws; the lock is already removed
     */
    public void partitionClosing(@NonNull PartitionClosingEvent event) throws CustomerApplicationException {
        final String partitionId = event.partitionId();
        log.info("Partition: {} closing, reason: {}", partitionId, event.reason());

        final MetricsScope scope = MetricsUtil.createMetricsWithOperation(metricsFactory, PARTITION_CLOSING_OPERATION);
        MetricsUtil.addPartitionId(scope, partitionId);
        scope.addDimension(CLOSE_REASON_DIMENSION_NAME, event.reason().name());
        final long startTime = System.currentTimeMillis();
        boolean drained = false;
        try {
            drained = lockContext.closePartition(partitionId);
        } finally {
            MetricsUtil.addSuccessAndLatency(scope, drained, startTime, MetricsLevel.SUMMARY);
            MetricsUtil.endScope(scope);
        }

        if (lifecycleConfig.partitionClosingHandler().isPresent()) {
            final PartitionClosingHandler handler = lifecycleConfig.partitionClosingHandler().get();
            try {
                handler.partitionClosing(event);
            } catch (Exception e) {
                log.error("Partition: {} application closing handler failed", partitionId, e);
                throw new CustomerApplicationException(
                        "Partition closing handler failed for partition " + partitionId, e);
            }
        }
    }
}

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
package software.amazon.eventstream.coordinator;

import com.google.common.annotations.VisibleForTesting;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import software.amazon.eventstream.checkpoint.CheckpointConfig;
import software.amazon.eventstream.checkpoint.FlushDecision;
import software.amazon.eventstream.checkpoint.ProcessorLockContext;
import software.amazon.eventstream.lifecycle.LifecycleConfig;
import software.amazon.eventstream.lifecycle.PartitionLifecycleCoordinator;
import software.amazon.eventstream.metrics.MetricsConfig;
import software.amazon.eventstream.metrics.MetricsFactory;
import software.amazon.eventstream.metrics.MetricsScope;
import software.amazon.eventstream.metrics.MetricsUtil;

/**
 * Hosts checkpoint coordination for one consumer. Message processing reports completions through
 * {@link #completeMessage(String, long)}; the partition lifecycle source binds to {@link #lifecycleCoordinator()}.
 */
@Slf4j
@Getter
@Accessors(fluent = true)
public class CheckpointCoordinator {
    private final CheckpointConfig checkpointConfig;
    private final LifecycleConfig lifecycleConfig;
    private final MetricsConfig metricsConfig;
    private final CoordinatorConfig coordinatorConfig;

    @Getter(AccessLevel.PACKAGE)
    private final ProcessorLockContext lockContext;

    private final PartitionLifecycleCoordinator lifecycleCoordinator;

    public CheckpointCoordinator(
            @NonNull CheckpointConfig checkpointConfig,
            @NonNull LifecycleConfig lifecycleConfig,
            @NonNull MetricsConfig metricsConfig,
            @NonNull CoordinatorConfig coordinatorConfig) {
        this(
                checkpointConfig,
                lifecycleConfig,
                metricsConfig,
                coordinatorConfig,
                ProcessorLockContext.create(
                        checkpointConfig, consumerMetricsFactory(metricsConfig.metricsFactory(), coordinatorConfig)));
    }

    @VisibleForTesting
    CheckpointCoordinator(
            @NonNull CheckpointConfig checkpointConfig,
            @NonNull LifecycleConfig lifecycleConfig,
            @NonNull MetricsConfig metricsConfig,
            @NonNull CoordinatorConfig coordinatorConfig,
            @NonNull ProcessorLockContext lockContext) {
        this.checkpointConfig = checkpointConfig;
        this.lifecycleConfig = lifecycleConfig;
        this.metricsConfig = metricsConfig;
        this.coordinatorConfig = coordinatorConfig;
        this.lockContext = lockContext;
        this.lifecycleCoordinator = new PartitionLifecycleCoordinator(
                lockContext,
                lifecycleConfig,
                consumerMetricsFactory(metricsConfig.metricsFactory(), coordinatorConfig));
    }

    /**
     * Starts periodic interval checkpointing. Safe to call more than once.
     */
    public void start() {
        log.info(
                "Starting checkpoint coordinator for event hub {}, consumer group {}",
                coordinatorConfig.eventHubName(),
                coordinatorConfig.consumerGroup());
        lockContext.start();
    }

    /**
     * Records a fully processed event. See {@link ProcessorLockContext#completeMessage(String, long)}.
     */
    public FlushDecision completeMessage(@NonNull String partitionId, long sequenceNumber) {
        return lockContext.completeMessage(partitionId, sequenceNumber);
    }

    /**
     * Stops interval checkpointing and waits up to {@link CheckpointConfig#shutdownGracePeriod()} for in-flight
     * flushes. Partitions should be closed through the lifecycle coordinator first so their positions are drained.
     */
    public void shutdown() {
        if (lockContext.isShutdown()) {
            log.warn(
                    "Checkpoint coordinator for event hub {}, consumer group {} already shut down",
                    coordinatorConfig.eventHubName(),
                    coordinatorConfig.consumerGroup());
            return;
        }
        log.info(
                "Shutting down checkpoint coordinator for event hub {}, consumer group {}",
                coordinatorConfig.eventHubName(),
                coordinatorConfig.consumerGroup());
        lockContext.shutdown();
        log.info("Checkpoint coordinator shut down");
    }

    private static MetricsFactory consumerMetricsFactory(
            final MetricsFactory metricsFactory, final CoordinatorConfig coordinatorConfig) {
        return () -> {
            final MetricsScope scope = metricsFactory.createMetrics();
            scope.addDimension(MetricsUtil.EVENT_HUB_DIMENSION_NAME, coordinatorConfig.eventHubName());
            scope.addDimension(MetricsUtil.CONSUMER_GROUP_DIMENSION_NAME, coordinatorConfig.consumerGroup());
            return scope;
        };
    }
}

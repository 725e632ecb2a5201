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
package software.amazon.eventstream.common;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import lombok.experimental.Accessors;
import software.amazon.eventstream.checkpoint.CheckpointConfig;
import software.amazon.eventstream.coordinator.CoordinatorConfig;
import software.amazon.eventstream.lifecycle.LifecycleConfig;
import software.amazon.eventstream.metrics.MetricsConfig;
import software.amazon.eventstream.processor.CheckpointStore;

/**
 * This Builder is useful to create all configurations for checkpoint coordination with default values.
 */
@Getter
@ToString
@EqualsAndHashCode
@Accessors(fluent = true)
public class ConfigsBuilder {
    /**
     * Name of the event hub being consumed.
     */
    @NonNull
    private final String eventHubName;

    /**
     * Consumer group the partitions are read under.
     */
    @NonNull
    private final String consumerGroup;

    /**
     * Store partition checkpoints are written to.
     */
    @NonNull
    private final CheckpointStore checkpointStore;

    public ConfigsBuilder(
            @NonNull String eventHubName, @NonNull String consumerGroup, @NonNull CheckpointStore checkpointStore) {
        this.eventHubName = eventHubName;
        this.consumerGroup = consumerGroup;
        this.checkpointStore = checkpointStore;
    }

    /**
     * Creates a new CheckpointConfig
     *
     * @return CheckpointConfig
     */
    public CheckpointConfig checkpointConfig() {
        return new CheckpointConfig(checkpointStore());
    }

    /**
     * Creates a new CoordinatorConfig
     *
     * @return CoordinatorConfig
     */
    public CoordinatorConfig coordinatorConfig() {
        return new CoordinatorConfig(eventHubName(), consumerGroup());
    }

    /**
     * Creates a new LifecycleConfig
     *
     * @return LifecycleConfig
     */
    public LifecycleConfig lifecycleConfig() {
        return new LifecycleConfig();
    }

    /**
     * Creates a new MetricsConfig
     *
     * @return MetricsConfig
     */
    public MetricsConfig metricsConfig() {
        return new MetricsConfig();
    }
}

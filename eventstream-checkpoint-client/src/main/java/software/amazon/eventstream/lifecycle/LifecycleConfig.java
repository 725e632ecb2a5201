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

import java.util.Optional;

import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import lombok.experimental.Accessors;
import software.amazon.eventstream.processor.PartitionClosingHandler;
import software.amazon.eventstream.processor.PartitionInitializingHandler;

/**
 * Used to register application handlers for partition lifecycle notifications. Each handler may be registered at
 * most once, before the coordinator is created.
 */
@Getter
@ToString
@Accessors(fluent = true)
public class LifecycleConfig {
    /**
     * Invoked after the checkpoint lock of a newly owned partition has been created.
     *
     * <p>Default value: {@link Optional#empty()}</p>
     */
    private Optional<PartitionInitializingHandler> partitionInitializingHandler = Optional.empty();

    /**
     * Invoked after the checkpoint lock of a relinquished partition has been drained and removed.
     *
     * <p>Default value: {@link Optional#empty()}</p>
     */
    private Optional<PartitionClosingHandler> partitionClosingHandler = Optional.empty();

    public LifecycleConfig onPartitionInitializing(@NonNull PartitionInitializingHandler handler) {
        if (partitionInitializingHandler.isPresent()) {
            throw new IllegalStateException(
                    "Partition initializing event handler may not be specified more than once.");
        }
        partitionInitializingHandler = Optional.of(handler);
        return this;
    }

    public LifecycleConfig onPartitionClosing(@NonNull PartitionClosingHandler handler) {
        if (partitionClosingHandler.isPresent()) {
            throw new IllegalStateException("Partition closing event handler may not be specified more than once.");
        }
        partitionClosingHandler = Optional.of(handler);
        return this;
    }
}

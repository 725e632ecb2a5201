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

import lombok.Data;
import lombok.NonNull;
import lombok.experimental.Accessors;

/**
 * Used to identify the consumer that owns the coordinator.
 */
@Data
@Accessors(fluent = true)
public class CoordinatorConfig {
    /**
     * Name of the event hub whose partitions are consumed. Added as a dimension to every metric.
     */
    @NonNull
    private final String eventHubName;

    /**
     * Consumer group the partitions are read under. Added as a dimension to every metric.
     */
    @NonNull
    private final String consumerGroup;
}

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
package software.amazon.eventstream.lifecycle.events;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import lombok.experimental.Accessors;
import software.amazon.eventstream.lifecycle.CloseReason;

/**
 * Notification that this consumer is relinquishing a partition. By the time an application handler sees it, any
 * pending checkpoint of the partition has been drained.
 */
@Builder
@Accessors(fluent = true)
@Getter
@EqualsAndHashCode
@ToString
public class PartitionClosingEvent {
    @NonNull
    private final String partitionId;

    @NonNull
    private final CloseReason reason;
}

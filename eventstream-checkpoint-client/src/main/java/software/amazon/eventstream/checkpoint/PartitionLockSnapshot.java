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

import java.util.Optional;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Point in time view of a {@link PartitionLock}, safe to hand out of the partition's exclusive section.
 */
@Value
@Accessors(fluent = true)
public class PartitionLockSnapshot {
    String partitionId;
    Long pendingPosition;
    int pendingCount;
    long lastFlushAtMillis;
    Long lastFlushedPosition;
    PartitionLockState state;

    public Optional<Long> pendingPositionOptional() {
        return Optional.ofNullable(pendingPosition);
    }

    public Optional<Long> lastFlushedPositionOptional() {
        return Optional.ofNullable(lastFlushedPosition);
    }
}

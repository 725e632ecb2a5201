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
package software.amazon.eventstream.processor;

import software.amazon.eventstream.exceptions.CheckpointStoreException;

/**
 * Durable storage for partition checkpoints (e.g. a blob container or a table keyed by partition).
 */
public interface CheckpointStore {

    /**
     * Record the last processed sequence number of a partition. Upon failover or restart, processing of the
     * partition resumes from this point.
     *
     * <p>Implementations must be idempotent: the same partition and sequence number may be written more than once
     * when an earlier attempt failed or timed out.</p>
     *
     * @param partitionId Checkpoint is specified for this partition.
     * @param sequenceNumber Sequence number of the last event that was fully processed.
     * @throws CheckpointStoreException Thrown if the checkpoint could not be saved.
     * @throws InterruptedException Thrown if the write was abandoned while waiting on the store.
     */
    void writeCheckpoint(String partitionId, long sequenceNumber)
            throws CheckpointStoreException, InterruptedException;
}

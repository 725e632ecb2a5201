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

/**
 * Receives the outcome of every checkpoint write attempted on behalf of a partition.
 */
public interface CheckpointListener {

    /**
     * Invoked after a checkpoint has been durably written.
     *
     * @param partitionId partition the checkpoint belongs to
     * @param sequenceNumber the persisted sequence number
     */
    void checkpointWritten(String partitionId, long sequenceNumber);

    /**
     * Invoked once a checkpoint write has been given up on, after its attempts were exhausted or abandoned.
     * Processing of the partition continues; the next flush trigger writes again.
     *
     * @param partitionId partition the checkpoint belongs to
     * @param sequenceNumber the sequence number that could not be persisted
     * @param cause the last failure observed
     */
    void checkpointFailed(String partitionId, long sequenceNumber, Throwable cause);
}

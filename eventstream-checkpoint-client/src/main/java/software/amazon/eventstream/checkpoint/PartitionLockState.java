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

/**
 * States a {@link PartitionLock} moves through. A partition without a lock is uninitialized.
 *
 * <pre>
 *  (none) --addPartition--> ACTIVE --closePartition--> CLOSING --drain done--> REMOVED
 * </pre>
 */
public enum PartitionLockState {
    /**
     * Owned by this consumer; completions are recorded and flushed.
     */
    ACTIVE,
    /**
     * Close notification received; completions are dropped while the pending checkpoint is drained.
     */
    CLOSING,
    /**
     * Drain finished and the lock has left the context. Any reference still held is stale.
     */
    REMOVED
}

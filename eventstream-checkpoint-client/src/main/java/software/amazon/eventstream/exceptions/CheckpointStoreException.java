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
package software.amazon.eventstream.exceptions;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown when a checkpoint could not be persisted to the backing store. Writes are idempotent, so the caller may
 * retry the same partition and sequence number.
 */
@Getter
@Accessors(fluent = true)
public class CheckpointStoreException extends CheckpointException {
    private static final long serialVersionUID = 1L;

    private final String partitionId;

    /**
     * @param partitionId partition whose checkpoint could not be written
     * @param message provides more details about the cause and potential ways to debug/address.
     */
    public CheckpointStoreException(String partitionId, String message) {
        super(message);
        this.partitionId = partitionId;
    }

    /**
     * @param partitionId partition whose checkpoint could not be written
     * @param message provides more details about the cause and potential ways to debug/address.
     * @param cause underlying cause of the exception.
     */
    public CheckpointStoreException(String partitionId, String message, Throwable cause) {
        super(message, cause);
        this.partitionId = partitionId;
    }
}

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

/**
 * Abstract class for exceptions raised while recording the processing position of a partition.
 */
public abstract class CheckpointException extends Exception {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor.
     *
     * @param message Message with details of the exception.
     */
    public CheckpointException(String message) {
        super(message);
    }

    /**
     * Constructor.
     *
     * @param message Message with details of the exception.
     * @param cause Cause.
     */
    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}

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

import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Position in a partition from where processing starts when no checkpoint exists for it.
 */
@ToString
@EqualsAndHashCode
public class StartingPosition {

    public enum Type {
        /**
         * Start from the oldest event still retained by the partition.
         */
        EARLIEST,
        /**
         * Start after the most recent event in the partition.
         */
        LATEST,
        /**
         * Start from a specific sequence number.
         */
        SEQUENCE_NUMBER
    }

    private static final StartingPosition EARLIEST = new StartingPosition(Type.EARLIEST, null, false);
    private static final StartingPosition LATEST = new StartingPosition(Type.LATEST, null, false);

    private final Type type;
    private final Long sequenceNumber;
    private final boolean inclusive;

    /**
     * Scoped as private to convey the intent to use the static factory methods instead.
     */
    private StartingPosition(final Type type, final Long sequenceNumber, final boolean inclusive) {
        this.type = type;
        this.sequenceNumber = sequenceNumber;
        this.inclusive = inclusive;
    }

    public Type type() {
        return type;
    }

    /**
     * @return the sequence number to start from; present only for {@link Type#SEQUENCE_NUMBER}
     */
    public Optional<Long> sequenceNumber() {
        return Optional.ofNullable(sequenceNumber);
    }

    /**
     * @return true if the event at {@link #sequenceNumber()} is itself delivered
     */
    public boolean inclusive() {
        return inclusive;
    }

    public static StartingPosition earliest() {
        return EARLIEST;
    }

    public static StartingPosition latest() {
        return LATEST;
    }

    public static StartingPosition fromSequenceNumber(final long sequenceNumber, final boolean inclusive) {
        if (sequenceNumber < 0) {
            throw new IllegalArgumentException("Sequence number must not be negative: " + sequenceNumber);
        }
        return new StartingPosition(Type.SEQUENCE_NUMBER, sequenceNumber, inclusive);
    }
}

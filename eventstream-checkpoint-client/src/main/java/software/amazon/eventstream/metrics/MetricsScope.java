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
package software.amazon.eventstream.metrics;

import software.amazon.awssdk.services.cloudwatch.model.StandardUnit;

/**
 * Metrics of one checkpoint operation, such as a count flush or a close drain of a single partition. The partition,
 * event hub and consumer group are attached as dimensions, and the scope is published once when the operation ends.
 */
public interface MetricsScope {

    /**
     * Records a value regardless of the configured level. Values recorded under the same name are summed into one
     * datum.
     *
     * @param name metric name, for example {@code Success} or {@code Time}
     * @param value value to add
     * @param unit unit the value is expressed in
     */
    void addData(String name, double value, StandardUnit unit);

    /**
     * Records a value only when {@code level} is enabled by the {@link MetricsConfig}.
     *
     * @param name metric name
     * @param value value to add
     * @param unit unit the value is expressed in
     * @param level {@link MetricsLevel#SUMMARY} for per-flush outcomes, {@link MetricsLevel#DETAILED} for counters
     *        such as dropped completions
     */
    void addData(String name, double value, StandardUnit unit, MetricsLevel level);

    /**
     * @param name dimension name, such as {@code PartitionId}
     * @param value dimension value
     */
    void addDimension(String name, String value);

    /**
     * Publishes the recorded values. Nothing may be added afterwards.
     */
    void end();
}

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

import org.apache.commons.lang3.StringUtils;

import lombok.NonNull;
import software.amazon.awssdk.services.cloudwatch.model.StandardUnit;

public class MetricsUtil {
    public static final String OPERATION_DIMENSION_NAME = "Operation";
    public static final String PARTITION_ID_DIMENSION_NAME = "PartitionId";
    public static final String EVENT_HUB_DIMENSION_NAME = "EventHub";
    public static final String CONSUMER_GROUP_DIMENSION_NAME = "ConsumerGroup";
    private static final String TIME_METRIC = "Time";
    private static final String SUCCESS_METRIC = "Success";

    public static MetricsScope createMetricsWithOperation(
            @NonNull final MetricsFactory metricsFactory, @NonNull final String operation) {
        return createMetricScope(metricsFactory, operation);
    }

    private static MetricsScope createMetricScope(final MetricsFactory metricsFactory, final String operation) {
        final MetricsScope metricsScope = metricsFactory.createMetrics();
        if (StringUtils.isNotEmpty(operation)) {
            metricsScope.addDimension(OPERATION_DIMENSION_NAME, operation);
        }
        return metricsScope;
    }

    public static void addPartitionId(@NonNull final MetricsScope metricsScope, @NonNull final String partitionId) {
        metricsScope.addDimension(PARTITION_ID_DIMENSION_NAME, partitionId);
    }

    public static void addSuccessAndLatency(
            @NonNull final MetricsScope metricsScope,
            final boolean success,
            final long startTime,
            @NonNull final MetricsLevel metricsLevel) {
        metricsScope.addData(SUCCESS_METRIC, success ? 1 : 0, StandardUnit.COUNT, metricsLevel);
        metricsScope.addData(
                TIME_METRIC, System.currentTimeMillis() - startTime, StandardUnit.MILLISECONDS, metricsLevel);
    }

    public static void addCount(
            @NonNull final MetricsScope metricsScope,
            @NonNull final String name,
            final long count,
            @NonNull final MetricsLevel metricsLevel) {
        metricsScope.addData(name, count, StandardUnit.COUNT, metricsLevel);
    }

    public static void endScope(@NonNull final MetricsScope metricsScope) {
        metricsScope.end();
    }
}

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

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.google.common.annotations.VisibleForTesting;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.MetricDatum;
import software.amazon.awssdk.services.cloudwatch.model.StandardUnit;
import software.amazon.awssdk.services.cloudwatch.model.StatisticSet;

/**
 * A MetricsScope that accumulates data points by name, tracking min, max, sample count and sum, and writes them to
 * the log when ended.
 */
@Slf4j
@RequiredArgsConstructor
public class LogMetricsScope implements MetricsScope {
    private final MetricsLevel enabledLevel;

    private final Set<Dimension> dimensions = new LinkedHashSet<>();
    private final Map<String, MetricDatum> data = new LinkedHashMap<>();
    private boolean ended = false;

    @Override
    public void addData(String name, double value, StandardUnit unit) {
        ensureNotEnded("addData");
        final MetricDatum datum = data.get(name);
        final MetricDatum metricDatum;
        if (datum == null) {
            metricDatum = MetricDatum.builder()
                    .metricName(name)
                    .unit(unit)
                    .statisticValues(StatisticSet.builder()
                            .maximum(value)
                            .minimum(value)
                            .sampleCount(1.0)
                            .sum(value)
                            .build())
                    .build();
        } else {
            if (!datum.unit().equals(unit)) {
                throw new IllegalArgumentException("Cannot add to existing metric with different unit");
            }
            final StatisticSet old = datum.statisticValues();
            metricDatum = datum.toBuilder()
                    .statisticValues(old.toBuilder()
                            .maximum(Math.max(value, old.maximum()))
                            .minimum(Math.min(value, old.minimum()))
                            .sampleCount(old.sampleCount() + 1)
                            .sum(old.sum() + value)
                            .build())
                    .build();
        }
        data.put(name, metricDatum);
    }

    @Override
    public void addData(String name, double value, StandardUnit unit, MetricsLevel level) {
        if (enabledLevel.enables(level)) {
            addData(name, value, unit);
        } else {
            ensureNotEnded("addData");
        }
    }

    @Override
    public void addDimension(String name, String value) {
        ensureNotEnded("addDimension");
        dimensions.add(Dimension.builder().name(name).value(value).build());
    }

    @Override
    public void end() {
        if (ended) {
            throw new IllegalArgumentException("Cannot call MetricsScope.end() more than once on the same instance");
        }
        ended = true;
        if (data.isEmpty() || !log.isDebugEnabled()) {
            return;
        }

        final StringBuilder output = new StringBuilder("Metrics:\nDimensions: ");
        boolean needsComma = false;
        for (Dimension dimension : dimensions) {
            output.append(String.format("%s[%s: %s]", needsComma ? ", " : "", dimension.name(), dimension.value()));
            needsComma = true;
        }
        output.append("\n");
        for (MetricDatum datum : data.values()) {
            final StatisticSet statistics = datum.statisticValues();
            output.append(String.format(
                    "Name=%25s\tMin=%.2f\tMax=%.2f\tCount=%.2f\tSum=%.2f\tAvg=%.2f\tUnit=%s\n",
                    datum.metricName(),
                    statistics.minimum(),
                    statistics.maximum(),
                    statistics.sampleCount(),
                    statistics.sum(),
                    statistics.sum() / statistics.sampleCount(),
                    datum.unit()));
        }
        log.debug(output.toString());
    }

    @VisibleForTesting
    Map<String, MetricDatum> data() {
        return data;
    }

    @VisibleForTesting
    Set<Dimension> dimensions() {
        return dimensions;
    }

    private void ensureNotEnded(String operation) {
        if (ended) {
            throw new IllegalArgumentException("Cannot call " + operation + " after calling MetricsScope.end()");
        }
    }
}

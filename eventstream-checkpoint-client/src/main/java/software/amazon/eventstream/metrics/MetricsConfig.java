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

import lombok.Data;
import lombok.experimental.Accessors;

/**
 * Configures how checkpoint metrics are emitted.
 */
@Data
@Accessors(fluent = true)
public class MetricsConfig {
    /**
     * Data points below this level are discarded. {@link MetricsLevel#NONE} disables metrics entirely.
     *
     * <p>Default value: {@link MetricsLevel#SUMMARY}</p>
     */
    private MetricsLevel metricsLevel = MetricsLevel.SUMMARY;

    private MetricsFactory metricsFactory;

    public MetricsFactory metricsFactory() {
        if (metricsFactory == null) {
            metricsFactory = metricsLevel == MetricsLevel.NONE
                    ? new NullMetricsFactory()
                    : new LogMetricsFactory(metricsLevel);
        }
        return metricsFactory;
    }
}

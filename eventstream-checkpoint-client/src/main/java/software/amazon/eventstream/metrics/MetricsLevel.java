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

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Ordered metrics levels. Enabling a level also enables every level with a higher value; NONE turns metrics off.
 */
@RequiredArgsConstructor
@Getter
@Accessors(fluent = true)
public enum MetricsLevel {
    NONE(Integer.MAX_VALUE),

    /**
     * Flush outcomes and latencies.
     */
    SUMMARY(10000),

    /**
     * Per-completion counters such as dropped and rejected completions.
     */
    DETAILED(9000);

    private final int value;

    /**
     * @param level level of a data point
     * @return true if data points at the given level are emitted when this level is enabled
     */
    public boolean enables(MetricsLevel level) {
        return this != NONE && level.value >= value;
    }

    public static MetricsLevel fromName(String name) {
        return valueOf(name == null ? null : name.toUpperCase());
    }
}

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

public class NullMetricsScope implements MetricsScope {

    @Override
    public void addData(String name, double value, StandardUnit unit) {
    }

    @Override
    public void addData(String name, double value, StandardUnit unit, MetricsLevel level) {
    }

    @Override
    public void addDimension(String name, String value) {
    }

    @Override
    public void end() {
    }
}

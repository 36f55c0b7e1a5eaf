/**
 * Copyright 2026 The call-limits Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.calllimits.internal;

import io.calllimits.MetricRegistry;

import java.util.function.Supplier;

public final class EmptyMetricRegistry implements MetricRegistry {
    public static final EmptyMetricRegistry INSTANCE = new EmptyMetricRegistry();

    private static final SampleListener NOOP_LISTENER = value -> { };
    private static final Counter NOOP_COUNTER = () -> { };

    private EmptyMetricRegistry() {}

    @Override
    public SampleListener distribution(String id, String... tagNameValuePairs) {
        return NOOP_LISTENER;
    }

    @Override
    public void gauge(String id, Supplier<Number> supplier, String... tagNameValuePairs) {
    }

    @Override
    public Counter counter(String id, String... tagNameValuePairs) {
        return NOOP_COUNTER;
    }
}

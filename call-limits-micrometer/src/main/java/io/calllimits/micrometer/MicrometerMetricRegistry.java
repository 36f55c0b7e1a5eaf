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
package io.calllimits.micrometer;

import io.calllimits.MetricIds;
import io.calllimits.MetricRegistry;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * A Micrometer-based implementation of {@link MetricRegistry}.
 * <p>
 * Meter names are prefixed, with {@code call.limits.} unless another prefix is given.  The grant
 * delay, sampled in nanos, is recorded as a {@link Timer}.
 */
public class MicrometerMetricRegistry implements MetricRegistry {

    public static final String DEFAULT_PREFIX = "call.limits.";

    private final MeterRegistry meterRegistry;
    private final String prefix;

    public MicrometerMetricRegistry(MeterRegistry meterRegistry) {
        this(meterRegistry, DEFAULT_PREFIX);
    }

    /**
     * @param meterRegistry the Micrometer meter registry to use
     * @param prefix prepended to every meter name
     */
    public MicrometerMetricRegistry(MeterRegistry meterRegistry, String prefix) {
        this.meterRegistry = meterRegistry;
        this.prefix = prefix;
    }

    @Override
    public SampleListener distribution(String id, String... tagNameValuePairs) {
        if (MetricIds.GRANT_DELAY_NAME.equals(id)) {
            final Timer timer = Timer.builder(prefix + id)
                    .description("Time spent waiting for admission by a bucket")
                    .tags(tagNameValuePairs)
                    .register(meterRegistry);
            return value -> timer.record(value.longValue(), TimeUnit.NANOSECONDS);
        }

        final DistributionSummary summary = DistributionSummary.builder(prefix + id)
                .tags(tagNameValuePairs)
                .register(meterRegistry);
        return value -> summary.record(value.doubleValue());
    }

    @Override
    public void gauge(String id, Supplier<Number> supplier, String... tagNameValuePairs) {
        Gauge.builder(prefix + id, supplier)
                .tags(tagNameValuePairs)
                .register(meterRegistry);
    }

    @Override
    public Counter counter(String id, String... tagNameValuePairs) {
        return meterRegistry.counter(prefix + id, tagNameValuePairs)::increment;
    }
}

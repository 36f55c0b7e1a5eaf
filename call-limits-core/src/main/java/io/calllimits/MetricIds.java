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
package io.calllimits;

/**
 * Common metric ids
 */
public final class MetricIds {
    public static final String CALL_NAME = "call";
    public static final String GRANT_DELAY_NAME = "grant.delay";
    public static final String BUCKETS_NAME = "buckets";

    public static final String ID_TAG = "id";
    public static final String STATUS_TAG = "status";

    private MetricIds() {}
}

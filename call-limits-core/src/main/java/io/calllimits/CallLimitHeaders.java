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

import io.calllimits.bucket.BucketState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Names and parsing of the headers used to scope and correct call limits.
 */
public final class CallLimitHeaders {
    private static final Logger log = LoggerFactory.getLogger(CallLimitHeaders.class);

    /**
     * Request header holding the credential.  Its value is the bucket key.
     */
    public static final String ACCESS_TOKEN = "X-Shopify-Access-Token";

    /**
     * Response header reporting the bucket as {@code <currentFillLevel>/<capacity>}
     */
    public static final String API_CALL_LIMIT = "X-Shopify-Shop-Api-Call-Limit";

    /**
     * Extract the bucket state reported in a response.
     *
     * @return Reported state, or empty if the header is absent or malformed
     */
    public static Optional<BucketState> getBucketState(ResponseHeaders headers) {
        return headers.firstValue(API_CALL_LIMIT).flatMap(CallLimitHeaders::parseCallLimit);
    }

    /**
     * Parse a {@code <currentFillLevel>/<capacity>} header value.
     *
     * @return Parsed state, or empty if the value is malformed
     */
    public static Optional<BucketState> parseCallLimit(String value) {
        if (value == null) {
            return Optional.empty();
        }

        String[] parts = value.split("/", -1);
        if (parts.length != 2) {
            log.debug("Ignoring malformed {} header '{}'", API_CALL_LIMIT, value);
            return Optional.empty();
        }

        try {
            int currentFillLevel = Integer.parseInt(parts[0].trim());
            int capacity = Integer.parseInt(parts[1].trim());
            return Optional.of(new BucketState(capacity, currentFillLevel));
        } catch (IllegalArgumentException e) {
            // NumberFormatException or an out of range state
            log.debug("Ignoring malformed {} header '{}': {}", API_CALL_LIMIT, value, e.getMessage());
            return Optional.empty();
        }
    }

    private CallLimitHeaders() {}
}

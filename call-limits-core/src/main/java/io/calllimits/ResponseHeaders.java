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

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Read only view of the headers of a response.  Header names are matched case insensitively.
 * Fits {@code java.net.http.HttpHeaders::firstValue}.
 */
@FunctionalInterface
public interface ResponseHeaders {
    ResponseHeaders EMPTY = name -> Optional.empty();

    /**
     * @param name Header name
     * @return First value of the header, or empty if absent
     */
    Optional<String> firstValue(String name);

    static ResponseHeaders empty() {
        return EMPTY;
    }

    static ResponseHeaders of(Map<String, String> headers) {
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(headers);
        return name -> Optional.ofNullable(copy.get(name));
    }
}

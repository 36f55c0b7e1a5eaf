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

import io.calllimits.internal.Preconditions;

/**
 * Outcome of one attempt at executing a request, as reported by the transport.
 *
 * @param <T> Result type of a successful attempt
 */
public final class Attempt<T> {
    public enum Kind {
        /**
         * The remote service accepted the request
         */
        SUCCESS,

        /**
         * The remote service rejected the request because its rate limit was exceeded.  The
         * request may be retried.
         */
        RATE_LIMITED,

        /**
         * Any other failure.  Passed to the caller as is.
         */
        FAILURE
    }

    private static final Attempt<?> RATE_LIMITED = new Attempt<>(Kind.RATE_LIMITED, null, ResponseHeaders.empty(), null);

    public static <T> Attempt<T> success(T value, ResponseHeaders headers) {
        return new Attempt<>(Kind.SUCCESS, value, Preconditions.checkNotNull(headers, "headers"), null);
    }

    @SuppressWarnings("unchecked")
    public static <T> Attempt<T> rateLimited() {
        return (Attempt<T>) RATE_LIMITED;
    }

    public static <T> Attempt<T> failure(Throwable cause) {
        return new Attempt<>(Kind.FAILURE, null, ResponseHeaders.empty(), Preconditions.checkNotNull(cause, "cause"));
    }

    private final Kind kind;
    private final T value;
    private final ResponseHeaders headers;
    private final Throwable cause;

    private Attempt(Kind kind, T value, ResponseHeaders headers, Throwable cause) {
        this.kind = kind;
        this.value = value;
        this.headers = headers;
        this.cause = cause;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return Result of a {@link Kind#SUCCESS} attempt, null otherwise
     */
    public T getValue() {
        return value;
    }

    /**
     * @return Response headers of a {@link Kind#SUCCESS} attempt, empty otherwise
     */
    public ResponseHeaders getHeaders() {
        return headers;
    }

    /**
     * @return Cause of a {@link Kind#FAILURE} attempt, null otherwise
     */
    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        switch (kind) {
            case SUCCESS:
                return "Attempt [SUCCESS, value=" + value + "]";
            case FAILURE:
                return "Attempt [FAILURE, cause=" + cause + "]";
            default:
                return "Attempt [" + kind + "]";
        }
    }
}

/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.botical.workflow.resilience;

/**
 * Categories used to decide whether a failed attempt is retried.
 */
public enum ErrorCategory {

    /**
     * Network timeouts, rate limits, temporary upstream problems.
     */
    RETRYABLE_TRANSIENT,

    /**
     * Unrecognised failures; retried on the assumption that actions are idempotent.
     */
    RETRYABLE_IDEMPOTENT,

    /**
     * Client errors such as 4xx responses. Retrying cannot help.
     */
    NON_RETRYABLE_CLIENT,

    /**
     * Programming, definition and security errors.
     */
    NON_RETRYABLE_FATAL,

    /**
     * An upstream that is down, or an open circuit breaker.
     */
    CIRCUIT_BREAKER
}

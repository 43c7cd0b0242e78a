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

import org.springframework.lang.Nullable;

import java.time.Duration;

/**
 * The verdict of {@link ErrorClassifier} for one failure.
 *
 * @param category the error category
 * @param shouldRetry whether another attempt may succeed
 * @param shouldTriggerCircuitBreaker whether the failure indicates an unhealthy upstream
 * @param retryDelay a minimum delay before the next attempt, if the error suggests one
 * @param reason human-readable explanation, logged with each retry decision
 */
public record ErrorClassification(
        ErrorCategory category,
        boolean shouldRetry,
        boolean shouldTriggerCircuitBreaker,
        @Nullable Duration retryDelay,
        String reason
) {

    static ErrorClassification of(ErrorCategory category, boolean shouldRetry, boolean circuitBreaker, String reason) {
        return new ErrorClassification(category, shouldRetry, circuitBreaker, null, reason);
    }
}

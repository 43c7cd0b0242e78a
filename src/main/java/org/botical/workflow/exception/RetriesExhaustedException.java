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

package org.botical.workflow.exception;

import java.time.Instant;

/**
 * Signals that a step under the {@code retry} strategy gave up, either because every attempt
 * failed or because an attempt failed with a non-retryable error.
 * <p>
 * The message is the last attempt's error message.
 */
public class RetriesExhaustedException extends StepExecutionException {

    private final int attempts;
    private final Instant lastAttemptAt;

    public RetriesExhaustedException(String stepId, String message, int attempts, Instant lastAttemptAt,
                                     Throwable lastError) {
        super(stepId, message, lastError);
        this.attempts = attempts;
        this.lastAttemptAt = lastAttemptAt;
    }

    public int getAttempts() {
        return attempts;
    }

    public Instant getLastAttemptAt() {
        return lastAttemptAt;
    }
}

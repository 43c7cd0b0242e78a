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

import org.springframework.lang.Nullable;

/**
 * Exception raised when an action invocation fails, either because the action threw
 * or because it returned an {@code error} result.
 * <p>
 * Failures are recorded by the action's circuit breaker and are eligible for retry.
 */
public class ActionExecutionException extends StepExecutionException {

    private final String actionId;
    private final String code;

    public ActionExecutionException(String actionId, String message, @Nullable String code) {
        super(message);
        this.actionId = actionId;
        this.code = code;
    }

    public String getActionId() {
        return actionId;
    }

    /**
     * Optional error code reported by the action, e.g. an HTTP status such as {@code "503"}.
     */
    @Nullable
    public String getCode() {
        return code;
    }
}

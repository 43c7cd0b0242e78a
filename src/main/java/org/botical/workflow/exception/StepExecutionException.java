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
 * A step could not produce a result.
 * <p>
 * The message is persisted as the step error verbatim, so it carries no step prefix.
 */
public class StepExecutionException extends WorkflowException {

    @Nullable
    private final String stepId;

    public StepExecutionException(String message) {
        this(null, message, null);
    }

    public StepExecutionException(@Nullable String stepId, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.stepId = stepId;
    }

    /**
     * A step needs a host collaborator that the application did not provide.
     *
     * @param stepId the step
     * @param collaborator what is missing, e.g. {@code "Approval service"}
     */
    public static StepExecutionException notConfigured(String stepId, String collaborator) {
        return new StepExecutionException(stepId, collaborator + " is not configured", null);
    }

    @Nullable
    public String getStepId() {
        return stepId;
    }
}

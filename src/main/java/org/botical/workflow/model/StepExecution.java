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

package org.botical.workflow.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted state of one step within one execution.
 * <p>
 * There is exactly one record per (execution, step) pair. It is created on the first update
 * and never deleted during the run.
 *
 * @param id step execution id ({@code stx_...})
 * @param executionId the owning execution
 * @param stepId the step id from the definition
 * @param status current status
 * @param resolvedArgs materialized action arguments, kept for audit
 * @param output step output, when completed
 * @param error failure message, when failed
 * @param startedAt time the step started running
 * @param completedAt time the step reached a terminal status
 */
public record StepExecution(
        String id,
        String executionId,
        String stepId,
        StepStatus status,
        Map<String, Object> resolvedArgs,
        Object output,
        String error,
        Instant startedAt,
        Instant completedAt
) {

    public StepExecution {
        Objects.requireNonNull(executionId, "executionId cannot be null");
        Objects.requireNonNull(stepId, "stepId cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        if (resolvedArgs != null) {
            resolvedArgs = Collections.unmodifiableMap(new LinkedHashMap<>(resolvedArgs));
        }
    }

    /**
     * Creates a new pending step execution.
     */
    public static StepExecution create(String id, String executionId, String stepId) {
        return new StepExecution(id, executionId, stepId, StepStatus.PENDING,
                null, null, null, null, null);
    }

    /**
     * Applies a partial update.
     * <p>
     * Moving to {@code running} stamps {@code startedAt}; moving to a terminal status stamps {@code completedAt}.
     *
     * @param update the patch
     * @param now the current time
     * @return the updated step execution
     */
    public StepExecution apply(StepUpdate update, Instant now) {
        StepStatus newStatus = update.status() != null ? update.status() : status;
        Instant newStartedAt = startedAt;
        Instant newCompletedAt = completedAt;
        if (update.status() == StepStatus.RUNNING && startedAt == null) {
            newStartedAt = now;
        }
        if (update.status() != null && update.status().isTerminal()) {
            newCompletedAt = now;
        }
        return new StepExecution(
                id,
                executionId,
                stepId,
                newStatus,
                update.resolvedArgs() != null ? update.resolvedArgs() : resolvedArgs,
                update.output() != null ? update.output() : output,
                update.error() != null ? update.error() : error,
                newStartedAt,
                newCompletedAt
        );
    }
}

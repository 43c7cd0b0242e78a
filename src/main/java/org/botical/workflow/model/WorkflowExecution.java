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

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted record of one run of a workflow.
 * <p>
 * Status moves forward only: {@code pending -> running -> completed | failed}; a terminal
 * record is never rewritten.
 *
 * @param id execution id ({@code wfx_...})
 * @param workflowId the definition that was run
 * @param projectId the owning project
 * @param status current status
 * @param input the execution input after defaults were applied
 * @param output aggregate of every completed {@code resolve} step's output
 * @param error message of the fatal failure, when failed
 * @param startedAt creation time
 * @param completedAt time the execution reached a terminal status
 */
public record WorkflowExecution(
        String id,
        String workflowId,
        String projectId,
        ExecutionStatus status,
        Map<String, Object> input,
        Map<String, Object> output,
        String error,
        Instant startedAt,
        Instant completedAt
) {

    public WorkflowExecution {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(workflowId, "workflowId cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        input = copy(input);
        output = output == null ? null : copy(output);
    }

    /**
     * Creates a new pending execution.
     */
    public static WorkflowExecution create(String id, String workflowId, String projectId,
                                           Map<String, Object> input, Instant now) {
        return new WorkflowExecution(id, workflowId, projectId, ExecutionStatus.PENDING,
                input, null, null, now, null);
    }

    public WorkflowExecution withStatus(ExecutionStatus newStatus, Instant now) {
        return new WorkflowExecution(id, workflowId, projectId, newStatus, input, output, error, startedAt,
                newStatus.isTerminal() ? now : completedAt);
    }

    public WorkflowExecution complete(Map<String, Object> finalOutput, Instant now) {
        return new WorkflowExecution(id, workflowId, projectId, ExecutionStatus.COMPLETED,
                input, finalOutput, null, startedAt, now);
    }

    public WorkflowExecution fail(String errorMessage, Instant now) {
        return new WorkflowExecution(id, workflowId, projectId, ExecutionStatus.FAILED,
                input, output, errorMessage, startedAt, now);
    }

    /**
     * Gets the execution duration, or null while still active.
     */
    @JsonIgnore
    public Duration getDuration() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt);
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}

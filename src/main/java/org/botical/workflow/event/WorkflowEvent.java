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

package org.botical.workflow.event;

import org.botical.workflow.model.ExecutionStatus;
import org.botical.workflow.model.StepStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An event broadcast to connected clients.
 * <p>
 * The payload carries the fields of the wire event; {@code executionId}, {@code stepId} and
 * {@code status} are repeated in it so the payload alone is the complete message body.
 *
 * @param type the event type
 * @param payload the event body
 * @param timestamp when the event occurred
 */
public record WorkflowEvent(
        WorkflowEventType type,
        Map<String, Object> payload,
        Instant timestamp
) {

    public WorkflowEvent {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * Creates an execution status event.
     */
    public static WorkflowEvent execution(String executionId, ExecutionStatus status, Map<String, Object> data) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("executionId", executionId);
        payload.put("status", status.value());
        if (data != null) {
            payload.putAll(data);
        }
        return new WorkflowEvent(WorkflowEventType.EXECUTION, payload, Instant.now());
    }

    /**
     * Creates a step status event.
     */
    public static WorkflowEvent step(String executionId, String stepId, StepStatus status, Map<String, Object> data) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("executionId", executionId);
        payload.put("stepId", stepId);
        payload.put("status", status.value());
        if (data != null) {
            payload.putAll(data);
        }
        return new WorkflowEvent(WorkflowEventType.STEP, payload, Instant.now());
    }

    /**
     * Creates a user-facing notification event.
     */
    public static WorkflowEvent notification(String message, String variant) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", message);
        payload.put("variant", variant);
        return new WorkflowEvent(WorkflowEventType.NOTIFY, payload, Instant.now());
    }

    /**
     * Creates an approval-required event.
     */
    public static WorkflowEvent approvalRequired(String approvalId, String executionId, String stepId,
                                                 String message, List<String> approvers, Long timeout) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("approvalId", approvalId);
        payload.put("workflowExecutionId", executionId);
        payload.put("stepId", stepId);
        payload.put("message", message);
        payload.put("approvers", approvers);
        payload.put("timeout", timeout);
        return new WorkflowEvent(WorkflowEventType.APPROVAL_REQUIRED, payload, Instant.now());
    }

    public String executionId() {
        Object id = payload.containsKey("executionId") ? payload.get("executionId") : payload.get("workflowExecutionId");
        return id == null ? null : id.toString();
    }

    public String stepId() {
        Object id = payload.get("stepId");
        return id == null ? null : id.toString();
    }

    public String status() {
        Object status = payload.get("status");
        return status == null ? null : status.toString();
    }
}

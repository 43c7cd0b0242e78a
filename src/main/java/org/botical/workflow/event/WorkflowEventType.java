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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Types of events broadcast to connected clients.
 */
public enum WorkflowEventType {

    /**
     * An execution changed status.
     */
    EXECUTION("workflow.execution"),

    /**
     * A step changed status.
     */
    STEP("workflow.step"),

    /**
     * A notify step produced a user-facing notification.
     */
    NOTIFY("workflow.notify"),

    /**
     * An approval step created an approval request.
     */
    APPROVAL_REQUIRED("workflow.approval.required");

    private final String wireName;

    WorkflowEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}

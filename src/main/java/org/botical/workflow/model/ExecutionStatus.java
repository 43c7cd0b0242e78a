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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Represents the status of a workflow execution.
 */
public enum ExecutionStatus {

    /**
     * Execution record has been created but the run has not started.
     */
    PENDING,

    /**
     * Execution is running its step levels.
     */
    RUNNING,

    /**
     * All levels were attempted without a fatal step failure.
     */
    COMPLETED,

    /**
     * A fatal step failure or definition error aborted the run.
     */
    FAILED,

    /**
     * Execution was cancelled through the persistence layer. The engine never enters this state itself.
     */
    CANCELLED;

    /**
     * Checks if the execution is in a terminal state.
     *
     * @return true if the execution has ended
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExecutionStatus fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}

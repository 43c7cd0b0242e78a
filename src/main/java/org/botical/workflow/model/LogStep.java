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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Writes a message to the operational log. Never fails.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LogStep(
        String id,
        List<String> dependsOn,
        @JsonProperty("if") ConditionExpression condition,
        ArgBinding message
) implements WorkflowStep {

    public LogStep {
        dependsOn = WorkflowStep.normalizeDependencies(dependsOn);
    }

    public static LogStep of(String id, ArgBinding message) {
        return new LogStep(id, null, null, message);
    }

    @Override
    public StepType type() {
        return StepType.LOG;
    }
}

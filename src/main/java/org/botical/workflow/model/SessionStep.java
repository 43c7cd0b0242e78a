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
 * Spawns a child agent session, sends it a message and waits for the agent to finish.
 *
 * @param message the user turn to send; must resolve to a non-empty string
 * @param agent the agent name; defaults to the configured default agent
 * @param maxMessages upper bound on agent turns
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionStep(
        String id,
        List<String> dependsOn,
        @JsonProperty("if") ConditionExpression condition,
        ErrorHandling onError,
        ArgBinding agent,
        ArgBinding message,
        ArgBinding systemPrompt,
        ArgBinding providerId,
        ArgBinding modelId,
        ArgBinding maxMessages
) implements WorkflowStep {

    public SessionStep {
        dependsOn = WorkflowStep.normalizeDependencies(dependsOn);
    }

    public static SessionStep of(String id, ArgBinding message) {
        return new SessionStep(id, null, null, null, null, message, null, null, null, null);
    }

    @Override
    public StepType type() {
        return StepType.SESSION;
    }
}

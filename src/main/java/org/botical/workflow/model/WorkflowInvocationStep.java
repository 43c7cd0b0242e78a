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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs another workflow of the same project and waits for it to finish.
 * Exactly one of {@code workflowId} and {@code workflowName} must be given.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowInvocationStep(
        String id,
        List<String> dependsOn,
        @JsonProperty("if") ConditionExpression condition,
        ErrorHandling onError,
        ArgBinding workflowId,
        ArgBinding workflowName,
        Map<String, ArgBinding> input
) implements WorkflowStep {

    public WorkflowInvocationStep {
        dependsOn = WorkflowStep.normalizeDependencies(dependsOn);
        input = input == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(input));
    }

    public static WorkflowInvocationStep byId(String id, String workflowId, Map<String, ArgBinding> input) {
        return new WorkflowInvocationStep(id, null, null, null, ArgBinding.literal(workflowId), null, input);
    }

    public static WorkflowInvocationStep byName(String id, String workflowName, Map<String, ArgBinding> input) {
        return new WorkflowInvocationStep(id, null, null, null, null, ArgBinding.literal(workflowName), input);
    }

    @Override
    public StepType type() {
        return StepType.WORKFLOW;
    }
}

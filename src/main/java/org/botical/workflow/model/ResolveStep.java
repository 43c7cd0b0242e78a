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
 * Contributes keys to the execution's aggregate output.
 *
 * @param output bindings resolved into a flat object and merged into the final output
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResolveStep(
        String id,
        List<String> dependsOn,
        @JsonProperty("if") ConditionExpression condition,
        Map<String, ArgBinding> output
) implements WorkflowStep {

    public ResolveStep {
        dependsOn = WorkflowStep.normalizeDependencies(dependsOn);
        output = output == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(output));
    }

    public static ResolveStep of(String id, Map<String, ArgBinding> output) {
        return new ResolveStep(id, null, null, output);
    }

    public ResolveStep dependingOn(String... stepIds) {
        return new ResolveStep(id, List.of(stepIds), condition, output);
    }

    @Override
    public StepType type() {
        return StepType.RESOLVE;
    }
}

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
 * Invokes a registered action with resolved arguments.
 *
 * @param action the action id, e.g. {@code git.commit}
 * @param args argument bindings, resolved independently
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionStep(
        String id,
        List<String> dependsOn,
        @JsonProperty("if") ConditionExpression condition,
        ErrorHandling onError,
        String action,
        Map<String, ArgBinding> args
) implements WorkflowStep {

    public ActionStep {
        dependsOn = WorkflowStep.normalizeDependencies(dependsOn);
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    public static ActionStep of(String id, String action, Map<String, ArgBinding> args) {
        return new ActionStep(id, null, null, null, action, args);
    }

    public ActionStep withOnError(ErrorHandling errorHandling) {
        return new ActionStep(id, dependsOn, condition, errorHandling, action, args);
    }

    public ActionStep dependingOn(String... stepIds) {
        return new ActionStep(id, List.of(stepIds), condition, onError, action, args);
    }

    public ActionStep when(ConditionExpression expression) {
        return new ActionStep(id, dependsOn, expression, onError, action, args);
    }

    @Override
    public StepType type() {
        return StepType.ACTION;
    }
}

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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * One node in a workflow's step graph.
 * <p>
 * The set of kinds is closed: each variant is a record and {@link #type()} identifies it,
 * so step dispatch can be an exhaustive {@code switch}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ActionStep.class, name = "action"),
        @JsonSubTypes.Type(value = NotifyStep.class, name = "notify"),
        @JsonSubTypes.Type(value = LogStep.class, name = "log"),
        @JsonSubTypes.Type(value = ResolveStep.class, name = "resolve"),
        @JsonSubTypes.Type(value = RejectStep.class, name = "reject"),
        @JsonSubTypes.Type(value = SessionStep.class, name = "session"),
        @JsonSubTypes.Type(value = ApprovalStep.class, name = "approval"),
        @JsonSubTypes.Type(value = WorkflowInvocationStep.class, name = "workflow")
})
public sealed interface WorkflowStep permits ActionStep, NotifyStep, LogStep, ResolveStep, RejectStep,
        SessionStep, ApprovalStep, WorkflowInvocationStep {

    /**
     * Unique identifier within the definition.
     */
    String id();

    StepType type();

    /**
     * Ids of steps that must settle before this one runs. Never null.
     */
    List<String> dependsOn();

    /**
     * Optional gate; the step is skipped when it evaluates to false.
     */
    @Nullable
    ConditionExpression condition();

    /**
     * The failure policy. Only action, session and workflow steps carry one.
     */
    @Nullable
    default ErrorHandling onError() {
        return null;
    }

    static List<String> normalizeDependencies(@Nullable List<String> dependsOn) {
        return dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }
}

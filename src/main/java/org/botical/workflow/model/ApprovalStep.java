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
 * Requests human approval. The step completes immediately with a pending approval.
 *
 * @param approvers a binding resolving to a list of user ids; all project members when absent
 * @param timeout advisory timeout in milliseconds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApprovalStep(
        String id,
        List<String> dependsOn,
        @JsonProperty("if") ConditionExpression condition,
        ArgBinding message,
        ArgBinding approvers,
        ArgBinding timeout,
        ArgBinding autoApprove
) implements WorkflowStep {

    public ApprovalStep {
        dependsOn = WorkflowStep.normalizeDependencies(dependsOn);
    }

    public static ApprovalStep of(String id, ArgBinding message) {
        return new ApprovalStep(id, null, null, message, null, null, null);
    }

    @Override
    public StepType type() {
        return StepType.APPROVAL;
    }
}

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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of a workflow.
 * <p>
 * A definition is loaded once per execution and never mutated by the engine.
 *
 * @param id unique identifier of the workflow
 * @param projectId the owning project
 * @param name machine name, unique within the project
 * @param label human-readable name
 * @param description description of what the workflow does
 * @param category grouping used by clients
 * @param inputSchema declared input fields
 * @param steps the step graph in declaration order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowDefinition(
        String id,
        String projectId,
        String name,
        String label,
        String description,
        String category,
        WorkflowInputSchema inputSchema,
        List<WorkflowStep> steps
) {

    public WorkflowDefinition {
        Objects.requireNonNull(id, "id cannot be null");
        if (name == null) {
            name = id;
        }
        if (label == null) {
            label = name;
        }
        if (inputSchema == null) {
            inputSchema = WorkflowInputSchema.EMPTY;
        }
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /**
     * Finds a step by its ID.
     *
     * @param stepId the step ID
     * @return optional containing the step if found
     */
    public Optional<WorkflowStep> findStep(String stepId) {
        return steps.stream()
                .filter(s -> s.id().equals(stepId))
                .findFirst();
    }

    /**
     * Builder for WorkflowDefinition.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String projectId;
        private String name;
        private String label;
        private String description;
        private String category;
        private WorkflowInputSchema inputSchema = WorkflowInputSchema.EMPTY;
        private final List<WorkflowStep> steps = new ArrayList<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder inputSchema(WorkflowInputSchema inputSchema) {
            this.inputSchema = inputSchema;
            return this;
        }

        public Builder step(WorkflowStep step) {
            this.steps.add(step);
            return this;
        }

        public Builder steps(List<? extends WorkflowStep> steps) {
            this.steps.addAll(steps);
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(id, projectId, name, label, description, category, inputSchema, steps);
        }
    }
}

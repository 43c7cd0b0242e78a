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

package org.botical.workflow.service;

import org.botical.workflow.exception.WorkflowInputException;
import org.botical.workflow.model.InputFieldType;
import org.botical.workflow.model.WorkflowDefinition;
import org.botical.workflow.model.WorkflowInputField;
import org.botical.workflow.model.WorkflowInputSchema;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowInputValidatorTest {

    private final WorkflowInputValidator validator = new WorkflowInputValidator();

    private static final WorkflowDefinition DEFINITION = WorkflowDefinition.builder()
            .id("wf-deploy")
            .name("deploy")
            .inputSchema(WorkflowInputSchema.of(
                    WorkflowInputField.required("service", InputFieldType.STRING),
                    WorkflowInputField.optional("replicas", InputFieldType.NUMBER, 2),
                    WorkflowInputField.optional("dryRun", InputFieldType.BOOLEAN, null),
                    new WorkflowInputField("environment", InputFieldType.ENUM, "Environment", null, false,
                            "staging", List.of("staging", "production"))))
            .build();

    @Test
    void shouldApplyDefaultsAndKeepExtraKeys() {
        Map<String, Object> validated = validator.validate(DEFINITION, Map.of("service", "api", "extra", 1));

        assertThat(validated)
                .containsEntry("service", "api")
                .containsEntry("replicas", 2)
                .containsEntry("environment", "staging")
                .containsEntry("extra", 1)
                .doesNotContainKey("dryRun");
    }

    @Test
    void shouldReportEveryViolation() {
        Map<String, Object> input = new HashMap<>();
        input.put("replicas", "three");
        input.put("dryRun", "yes");
        input.put("environment", "qa");

        assertThatThrownBy(() -> validator.validate(DEFINITION, input))
                .isInstanceOfSatisfying(WorkflowInputException.class, e -> assertThat(e.getViolations())
                        .containsExactly(
                                "Missing required input: service",
                                "replicas must be a number",
                                "dryRun must be a boolean",
                                "environment must be one of [staging, production]"))
                .hasMessageStartingWith("Invalid input for workflow 'wf-deploy'");
    }

    @Test
    void shouldAcceptNullInputWhenNothingIsRequired() {
        WorkflowDefinition open = WorkflowDefinition.builder().id("wf-open").build();

        assertThat(validator.validate(open, null)).isEmpty();
    }
}

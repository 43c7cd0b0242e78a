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

import lombok.extern.slf4j.Slf4j;
import org.botical.workflow.exception.WorkflowInputException;
import org.botical.workflow.model.WorkflowDefinition;
import org.botical.workflow.model.WorkflowInputField;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks execution input against a workflow's input schema.
 */
@Slf4j
public class WorkflowInputValidator {

    /**
     * Applies schema defaults and validates the result.
     *
     * @param definition the workflow
     * @param input the caller's input, possibly null
     * @return a new map holding the input with defaults applied
     * @throws WorkflowInputException listing every violation
     */
    public Map<String, Object> validate(WorkflowDefinition definition, Map<String, Object> input) {
        Map<String, Object> effective = input == null ? new LinkedHashMap<>() : new LinkedHashMap<>(input);
        List<String> violations = new ArrayList<>();

        for (WorkflowInputField field : definition.inputSchema().fields()) {
            Object value = effective.get(field.name());
            if (value == null && field.defaultValue() != null) {
                value = field.defaultValue();
                effective.put(field.name(), value);
            }
            if (value == null) {
                if (field.required()) {
                    violations.add("Missing required input: " + field.name());
                }
                continue;
            }
            String violation = checkType(field, value);
            if (violation != null) {
                violations.add(violation);
            }
        }

        if (!violations.isEmpty()) {
            log.warn("WORKFLOW_INPUT_INVALID: workflowId={}, violations={}", definition.id(), violations);
            throw new WorkflowInputException(definition.id(), violations);
        }
        return effective;
    }

    private static String checkType(WorkflowInputField field, Object value) {
        switch (field.type()) {
            case STRING:
                return value instanceof String ? null : field.name() + " must be a string";
            case NUMBER:
                return value instanceof Number ? null : field.name() + " must be a number";
            case BOOLEAN:
                return value instanceof Boolean ? null : field.name() + " must be a boolean";
            case ENUM:
                if (!(value instanceof String)) {
                    return field.name() + " must be one of " + field.options();
                }
                return field.options().isEmpty() || field.options().contains(value)
                        ? null
                        : field.name() + " must be one of " + field.options();
            default:
                return null;
        }
    }
}

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
import java.util.Objects;

/**
 * One named field of a workflow's input schema.
 *
 * @param name the input key
 * @param type the expected value type
 * @param required whether the caller must supply a value when no default exists
 * @param defaultValue value applied when the caller omits the field
 * @param options allowed values for {@link InputFieldType#ENUM} fields
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowInputField(
        String name,
        InputFieldType type,
        String label,
        String description,
        boolean required,
        @JsonProperty("default") Object defaultValue,
        List<String> options
) {

    public WorkflowInputField {
        Objects.requireNonNull(name, "name cannot be null");
        if (type == null) {
            type = InputFieldType.STRING;
        }
        options = options == null ? List.of() : List.copyOf(options);
    }

    public static WorkflowInputField required(String name, InputFieldType type) {
        return new WorkflowInputField(name, type, name, null, true, null, null);
    }

    public static WorkflowInputField optional(String name, InputFieldType type, Object defaultValue) {
        return new WorkflowInputField(name, type, name, null, false, defaultValue, null);
    }
}

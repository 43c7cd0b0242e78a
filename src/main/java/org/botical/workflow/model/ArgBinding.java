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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.Objects;

/**
 * A deferred value reference resolved against the running execution.
 * <p>
 * Three forms exist on the wire:
 * <pre>
 * {"type": "literal", "value": ...}
 * {"type": "input", "path": "customer.email"}
 * {"type": "step", "stepId": "fetch", "path": "output.items.0"}
 * </pre>
 * Any other JSON value in a binding position is read as a literal, so
 * {@code "variant": "success"} and {@code "variant": {"type": "literal", "value": "success"}} are equivalent.
 */
@JsonDeserialize(using = ArgBindingDeserializer.class)
public sealed interface ArgBinding permits ArgBinding.Literal, ArgBinding.Input, ArgBinding.StepOutput {

    static ArgBinding literal(Object value) {
        return new Literal(value);
    }

    static ArgBinding input(String path) {
        return new Input(path);
    }

    static ArgBinding step(String stepId, String path) {
        return new StepOutput(stepId, path);
    }

    /**
     * An embedded value returned verbatim.
     */
    record Literal(Object value) implements ArgBinding {

        @JsonProperty("type")
        public String type() {
            return "literal";
        }
    }

    /**
     * A dot-path into the execution input. An empty path selects the whole input.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Input(String path) implements ArgBinding {

        @JsonProperty("type")
        public String type() {
            return "input";
        }
    }

    /**
     * A dot-path into the output of an earlier completed step.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record StepOutput(String stepId, String path) implements ArgBinding {

        public StepOutput {
            Objects.requireNonNull(stepId, "stepId cannot be null");
        }

        @JsonProperty("type")
        public String type() {
            return "step";
        }
    }
}

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
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Boolean expression tree gating a step's execution.
 * <p>
 * Leaves compare {@link ArgBinding}s; {@code and}, {@code or} and {@code not} nest recursively.
 * An expression with an unrecognised {@code op} is read as {@link Unknown}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "op",
        defaultImpl = ConditionExpression.Unknown.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = ConditionExpression.Equals.class, name = "equals"),
        @JsonSubTypes.Type(value = ConditionExpression.NotEquals.class, name = "notEquals"),
        @JsonSubTypes.Type(value = ConditionExpression.Contains.class, name = "contains"),
        @JsonSubTypes.Type(value = ConditionExpression.Exists.class, name = "exists"),
        @JsonSubTypes.Type(value = ConditionExpression.Truthy.class, name = "truthy"),
        @JsonSubTypes.Type(value = ConditionExpression.And.class, name = "and"),
        @JsonSubTypes.Type(value = ConditionExpression.Or.class, name = "or"),
        @JsonSubTypes.Type(value = ConditionExpression.Not.class, name = "not")
})
public sealed interface ConditionExpression permits
        ConditionExpression.Equals, ConditionExpression.NotEquals, ConditionExpression.Contains,
        ConditionExpression.Exists, ConditionExpression.Truthy, ConditionExpression.And,
        ConditionExpression.Or, ConditionExpression.Not, ConditionExpression.Unknown {

    record Equals(ArgBinding left, ArgBinding right) implements ConditionExpression {}

    record NotEquals(ArgBinding left, ArgBinding right) implements ConditionExpression {}

    record Contains(ArgBinding value, ArgBinding search) implements ConditionExpression {}

    record Exists(ArgBinding value) implements ConditionExpression {}

    record Truthy(ArgBinding value) implements ConditionExpression {}

    record And(List<ConditionExpression> conditions) implements ConditionExpression {
        public And {
            conditions = conditions == null ? List.of() : List.copyOf(conditions);
        }
    }

    record Or(List<ConditionExpression> conditions) implements ConditionExpression {
        public Or {
            conditions = conditions == null ? List.of() : List.copyOf(conditions);
        }
    }

    record Not(ConditionExpression condition) implements ConditionExpression {}

    /**
     * Placeholder for an operator this engine does not know. Evaluates to true.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    final class Unknown implements ConditionExpression {

        @Override
        public String toString() {
            return "Unknown[]";
        }
    }
}

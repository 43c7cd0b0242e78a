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

package org.botical.workflow.core;

import org.botical.workflow.action.ActionContext;
import org.botical.workflow.model.ArgBinding;
import org.botical.workflow.model.ConditionExpression;
import org.botical.workflow.model.WorkflowDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConditionEvaluatorTest {

    private final ConditionEvaluator evaluator = new ConditionEvaluator(new BindingResolver());
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("count", 3);
        input.put("label", "urgent: disk full");
        input.put("empty", "");
        input.put("nothing", null);
        input.put("items", List.of("a"));
        context = new ExecutionContext("wfx_1", WorkflowDefinition.builder().id("wf").name("wf").build(),
                input, ActionContext.of("prj", "/p", "usr"), false, null);
    }

    @Test
    void shouldTreatMissingConditionAsTrue() {
        assertThat(evaluator.evaluate(null, context)).isTrue();
    }

    @Test
    void shouldCompareWithStrictEquality() {
        assertThat(evaluator.evaluate(new ConditionExpression.Equals(
                ArgBinding.input("count"), ArgBinding.literal(3.0)), context)).isTrue();
        assertThat(evaluator.evaluate(new ConditionExpression.Equals(
                ArgBinding.input("count"), ArgBinding.literal("3")), context)).isFalse();
        assertThat(evaluator.evaluate(new ConditionExpression.NotEquals(
                ArgBinding.input("count"), ArgBinding.literal("3")), context)).isTrue();
    }

    @Test
    void shouldCompareCollectionsByReference() {
        assertThat(evaluator.evaluate(new ConditionExpression.Equals(
                ArgBinding.input("items"), ArgBinding.literal(List.of("a"))), context)).isFalse();
        assertThat(evaluator.evaluate(new ConditionExpression.Equals(
                ArgBinding.input("items"), ArgBinding.input("items")), context)).isTrue();
    }

    @Test
    void shouldSearchStringifiedOperands() {
        assertThat(evaluator.evaluate(new ConditionExpression.Contains(
                ArgBinding.input("label"), ArgBinding.literal("urgent")), context)).isTrue();
        assertThat(evaluator.evaluate(new ConditionExpression.Contains(
                ArgBinding.input("count"), ArgBinding.literal(3)), context)).isTrue();
        assertThat(evaluator.evaluate(new ConditionExpression.Contains(
                ArgBinding.input("nothing"), ArgBinding.literal("")), context)).isTrue();
        assertThat(evaluator.evaluate(new ConditionExpression.Contains(
                ArgBinding.input("nothing"), ArgBinding.literal("x")), context)).isFalse();
        assertThat(evaluator.evaluate(new ConditionExpression.Contains(
                ArgBinding.literal(false), ArgBinding.literal("false")), context)).isTrue();
        assertThat(evaluator.evaluate(new ConditionExpression.Contains(
                ArgBinding.literal(0), ArgBinding.literal("0")), context)).isTrue();
    }

    @Test
    void shouldCheckExistenceAndTruthiness() {
        assertThat(evaluator.evaluate(new ConditionExpression.Exists(ArgBinding.input("empty")), context)).isTrue();
        assertThat(evaluator.evaluate(new ConditionExpression.Exists(ArgBinding.input("nothing")), context)).isFalse();
        assertThat(evaluator.evaluate(new ConditionExpression.Truthy(ArgBinding.input("empty")), context)).isFalse();
        assertThat(evaluator.evaluate(new ConditionExpression.Truthy(ArgBinding.input("count")), context)).isTrue();
    }

    @Test
    void shouldCombineConditions() {
        ConditionExpression yes = new ConditionExpression.Truthy(ArgBinding.literal(true));
        ConditionExpression no = new ConditionExpression.Truthy(ArgBinding.literal(false));

        assertThat(evaluator.evaluate(new ConditionExpression.And(List.of(yes, yes)), context)).isTrue();
        assertThat(evaluator.evaluate(new ConditionExpression.And(List.of(yes, no)), context)).isFalse();
        assertThat(evaluator.evaluate(new ConditionExpression.Or(List.of(no, yes)), context)).isTrue();
        assertThat(evaluator.evaluate(new ConditionExpression.Or(List.of(no, no)), context)).isFalse();
        assertThat(evaluator.evaluate(new ConditionExpression.Not(no), context)).isTrue();
    }

    @Test
    @DisplayName("unknown operators evaluate to true")
    void shouldFailOpenOnUnknownOperator() {
        assertThat(evaluator.evaluate(new ConditionExpression.Unknown(), context)).isTrue();
    }
}

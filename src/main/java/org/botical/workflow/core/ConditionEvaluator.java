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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.botical.workflow.model.ConditionExpression;

/**
 * Evaluates step conditions.
 * <p>
 * {@code equals}/{@code notEquals} use strict equality (see {@link Values#strictEquals}).
 * {@code contains} stringifies both operands, null becoming the empty string, and does
 * a substring search. An unknown operator evaluates to true.
 */
@Slf4j
@RequiredArgsConstructor
public class ConditionEvaluator {

    private final BindingResolver bindingResolver;

    /**
     * Evaluates a condition. A null condition is true.
     *
     * @param expression the condition
     * @param context the execution context
     * @return the result
     */
    public boolean evaluate(ConditionExpression expression, ExecutionContext context) {
        if (expression == null) {
            return true;
        }
        if (expression instanceof ConditionExpression.Equals equals) {
            return Values.strictEquals(
                    bindingResolver.resolve(equals.left(), context),
                    bindingResolver.resolve(equals.right(), context));
        }
        if (expression instanceof ConditionExpression.NotEquals notEquals) {
            return !Values.strictEquals(
                    bindingResolver.resolve(notEquals.left(), context),
                    bindingResolver.resolve(notEquals.right(), context));
        }
        if (expression instanceof ConditionExpression.Contains contains) {
            String value = Values.stringify(bindingResolver.resolve(contains.value(), context));
            String search = Values.stringify(bindingResolver.resolve(contains.search(), context));
            return value.contains(search);
        }
        if (expression instanceof ConditionExpression.Exists exists) {
            return bindingResolver.resolve(exists.value(), context) != null;
        }
        if (expression instanceof ConditionExpression.Truthy truthy) {
            return Values.isTruthy(bindingResolver.resolve(truthy.value(), context));
        }
        if (expression instanceof ConditionExpression.And and) {
            return and.conditions().stream().allMatch(c -> evaluate(c, context));
        }
        if (expression instanceof ConditionExpression.Or or) {
            return or.conditions().stream().anyMatch(c -> evaluate(c, context));
        }
        if (expression instanceof ConditionExpression.Not not) {
            return !evaluate(not.condition(), context);
        }
        log.warn("Unknown condition operator in workflow execution {}, treating as true", context.getExecutionId());
        return true;
    }
}

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

import org.botical.workflow.model.ArgBinding;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves {@link ArgBinding}s against a running execution.
 * <p>
 * Resolution is pure and total: it has no side effects and returns null for anything it cannot
 * find rather than throwing.
 */
public class BindingResolver {

    /**
     * Resolves one binding.
     *
     * @param binding the binding; null resolves to null
     * @param context the execution context
     * @return the resolved value, possibly null
     */
    public Object resolve(ArgBinding binding, ExecutionContext context) {
        if (binding == null) {
            return null;
        }
        if (binding instanceof ArgBinding.Literal literal) {
            return literal.value();
        }
        if (binding instanceof ArgBinding.Input input) {
            return Values.getPath(context.getInput(), input.path());
        }
        ArgBinding.StepOutput step = (ArgBinding.StepOutput) binding;
        return Values.getPath(context.getStepOutput(step.stepId()), step.path());
    }

    /**
     * Resolves every entry of a named binding map independently. Null results are kept.
     *
     * @param bindings the bindings
     * @param context the execution context
     * @return a new map with the same keys in the same order
     */
    public Map<String, Object> resolveArgs(Map<String, ArgBinding> bindings, ExecutionContext context) {
        if (bindings == null || bindings.isEmpty()) {
            return new HashMap<>();
        }
        Map<String, Object> resolved = new LinkedHashMap<>();
        bindings.forEach((key, binding) -> resolved.put(key, resolve(binding, context)));
        return resolved;
    }
}

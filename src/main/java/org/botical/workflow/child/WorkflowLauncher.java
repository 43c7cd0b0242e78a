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

package org.botical.workflow.child;

import org.botical.workflow.action.ActionContext;
import org.botical.workflow.model.WorkflowDefinition;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Starts workflow executions without waiting for them.
 */
public interface WorkflowLauncher {

    /**
     * Creates an execution and runs it in the background.
     *
     * @param definition the workflow to run
     * @param input the execution input
     * @param actionContext the caller context
     * @param agentContext whether the caller is an agent
     * @return the new execution id, emitted once the execution record exists
     */
    Mono<String> launch(WorkflowDefinition definition, Map<String, Object> input,
                        ActionContext actionContext, boolean agentContext);
}

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

package org.botical.workflow.action;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Registry of executable actions. Implementations are provided by the host application.
 */
public interface ActionRegistry {

    /**
     * Executes an action.
     *
     * @param actionId the registered action id
     * @param args the resolved arguments
     * @param context the caller context
     * @return the action result; an error signal is treated like an {@link ActionResult.Error}
     */
    Mono<ActionResult> execute(String actionId, Map<String, Object> args, ActionContext context);
}

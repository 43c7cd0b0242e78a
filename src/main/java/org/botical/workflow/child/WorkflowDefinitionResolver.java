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

import org.botical.workflow.model.WorkflowDefinition;
import reactor.core.publisher.Mono;

/**
 * Looks up workflow definitions of a project. Provided by the host application.
 * Both lookups complete empty when no workflow matches.
 */
public interface WorkflowDefinitionResolver {

    Mono<WorkflowDefinition> findById(String projectId, String projectPath, String workflowId);

    Mono<WorkflowDefinition> findByName(String projectId, String projectPath, String workflowName);
}

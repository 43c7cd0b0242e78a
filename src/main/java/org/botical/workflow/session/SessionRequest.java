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

package org.botical.workflow.session;

import org.springframework.lang.Nullable;

/**
 * Parameters of a child agent session created by a session step.
 *
 * @param projectId the project the session belongs to
 * @param parentId the calling session, if the workflow was started from one
 * @param title session title
 * @param agent agent name
 * @param systemPrompt optional system prompt override
 * @param providerId optional model provider override
 * @param modelId optional model override
 */
public record SessionRequest(
        String projectId,
        @Nullable String parentId,
        String title,
        String agent,
        @Nullable String systemPrompt,
        @Nullable String providerId,
        @Nullable String modelId
) {}

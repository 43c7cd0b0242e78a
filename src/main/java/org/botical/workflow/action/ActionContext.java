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

import org.springframework.lang.Nullable;

/**
 * Caller context handed to every action invocation.
 *
 * @param projectId the project the workflow runs in
 * @param projectPath the project's workspace path
 * @param sessionId the calling session, when invoked from one
 * @param messageId the triggering message, when invoked from one
 * @param userId the user on whose behalf the workflow runs
 */
public record ActionContext(
        String projectId,
        String projectPath,
        @Nullable String sessionId,
        @Nullable String messageId,
        String userId
) {

    public static ActionContext of(String projectId, String projectPath, String userId) {
        return new ActionContext(projectId, projectPath, null, null, userId);
    }

    public ActionContext withSession(String sessionId, String messageId) {
        return new ActionContext(projectId, projectPath, sessionId, messageId, userId);
    }
}

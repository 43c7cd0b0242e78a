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

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Agent session operations needed by session steps. Provided by the host application.
 */
public interface AgentSessionService {

    /**
     * Creates a session.
     *
     * @return the new session id
     */
    Mono<String> createSession(SessionRequest request);

    /**
     * Appends a user turn to a session.
     */
    Mono<Void> sendUserMessage(String sessionId, String message);

    /**
     * Drives the agent on the session until it stops or {@code maxMessages} turns were produced.
     */
    Mono<Void> runToCompletion(String sessionId, int maxMessages);

    /**
     * Reads the session statistics.
     */
    Mono<SessionSnapshot> getSession(String sessionId);

    /**
     * Reads the text parts of the session's last assistant turn, in order. Empty when the agent
     * produced no assistant turn.
     */
    Mono<List<String>> getLastAssistantTextParts(String sessionId);
}

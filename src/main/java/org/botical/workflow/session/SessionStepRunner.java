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

import lombok.extern.slf4j.Slf4j;
import org.botical.workflow.core.ExecutionContext;
import org.botical.workflow.exception.StepExecutionException;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a session step: creates a child session parented to the calling session, sends the
 * message as a user turn, lets the agent run and reads back its final answer.
 */
@Slf4j
public class SessionStepRunner {

    private final AgentSessionService sessionService;

    public SessionStepRunner(@Nullable AgentSessionService sessionService) {
        this.sessionService = sessionService;
    }

    /**
     * Runs the session.
     *
     * @return output {@code {sessionId, messageCount, totalCost, response, status}}
     */
    public Mono<Object> run(ExecutionContext context, String stepId, SessionInvocation invocation) {
        if (sessionService == null) {
            return Mono.error(StepExecutionException.notConfigured(stepId, "Agent session service"));
        }

        SessionRequest request = new SessionRequest(
                context.getDefinition().projectId() != null
                        ? context.getDefinition().projectId()
                        : context.getActionContext().projectId(),
                context.getActionContext().sessionId(),
                "Workflow Session: " + context.getDefinition().name(),
                invocation.agent(),
                invocation.systemPrompt(),
                invocation.providerId(),
                invocation.modelId());

        return sessionService.createSession(request)
                .flatMap(sessionId -> {
                    log.info("SESSION_START: executionId={}, stepId={}, sessionId={}, agent={}, maxMessages={}",
                            context.getExecutionId(), stepId, sessionId, invocation.agent(), invocation.maxMessages());
                    return sessionService.sendUserMessage(sessionId, invocation.message())
                            .then(sessionService.runToCompletion(sessionId, invocation.maxMessages()))
                            .then(Mono.zip(
                                    sessionService.getSession(sessionId),
                                    sessionService.getLastAssistantTextParts(sessionId).defaultIfEmpty(List.of())))
                            .map(tuple -> toOutput(sessionId, tuple.getT1(), tuple.getT2()));
                });
    }

    private static Object toOutput(String sessionId, SessionSnapshot session, List<String> textParts) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("sessionId", sessionId);
        output.put("messageCount", session.messageCount());
        output.put("totalCost", session.totalCost());
        output.put("response", String.join("\n", textParts));
        output.put("status", session.status());
        return output;
    }

    /**
     * Resolved parameters of a session step.
     */
    public record SessionInvocation(
            String message,
            String agent,
            @Nullable String systemPrompt,
            @Nullable String providerId,
            @Nullable String modelId,
            int maxMessages
    ) {}
}

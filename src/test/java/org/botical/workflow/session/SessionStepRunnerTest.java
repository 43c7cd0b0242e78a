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

import org.botical.workflow.action.ActionContext;
import org.botical.workflow.child.WorkflowLauncher;
import org.botical.workflow.core.ExecutionContext;
import org.botical.workflow.exception.StepExecutionException;
import org.botical.workflow.model.WorkflowDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionStepRunnerTest {

    @Mock
    private AgentSessionService sessionService;

    @Mock
    private WorkflowLauncher launcher;

    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        WorkflowDefinition definition = WorkflowDefinition.builder()
                .id("wf-summary")
                .projectId("prj-9")
                .name("release-summary")
                .build();
        ActionContext actionContext = ActionContext.of("prj-1", "/projects/one", "usr-1")
                .withSession("ses_parent", "msg_1");
        context = new ExecutionContext("wfx_1", definition, Map.of(), actionContext, false, launcher);
    }

    @Test
    void shouldRunSessionAndCollectResponse() {
        SessionRequest expectedRequest = new SessionRequest("prj-9", "ses_parent",
                "Workflow Session: release-summary", "writer", "Be brief", null, null);
        when(sessionService.createSession(expectedRequest)).thenReturn(Mono.just("ses_1"));
        when(sessionService.sendUserMessage("ses_1", "Summarize")).thenReturn(Mono.empty());
        when(sessionService.runToCompletion("ses_1", 4)).thenReturn(Mono.empty());
        when(sessionService.getSession("ses_1")).thenReturn(Mono.just(new SessionSnapshot("ses_1", 3, 0.25, "active")));
        when(sessionService.getLastAssistantTextParts("ses_1")).thenReturn(Mono.just(List.of("Line one", "Line two")));

        SessionStepRunner runner = new SessionStepRunner(sessionService);
        SessionStepRunner.SessionInvocation invocation = new SessionStepRunner.SessionInvocation(
                "Summarize", "writer", "Be brief", null, null, 4);

        StepVerifier.create(runner.run(context, "summarize", invocation))
                .assertNext(output -> assertThat(output).isEqualTo(Map.of(
                        "sessionId", "ses_1",
                        "messageCount", 3,
                        "totalCost", 0.25,
                        "response", "Line one\nLine two",
                        "status", "active")))
                .verifyComplete();

        InOrder order = inOrder(sessionService);
        order.verify(sessionService).sendUserMessage("ses_1", "Summarize");
        order.verify(sessionService).runToCompletion("ses_1", 4);
    }

    @Test
    void shouldFailWithoutSessionService() {
        SessionStepRunner runner = new SessionStepRunner(null);

        StepVerifier.create(runner.run(context, "summarize",
                        new SessionStepRunner.SessionInvocation("Summarize", "default", null, null, null, 10)))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(StepExecutionException.class)
                        .hasMessage("Agent session service is not configured"))
                .verify();
    }
}

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

package org.botical.workflow.approval;

import org.botical.workflow.action.ActionContext;
import org.botical.workflow.child.WorkflowLauncher;
import org.botical.workflow.core.ExecutionContext;
import org.botical.workflow.event.WorkflowEventPublisher;
import org.botical.workflow.event.WorkflowEventType;
import org.botical.workflow.exception.StepExecutionException;
import org.botical.workflow.model.WorkflowDefinition;
import org.botical.workflow.properties.WorkflowProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ApprovalStepRunnerTest {

    private static final Instant CREATED_AT = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private ApprovalRequestService approvalService;

    @Mock
    private ProjectMemberDirectory memberDirectory;

    @Mock
    private WorkflowLauncher launcher;

    private WorkflowEventPublisher eventPublisher;
    private ApprovalStepRunner runner;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        eventPublisher = new WorkflowEventPublisher(new WorkflowProperties());
        runner = new ApprovalStepRunner(approvalService, memberDirectory, eventPublisher);
        WorkflowDefinition definition = WorkflowDefinition.builder().id("wf-release").build();
        context = new ExecutionContext("wfx_1", definition, Map.of(),
                ActionContext.of("prj-1", "/projects/one", "usr-1"), false, launcher);
    }

    @Test
    void shouldCreateRequestForExplicitApproversAndBroadcast() {
        when(approvalService.create("wfx_1", "gate", "Ship it?", List.of("usr-2", "7"), 60_000L, false))
                .thenReturn(Mono.just(new ApprovalRequest("apr_1", "wfx_1", "gate", "Ship it?",
                        List.of("usr-2", "7"), 60_000L, false, CREATED_AT)));

        StepVerifier.create(eventPublisher.events().take(1))
                .then(() -> assertThat((Map<String, Object>) runner.run(context, "gate", "Ship it?", List.of("usr-2", 7),
                        60_000L, false).block())
                        .containsEntry("approvalId", "apr_1")
                        .containsEntry("status", "pending")
                        .containsEntry("approvers", List.of("usr-2", "7"))
                        .containsEntry("timeout", 60_000L)
                        .containsEntry("createdAt", CREATED_AT.toEpochMilli()))
                .assertNext(event -> {
                    assertThat(event.type()).isEqualTo(WorkflowEventType.APPROVAL_REQUIRED);
                    assertThat(event.payload())
                            .containsEntry("approvalId", "apr_1")
                            .containsEntry("workflowExecutionId", "wfx_1")
                            .containsEntry("stepId", "gate");
                })
                .verifyComplete();

        verify(memberDirectory, never()).listMemberIds(any());
    }

    @Test
    void shouldFallBackToProjectMembers() {
        when(memberDirectory.listMemberIds("prj-1")).thenReturn(Flux.just("usr-1", "usr-3"));
        when(approvalService.create("wfx_1", "gate", "Approval required", List.of("usr-1", "usr-3"), null, true))
                .thenReturn(Mono.just(new ApprovalRequest("apr_2", "wfx_1", "gate", "Approval required",
                        List.of("usr-1", "usr-3"), null, true, CREATED_AT)));

        StepVerifier.create(runner.run(context, "gate", "Approval required", "everyone", null, true))
                .assertNext(output -> assertThat((Map<String, Object>) output)
                        .containsEntry("approvers", List.of("usr-1", "usr-3"))
                        .containsEntry("timeout", null))
                .verifyComplete();
    }

    @Test
    void shouldFailWhenNobodyCanApprove() {
        when(memberDirectory.listMemberIds("prj-1")).thenReturn(Flux.empty());

        StepVerifier.create(runner.run(context, "gate", "Approval required", null, null, false))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(StepExecutionException.class)
                        .hasMessage("No approvers available for approval step"))
                .verify();

        verify(approvalService, never()).create(any(), any(), any(), any(), any(), anyBoolean());
    }

    @Test
    void shouldFailWithoutApprovalService() {
        ApprovalStepRunner unconfigured = new ApprovalStepRunner(null, null, eventPublisher);

        StepVerifier.create(unconfigured.run(context, "gate", "Approval required", List.of("usr-1"), null, false))
                .expectErrorMessage("Approval service is not configured")
                .verify();
    }
}

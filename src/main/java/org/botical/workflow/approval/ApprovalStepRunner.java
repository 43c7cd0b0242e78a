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

import lombok.extern.slf4j.Slf4j;
import org.botical.workflow.core.ExecutionContext;
import org.botical.workflow.core.Values;
import org.botical.workflow.event.WorkflowEventPublisher;
import org.botical.workflow.exception.StepExecutionException;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs an approval step: creates an approval request, announces it and completes at once with a
 * pending status. The step does not wait for the decision.
 */
@Slf4j
public class ApprovalStepRunner {

    private final ApprovalRequestService approvalService;
    private final ProjectMemberDirectory memberDirectory;
    private final WorkflowEventPublisher eventPublisher;

    public ApprovalStepRunner(@Nullable ApprovalRequestService approvalService,
                              @Nullable ProjectMemberDirectory memberDirectory,
                              WorkflowEventPublisher eventPublisher) {
        this.approvalService = approvalService;
        this.memberDirectory = memberDirectory;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Creates the approval request.
     *
     * @param approvers resolved approvers; a collection is used as given, anything else selects every project member
     * @return output {@code {approvalId, status, message, approvers, timeout, createdAt}}
     */
    public Mono<Object> run(ExecutionContext context, String stepId, String message, @Nullable Object approvers,
                            @Nullable Long timeout, boolean autoApprove) {
        if (approvalService == null) {
            return Mono.error(StepExecutionException.notConfigured(stepId, "Approval service"));
        }

        return resolveApprovers(context, stepId, approvers)
                .flatMap(approverIds -> {
                    if (approverIds.isEmpty()) {
                        return Mono.error(new StepExecutionException(stepId,
                                "No approvers available for approval step", null));
                    }
                    return approvalService.create(context.getExecutionId(), stepId, message, approverIds,
                                    timeout, autoApprove)
                            .flatMap(approval -> {
                                log.info("APPROVAL_REQUESTED: executionId={}, stepId={}, approvalId={}, approvers={}",
                                        context.getExecutionId(), stepId, approval.id(), approverIds.size());
                                return eventPublisher.publishApprovalRequired(approval.id(), context.getExecutionId(),
                                                stepId, message, approverIds, timeout)
                                        .thenReturn(toOutput(approval, message, approverIds, timeout));
                            });
                });
    }

    private Mono<List<String>> resolveApprovers(ExecutionContext context, String stepId, @Nullable Object approvers) {
        if (approvers instanceof Collection<?> explicit) {
            return Mono.just(explicit.stream().map(Values::stringify).toList());
        }
        if (memberDirectory == null) {
            return Mono.error(StepExecutionException.notConfigured(stepId, "Project member directory"));
        }
        String projectId = context.getDefinition().projectId() != null
                ? context.getDefinition().projectId()
                : context.getActionContext().projectId();
        return memberDirectory.listMemberIds(projectId).collectList();
    }

    private static Object toOutput(ApprovalRequest approval, String message, List<String> approvers, Long timeout) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("approvalId", approval.id());
        output.put("status", "pending");
        output.put("message", message);
        output.put("approvers", approvers);
        output.put("timeout", timeout);
        output.put("createdAt", approval.createdAt() != null ? approval.createdAt().toEpochMilli() : null);
        return output;
    }
}

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

package org.botical.workflow.core;

import lombok.extern.slf4j.Slf4j;
import org.botical.workflow.action.ActionRegistry;
import org.botical.workflow.action.ActionResult;
import org.botical.workflow.approval.ApprovalStepRunner;
import org.botical.workflow.child.ChildWorkflowService;
import org.botical.workflow.event.WorkflowEventPublisher;
import org.botical.workflow.exception.ActionExecutionException;
import org.botical.workflow.exception.RetriesExhaustedException;
import org.botical.workflow.exception.StepExecutionException;
import org.botical.workflow.exception.WorkflowRejectedException;
import org.botical.workflow.exception.WorkflowValidationException;
import org.botical.workflow.model.ActionStep;
import org.botical.workflow.model.ApprovalStep;
import org.botical.workflow.model.ErrorHandling;
import org.botical.workflow.model.ErrorStrategy;
import org.botical.workflow.model.LogStep;
import org.botical.workflow.model.NotifyStep;
import org.botical.workflow.model.RejectStep;
import org.botical.workflow.model.ResolveStep;
import org.botical.workflow.model.SessionStep;
import org.botical.workflow.model.StepResult;
import org.botical.workflow.model.StepStatus;
import org.botical.workflow.model.StepUpdate;
import org.botical.workflow.model.WorkflowInvocationStep;
import org.botical.workflow.model.WorkflowStep;
import org.botical.workflow.properties.WorkflowProperties;
import org.botical.workflow.resilience.RetryPolicy;
import org.botical.workflow.resilience.WorkflowResilience;
import org.botical.workflow.session.SessionStepRunner;
import org.botical.workflow.state.WorkflowExecutionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Executes a single workflow step.
 * <p>
 * Evaluates the step condition, records the running transition and dispatches on the step kind.
 * The returned Mono always completes with a {@link StepResult}; step failures are reported as
 * {@link StepResult.Failed} rather than as error signals. Failures of action, session and
 * workflow steps go through the step's {@code onError} policy first.
 */
@Slf4j
public class StepExecutor {

    private static final Logger STEP_LOG = LoggerFactory.getLogger("org.botical.workflow.step.log");

    private final WorkflowProperties properties;
    private final BindingResolver bindingResolver;
    private final ConditionEvaluator conditionEvaluator;
    private final WorkflowExecutionStore executionStore;
    private final WorkflowEventPublisher eventPublisher;
    private final WorkflowResilience resilience;
    private final ActionRegistry actionRegistry;
    private final SessionStepRunner sessionRunner;
    private final ApprovalStepRunner approvalRunner;
    private final ChildWorkflowService childWorkflowService;

    public StepExecutor(WorkflowProperties properties,
                        BindingResolver bindingResolver,
                        ConditionEvaluator conditionEvaluator,
                        WorkflowExecutionStore executionStore,
                        WorkflowEventPublisher eventPublisher,
                        WorkflowResilience resilience,
                        @Nullable ActionRegistry actionRegistry,
                        SessionStepRunner sessionRunner,
                        ApprovalStepRunner approvalRunner,
                        ChildWorkflowService childWorkflowService) {
        this.properties = properties;
        this.bindingResolver = bindingResolver;
        this.conditionEvaluator = conditionEvaluator;
        this.executionStore = executionStore;
        this.eventPublisher = eventPublisher;
        this.resilience = resilience;
        this.actionRegistry = actionRegistry;
        this.sessionRunner = sessionRunner;
        this.approvalRunner = approvalRunner;
        this.childWorkflowService = childWorkflowService;
    }

    /**
     * Executes a step.
     *
     * @param step the step
     * @param context the execution context
     * @return the settled result
     */
    public Mono<StepResult> execute(WorkflowStep step, ExecutionContext context) {
        return Mono.defer(() -> {
            if (!conditionEvaluator.evaluate(step.condition(), context)) {
                log.debug("Step {} of execution {} skipped by condition", step.id(), context.getExecutionId());
                return Mono.just(StepResult.skipped());
            }
            return executionStore.updateStep(context.getExecutionId(), step.id(), StepUpdate.running())
                    .then(eventPublisher.publishStepUpdate(context.getExecutionId(), step.id(), StepStatus.RUNNING))
                    .then(dispatch(step, context))
                    .onErrorResume(error -> Mono.just(StepResult.failed(messageOf(error), error)));
        });
    }

    private Mono<StepResult> dispatch(WorkflowStep step, ExecutionContext context) {
        return switch (step.type()) {
            case ACTION -> withErrorPolicy(step, context, () -> executeAction((ActionStep) step, context));
            case NOTIFY -> executeNotify((NotifyStep) step, context).map(StepResult::completed);
            case LOG -> Mono.fromSupplier(() -> StepResult.completed(executeLog((LogStep) step, context)));
            case RESOLVE -> Mono.fromSupplier(() -> StepResult.completed(
                    bindingResolver.resolveArgs(((ResolveStep) step).output(), context)));
            case REJECT -> executeReject((RejectStep) step, context);
            case SESSION -> withErrorPolicy(step, context, () -> executeSession((SessionStep) step, context));
            case APPROVAL -> executeApproval((ApprovalStep) step, context).map(StepResult::completed);
            case WORKFLOW -> withErrorPolicy(step, context,
                    () -> executeWorkflow((WorkflowInvocationStep) step, context));
        };
    }

    private Mono<StepResult> withErrorPolicy(WorkflowStep step, ExecutionContext context,
                                             Supplier<Mono<Object>> invocation) {
        ErrorHandling onError = step.onError();
        ErrorStrategy strategy = onError != null && onError.strategy() != null ? onError.strategy() : ErrorStrategy.FAIL;

        if (strategy == ErrorStrategy.RETRY) {
            RetryPolicy policy = RetryPolicy.from(onError, properties.getRetry());
            return resilience.executeWithRetry(context.getExecutionId(), step.id(), policy, invocation)
                    .map(StepResult::completed)
                    .onErrorResume(RetriesExhaustedException.class, exhausted -> {
                        Map<String, Object> output = new LinkedHashMap<>();
                        output.put("error", exhausted.getMessage());
                        output.put("retryFailed", true);
                        output.put("attempts", exhausted.getAttempts());
                        output.put("lastAttemptAt", exhausted.getLastAttemptAt().toEpochMilli());
                        return Mono.just(StepResult.completed(output));
                    });
        }

        Mono<StepResult> result = Mono.defer(invocation).map(StepResult::completed);
        if (strategy == ErrorStrategy.CONTINUE) {
            return result.onErrorResume(error -> !(error instanceof WorkflowValidationException), error -> {
                log.warn("STEP_CONTINUE_ON_ERROR: executionId={}, stepId={}, error={}",
                        context.getExecutionId(), step.id(), messageOf(error));
                Map<String, Object> output = new LinkedHashMap<>();
                output.put("error", messageOf(error));
                output.put("continued", true);
                return Mono.just(StepResult.completed(output));
            });
        }
        return result;
    }

    private Mono<Object> executeAction(ActionStep step, ExecutionContext context) {
        String actionId = step.action();
        if (actionId == null || actionId.isBlank()) {
            return Mono.error(new WorkflowValidationException("Action step missing action ID"));
        }
        if (actionRegistry == null) {
            return Mono.error(StepExecutionException.notConfigured(step.id(), "Action registry"));
        }

        Map<String, Object> args = bindingResolver.resolveArgs(step.args(), context);
        Mono<Object> invocation = Mono.defer(() -> actionRegistry.execute(actionId, args, context.getActionContext()))
                .flatMap(result -> mapActionResult(actionId, result));

        return executionStore.updateStep(context.getExecutionId(), step.id(), StepUpdate.resolvedArgs(args))
                .then(resilience.decorateAction(actionId, invocation));
    }

    private static Mono<Object> mapActionResult(String actionId, ActionResult result) {
        Map<String, Object> output = new LinkedHashMap<>();
        if (result instanceof ActionResult.Success success) {
            output.put("title", success.title());
            output.put("output", success.output());
            output.put("metadata", success.metadata());
        } else if (result instanceof ActionResult.Navigate navigate) {
            output.put("navigated", true);
            output.put("pageId", navigate.pageId());
            output.put("params", navigate.params());
        } else if (result instanceof ActionResult.Ui ui) {
            output.put("uiAction", ui.action());
            output.put("value", ui.value());
            output.put("message", ui.message());
        } else {
            ActionResult.Error error = (ActionResult.Error) result;
            return Mono.error(new ActionExecutionException(actionId, error.message(), error.code()));
        }
        return Mono.just(output);
    }

    private Mono<Object> executeNotify(NotifyStep step, ExecutionContext context) {
        String message = Values.stringify(bindingResolver.resolve(step.message(), context));
        String variant = Values.stringifyOr(bindingResolver.resolve(step.variant(), context), "info");

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("notified", true);
        output.put("message", message);
        output.put("variant", variant);

        if (context.isAgentContext()) {
            return Mono.just(output);
        }
        return eventPublisher.publishNotification(message, variant).thenReturn(output);
    }

    private Object executeLog(LogStep step, ExecutionContext context) {
        String message = Values.stringify(bindingResolver.resolve(step.message(), context));
        STEP_LOG.info("[Workflow {}] {}", context.getExecutionId(), message);

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("logged", true);
        output.put("message", message);
        return output;
    }

    private Mono<StepResult> executeReject(RejectStep step, ExecutionContext context) {
        String message = Values.stringifyOr(bindingResolver.resolve(step.message(), context), "Workflow rejected");
        log.info("STEP_REJECTED: executionId={}, stepId={}, message={}", context.getExecutionId(), step.id(), message);
        return Mono.error(new WorkflowRejectedException(message));
    }

    private Mono<Object> executeSession(SessionStep step, ExecutionContext context) {
        Object message = bindingResolver.resolve(step.message(), context);
        if (!Values.isTruthy(message)) {
            return Mono.error(new WorkflowValidationException("Session step missing message"));
        }

        WorkflowProperties.SessionConfig defaults = properties.getSession();
        Double maxMessages = Values.toNumber(bindingResolver.resolve(step.maxMessages(), context));
        SessionStepRunner.SessionInvocation invocation = new SessionStepRunner.SessionInvocation(
                Values.stringify(message),
                Values.stringifyOr(bindingResolver.resolve(step.agent(), context), defaults.getDefaultAgent()),
                optionalString(bindingResolver.resolve(step.systemPrompt(), context)),
                optionalString(bindingResolver.resolve(step.providerId(), context)),
                optionalString(bindingResolver.resolve(step.modelId(), context)),
                maxMessages != null && maxMessages.intValue() > 0
                        ? maxMessages.intValue()
                        : defaults.getDefaultMaxMessages());
        return sessionRunner.run(context, step.id(), invocation);
    }

    private Mono<Object> executeApproval(ApprovalStep step, ExecutionContext context) {
        String message = Values.stringifyOr(bindingResolver.resolve(step.message(), context), "Approval required");
        Object approvers = bindingResolver.resolve(step.approvers(), context);
        Double timeout = Values.toNumber(bindingResolver.resolve(step.timeout(), context));
        boolean autoApprove = Values.isTruthy(bindingResolver.resolve(step.autoApprove(), context));
        return approvalRunner.run(context, step.id(), message, approvers,
                timeout != null ? timeout.longValue() : null, autoApprove);
    }

    private Mono<Object> executeWorkflow(WorkflowInvocationStep step, ExecutionContext context) {
        String workflowId = optionalString(bindingResolver.resolve(step.workflowId(), context));
        String workflowName = optionalString(bindingResolver.resolve(step.workflowName(), context));
        if (workflowId == null && workflowName == null) {
            return Mono.error(new WorkflowValidationException(
                    "Workflow step must specify either workflowId or workflowName"));
        }
        if (workflowId != null && workflowName != null) {
            return Mono.error(new WorkflowValidationException(
                    "Workflow step cannot specify both workflowId and workflowName"));
        }
        Map<String, Object> input = bindingResolver.resolveArgs(step.input(), context);
        return childWorkflowService.invoke(context, step.id(), workflowId, workflowName, input);
    }

    @Nullable
    private static String optionalString(@Nullable Object value) {
        return Values.isTruthy(value) ? Values.stringify(value) : null;
    }

    static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}

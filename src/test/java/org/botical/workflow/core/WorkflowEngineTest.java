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

import org.botical.workflow.action.ActionContext;
import org.botical.workflow.action.ActionRegistry;
import org.botical.workflow.action.ActionResult;
import org.botical.workflow.approval.ApprovalStepRunner;
import org.botical.workflow.child.ChildWorkflowService;
import org.botical.workflow.child.WorkflowDefinitionResolver;
import org.botical.workflow.event.WorkflowEvent;
import org.botical.workflow.event.WorkflowEventPublisher;
import org.botical.workflow.model.ActionStep;
import org.botical.workflow.model.ArgBinding;
import org.botical.workflow.model.ConditionExpression;
import org.botical.workflow.model.ErrorHandling;
import org.botical.workflow.model.ExecutionStatus;
import org.botical.workflow.model.LogStep;
import org.botical.workflow.model.RejectStep;
import org.botical.workflow.model.ResolveStep;
import org.botical.workflow.model.SessionStep;
import org.botical.workflow.model.StepExecution;
import org.botical.workflow.model.StepStatus;
import org.botical.workflow.model.WorkflowDefinition;
import org.botical.workflow.model.WorkflowExecution;
import org.botical.workflow.model.WorkflowInvocationStep;
import org.botical.workflow.properties.WorkflowProperties;
import org.botical.workflow.resilience.ErrorClassifier;
import org.botical.workflow.resilience.WorkflowResilience;
import org.botical.workflow.session.SessionStepRunner;
import org.botical.workflow.state.CacheWorkflowExecutionStore;
import org.botical.workflow.state.WorkflowExecutionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkflowEngineTest {

    private static final ActionContext ACTION_CONTEXT = ActionContext.of("prj-1", "/projects/one", "usr-1");

    @Mock
    private ActionRegistry actionRegistry;

    @Mock
    private WorkflowDefinitionResolver definitionResolver;

    private WorkflowExecutionStore executionStore;
    private WorkflowEventPublisher eventPublisher;
    private WorkflowEngine engine;

    @BeforeEach
    void setUp() {
        WorkflowProperties properties = new WorkflowProperties();
        properties.getSubWorkflow().setPollInterval(Duration.ofMillis(5));
        BindingResolver bindingResolver = new BindingResolver();
        executionStore = new CacheWorkflowExecutionStore(properties);
        eventPublisher = new WorkflowEventPublisher(properties);
        StepExecutor stepExecutor = new StepExecutor(properties, bindingResolver,
                new ConditionEvaluator(bindingResolver), executionStore, eventPublisher,
                new WorkflowResilience(properties, new ErrorClassifier(), null), actionRegistry,
                new SessionStepRunner(null), new ApprovalStepRunner(null, null, eventPublisher),
                new ChildWorkflowService(definitionResolver, executionStore, properties));
        engine = new WorkflowEngine(new WorkflowExecutor(stepExecutor, executionStore, eventPublisher, null),
                executionStore);
    }

    private Mono<WorkflowExecution> run(WorkflowDefinition definition,
                                                                  Map<String, Object> input) {
        return engine.runToCompletion(definition, input, ACTION_CONTEXT, ExecutionOptions.DEFAULT);
    }

    private WorkflowExecution runAndAwait(WorkflowDefinition definition, Map<String, Object> input) {
        AtomicReference<WorkflowExecution> result = new AtomicReference<>();
        StepVerifier.create(run(definition, input))
                .consumeNextWith(result::set)
                .expectComplete()
                .verify(Duration.ofSeconds(10));
        return result.get();
    }

    private Map<String, StepExecution> stepsOf(String executionId) {
        return executionStore.findSteps(executionId).collectList().block().stream()
                .collect(Collectors.toMap(StepExecution::stepId, Function.identity()));
    }

    @Nested
    @DisplayName("successful runs")
    class SuccessTests {

        @Test
        void shouldRetryActionAndResolveItsOutput() {
            when(actionRegistry.execute(eq("http.get"), anyMap(), eq(ACTION_CONTEXT)))
                    .thenReturn(Mono.error(new IllegalStateException("connection reset")),
                            Mono.error(new IllegalStateException("connection reset")),
                            Mono.just(ActionResult.success(Map.of("x", 42))));
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .id("wf-fetch")
                    .step(ActionStep.of("fetch", "http.get", Map.of("url", ArgBinding.input("url")))
                            .withOnError(ErrorHandling.retry(3, 1)))
                    .step(ResolveStep.of("result", Map.of("x", ArgBinding.step("fetch", "output.x")))
                            .dependingOn("fetch"))
                    .build();

            WorkflowExecution execution = runAndAwait(definition, Map.of("url", "https://example.org"));

            assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(execution.output()).isEqualTo(Map.of("x", 42));
            assertThat(execution.completedAt()).isNotNull();
            Map<String, StepExecution> steps = stepsOf(execution.id());
            assertThat(steps.get("fetch").status()).isEqualTo(StepStatus.COMPLETED);
            assertThat(steps.get("fetch").resolvedArgs()).containsEntry("url", "https://example.org");
            assertThat(steps.get("result").status()).isEqualTo(StepStatus.COMPLETED);
        }

        @Test
        void shouldMergeResolveOutputsInDeclarationOrder() {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .id("wf-merge")
                    .step(ResolveStep.of("first", Map.of("a", ArgBinding.literal(1), "shared", ArgBinding.literal("first"))))
                    .step(ResolveStep.of("second", Map.of("b", ArgBinding.literal(2), "shared", ArgBinding.literal("second"))))
                    .build();

            StepVerifier.create(run(definition, Map.of()))
                    .assertNext(execution -> assertThat(execution.output())
                            .containsEntry("a", 1)
                            .containsEntry("b", 2)
                            .containsEntry("shared", "second"))
                    .verifyComplete();
        }

        @Test
        void shouldResolveBindingsToSkippedStepsAsNull() {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .id("wf-skip")
                    .step(new LogStep("maybe", null, new ConditionExpression.Truthy(ArgBinding.input("verbose")),
                            ArgBinding.literal("verbose run")))
                    .step(ResolveStep.of("result", Map.of("logged", ArgBinding.step("maybe", "logged")))
                            .dependingOn("maybe"))
                    .build();

            WorkflowExecution execution = runAndAwait(definition, Map.of());

            assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(execution.output()).containsEntry("logged", null);
            assertThat(stepsOf(execution.id()).get("maybe").status()).isEqualTo(StepStatus.SKIPPED);
        }

        @Test
        void shouldContinuePastFailedActionWithContinuePolicy() {
            when(actionRegistry.execute(eq("optional"), anyMap(), any()))
                    .thenReturn(Mono.just(ActionResult.error("not available")));
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .id("wf-continue")
                    .step(ActionStep.of("try", "optional", Map.of()).withOnError(ErrorHandling.continueOnError()))
                    .step(ResolveStep.of("result", Map.of("error", ArgBinding.step("try", "error")))
                            .dependingOn("try"))
                    .build();

            StepVerifier.create(run(definition, Map.of()))
                    .assertNext(execution -> {
                        assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETED);
                        assertThat(execution.output()).containsEntry("error", "not available");
                    })
                    .verifyComplete();
        }

        @Test
        void shouldBroadcastLifecycleEvents() {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .id("wf-events")
                    .step(ResolveStep.of("result", Map.of("ok", ArgBinding.literal(true))))
                    .build();

            StepVerifier.create(eventPublisher.events().take(4).map(WorkflowEngineTest::describe))
                    .then(() -> run(definition, Map.of()).block())
                    .expectNext("workflow.execution:running", "workflow.step:running",
                            "workflow.step:completed", "workflow.execution:completed")
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("failing runs")
    class FailureTests {

        @Test
        void shouldFailWithRejectMessageAndStopLaterLevels() {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .id("wf-reject")
                    .step(RejectStep.of("stop", "nope"))
                    .step(ActionStep.of("never", "http.get", Map.of()).dependingOn("stop"))
                    .build();

            WorkflowExecution execution = runAndAwait(definition, Map.of());

            assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(execution.error()).isEqualTo("nope");
            Map<String, StepExecution> steps = stepsOf(execution.id());
            assertThat(steps.get("stop").status()).isEqualTo(StepStatus.FAILED);
            assertThat(steps).doesNotContainKey("never");

            verify(actionRegistry, never()).execute(any(), any(), any());
        }

        @Test
        void shouldFailOnDependencyCycle() {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .id("wf-cycle")
                    .step(ResolveStep.of("a", Map.of()).dependingOn("b"))
                    .step(ResolveStep.of("b", Map.of()).dependingOn("a"))
                    .build();

            WorkflowExecution execution = runAndAwait(definition, Map.of());

            assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(execution.error()).startsWith("Circular dependency in workflow steps");
            assertThat(stepsOf(execution.id())).isEmpty();
        }

        @Test
        void shouldFailOnActionFailureWithoutPolicy() {
            when(actionRegistry.execute(eq("deploy"), anyMap(), any()))
                    .thenReturn(Mono.just(ActionResult.error("quota exceeded")));
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .id("wf-fail")
                    .step(ActionStep.of("ship", "deploy", Map.of()))
                    .build();

            WorkflowExecution execution = runAndAwait(definition, Map.of());

            assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(execution.error()).isEqualTo("quota exceeded");
            assertThat(stepsOf(execution.id()).get("ship").error()).isEqualTo("quota exceeded");
        }

        @Test
        void shouldFailSessionStepWithoutService() {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .id("wf-session")
                    .step(SessionStep.of("ask", ArgBinding.literal("Summarize the release")))
                    .build();

            StepVerifier.create(run(definition, Map.of()))
                    .assertNext(execution -> assertThat(execution.error())
                            .isEqualTo("Agent session service is not configured"))
                    .verifyComplete();
        }

        @Test
        void shouldFailSelfInvocationBeforeLookup() {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .id("wf-self")
                    .step(WorkflowInvocationStep.byId("again", "wf-self", Map.of()))
                    .build();

            StepVerifier.create(run(definition, Map.of()))
                    .assertNext(execution -> {
                        assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
                        assertThat(execution.error())
                                .isEqualTo("Workflow cannot call itself (infinite recursion detected)");
                    })
                    .verifyComplete();

            verify(definitionResolver, never()).findById(any(), any(), any());
        }

        @Test
        @DisplayName("a cancel during the run keeps the cancelled status and suppresses the completed event")
        void shouldKeepCancelledStatusWrittenMidRun() {
            when(actionRegistry.execute(eq("slow"), anyMap(), any()))
                    .thenReturn(Mono.defer(() -> executionStore.findByWorkflowId("wf-cancel", 1, 0).next())
                            .flatMap(current -> executionStore.cancel(current.id()))
                            .thenReturn(ActionResult.success(Map.of("done", true))));
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .id("wf-cancel")
                    .step(ActionStep.of("work", "slow", Map.of()))
                    .step(ResolveStep.of("result", Map.of("done", ArgBinding.step("work", "output.done")))
                            .dependingOn("work"))
                    .build();
            List<String> events = new CopyOnWriteArrayList<>();
            Disposable subscription = eventPublisher.events().map(WorkflowEngineTest::describe).subscribe(events::add);

            try {
                WorkflowExecution execution = runAndAwait(definition, Map.of());

                assertThat(execution.status()).isEqualTo(ExecutionStatus.CANCELLED);
                assertThat(executionStore.findById(execution.id()).block().status())
                        .isEqualTo(ExecutionStatus.CANCELLED);
                assertThat(events)
                        .contains("workflow.execution:running")
                        .doesNotContain("workflow.execution:completed", "workflow.execution:failed");
            } finally {
                subscription.dispose();
            }
        }
    }

    @Nested
    @DisplayName("child workflows")
    class ChildWorkflowTests {

        @Test
        void shouldRunChildAndExposeItsOutput() {
            WorkflowDefinition child = WorkflowDefinition.builder()
                    .id("wf-child")
                    .name("greeter")
                    .step(ResolveStep.of("result", Map.of("greeting", ArgBinding.input("who"))))
                    .build();
            when(definitionResolver.findByName("prj-1", "/projects/one", "greeter")).thenReturn(Mono.just(child));

            WorkflowDefinition parent = WorkflowDefinition.builder()
                    .id("wf-parent")
                    .step(WorkflowInvocationStep.byName("call", "greeter", Map.of("who", ArgBinding.input("name"))))
                    .step(ResolveStep.of("result", Map.of(
                                    "greeting", ArgBinding.step("call", "output.greeting"),
                                    "status", ArgBinding.step("call", "status")))
                            .dependingOn("call"))
                    .build();

            StepVerifier.create(run(parent, Map.of("name", "Ada")))
                    .assertNext(execution -> {
                        assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETED);
                        assertThat(execution.output())
                                .containsEntry("greeting", "Ada")
                                .containsEntry("status", "completed");
                    })
                    .expectComplete()
                    .verify(Duration.ofSeconds(10));
        }

        @Test
        void shouldSurfaceChildFailure() {
            WorkflowDefinition child = WorkflowDefinition.builder()
                    .id("wf-child")
                    .step(RejectStep.of("stop", "child said no"))
                    .build();
            when(definitionResolver.findById("prj-1", "/projects/one", "wf-child")).thenReturn(Mono.just(child));

            WorkflowDefinition parent = WorkflowDefinition.builder()
                    .id("wf-parent")
                    .step(WorkflowInvocationStep.byId("call", "wf-child", Map.of()))
                    .build();

            StepVerifier.create(run(parent, Map.of()))
                    .assertNext(execution -> {
                        assertThat(execution.status()).isEqualTo(ExecutionStatus.FAILED);
                        assertThat(execution.error()).isEqualTo("child said no");
                    })
                    .expectComplete()
                    .verify(Duration.ofSeconds(10));
        }
    }

    private static String describe(WorkflowEvent event) {
        return event.type().getWireName() + ":" + event.status();
    }
}

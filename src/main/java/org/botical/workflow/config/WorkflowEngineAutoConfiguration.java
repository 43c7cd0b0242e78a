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

package org.botical.workflow.config;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.botical.workflow.action.ActionRegistry;
import org.botical.workflow.approval.ApprovalRequestService;
import org.botical.workflow.approval.ApprovalStepRunner;
import org.botical.workflow.approval.ProjectMemberDirectory;
import org.botical.workflow.child.ChildWorkflowService;
import org.botical.workflow.child.WorkflowDefinitionResolver;
import org.botical.workflow.core.BindingResolver;
import org.botical.workflow.core.ConditionEvaluator;
import org.botical.workflow.core.StepExecutor;
import org.botical.workflow.core.WorkflowEngine;
import org.botical.workflow.core.WorkflowExecutor;
import org.botical.workflow.event.WorkflowEventPublisher;
import org.botical.workflow.health.WorkflowEngineHealthIndicator;
import org.botical.workflow.metrics.WorkflowMetrics;
import org.botical.workflow.properties.WorkflowProperties;
import org.botical.workflow.resilience.ErrorClassifier;
import org.botical.workflow.resilience.WorkflowResilience;
import org.botical.workflow.service.WorkflowInputValidator;
import org.botical.workflow.service.WorkflowService;
import org.botical.workflow.session.AgentSessionService;
import org.botical.workflow.session.SessionStepRunner;
import org.botical.workflow.state.CacheWorkflowExecutionStore;
import org.botical.workflow.state.WorkflowExecutionStore;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.Nullable;

/**
 * Auto-configuration for the Botical workflow engine.
 * <p>
 * Provides the engine and its internal collaborators:
 * <ul>
 *   <li>WorkflowExecutionStore - Caffeine-backed execution state</li>
 *   <li>WorkflowEventPublisher - live event stream</li>
 *   <li>WorkflowResilience - per-action circuit breakers and retry</li>
 *   <li>StepExecutor, WorkflowExecutor, WorkflowEngine - execution</li>
 *   <li>WorkflowService - input validation and execution queries</li>
 *   <li>WorkflowEngineHealthIndicator - health monitoring</li>
 * </ul>
 * <p>
 * The host application contributes {@link ActionRegistry}, {@link AgentSessionService},
 * {@link ApprovalRequestService}, {@link ProjectMemberDirectory} and
 * {@link WorkflowDefinitionResolver} beans. Each is optional; a step that needs a missing
 * collaborator fails when it runs.
 */
@Slf4j
@AutoConfiguration(afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@EnableConfigurationProperties(WorkflowProperties.class)
@ConditionalOnProperty(prefix = "botical.workflow", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WorkflowEngineAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ErrorClassifier workflowErrorClassifier() {
        return new ErrorClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "botical.workflow", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
    public WorkflowMetrics workflowMetrics(MeterRegistry meterRegistry) {
        log.info("Creating WorkflowMetrics");
        return new WorkflowMetrics(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowResilience workflowResilience(WorkflowProperties properties,
                                                 ErrorClassifier errorClassifier,
                                                 @Nullable WorkflowMetrics workflowMetrics) {
        log.info("Creating WorkflowResilience with circuit breaker enabled: {}",
                properties.getCircuitBreaker().isEnabled());
        return new WorkflowResilience(properties, errorClassifier, workflowMetrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowExecutionStore workflowExecutionStore(WorkflowProperties properties) {
        log.info("Creating CacheWorkflowExecutionStore with TTL: {}", properties.getState().getDefaultTtl());
        return new CacheWorkflowExecutionStore(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowEventPublisher workflowEventPublisher(WorkflowProperties properties) {
        return new WorkflowEventPublisher(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public BindingResolver workflowBindingResolver() {
        return new BindingResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConditionEvaluator workflowConditionEvaluator(BindingResolver bindingResolver) {
        return new ConditionEvaluator(bindingResolver);
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionStepRunner sessionStepRunner(@Nullable AgentSessionService agentSessionService) {
        log.info("Creating SessionStepRunner with agent session service: {}", agentSessionService != null);
        return new SessionStepRunner(agentSessionService);
    }

    @Bean
    @ConditionalOnMissingBean
    public ApprovalStepRunner approvalStepRunner(@Nullable ApprovalRequestService approvalRequestService,
                                                 @Nullable ProjectMemberDirectory projectMemberDirectory,
                                                 WorkflowEventPublisher eventPublisher) {
        log.info("Creating ApprovalStepRunner with approval service: {}, member directory: {}",
                approvalRequestService != null, projectMemberDirectory != null);
        return new ApprovalStepRunner(approvalRequestService, projectMemberDirectory, eventPublisher);
    }

    @Bean
    @ConditionalOnMissingBean
    public ChildWorkflowService childWorkflowService(@Nullable WorkflowDefinitionResolver definitionResolver,
                                                     WorkflowExecutionStore executionStore,
                                                     WorkflowProperties properties) {
        log.info("Creating ChildWorkflowService with definition resolver: {}", definitionResolver != null);
        return new ChildWorkflowService(definitionResolver, executionStore, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public StepExecutor stepExecutor(WorkflowProperties properties,
                                     BindingResolver bindingResolver,
                                     ConditionEvaluator conditionEvaluator,
                                     WorkflowExecutionStore executionStore,
                                     WorkflowEventPublisher eventPublisher,
                                     WorkflowResilience resilience,
                                     @Nullable ActionRegistry actionRegistry,
                                     SessionStepRunner sessionStepRunner,
                                     ApprovalStepRunner approvalStepRunner,
                                     ChildWorkflowService childWorkflowService) {
        log.info("Creating StepExecutor with action registry: {}", actionRegistry != null);
        return new StepExecutor(properties, bindingResolver, conditionEvaluator, executionStore, eventPublisher,
                resilience, actionRegistry, sessionStepRunner, approvalStepRunner, childWorkflowService);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowExecutor workflowExecutor(StepExecutor stepExecutor,
                                             WorkflowExecutionStore executionStore,
                                             WorkflowEventPublisher eventPublisher,
                                             @Nullable WorkflowMetrics workflowMetrics) {
        log.info("Creating WorkflowExecutor with metrics: {}", workflowMetrics != null);
        return new WorkflowExecutor(stepExecutor, executionStore, eventPublisher, workflowMetrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowEngine workflowEngine(WorkflowExecutor executor, WorkflowExecutionStore executionStore) {
        log.info("Creating WorkflowEngine");
        return new WorkflowEngine(executor, executionStore);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowInputValidator workflowInputValidator() {
        return new WorkflowInputValidator();
    }

    /**
     * Service layer for workflow operations.
     */
    @Bean
    @ConditionalOnMissingBean
    public WorkflowService workflowService(WorkflowEngine workflowEngine,
                                           WorkflowExecutionStore executionStore,
                                           WorkflowEventPublisher eventPublisher,
                                           WorkflowInputValidator inputValidator) {
        log.info("Creating WorkflowService");
        return new WorkflowService(workflowEngine, executionStore, eventPublisher, inputValidator);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(ReactiveHealthIndicator.class)
    @ConditionalOnProperty(prefix = "botical.workflow", name = "health-enabled", havingValue = "true", matchIfMissing = true)
    static class WorkflowHealthConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public WorkflowEngineHealthIndicator workflowEngineHealthIndicator(WorkflowExecutionStore executionStore,
                                                                           WorkflowResilience resilience) {
            return new WorkflowEngineHealthIndicator(executionStore, resilience);
        }
    }
}

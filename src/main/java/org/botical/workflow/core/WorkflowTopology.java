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
import org.botical.workflow.exception.WorkflowValidationException;
import org.botical.workflow.model.WorkflowStep;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Computes the execution layers of a step graph.
 * <p>
 * Uses Kahn's algorithm: layer 0 holds every step without dependencies, and each following
 * layer holds the steps whose dependencies all sit in earlier layers. Steps of one layer run
 * concurrently. Within a layer steps keep their declaration order.
 * <p>
 * A {@code dependsOn} entry naming a step that does not exist is ignored. A cycle is a
 * definition error raised before any layer is returned.
 */
@Slf4j
public class WorkflowTopology {

    private final Map<String, WorkflowStep> stepMap;
    private final Map<String, List<String>> dependents;
    private final Map<String, Integer> inDegree;
    private List<List<WorkflowStep>> executionLayers;

    /**
     * Creates a topology for the given steps.
     *
     * @param steps the steps in declaration order
     * @throws WorkflowValidationException if two steps share an id
     */
    public WorkflowTopology(List<WorkflowStep> steps) {
        Objects.requireNonNull(steps, "steps cannot be null");
        this.stepMap = new LinkedHashMap<>();
        this.dependents = new HashMap<>();
        this.inDegree = new HashMap<>();

        for (WorkflowStep step : steps) {
            if (stepMap.putIfAbsent(step.id(), step) != null) {
                throw new WorkflowValidationException("Duplicate step id in workflow: " + step.id());
            }
            dependents.put(step.id(), new ArrayList<>());
            inDegree.put(step.id(), 0);
        }

        for (WorkflowStep step : steps) {
            for (String depId : step.dependsOn()) {
                if (stepMap.containsKey(depId)) {
                    inDegree.merge(step.id(), 1, Integer::sum);
                    dependents.get(depId).add(step.id());
                } else {
                    log.debug("Ignoring dependency on unknown step: stepId={}, dependsOn={}", step.id(), depId);
                }
            }
        }
    }

    /**
     * Builds execution layers.
     *
     * @return list of execution layers, each containing steps that can run in parallel
     * @throws WorkflowValidationException if the dependencies form a cycle
     */
    public List<List<WorkflowStep>> buildExecutionLayers() {
        if (executionLayers != null) {
            return executionLayers;
        }

        Map<String, Integer> remainingDegree = new HashMap<>(inDegree);
        List<String> remaining = new ArrayList<>(stepMap.keySet());
        List<List<WorkflowStep>> layers = new ArrayList<>();

        while (!remaining.isEmpty()) {
            List<WorkflowStep> currentLayer = remaining.stream()
                    .filter(id -> remainingDegree.get(id) == 0)
                    .map(stepMap::get)
                    .collect(Collectors.toList());

            if (currentLayer.isEmpty()) {
                throw new WorkflowValidationException(
                        "Circular dependency in workflow steps: " + String.join(", ", remaining));
            }

            layers.add(Collections.unmodifiableList(currentLayer));

            for (WorkflowStep step : currentLayer) {
                remaining.remove(step.id());
                for (String dependentId : dependents.get(step.id())) {
                    remainingDegree.merge(dependentId, -1, Integer::sum);
                }
            }
        }

        executionLayers = Collections.unmodifiableList(layers);
        log.debug("Built {} execution layers for {} steps", executionLayers.size(), stepMap.size());
        return executionLayers;
    }

    /**
     * Gets the ids of steps that depend on the given step.
     */
    public List<String> getDependents(String stepId) {
        return Collections.unmodifiableList(dependents.getOrDefault(stepId, List.of()));
    }
}

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

import java.time.Instant;
import java.util.List;

/**
 * A persisted request for human approval.
 *
 * @param id approval id
 * @param executionId the execution that asked for approval
 * @param stepId the approval step
 * @param message what the approvers are asked
 * @param approvers user ids allowed to decide
 * @param timeoutMs advisory timeout, null when unbounded
 * @param autoApprove whether the request approves itself on timeout
 * @param createdAt creation time
 */
public record ApprovalRequest(
        String id,
        String executionId,
        String stepId,
        String message,
        List<String> approvers,
        Long timeoutMs,
        boolean autoApprove,
        Instant createdAt
) {}

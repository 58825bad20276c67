/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.research.domain.model;

/**
 * Per-run context handed to tools that spawn work of their own (the fact-check
 * tool starts claim-validation sub-conversations).
 *
 * @param cancellation
 *            cancellation token of the owning run
 * @param metrics
 *            counters of the owning run
 * @param depth
 *            0 for the top-level conversation, 1 for sub-conversations
 */
public record ToolInvocationContext(CancellationToken cancellation, ResearchMetrics metrics, int depth) {

    public static ToolInvocationContext detached() {
        return new ToolInvocationContext(CancellationToken.none(), new ResearchMetrics(), 0);
    }

    public ToolInvocationContext nested() {
        return new ToolInvocationContext(cancellation, metrics, depth + 1);
    }
}

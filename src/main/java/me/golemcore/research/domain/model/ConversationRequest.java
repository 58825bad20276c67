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

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Input of one conversation engine run.
 */
@Value
@Builder
public class ConversationRequest {

    String systemPrompt;
    String userPrompt;

    /**
     * Names of the tools the model may call; empty means a tool-less run.
     */
    @Builder.Default
    List<String> toolNames = List.of();

    /**
     * Step budget override; null uses the configured default.
     */
    Integer maxSteps;

    /**
     * Wall-clock budget override; null uses the configured default.
     */
    Duration timeout;

    Double temperature;

    @Builder.Default
    CancellationToken cancellation = CancellationToken.none();

    @Builder.Default
    ResearchMetrics metrics = new ResearchMetrics();

    @Builder.Default
    int depth = 0;

    public ToolInvocationContext toolContext() {
        return new ToolInvocationContext(cancellation, metrics, depth);
    }
}

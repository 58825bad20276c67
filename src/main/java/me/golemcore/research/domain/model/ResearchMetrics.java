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

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Passive counters for one research run. Shared with the claim-validation
 * sub-conversations of the run, so all counters are thread-safe.
 */
public class ResearchMetrics {

    private final AtomicInteger modelCalls = new AtomicInteger();
    private final AtomicInteger steps = new AtomicInteger();
    private final AtomicInteger subConversations = new AtomicInteger();
    private final AtomicInteger claimsValidated = new AtomicInteger();
    private final Map<String, AtomicInteger> toolCalls = new ConcurrentHashMap<>();

    public void recordModelCall() {
        modelCalls.incrementAndGet();
    }

    public void recordStep() {
        steps.incrementAndGet();
    }

    public void recordToolCall(String toolName) {
        toolCalls.computeIfAbsent(toolName, k -> new AtomicInteger()).incrementAndGet();
    }

    public void recordSubConversation() {
        subConversations.incrementAndGet();
    }

    public void recordClaimValidated() {
        claimsValidated.incrementAndGet();
    }

    public int getModelCalls() {
        return modelCalls.get();
    }

    public int getToolCalls(String toolName) {
        AtomicInteger counter = toolCalls.get(toolName);
        return counter == null ? 0 : counter.get();
    }

    public MetricsSnapshot snapshot() {
        Map<String, Integer> perTool = new TreeMap<>();
        int total = 0;
        for (Map.Entry<String, AtomicInteger> entry : toolCalls.entrySet()) {
            int count = entry.getValue().get();
            perTool.put(entry.getKey(), count);
            total += count;
        }
        return new MetricsSnapshot(modelCalls.get(), steps.get(), total, perTool,
                subConversations.get(), claimsValidated.get());
    }
}

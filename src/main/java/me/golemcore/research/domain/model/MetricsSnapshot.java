package me.golemcore.research.domain.model;

import java.util.Map;

/**
 * Immutable view of a run's counters.
 */
public record MetricsSnapshot(
        int modelCalls,
        int steps,
        int totalToolCalls,
        Map<String, Integer> toolCalls,
        int subConversations,
        int claimsValidated) {

    public MetricsSnapshot {
        toolCalls = toolCalls == null ? Map.of() : Map.copyOf(toolCalls);
    }
}

package me.golemcore.research.domain.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a complete research run. Always carries a report, even when the
 * run stopped on a budget, a model error or a cancellation.
 */
@Value
@Builder
public class ResearchResult {

    String runId;
    String query;
    ResearchMode mode;
    Report report;
    StopReason stopReason;
    int steps;
    MetricsSnapshot metrics;

    @Builder.Default
    List<Claim> claims = List.of();

    /**
     * Where the report was written, or null when it was not persisted.
     */
    Path reportPath;
}

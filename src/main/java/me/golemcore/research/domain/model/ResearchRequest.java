package me.golemcore.research.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ResearchRequest {

    String query;

    @Builder.Default
    ResearchMode mode = ResearchMode.WEB;

    /**
     * Step budget override; null uses the configured default.
     */
    Integer maxSteps;

    @Builder.Default
    boolean persist = true;
}

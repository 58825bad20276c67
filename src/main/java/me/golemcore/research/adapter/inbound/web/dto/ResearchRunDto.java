package me.golemcore.research.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.research.domain.model.MetricsSnapshot;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchRunDto {
    private String id;
    private String query;
    private String mode;
    private String status;
    private String stopReason;
    private Integer steps;
    private String report;
    private boolean reportFallback;
    private String reportPath;
    private MetricsSnapshot metrics;
    private List<ClaimDto> claims;
    private String error;
    private String startedAt;
    private String finishedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ClaimDto {
        private String text;
        private String confidence;
        private String verdict;
        private boolean needsMoreResearch;
        private List<String> supportingSources;
        private List<String> contradictingSources;
        private String notes;
    }
}

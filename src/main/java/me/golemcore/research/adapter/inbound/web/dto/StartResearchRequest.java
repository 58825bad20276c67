package me.golemcore.research.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartResearchRequest {
    private String query;
    private String mode;
    private Integer maxSteps;
    @Builder.Default
    private Boolean persist = true;
}

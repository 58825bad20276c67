package me.golemcore.research.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmUsage {

    private Integer inputTokens;
    private Integer outputTokens;
    private Integer totalTokens;
    private Duration latency;
    private String model;
}

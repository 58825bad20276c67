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

package me.golemcore.research.tools;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.research.domain.component.ToolComponent;
import me.golemcore.research.domain.model.CancellationToken;
import me.golemcore.research.domain.model.Citation;
import me.golemcore.research.domain.model.Claim;
import me.golemcore.research.domain.model.ToolDefinition;
import me.golemcore.research.domain.model.ToolFailureKind;
import me.golemcore.research.domain.model.ToolInvocationContext;
import me.golemcore.research.domain.model.ToolResult;
import me.golemcore.research.domain.validation.ClaimValidator;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Hands claims extracted by the model to the {@link ClaimValidator}
 * ({@code fact_check}). Each claim is validated in its own bounded
 * sub-conversation; the result lists verdict, confidence and evidence per
 * claim. Not offered inside sub-conversations.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FactCheckTool implements ToolComponent {

    public static final String NAME = "fact_check";
    private static final String PARAM_CLAIMS = "claims";

    // provider breaks the cycle engine -> registry -> tools -> validator -> engine
    private final ObjectProvider<ClaimValidator> claimValidator;
    private final ResearchProperties properties;
    private final ExecutorService researchExecutor;

    @Override
    public Duration getTimeout() {
        return Duration.ofSeconds(properties.getEngine().getDeadlineSeconds());
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Validate factual claims. Each claim is checked independently by searching for "
                        + "supporting and contradicting evidence. Returns verdict, confidence and sources per claim.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_CLAIMS, Map.of(
                                        "type", "array",
                                        "items", Map.of("type", "string"),
                                        "description", "Atomic factual claims, one short sentence each")),
                        "required", List.of(PARAM_CLAIMS)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return execute(parameters, ToolInvocationContext.detached());
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolInvocationContext context) {
        if (context.depth() > 0) {
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                    "fact_check is not available while validating a claim"));
        }
        List<String> claims = ((List<?>) parameters.get(PARAM_CLAIMS)).stream()
                .filter(item -> item != null)
                .map(String::valueOf)
                .toList();
        if (claims.isEmpty()) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, "At least one claim is required"));
        }
        // Validation stops with the run, and also when the caller abandons this
        // future (timeout or cancel).
        CancellationToken validation = CancellationToken.create();
        Runnable unlink = context.cancellation().onCancel(validation::cancel);
        ToolInvocationContext validationContext = new ToolInvocationContext(validation, context.metrics(),
                context.depth());
        CompletableFuture<ToolResult> future = CompletableFuture.supplyAsync(() -> {
            List<Claim> validated = claimValidator.getObject().validateAll(claims, validationContext);
            return ToolResult.success(format(validated), validated);
        }, researchExecutor);
        future.whenComplete((result, error) -> {
            unlink.run();
            if (error != null && validation.cancel()) {
                log.info("[FactCheck] Validation of {} claim(s) abandoned", claims.size());
            }
        });
        return future;
    }

    static String format(List<Claim> claims) {
        StringBuilder sb = new StringBuilder();
        for (Claim claim : claims) {
            if (sb.length() > 0) {
                sb.append("\n---\n\n");
            }
            sb.append("CLAIM: ").append(claim.getText()).append('\n');
            sb.append("VERDICT: ").append(claim.getVerdict())
                    .append(" | CONFIDENCE: ").append(claim.getConfidence())
                    .append(" | ROUNDS: ").append(claim.getRounds()).append('\n');
            appendEvidence(sb, "SUPPORTING", claim.getSupportingEvidence());
            appendEvidence(sb, "CONTRADICTING", claim.getContradictingEvidence());
            if (claim.getNotes() != null && !claim.getNotes().isBlank()) {
                sb.append("NOTES: ").append(claim.getNotes()).append('\n');
            }
            sb.append("NEEDS_MORE_RESEARCH: ").append(claim.isNeedsMoreResearch() ? "YES" : "NO").append('\n');
        }
        return sb.toString();
    }

    private static void appendEvidence(StringBuilder sb, String label, List<Citation> citations) {
        sb.append(label).append(':');
        if (citations.isEmpty()) {
            sb.append(" none\n");
            return;
        }
        sb.append('\n');
        for (Citation citation : citations) {
            sb.append("- ").append(citation.snippet()).append(" (").append(citation.sourceUrl()).append(")\n");
        }
    }
}

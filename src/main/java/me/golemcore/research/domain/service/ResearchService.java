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

package me.golemcore.research.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.research.domain.engine.ConversationEngine;
import me.golemcore.research.domain.model.CancellationToken;
import me.golemcore.research.domain.model.Claim;
import me.golemcore.research.domain.model.Conversation;
import me.golemcore.research.domain.model.ConversationRequest;
import me.golemcore.research.domain.model.ConversationRunResult;
import me.golemcore.research.domain.model.Message;
import me.golemcore.research.domain.model.MetricsSnapshot;
import me.golemcore.research.domain.model.Report;
import me.golemcore.research.domain.model.ResearchMetrics;
import me.golemcore.research.domain.model.ResearchMode;
import me.golemcore.research.domain.model.ResearchRequest;
import me.golemcore.research.domain.model.ResearchResult;
import me.golemcore.research.domain.model.StopReason;
import me.golemcore.research.domain.model.ToolExecutionOutcome;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import me.golemcore.research.port.outbound.ReportStoragePort;
import me.golemcore.research.tools.FactCheckTool;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs one research request end to end: conversation engine run for the
 * selected mode, report extraction, claim collection, persistence and metrics.
 *
 * <p>
 * A result always carries a report. Runs stopped by a budget, a model error or
 * a cancellation still yield the best text found in the conversation, or a
 * placeholder naming the stop reason when no message carried any text.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResearchService {

    private final ConversationEngine conversationEngine;
    private final ReportExtractor reportExtractor;
    private final ReportStoragePort reportStorage;
    private final ResearchProperties properties;

    public ResearchResult research(ResearchRequest request) {
        return research(UUID.randomUUID().toString(), request, CancellationToken.create());
    }

    public ResearchResult research(String runId, ResearchRequest request, CancellationToken cancellation) {
        if (request.getQuery() == null || request.getQuery().isBlank()) {
            throw new IllegalArgumentException("Research query must not be blank");
        }
        ResearchMode mode = request.getMode() != null ? request.getMode() : ResearchMode.WEB;
        ResearchMetrics metrics = new ResearchMetrics();
        log.info("[Research] Starting run {}: mode={}, query='{}'", runId, mode, request.getQuery());

        ConversationRunResult run = conversationEngine.run(buildConversationRequest(mode, request, cancellation,
                metrics));

        Report report = reportExtractor.extract(run.conversation(), request.getQuery())
                .orElseGet(() -> placeholder(request.getQuery(), run.stopReason()));
        List<Claim> claims = collectClaims(run.conversation());

        Path reportPath = null;
        if (request.isPersist() && properties.getStorage().isEnabled()) {
            reportPath = persist(mode, runId, request.getQuery(), report);
        }

        MetricsSnapshot snapshot = metrics.snapshot();
        log.info("[Research] Run {} finished: stopReason={}, steps={}, modelCalls={}, toolCalls={}, "
                + "subConversations={}, claimsValidated={}", runId, run.stopReason(), run.steps(),
                snapshot.modelCalls(), snapshot.toolCalls(), snapshot.subConversations(),
                snapshot.claimsValidated());

        return ResearchResult.builder()
                .runId(runId)
                .query(request.getQuery())
                .mode(mode)
                .report(report)
                .stopReason(run.stopReason())
                .steps(run.steps())
                .metrics(snapshot)
                .claims(claims)
                .reportPath(reportPath)
                .build();
    }

    private ConversationRequest buildConversationRequest(ResearchMode mode, ResearchRequest request,
            CancellationToken cancellation, ResearchMetrics metrics) {
        Integer maxSteps = mode == ResearchMode.DIRECT ? Integer.valueOf(1) : request.getMaxSteps();
        return ConversationRequest.builder()
                .systemPrompt(ResearchPrompts.instructionsFor(mode))
                .userPrompt(ResearchPrompts.userPromptFor(mode, request.getQuery()))
                .toolNames(mode.getToolNames())
                .maxSteps(maxSteps)
                .cancellation(cancellation)
                .metrics(metrics)
                .build();
    }

    static Report placeholder(String query, StopReason stopReason) {
        return new Report(query, "No report text was produced (run stopped: " + stopReason + ").", -1, true);
    }

    static List<Claim> collectClaims(Conversation conversation) {
        List<Claim> claims = new ArrayList<>();
        for (Message message : conversation.getMessages()) {
            if (!message.isToolOutcome()) {
                continue;
            }
            for (ToolExecutionOutcome outcome : message.getToolOutcomes()) {
                if (!FactCheckTool.NAME.equals(outcome.toolName()) || !outcome.isSuccess()) {
                    continue;
                }
                if (outcome.toolResult().getData() instanceof List<?> data) {
                    for (Object item : data) {
                        if (item instanceof Claim claim) {
                            claims.add(claim);
                        }
                    }
                }
            }
        }
        return claims;
    }

    private Path persist(ResearchMode mode, String runId, String query, Report report) {
        try {
            Path path = reportStorage.save(mode, runId, mode.getReportTitle(), query, report.body());
            log.info("[Research] Report saved to {}", path);
            return path;
        } catch (IOException | RuntimeException e) {
            log.warn("[Research] Failed to save report for run {}: {}", runId, e.getMessage());
            return null;
        }
    }
}

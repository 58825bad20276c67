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

package me.golemcore.research.domain.validation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.research.domain.engine.ConversationEngine;
import me.golemcore.research.domain.model.Citation;
import me.golemcore.research.domain.model.Claim;
import me.golemcore.research.domain.model.Confidence;
import me.golemcore.research.domain.model.ConversationRequest;
import me.golemcore.research.domain.model.ConversationRunResult;
import me.golemcore.research.domain.model.ToolInvocationContext;
import me.golemcore.research.domain.model.Verdict;
import me.golemcore.research.domain.service.ResearchPrompts;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Bounded search-and-verify loop per claim.
 *
 * <p>
 * Each round is an independent sub-conversation of the conversation engine,
 * seeded with the fact-checker instructions and limited to web search and
 * crawling. Evidence accumulates across rounds. A claim is final once its
 * confidence is HIGH; when the round budget runs out first the claim is marked
 * as needing more research and its confidence drops to LOW.
 *
 * <p>
 * Claims are validated concurrently; each claim's rounds run sequentially.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClaimValidator {

    static final List<String> VALIDATION_TOOLS = List.of("web_search", "crawl_webpage");

    private final ConversationEngine conversationEngine;
    private final ClaimFindingsParser findingsParser;
    private final ResearchProperties properties;
    private final ExecutorService researchExecutor;

    /**
     * Validates claims concurrently and returns them in input order. Blank and
     * duplicate claims are skipped; at most {@code validation.max-claims} are
     * validated.
     */
    public List<Claim> validateAll(List<String> claimTexts, ToolInvocationContext context) {
        List<String> distinct = claimTexts.stream()
                .filter(text -> text != null && !text.isBlank())
                .map(String::trim)
                .distinct()
                .limit(properties.getValidation().getMaxClaims())
                .toList();
        log.info("[Validator] Validating {} claim(s)", distinct.size());

        List<CompletableFuture<Claim>> futures = new ArrayList<>();
        for (String text : distinct) {
            futures.add(CompletableFuture.supplyAsync(() -> validate(text, context), researchExecutor));
        }
        Runnable deregister = context.cancellation().onCancel(() -> futures.forEach(f -> f.cancel(true)));
        try {
            List<Claim> claims = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                claims.add(awaitClaim(futures.get(i), distinct.get(i)));
            }
            return claims;
        } finally {
            deregister.run();
        }
    }

    private Claim awaitClaim(CompletableFuture<Claim> future, String text) {
        try {
            return future.join();
        } catch (RuntimeException e) {
            log.warn("[Validator] Validation of '{}' did not complete: {}", text, e.getMessage());
            Claim claim = Claim.of(text);
            claim.setNeedsMoreResearch(true);
            claim.setNotes("Validation did not complete");
            return claim;
        }
    }

    /**
     * Runs up to {@code validation.max-rounds} rounds for one claim.
     */
    public Claim validate(String text, ToolInvocationContext context) {
        Claim claim = Claim.of(text);
        int maxRounds = properties.getValidation().getMaxRounds();
        Verdict lastReported = null;
        String previousFindings = null;
        boolean conflict = false;

        for (int round = 1; round <= maxRounds; round++) {
            if (context.cancellation().isCancelled()) {
                log.info("[Validator] Cancelled before round {} of '{}'", round, text);
                break;
            }
            ClaimFindings findings = runRound(text, round, previousFindings, context);
            claim.setRounds(round);
            findings.supporting().forEach(claim::addSupporting);
            findings.contradicting().forEach(claim::addContradicting);
            if (findings.notes() != null) {
                claim.setNotes(findings.notes());
            }
            if (findings.verdict() != null) {
                lastReported = findings.verdict();
            }

            boolean hasSupporting = !claim.getSupportingEvidence().isEmpty();
            conflict = conflictAfter(conflict, claim, findings);
            Confidence confidence = VerdictPolicy.confidence(findings.confidence(), hasSupporting, conflict);
            claim.setConfidence(confidence);
            claim.setVerdict(VerdictPolicy.verdict(lastReported, confidence, hasSupporting,
                    !claim.getContradictingEvidence().isEmpty(), conflict));
            claim.setNeedsMoreResearch(confidence != Confidence.HIGH || Boolean.TRUE.equals(findings.needsMoreResearch()));

            log.debug("[Validator] Round {} of '{}': {} / {}", round, text, claim.getVerdict(), confidence);
            if (confidence == Confidence.HIGH) {
                claim.setNeedsMoreResearch(false);
                break;
            }
            previousFindings = describe(claim);
        }

        if (claim.getConfidence() != Confidence.HIGH) {
            boolean hasSupporting = !claim.getSupportingEvidence().isEmpty();
            boolean hasContradicting = !claim.getContradictingEvidence().isEmpty();
            claim.setNeedsMoreResearch(true);
            claim.setConfidence(Confidence.LOW);
            if (claim.getVerdict() != Verdict.UNCERTAIN) {
                claim.setVerdict(VerdictPolicy.verdict(lastReported, Confidence.LOW, hasSupporting, hasContradicting,
                        conflict));
            }
        }

        context.metrics().recordClaimValidated();
        log.info("[Validator] '{}' -> {} ({}, {} round(s))", text, claim.getVerdict(), claim.getConfidence(),
                claim.getRounds());
        return claim;
    }

    /**
     * A conflict opens when supporting evidence exists and a round lists
     * contradicting evidence. Only a round answering with supporting evidence
     * and no contradictions resolves it; rounds without evidence leave it as is.
     */
    static boolean conflictAfter(boolean previous, Claim claim, ClaimFindings latest) {
        if (!latest.contradicting().isEmpty()) {
            return previous || !claim.getSupportingEvidence().isEmpty();
        }
        if (!latest.supporting().isEmpty()) {
            return false;
        }
        return previous;
    }

    private ClaimFindings runRound(String text, int round, String previousFindings, ToolInvocationContext context) {
        context.metrics().recordSubConversation();
        ConversationRequest request = ConversationRequest.builder()
                .systemPrompt(ResearchPrompts.FACT_CHECKER_INSTRUCTIONS)
                .userPrompt(ResearchPrompts.claimRoundPrompt(text, round, previousFindings))
                .toolNames(VALIDATION_TOOLS)
                .maxSteps(properties.getValidation().getMaxStepsPerRound())
                .cancellation(context.cancellation())
                .metrics(context.metrics())
                .depth(context.depth() + 1)
                .build();
        ConversationRunResult result = conversationEngine.run(request);
        return result.conversation().lastAssistantText()
                .map(findingsParser::parse)
                .orElseGet(() -> {
                    log.warn("[Validator] Round {} of '{}' ended without an answer ({})", round, text,
                            result.stopReason());
                    return ClaimFindings.empty();
                });
    }

    private static String describe(Claim claim) {
        StringBuilder sb = new StringBuilder();
        sb.append("SUPPORTING:");
        appendCitations(sb, claim.getSupportingEvidence());
        sb.append("\nCONTRADICTING:");
        appendCitations(sb, claim.getContradictingEvidence());
        sb.append("\nCONFIDENCE: ").append(claim.getConfidence());
        if (claim.getNotes() != null) {
            sb.append("\nNOTES: ").append(claim.getNotes());
        }
        return sb.toString();
    }

    private static void appendCitations(StringBuilder sb, List<Citation> citations) {
        if (citations.isEmpty()) {
            sb.append(" none found");
            return;
        }
        for (Citation citation : citations) {
            sb.append("\n- ").append(citation.snippet()).append(" (").append(citation.sourceUrl()).append(')');
        }
    }
}

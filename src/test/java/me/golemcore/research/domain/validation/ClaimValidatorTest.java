package me.golemcore.research.domain.validation;

import me.golemcore.research.domain.engine.ConversationEngine;
import me.golemcore.research.domain.model.CancellationToken;
import me.golemcore.research.domain.model.Claim;
import me.golemcore.research.domain.model.Confidence;
import me.golemcore.research.domain.model.Conversation;
import me.golemcore.research.domain.model.ConversationRequest;
import me.golemcore.research.domain.model.ConversationRunResult;
import me.golemcore.research.domain.model.Message;
import me.golemcore.research.domain.model.ResearchMetrics;
import me.golemcore.research.domain.model.StopReason;
import me.golemcore.research.domain.model.ToolInvocationContext;
import me.golemcore.research.domain.model.Verdict;
import me.golemcore.research.infrastructure.config.ResearchProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ClaimValidatorTest {

    private static final String CLAIM = "Java was released in 1995";

    private static final String CONFIRMED_ANSWER = """
            CLAIM: Java was released in 1995
            SUPPORTING:
            - Oracle history (https://www.oracle.com/java/history.html)
            CONTRADICTING: none
            CONFIDENCE: HIGH
            VERDICT: CONFIRMED
            NEEDS_MORE_RESEARCH: no
            """;

    private static final String CONFLICTING_ANSWER = """
            SUPPORTING:
            - Oracle history (https://www.oracle.com/java/history.html)
            CONTRADICTING:
            - Forum post claims 1996 (https://forum.example/java)
            CONFIDENCE: HIGH
            VERDICT: CONFIRMED
            """;

    private static final String CONFLICT_REPORTED_LIKELY_TRUE = """
            SUPPORTING:
            - Oracle history (https://www.oracle.com/java/history.html)
            CONTRADICTING:
            - Forum post claims 1996 (https://forum.example/java)
            CONFIDENCE: MEDIUM
            VERDICT: LIKELY_TRUE
            """;

    private static final String SUPPORTING_ONLY_ANSWER = """
            SUPPORTING:
            - Sun press release (https://sun.example/1995/java)
            CONTRADICTING: none
            CONFIDENCE: MEDIUM
            VERDICT: LIKELY_TRUE
            """;

    private static final String MEDIUM_ANSWER = """
            SUPPORTING:
            - Some article (https://news.example/java)
            CONFIDENCE: MEDIUM
            VERDICT: CONFIRMED
            """;

    private ConversationEngine engine;
    private ResearchProperties properties;
    private ExecutorService executor;
    private ClaimValidator validator;
    private ResearchMetrics metrics;
    private CancellationToken cancellation;
    private ToolInvocationContext context;

    @BeforeEach
    void setUp() {
        engine = mock(ConversationEngine.class);
        properties = new ResearchProperties();
        executor = Executors.newFixedThreadPool(4);
        validator = new ClaimValidator(engine, new ClaimFindingsParser(), properties, executor);
        metrics = new ResearchMetrics();
        cancellation = CancellationToken.create();
        context = new ToolInvocationContext(cancellation, metrics, 0);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static ConversationRunResult answered(String text) {
        Conversation conversation = Conversation.start("Validate this claim");
        conversation.append(Message.assistantText(text));
        return new ConversationRunResult(conversation, StopReason.FINAL_ANSWER, 1, 0);
    }

    private static ConversationRunResult unanswered() {
        return new ConversationRunResult(Conversation.start("Validate this claim"),
                StopReason.STEP_BUDGET_EXHAUSTED, 8, 0);
    }

    // ==================== Single claim ====================

    @Test
    void shouldConfirmClaimWithHighConfidenceInFirstRound() {
        when(engine.run(any())).thenReturn(answered(CONFIRMED_ANSWER));

        Claim claim = validator.validate(CLAIM, context);

        assertEquals(Verdict.CONFIRMED, claim.getVerdict());
        assertEquals(Confidence.HIGH, claim.getConfidence());
        assertFalse(claim.isNeedsMoreResearch());
        assertEquals(1, claim.getRounds());
        assertEquals(1, claim.getSupportingEvidence().size());
        verify(engine, times(1)).run(any());
    }

    @Test
    void shouldRunSubConversationWithValidationToolsOnly() {
        when(engine.run(any())).thenReturn(answered(CONFIRMED_ANSWER));

        validator.validate(CLAIM, context);

        ArgumentCaptor<ConversationRequest> captor = ArgumentCaptor.forClass(ConversationRequest.class);
        verify(engine).run(captor.capture());
        ConversationRequest request = captor.getValue();
        assertEquals(List.of("web_search", "crawl_webpage"), request.getToolNames());
        assertEquals(1, request.getDepth());
        assertEquals(8, request.getMaxSteps());
        assertTrue(request.getUserPrompt().contains(CLAIM));
        assertEquals(cancellation, request.getCancellation());
        assertEquals(metrics, request.getMetrics());
    }

    @Test
    void shouldMarkUnresolvedConflictUncertainAfterRoundBudget() {
        when(engine.run(any())).thenReturn(answered(CONFLICTING_ANSWER));

        Claim claim = validator.validate(CLAIM, context);

        assertEquals(Verdict.UNCERTAIN, claim.getVerdict());
        assertEquals(Confidence.LOW, claim.getConfidence());
        assertTrue(claim.isNeedsMoreResearch());
        assertEquals(3, claim.getRounds());
        assertEquals(1, claim.getContradictingEvidence().size());
        verify(engine, times(3)).run(any());
    }

    @Test
    void shouldDowngradeConfirmedWithoutHighConfidence() {
        when(engine.run(any())).thenReturn(answered(MEDIUM_ANSWER));

        Claim claim = validator.validate(CLAIM, context);

        assertEquals(Verdict.LIKELY_TRUE, claim.getVerdict());
        assertEquals(Confidence.LOW, claim.getConfidence());
        assertTrue(claim.isNeedsMoreResearch());
    }

    @Test
    void shouldAccumulateEvidenceAcrossRounds() {
        when(engine.run(any())).thenReturn(answered(MEDIUM_ANSWER), answered(CONFIRMED_ANSWER));

        Claim claim = validator.validate(CLAIM, context);

        assertEquals(2, claim.getRounds());
        assertEquals(2, claim.getSupportingEvidence().size());
        assertEquals(Verdict.CONFIRMED, claim.getVerdict());
        assertEquals(2, metrics.snapshot().subConversations());
        assertEquals(1, metrics.snapshot().claimsValidated());
    }

    @Test
    void shouldReportUncertainWhenRoundsProduceNoAnswer() {
        when(engine.run(any())).thenReturn(unanswered());

        Claim claim = validator.validate(CLAIM, context);

        assertEquals(Verdict.UNCERTAIN, claim.getVerdict());
        assertEquals(Confidence.LOW, claim.getConfidence());
        assertTrue(claim.isNeedsMoreResearch());
        assertEquals(3, claim.getRounds());
    }

    @Test
    void shouldKeepConflictWhenLaterRoundsProduceNoAnswer() {
        when(engine.run(any())).thenReturn(answered(CONFLICT_REPORTED_LIKELY_TRUE), unanswered(), unanswered());

        Claim claim = validator.validate(CLAIM, context);

        assertEquals(Verdict.UNCERTAIN, claim.getVerdict());
        assertEquals(Confidence.LOW, claim.getConfidence());
        assertTrue(claim.isNeedsMoreResearch());
        assertEquals(3, claim.getRounds());
        assertEquals(1, claim.getContradictingEvidence().size());
    }

    @Test
    void shouldResolveConflictOnlyWhenRoundAnswersWithoutContradictions() {
        when(engine.run(any())).thenReturn(answered(CONFLICT_REPORTED_LIKELY_TRUE), answered(SUPPORTING_ONLY_ANSWER),
                unanswered());

        Claim claim = validator.validate(CLAIM, context);

        assertEquals(Verdict.LIKELY_TRUE, claim.getVerdict());
        assertEquals(Confidence.LOW, claim.getConfidence());
        assertTrue(claim.isNeedsMoreResearch());
        assertEquals(2, claim.getSupportingEvidence().size());
    }

    @Test
    void shouldStopRoundsWhenCancelled() {
        cancellation.cancel();

        Claim claim = validator.validate(CLAIM, context);

        assertEquals(0, claim.getRounds());
        assertTrue(claim.isNeedsMoreResearch());
        verify(engine, never()).run(any());
    }

    // ==================== Batch ====================

    @Test
    void shouldValidateDistinctClaimsInInputOrder() {
        properties.getValidation().setMaxClaims(2);
        when(engine.run(any())).thenAnswer(invocation -> {
            ConversationRequest request = invocation.getArgument(0);
            return request.getUserPrompt().contains("Water")
                    ? answered(MEDIUM_ANSWER)
                    : answered(CONFIRMED_ANSWER);
        });

        List<Claim> claims = validator.validateAll(
                List.of(CLAIM, " ", CLAIM, "Water boils at 90 C at sea level", "Third claim"), context);

        assertEquals(2, claims.size());
        assertEquals(CLAIM, claims.get(0).getText());
        assertEquals(Verdict.CONFIRMED, claims.get(0).getVerdict());
        assertEquals("Water boils at 90 C at sea level", claims.get(1).getText());
        assertTrue(claims.get(1).isNeedsMoreResearch());
        assertEquals(2, metrics.snapshot().claimsValidated());
    }
}

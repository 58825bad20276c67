package me.golemcore.research.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ResearchMetricsTest {

    @Test
    void shouldSnapshotAllCounters() {
        ResearchMetrics metrics = new ResearchMetrics();
        metrics.recordModelCall();
        metrics.recordModelCall();
        metrics.recordStep();
        metrics.recordToolCall("web_search");
        metrics.recordToolCall("web_search");
        metrics.recordToolCall("crawl_webpage");
        metrics.recordSubConversation();
        metrics.recordClaimValidated();

        MetricsSnapshot snapshot = metrics.snapshot();

        assertEquals(2, snapshot.modelCalls());
        assertEquals(1, snapshot.steps());
        assertEquals(3, snapshot.totalToolCalls());
        assertEquals(2, snapshot.toolCalls().get("web_search"));
        assertEquals(1, snapshot.toolCalls().get("crawl_webpage"));
        assertEquals(1, snapshot.subConversations());
        assertEquals(1, snapshot.claimsValidated());
    }

    @Test
    void shouldReportZeroForUnusedTool() {
        assertEquals(0, new ResearchMetrics().getToolCalls("wolfram_query"));
    }
}

package me.golemcore.research.domain.model;

/**
 * One search result. Rank is 1-based and follows provider relevance order.
 */
public record SearchHit(int rank, String title, String snippet, String url) {
}

package me.golemcore.research.domain.model;

/**
 * A piece of evidence: where it came from and what it says.
 */
public record Citation(String sourceUrl, String snippet) {
}

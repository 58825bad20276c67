package me.golemcore.research.domain.model;

/**
 * The single selected final-answer text of a research run.
 *
 * @param query
 *            the research query
 * @param body
 *            selected text, never blank
 * @param extractedFromMessageIndex
 *            index of the source message in the conversation, or -1 for a
 *            placeholder body
 * @param fallback
 *            true when no message matched the report-shape heuristic
 */
public record Report(String query, String body, int extractedFromMessageIndex, boolean fallback) {
}

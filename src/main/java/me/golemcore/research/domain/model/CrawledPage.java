package me.golemcore.research.domain.model;

/**
 * Extracted text of a fetched web page.
 *
 * @param url
 *            the fetched URL
 * @param title
 *            document title, may be empty
 * @param content
 *            whitespace-collapsed text, possibly truncated
 * @param charCount
 *            length of {@code content}
 * @param truncated
 *            whether the truncation marker was appended
 */
public record CrawledPage(String url, String title, String content, int charCount, boolean truncated) {
}

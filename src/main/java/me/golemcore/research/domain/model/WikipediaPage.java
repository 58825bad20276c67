package me.golemcore.research.domain.model;

import java.util.List;

/**
 * Result of an encyclopedia lookup. When {@code found} is false only
 * {@code query} and {@code suggestion} are set.
 */
public record WikipediaPage(
        boolean found,
        String query,
        String title,
        String summary,
        String url,
        List<String> sections,
        List<String> relatedTopics,
        String suggestion) {

    public WikipediaPage {
        sections = sections == null ? List.of() : List.copyOf(sections);
        relatedTopics = relatedTopics == null ? List.of() : List.copyOf(relatedTopics);
    }

    public static WikipediaPage notFound(String query) {
        return new WikipediaPage(false, query, null, null, null, List.of(), List.of(),
                "Try a different search term or check spelling");
    }
}

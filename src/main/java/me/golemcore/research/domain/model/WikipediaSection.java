package me.golemcore.research.domain.model;

import java.util.List;

/**
 * Result of a section lookup. When the page exists but the section does not,
 * {@code availableSections} lists the valid titles.
 */
public record WikipediaSection(
        boolean found,
        String pageTitle,
        String sectionTitle,
        String content,
        List<String> availableSections) {

    public WikipediaSection {
        availableSections = availableSections == null ? List.of() : List.copyOf(availableSections);
    }
}

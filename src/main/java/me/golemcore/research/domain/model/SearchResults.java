package me.golemcore.research.domain.model;

import java.util.List;

/**
 * Search adapter payload. An empty hit list is a normal outcome and carries a
 * suggestion for the model.
 */
public record SearchResults(String query, List<SearchHit> hits, String suggestion) {

    public static final String EMPTY_SUGGESTION = "Try different keywords or rephrase your search";

    public SearchResults {
        hits = hits == null ? List.of() : List.copyOf(hits);
    }

    public static SearchResults of(String query, List<SearchHit> hits) {
        if (hits == null || hits.isEmpty()) {
            return new SearchResults(query, List.of(), EMPTY_SUGGESTION);
        }
        return new SearchResults(query, hits, null);
    }

    public boolean isEmpty() {
        return hits.isEmpty();
    }
}

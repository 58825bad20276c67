package me.golemcore.research.domain.model;

import java.util.List;

/**
 * Wolfram Alpha answer as "pod title: plaintext" lines in provider order.
 */
public record MathResult(String query, List<String> lines) {

    public MathResult {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public String text() {
        return String.join("\n", lines);
    }
}

package me.golemcore.research.domain.model;

/**
 * Verdict-strength label attached to a validated claim, strongest first.
 */
public enum Confidence {
    HIGH, MEDIUM, LOW;

    public boolean isAtLeast(Confidence other) {
        return ordinal() <= other.ordinal();
    }

    public static Confidence weakest(Confidence a, Confidence b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}

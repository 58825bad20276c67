package me.golemcore.research.domain.model;

public enum Verdict {
    CONFIRMED, LIKELY_TRUE, UNCERTAIN, LIKELY_FALSE
}

package com.infra.anomaly.model;

import java.util.Collection;

public enum Severity {
    CRITICAL("critical", 0),
    WARNING("warning", 1),
    INFO("info", 2);

    private final String tag;
    private final int rank;

    Severity(String tag, int rank) {
        this.tag = tag;
        this.rank = rank;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Lower rank = more severe. Used for root-cause ordering.
     */
    public int getRank() {
        return rank;
    }

    public static Severity fromTag(String tag) {
        for (Severity s : values()) {
            if (s.tag.equalsIgnoreCase(tag)) return s;
        }
        throw new IllegalArgumentException("Unknown severity: " + tag);
    }

    public static Severity highest(Collection<Insight> insights) {
        if (insights.stream().anyMatch(i -> i.getSeverity() == CRITICAL)) return CRITICAL;
        if (insights.stream().anyMatch(i -> i.getSeverity() == WARNING)) return WARNING;
        return INFO;
    }
}

package com.infra.anomaly.model;

/**
 * Closed set of insight categories. Upstream producers emit free-form tags
 * such as {@code "security:root-user"}; {@link #fromTag(String)} folds them
 * into this enum so correlation eligibility is a switch, not a string compare.
 */
public enum InsightCategory {
    ANOMALY("anomaly"),
    SECURITY("security"),
    AI_ANALYSIS("ai-analysis"),
    PREDICTIVE("predictive"),
    OTHER("other");

    private final String tag;

    InsightCategory(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public boolean isCorrelatable() {
        switch (this) {
            case ANOMALY:
                return true;
            case SECURITY:
            case AI_ANALYSIS:
            case PREDICTIVE:
            case OTHER:
            default:
                return false;
        }
    }

    public static InsightCategory fromTag(String tag) {
        if (tag == null || tag.isBlank()) return OTHER;
        String prefix = tag.toLowerCase();
        int colon = prefix.indexOf(':');
        if (colon >= 0) {
            prefix = prefix.substring(0, colon);
        }
        for (InsightCategory c : values()) {
            if (c.tag.equals(prefix)) return c;
        }
        return OTHER;
    }
}

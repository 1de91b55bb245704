package com.infra.anomaly.model;

public enum CorrelationType {
    DEDUP("dedup"),
    CASCADE("cascade"),
    TEMPORAL("temporal"),
    SEMANTIC("semantic");

    private final String tag;

    CorrelationType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static CorrelationType fromTag(String tag) {
        for (CorrelationType t : values()) {
            if (t.tag.equalsIgnoreCase(tag)) return t;
        }
        throw new IllegalArgumentException("Unknown correlation type: " + tag);
    }
}

package com.infra.anomaly.model;

public enum DetectionMethod {
    ZSCORE("zscore"),
    BOLLINGER("bollinger"),
    ADAPTIVE("adaptive");

    private final String tag;

    DetectionMethod(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static DetectionMethod fromTag(String tag) {
        for (DetectionMethod m : values()) {
            if (m.tag.equalsIgnoreCase(tag)) return m;
        }
        throw new IllegalArgumentException("Unknown detection method: " + tag);
    }
}

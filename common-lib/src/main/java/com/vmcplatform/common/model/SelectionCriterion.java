package com.vmcplatform.common.model;

/**
 * Why a segment entered the rating pipeline. Persisted by enum name; {@link #symbol()}
 * is the two-letter code used in exported reports.
 */
public enum SelectionCriterion {
    HIGH_VOLUBILITY("HV", "high-volubility"),
    RANDOM_SAMPLE("RS", "random-sample");

    private final String symbol;
    private final String label;

    SelectionCriterion(String symbol, String label) {
        this.symbol = symbol;
        this.label  = label;
    }

    public String symbol() {
        return symbol;
    }

    public String label() {
        return label;
    }

    /** Null-safe lookup by enum name; returns {@code null} for unknown or missing values. */
    public static SelectionCriterion fromName(String name) {
        if (name == null) return null;
        for (SelectionCriterion c : values()) {
            if (c.name().equalsIgnoreCase(name)) return c;
        }
        return null;
    }
}

package com.bloom.recommender.service.profile;

import java.util.ArrayList;
import java.util.List;

/**
 * Running value of a dimension plus the list of factors applied, used to explain the score.
 */
public final class DimensionResult {
    private int value;
    private final List<String> factors = new ArrayList<>();

    public DimensionResult(int baseline) {
        this.value = baseline;
    }

    /** Adds {@code delta} to the value and records the factor when it moved the score. */
    public DimensionResult apply(int delta, String factor) {
        if (delta != 0) {
            value += delta;
            factors.add(factor + " (" + (delta > 0 ? "+" : "") + delta + ")");
        }
        return this;
    }

    public int getValue() { return value; }
    public List<String> getFactors() { return List.copyOf(factors); }

    public String rationale() {
        return factors.isEmpty() ? "baseline" : String.join("; ", factors);
    }
}

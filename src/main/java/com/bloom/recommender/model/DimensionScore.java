package com.bloom.recommender.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Map;

/**
 * The three behavioural axes, each clamped to [0,100], with a short rationale per axis.
 * Conviction: focused (high) vs. exploring (low). Intuition: vision-led (high) vs.
 * data-led (low). Contribution: how actively the person creates, helps and advocates.
 */
public final class DimensionScore {
    private final int conviction;
    private final int intuition;
    private final int contribution;
    private final Map<Dimension, String> rationale;

    public DimensionScore(int conviction, int intuition, int contribution) {
        this(conviction, intuition, contribution, Map.of(
                Dimension.CONVICTION, "",
                Dimension.INTUITION, "",
                Dimension.CONTRIBUTION, ""));
    }

    public DimensionScore(int conviction, int intuition, int contribution, Map<Dimension, String> rationale) {
        this.conviction = clamp(conviction);
        this.intuition = clamp(intuition);
        this.contribution = clamp(contribution);
        this.rationale = Map.of(
                Dimension.CONVICTION, rationale.getOrDefault(Dimension.CONVICTION, ""),
                Dimension.INTUITION, rationale.getOrDefault(Dimension.INTUITION, ""),
                Dimension.CONTRIBUTION, rationale.getOrDefault(Dimension.CONTRIBUTION, ""));
    }

    public static int clamp(long value) {
        return (int) Math.min(Math.max(value, 0), 100);
    }

    public int getConviction() { return conviction; }
    public int getIntuition() { return intuition; }
    public int getContribution() { return contribution; }
    public Map<Dimension, String> getRationale() { return rationale; }

    @JsonIgnore
    public int get(Dimension dimension) {
        return switch (dimension) {
            case CONVICTION -> conviction;
            case INTUITION -> intuition;
            case CONTRIBUTION -> contribution;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DimensionScore other)) return false;
        return conviction == other.conviction && intuition == other.intuition && contribution == other.contribution;
    }

    @Override
    public int hashCode() {
        return (conviction * 101 + intuition) * 101 + contribution;
    }

    @Override
    public String toString() {
        return "DimensionScore{conviction=" + conviction + ", intuition=" + intuition + ", contribution=" + contribution + "}";
    }
}

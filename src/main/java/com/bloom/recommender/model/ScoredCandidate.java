package com.bloom.recommender.model;

/**
 * A candidate with its personalised match score and the human-readable reason for it.
 */
public final class ScoredCandidate {
    private final CandidateItem item;
    private final int matchScore;
    private final String reason;

    public ScoredCandidate(CandidateItem item, int matchScore, String reason) {
        this.item = item;
        this.matchScore = DimensionScore.clamp(matchScore);
        this.reason = reason;
    }

    public CandidateItem getItem() { return item; }
    public int getMatchScore() { return matchScore; }
    public String getReason() { return reason; }
}

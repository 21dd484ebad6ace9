package com.bloom.recommender.model;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * Terminal artifact of the recommendation pipeline: the candidate, its match score, the
 * profile category it was grouped under and the reason shown to the user.
 */
public final class RankedRecommendation {
    @JsonUnwrapped
    private final CandidateItem item;
    private final int matchScore;
    private final Category categoryGroup;
    private final String reason;

    public RankedRecommendation(ScoredCandidate scored, Category categoryGroup) {
        this.item = scored.getItem();
        this.matchScore = scored.getMatchScore();
        this.reason = scored.getReason();
        this.categoryGroup = categoryGroup;
    }

    public CandidateItem getItem() { return item; }
    public int getMatchScore() { return matchScore; }
    public Category getCategoryGroup() { return categoryGroup; }
    public String getReason() { return reason; }

    @Override
    public String toString() {
        return "RankedRecommendation{" + item.getCanonicalId() + ", score=" + matchScore + ", group=" + categoryGroup + "}";
    }
}

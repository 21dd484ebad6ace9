package com.bloom.recommender.service.profile;

import com.bloom.recommender.model.Dimension;
import com.bloom.recommender.model.SignalCorpus;
import com.bloom.recommender.model.StructuredSignals;
import com.bloom.recommender.util.KeywordMatcher;

/**
 * Contribution: content creation, community engagement, referrals and governance participation.
 * Starts at zero and only ever adds; each factor has its own cap.
 */
public class ContributionCalculator implements DimensionCalculator {
    static final int CONTENT_POINTS = 5;
    static final int ENGAGEMENT_POINTS = 5;
    static final int REFERRAL_POINTS = 3;
    static final int GOVERNANCE_POINTS = 10;
    static final int GOVERNANCE_CAP = 40;

    @Override
    public Dimension dimension() {
        return Dimension.CONTRIBUTION;
    }

    @Override
    public DimensionResult calculate(SignalCorpus corpus, StructuredSignals structured) {
        DimensionResult r = new DimensionResult(0);
        String text = corpus.fullText();

        r.apply(KeywordMatcher.countDistinct(text, DimensionVocabulary.CONTENT_CREATION) * CONTENT_POINTS,
                "creates content");
        r.apply(KeywordMatcher.countDistinct(text, DimensionVocabulary.COMMUNITY_ENGAGEMENT) * ENGAGEMENT_POINTS,
                "engages with communities");
        r.apply(KeywordMatcher.countDistinct(text, DimensionVocabulary.REFERRAL) * REFERRAL_POINTS,
                "recommends things to others");

        if (structured != null) {
            int actions = structured.getGovernanceActions().size();
            r.apply(Math.min(actions * GOVERNANCE_POINTS, GOVERNANCE_CAP), actions + " governance actions");
        }

        int posts = corpus.getSocial().getPostCount();
        if (posts > 100) r.apply(10, "very active poster");
        else if (posts > 50) r.apply(5, "active poster");
        return r;
    }
}

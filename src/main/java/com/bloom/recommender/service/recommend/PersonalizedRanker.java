package com.bloom.recommender.service.recommend;

import com.bloom.recommender.config.RecommenderProperties;
import com.bloom.recommender.model.CandidateItem;
import com.bloom.recommender.model.Category;
import com.bloom.recommender.model.CategoryTag;
import com.bloom.recommender.model.DimensionScore;
import com.bloom.recommender.model.PersonalityArchetype;
import com.bloom.recommender.model.Profile;
import com.bloom.recommender.model.ScoredCandidate;
import com.bloom.recommender.util.KeywordMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores a candidate against a profile.
 *
 * <p>The score is the sum of four capped components: category overlap (40), archetype keyword
 * affinity (15), dimension-aware structural bonuses (15) and the source's own relevance score
 * (30). The reason string is picked from the strongest component and never feeds back into the
 * number.
 */
@Component
public class PersonalizedRanker {
    private static final Logger log = LoggerFactory.getLogger(PersonalizedRanker.class);

    static final int CATEGORY_CAP = 40;
    static final int ARCHETYPE_CAP = 15;
    static final int STRUCTURAL_CAP = 15;
    static final int SOURCE_CAP = 30;

    private static final int[] CATEGORY_WEIGHTS = {20, 12, 8};
    private static final int CATEGORY_WEIGHT_TAIL = 4;

    static final int EXACT_CATEGORY_BONUS = 8;
    static final int NOVEL_CATEGORY_BONUS = 5;
    static final int EARLY_BONUS = 6;
    static final int ESTABLISHED_BONUS = 6;
    static final int COMMUNITY_BONUS = 6;

    static final int LOW_POPULARITY = 500;
    static final int HIGH_POPULARITY = 5000;

    private static final List<String> EARLY_SIGNALS = List.of(
            "early", "experimental", "alpha", "beta", "prototype", "emerging", "new");
    private static final List<String> COMMUNITY_SIGNALS = List.of(
            "community", "collaborative", "collaborate", "contribut", "open source", "open-source", "governance");

    private final RecommenderProperties properties;

    public PersonalizedRanker(RecommenderProperties properties) {
        this.properties = properties;
    }

    public ScoredCandidate rank(CandidateItem candidate, Profile profile) {
        String text = candidate.searchText();

        List<Category> matchedCategories = matchedCategories(candidate, text, profile);
        int categoryPoints = categoryPoints(matchedCategories.size());
        int archetypePoints = archetypePoints(text, profile.getArchetype());
        int structuralPoints = structuralPoints(candidate, text, profile);
        int sourcePoints = sourcePoints(candidate.getRawScore());

        int total = DimensionScore.clamp((long) categoryPoints + archetypePoints + structuralPoints + sourcePoints);
        String reason = reason(matchedCategories, categoryPoints, archetypePoints, structuralPoints, sourcePoints,
                profile.getArchetype());

        if (log.isDebugEnabled()) {
            log.debug("Ranked {}: category={} archetype={} structural={} source={} total={}",
                    candidate.getCanonicalId(), categoryPoints, archetypePoints, structuralPoints, sourcePoints, total);
        }
        return new ScoredCandidate(candidate, total, reason);
    }

    /** Scores every candidate and returns them best first; equal scores keep input order. */
    public List<ScoredCandidate> rankAll(List<CandidateItem> candidates, Profile profile) {
        List<ScoredCandidate> scored = new ArrayList<>(candidates.size());
        for (CandidateItem c : candidates) scored.add(rank(c, profile));
        scored.sort(Comparator.comparingInt(ScoredCandidate::getMatchScore).reversed());
        return scored;
    }

    private static List<Category> matchedCategories(CandidateItem candidate, String text, Profile profile) {
        List<Category> matched = new ArrayList<>();
        for (CategoryTag tag : profile.getCategories()) {
            Category category = tag.getCategory();
            if (hasExactTag(candidate, category) || KeywordMatcher.countDistinct(text, category.getKeywords()) > 0) {
                matched.add(category);
            }
        }
        return matched;
    }

    static int categoryPoints(int matches) {
        int points = 0;
        for (int i = 0; i < matches; i++) {
            points += i < CATEGORY_WEIGHTS.length ? CATEGORY_WEIGHTS[i] : CATEGORY_WEIGHT_TAIL;
        }
        return Math.min(points, CATEGORY_CAP);
    }

    static int archetypePoints(String text, PersonalityArchetype archetype) {
        int hits = KeywordMatcher.matched(text, archetype.getAffinityKeywords()).size();
        int points = 0;
        for (int i = 0; i < hits; i++) {
            if (i < 3) points += 3;
            else if (i < 6) points += 2;
            else points += 1;
        }
        return Math.min(points, ARCHETYPE_CAP);
    }

    private int structuralPoints(CandidateItem candidate, String text, Profile profile) {
        DimensionScore dims = profile.getDimensions();
        int high = properties.getHighDimension();
        int low = properties.getLowDimension();
        Integer popularity = candidate.getPopularity();
        int points = 0;

        if (dims.getConviction() > high && hasExactCategoryTag(candidate, profile)) {
            points += EXACT_CATEGORY_BONUS;
        }
        if (dims.getConviction() < low && hasNovelTag(candidate, profile)) {
            points += NOVEL_CATEGORY_BONUS;
        }
        if (dims.getIntuition() > high
                && ((popularity != null && popularity < LOW_POPULARITY) || KeywordMatcher.countDistinct(text, EARLY_SIGNALS) > 0)) {
            points += EARLY_BONUS;
        }
        if (dims.getIntuition() < low && popularity != null && popularity > HIGH_POPULARITY) {
            points += ESTABLISHED_BONUS;
        }
        if (dims.getContribution() > properties.getCultivatorThreshold()
                && KeywordMatcher.countDistinct(text, COMMUNITY_SIGNALS) > 0) {
            points += COMMUNITY_BONUS;
        }
        return Math.min(points, STRUCTURAL_CAP);
    }

    static int sourcePoints(Double rawScore) {
        if (rawScore == null || rawScore.isNaN()) return 0;
        double bounded = Math.max(0, Math.min(100, rawScore));
        return (int) Math.min(SOURCE_CAP, Math.round(bounded * 0.3));
    }

    private static boolean hasExactTag(CandidateItem candidate, Category category) {
        for (String tag : candidate.getTags()) {
            if (category.matchesTag(tag)) return true;
        }
        return false;
    }

    private static boolean hasExactCategoryTag(CandidateItem candidate, Profile profile) {
        for (Category category : profile.categoryList()) {
            if (hasExactTag(candidate, category)) return true;
        }
        return false;
    }

    /** A tag that names a known category outside the profile's own. */
    private static boolean hasNovelTag(CandidateItem candidate, Profile profile) {
        List<Category> own = profile.categoryList();
        for (String tag : candidate.getTags()) {
            for (Category category : Category.values()) {
                if (!own.contains(category) && category.matchesTag(tag)) return true;
            }
        }
        return false;
    }

    private static String reason(List<Category> matchedCategories,
                                 int categoryPoints,
                                 int archetypePoints,
                                 int structuralPoints,
                                 int sourcePoints,
                                 PersonalityArchetype archetype) {
        String style = archetype.shortName();
        if (categoryPoints > 0 && categoryPoints >= Math.max(archetypePoints, Math.max(structuralPoints, sourcePoints))) {
            String base = "Because you're into " + matchedCategories.get(0).getLabel();
            return archetypePoints > 0 ? base + " - fits your " + style + " style" : base;
        }
        if (archetypePoints > 0 && archetypePoints >= Math.max(structuralPoints, sourcePoints)) {
            return "Fits your " + style + " style";
        }
        return "Fits your " + style + " profile";
    }
}

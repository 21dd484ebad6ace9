package com.bloom.recommender.service.recommend;

import com.bloom.recommender.config.RecommenderProperties;
import com.bloom.recommender.model.CandidateItem;
import com.bloom.recommender.model.Category;
import com.bloom.recommender.model.CategoryTag;
import com.bloom.recommender.model.DimensionScore;
import com.bloom.recommender.model.PersonalityArchetype;
import com.bloom.recommender.model.Profile;
import com.bloom.recommender.model.ScoredCandidate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PersonalizedRankerTest {

    private final PersonalizedRanker ranker = new PersonalizedRanker(new RecommenderProperties());

    private static Profile profile(DimensionScore dims, PersonalityArchetype archetype, Category... categories) {
        List<CategoryTag> tags = new java.util.ArrayList<>();
        for (Category c : categories) tags.add(new CategoryTag(c, 5));
        return Profile.of(tags, dims, archetype);
    }

    private static final Profile NEUTRAL_AI = profile(new DimensionScore(50, 50, 0), PersonalityArchetype.VISIONARY, Category.AI_TOOLS);

    @Test
    public void degenerateCandidatesStayInRange() {
        CandidateItem empty = new CandidateItem("https://x.dev/e", null, null, null, 0, "s", null);
        ScoredCandidate sc = ranker.rank(empty, NEUTRAL_AI);
        assertEquals(0, sc.getMatchScore());
        assertEquals("Fits your Visionary profile", sc.getReason());

        CandidateItem weird = new CandidateItem("https://x.dev/w", "", "", List.of(""), -5, "s", -40.0);
        assertEquals(0, ranker.rank(weird, NEUTRAL_AI).getMatchScore());
    }

    @Test
    public void saturatedCandidateIsCappedAt100() {
        Profile p = profile(new DimensionScore(90, 90, 90), PersonalityArchetype.CULTIVATOR,
                Category.AI_TOOLS, Category.DEVELOPMENT, Category.CRYPTO);
        CandidateItem rich = new CandidateItem("https://x.dev/r",
                "community ai agent sdk for web3 developers",
                "collaborate, nurture, build, ecosystem, mentor, contribute, share, governance, collective, stewardship; early alpha",
                List.of("ai", "cli", "defi", "lifestyle"), 100, "s", 100.0);
        ScoredCandidate sc = ranker.rank(rich, p);
        assertEquals(100, sc.getMatchScore());
    }

    @Test
    public void categoryWeightsDiminish() {
        assertEquals(0, PersonalizedRanker.categoryPoints(0));
        assertEquals(20, PersonalizedRanker.categoryPoints(1));
        assertEquals(32, PersonalizedRanker.categoryPoints(2));
        assertEquals(40, PersonalizedRanker.categoryPoints(3));
        assertEquals(40, PersonalizedRanker.categoryPoints(6));
    }

    @Test
    public void archetypeAffinityHasDiminishingReturnsAndCap() {
        assertEquals(9, PersonalizedRanker.archetypePoints("innovative vision future", PersonalityArchetype.VISIONARY));
        assertEquals(15, PersonalizedRanker.archetypePoints(
                "innovative vision future paradigm pioneer disrupt bold ambitious frontier emerging breakthrough",
                PersonalityArchetype.VISIONARY));
    }

    @Test
    public void sourceRelevanceIsThirtyPercentOfRawScore() {
        assertEquals(0, PersonalizedRanker.sourcePoints(null));
        assertEquals(15, PersonalizedRanker.sourcePoints(50.0));
        assertEquals(30, PersonalizedRanker.sourcePoints(100.0));
        assertEquals(30, PersonalizedRanker.sourcePoints(250.0));
        assertEquals(0, PersonalizedRanker.sourcePoints(-1.0));
    }

    @Test
    public void highConvictionBoostsExactCategoryTags() {
        CandidateItem tagged = new CandidateItem("https://x.dev/t", "x", "", List.of("llm"), null, "s", null);
        Profile focused = profile(new DimensionScore(80, 50, 0), PersonalityArchetype.VISIONARY, Category.AI_TOOLS);
        int boosted = ranker.rank(tagged, focused).getMatchScore();
        int plain = ranker.rank(tagged, NEUTRAL_AI).getMatchScore();
        assertEquals(PersonalizedRanker.EXACT_CATEGORY_BONUS, boosted - plain);
    }

    @Test
    public void intuitionPicksEarlyOrEstablishedItems() {
        CandidateItem small = new CandidateItem("https://x.dev/s", "x", "", List.of(), 120, "s", null);
        CandidateItem big = new CandidateItem("https://x.dev/b", "x", "", List.of(), 20000, "s", null);
        Profile intuitive = profile(new DimensionScore(50, 80, 0), PersonalityArchetype.EXPLORER, Category.AI_TOOLS);
        Profile analytical = profile(new DimensionScore(50, 20, 0), PersonalityArchetype.INNOVATOR, Category.AI_TOOLS);

        assertEquals(6, ranker.rank(small, intuitive).getMatchScore());
        assertEquals(0, ranker.rank(big, intuitive).getMatchScore());
        assertEquals(6, ranker.rank(big, analytical).getMatchScore());
        assertEquals(0, ranker.rank(small, analytical).getMatchScore());
    }

    @Test
    public void lowConvictionBoostsTagsOfOtherCategories() {
        Profile restless = profile(new DimensionScore(20, 50, 0), PersonalityArchetype.VISIONARY, Category.AI_TOOLS);
        CandidateItem fitness = new CandidateItem("https://x.dev/f", "x", "", List.of("fitness"), null, "s", null);
        CandidateItem llm = new CandidateItem("https://x.dev/l", "x", "", List.of("llm"), null, "s", null);

        assertEquals(PersonalizedRanker.NOVEL_CATEGORY_BONUS, ranker.rank(fitness, restless).getMatchScore());
        assertEquals(0, ranker.rank(fitness, NEUTRAL_AI).getMatchScore());
        assertEquals(ranker.rank(llm, NEUTRAL_AI).getMatchScore(), ranker.rank(llm, restless).getMatchScore());
    }

    @Test
    public void highContributionBoostsCommunityItems() {
        Profile contributor = profile(new DimensionScore(50, 50, 60), PersonalityArchetype.VISIONARY, Category.AI_TOOLS);
        Profile atThreshold = profile(new DimensionScore(50, 50, 55), PersonalityArchetype.VISIONARY, Category.AI_TOOLS);
        CandidateItem garden = new CandidateItem("https://x.dev/g", "community garden", "contributors welcome",
                List.of(), null, "s", null);

        assertEquals(PersonalizedRanker.COMMUNITY_BONUS, ranker.rank(garden, contributor).getMatchScore());
        assertEquals(0, ranker.rank(garden, atThreshold).getMatchScore());
    }

    @Test
    public void reasonNamesTheStrongestComponent() {
        CandidateItem ai = new CandidateItem("https://x.dev/a", "LLM prompt kit", "", List.of(), null, "s", null);
        assertEquals("Because you're into AI Tools", ranker.rank(ai, NEUTRAL_AI).getReason());

        CandidateItem visionaryAi = new CandidateItem("https://x.dev/v", "LLM prompt kit for a bold future", "", List.of(), null, "s", null);
        assertEquals("Because you're into AI Tools - fits your Visionary style", ranker.rank(visionaryAi, NEUTRAL_AI).getReason());

        CandidateItem visionOnly = new CandidateItem("https://x.dev/o", "bold pioneer frontier", "", List.of(), null, "s", null);
        assertEquals("Fits your Visionary style", ranker.rank(visionOnly, NEUTRAL_AI).getReason());
    }

    @Test
    public void rankAllSortsBestFirst() {
        List<ScoredCandidate> ranked = ranker.rankAll(List.of(
                new CandidateItem("https://x.dev/1", "plain", "", List.of(), null, "s", 10.0),
                new CandidateItem("https://x.dev/2", "llm agent", "", List.of(), null, "s", 90.0),
                new CandidateItem("https://x.dev/3", "plain", "", List.of(), null, "s", 50.0)), NEUTRAL_AI);
        assertEquals("https://x.dev/2", ranked.get(0).getItem().getCanonicalId());
        assertEquals("https://x.dev/3", ranked.get(1).getItem().getCanonicalId());
        assertEquals("https://x.dev/1", ranked.get(2).getItem().getCanonicalId());
    }
}

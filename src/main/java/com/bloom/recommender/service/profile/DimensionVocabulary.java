package com.bloom.recommender.service.profile;

import java.util.List;

/**
 * Word lists read by the dimension calculators. Kept as data so they can be extended or
 * localised without touching scoring logic.
 */
public final class DimensionVocabulary {
    private DimensionVocabulary() {}

    public static final List<String> EXPLORATION = List.of(
            "curious", "explore", "exploring", "explorer", "discovery", "discover",
            "experiment", "experimenting", "variety", "diverse", "try new",
            "always looking", "different", "comparing", "new things", "so many things",
            "rabbit hole", "stumble upon");

    public static final List<String> COMMITMENT = List.of(
            "committed", "dedicated", "focused", "deep dive", "specialize",
            "expert", "obsessed", "passionate about", "all in", "doubled down");

    public static final List<String> VISION = List.of(
            "vision", "future", "believe", "potential", "revolutionary", "paradigm", "early", "first");

    public static final List<String> ANALYSIS = List.of(
            "data", "metrics", "roi", "tvl", "apy", "analysis", "performance", "track record");

    public static final List<String> CONTENT_CREATION = List.of(
            "wrote", "published", "created", "shared", "tutorial", "guide", "review");

    public static final List<String> COMMUNITY_ENGAGEMENT = List.of(
            "feedback", "suggestion", "improvement", "helped", "support", "community");

    public static final List<String> REFERRAL = List.of(
            "recommend", "check out", "try this", "using", "love this");

    /** Counterparty labels that mark mature, widely used venues */
    public static final List<String> ESTABLISHED_MARKERS = List.of(
            "uniswap", "aave", "compound", "curve", "maker", "established", "mature", "blue-chip");

    /** Counterparty labels that mark early or experimental venues */
    public static final List<String> EARLY_MARKERS = List.of(
            "early", "experimental", "beta", "alpha", "testnet", "pre-launch", "new");
}

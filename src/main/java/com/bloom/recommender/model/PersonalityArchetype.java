package com.bloom.recommender.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * The five behavioural archetypes. Four come from the conviction/intuition quadrant, the
 * Cultivator overrides the quadrant when contribution is high.
 *
 * <p>Each archetype carries the vocabulary used for keyword affinity when ranking candidates,
 * the noun used in its tagline and a fixed set of description phrasings.
 */
public enum PersonalityArchetype {
    VISIONARY("The Visionary", "Pioneer",
            List.of("innovative", "early-stage", "vision", "future", "paradigm", "pioneer", "disrupt", "bold",
                    "ambitious", "frontier", "emerging", "breakthrough"),
            List.of("You back bold ideas before they are obvious. Conviction is your edge, and in %s you see potential where others see risk.",
                    "Vision-driven and future-oriented, you champion %s projects that challenge the status quo instead of waiting for proof.")),
    EXPLORER("The Explorer", "Nomad",
            List.of("diverse", "experimental", "discovery", "research", "explore", "curiosity", "variety", "breadth",
                    "survey", "sandbox", "prototype", "tinker"),
            List.of("Every project is a new adventure. Curious and open-minded, your interests across %s keep you discovering.",
                    "You do not settle into one niche; %s is one stop on a wide map, and variety is your strength.")),
    CULTIVATOR("The Cultivator", "Gardener",
            List.of("community", "social", "collaborate", "nurture", "build", "ecosystem", "mentor", "contribute",
                    "share", "governance", "collective", "stewardship"),
            List.of("You do not just support projects, you help them grow. Feedback, content and community building in %s are how you show up.",
                    "An active participant rather than a passive observer, you make %s communities better by being involved.")),
    OPTIMIZER("The Optimizer", "Analyst",
            List.of("efficiency", "data-driven", "optimize", "systematic", "analytics", "performance", "metrics", "roi",
                    "benchmark", "refine", "precision", "reliable"),
            List.of("Always leveling up. Data-driven and focused, you back %s tools that measurably improve how things work.",
                    "There is always a better way and you are determined to find it; in %s you iterate and refine until it is right.")),
    INNOVATOR("The Innovator", "Architect",
            List.of("technology", "ai", "automation", "creative", "cutting-edge", "novel", "hybrid", "synthesis",
                    "interdisciplinary", "integrate", "cross-domain", "generative"),
            List.of("First to try breakthrough technology, especially in %s. While others wait for consensus you are already building with it.",
                    "Technical depth meets early adoption. You understand how %s works under the hood and are not afraid of the bleeding edge."));

    private final String label;
    private final String taglineNoun;
    private final List<String> affinityKeywords;
    private final List<String> descriptions;

    PersonalityArchetype(String label, String taglineNoun, List<String> affinityKeywords, List<String> descriptions) {
        this.label = label;
        this.taglineNoun = taglineNoun;
        this.affinityKeywords = affinityKeywords;
        this.descriptions = descriptions;
    }

    @JsonValue
    public String getLabel() { return label; }
    public String getTaglineNoun() { return taglineNoun; }
    public List<String> getAffinityKeywords() { return affinityKeywords; }
    public List<String> getDescriptions() { return descriptions; }

    /** Label without the leading article, e.g. "Visionary". */
    public String shortName() {
        return label.startsWith("The ") ? label.substring(4) : label;
    }
}

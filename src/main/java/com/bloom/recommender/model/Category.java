package com.bloom.recommender.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Canonical topic vocabulary. Each category carries the keywords used to detect it in
 * evidence text and to match it against candidate items, and the topic slugs used when
 * querying code-repository sources.
 *
 * <p>Categories describe WHAT a person is interested in; the archetype describes HOW they
 * approach it.
 */
public enum Category {
    AI_TOOLS("AI Tools",
            List.of("ai", "gpt", "llm", "machine learning", "neural", "model", "chatbot", "openai",
                    "anthropic", "claude", "copilot", "prompt", "inference", "transformer", "agent"),
            List.of("ai", "artificial-intelligence", "machine-learning", "llm", "chatgpt", "gpt")),
    PRODUCTIVITY("Productivity",
            List.of("productivity", "workflow", "automation", "efficiency", "task management", "notion",
                    "calendar", "time tracking", "optimize", "systematic"),
            List.of("productivity", "automation", "workflow", "tools", "utilities")),
    WELLNESS("Wellness",
            List.of("wellness", "health", "fitness", "meditation", "mindfulness", "mental health", "yoga",
                    "sleep", "nutrition", "self-care", "wellbeing"),
            List.of("health", "fitness", "wellness", "meditation", "mindfulness", "mental-health")),
    EDUCATION("Education",
            List.of("education", "learning", "course", "teach", "knowledge", "tutorial", "study", "mentor",
                    "curriculum", "workshop", "training"),
            List.of("education", "learning", "tutorial", "course", "teaching")),
    CRYPTO("Crypto",
            List.of("crypto", "defi", "web3", "blockchain", "token", "dao", "nft", "onchain", "smart contract",
                    "wallet", "protocol", "ethereum", "solana", "base"),
            List.of("blockchain", "web3", "crypto", "ethereum", "solana", "defi", "smart-contracts")),
    LIFESTYLE("Lifestyle",
            List.of("lifestyle", "fashion", "travel", "personal brand", "food", "photography"),
            List.of("lifestyle", "travel", "food", "photography", "personal")),
    DESIGN("Design",
            List.of("design", "ui", "ux", "figma", "creative", "visual", "typography", "layout", "prototype"),
            List.of("design", "ui", "ux", "figma", "design-tools", "creative")),
    DEVELOPMENT("Development",
            List.of("development", "coding", "programming", "software", "engineering", "code", "developer",
                    "api", "framework", "architecture", "debugging", "typescript", "python", "rust"),
            List.of("developer-tools", "devtools", "cli", "sdk", "library", "framework")),
    MARKETING("Marketing",
            List.of("marketing", "growth", "seo", "content strategy", "advertising", "brand", "conversion",
                    "funnel", "campaign", "audience"),
            List.of("marketing", "seo", "analytics", "growth", "content")),
    FINANCE("Finance",
            List.of("finance", "investing", "trading", "portfolio", "wealth", "stock", "market", "budget",
                    "revenue"),
            List.of("finance", "fintech", "trading", "investing", "budgeting"));

    private final String label;
    private final List<String> keywords;
    private final List<String> sourceTopics;

    Category(String label, List<String> keywords, List<String> sourceTopics) {
        this.label = label;
        this.keywords = keywords;
        this.sourceTopics = sourceTopics;
    }

    @JsonValue
    public String getLabel() { return label; }
    public List<String> getKeywords() { return keywords; }
    public List<String> getSourceTopics() { return sourceTopics; }

    /**
     * True when the given tag names this category directly, either by label or by one of its
     * source topics.
     */
    public boolean matchesTag(String tag) {
        if (tag == null) return false;
        String t = tag.trim().toLowerCase(Locale.ROOT);
        return t.equals(label.toLowerCase(Locale.ROOT)) || sourceTopics.contains(t);
    }

    public static Optional<Category> fromLabel(String label) {
        if (label == null) return Optional.empty();
        String l = label.trim();
        for (Category c : values()) {
            if (c.label.equalsIgnoreCase(l) || c.name().equalsIgnoreCase(l)) return Optional.of(c);
        }
        return Optional.empty();
    }
}

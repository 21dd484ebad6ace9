package com.bloom.recommender.service.profile;

import com.bloom.recommender.model.Category;
import com.bloom.recommender.model.CategoryTag;
import com.bloom.recommender.model.DimensionScore;
import com.bloom.recommender.model.PersonalityArchetype;
import com.bloom.recommender.model.SignalCorpus;
import com.bloom.recommender.model.SignalSource;
import com.bloom.recommender.util.KeywordMatcher;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Presentation fields of a profile: tagline, description, interests and confidence.
 * Nothing here feeds back into scoring.
 */
@Component
public class ProfileSummaryBuilder {
    static final int MAX_INTERESTS = 10;

    private static final List<String> INTEREST_LABELS = List.of(
            "AI Tools", "Machine Learning", "Crypto", "DeFi", "NFTs",
            "Education", "Wellness", "Fitness", "Productivity", "Meditation",
            "Web3", "DAOs", "Gaming", "Art", "Music", "Writing",
            "Coding", "Design", "Marketing", "Finance", "Health");

    public String tagline(PersonalityArchetype archetype, Category primary) {
        return "The " + primary.getLabel() + " " + archetype.getTaglineNoun();
    }

    /**
     * Picks one of the archetype's fixed phrasings. The choice is keyed on the dimension scores,
     * so the same profile always reads the same.
     */
    public String description(PersonalityArchetype archetype, List<CategoryTag> categories, DimensionScore dimensions) {
        List<String> options = archetype.getDescriptions();
        String template = options.get(Math.floorMod(dimensions.hashCode(), options.size()));
        String subject;
        if (archetype == PersonalityArchetype.EXPLORER && categories.size() > 1) {
            List<String> labels = new ArrayList<>();
            for (CategoryTag t : categories) labels.add(t.getLabel());
            subject = String.join(", ", labels);
        } else {
            subject = categories.get(0).getLabel();
        }
        return String.format(Locale.ROOT, template, subject);
    }

    public List<String> interests(SignalCorpus corpus) {
        String text = corpus.fullText();
        List<String> out = new ArrayList<>();
        for (String label : INTEREST_LABELS) {
            if (KeywordMatcher.contains(text, label.toLowerCase(Locale.ROOT))) out.add(label);
            if (out.size() == MAX_INTERESTS) break;
        }
        return out;
    }

    /**
     * Data-quality confidence, 0-100. Conversation is the foundation (70 base, up to 15 more for
     * richness); a social profile adds up to 15.
     */
    public int confidence(SignalCorpus corpus, List<String> interests) {
        int score = 0;
        if (corpus.getMessageCount() > 0) {
            score += 70;
            if (corpus.getTopics().size() >= 3) score += 5;
            if (interests.size() >= 3) score += 5;
            if (corpus.getMessageCount() >= 5) score += 5;
        }
        if (corpus.segmentCount(SignalSource.SOCIAL_PROFILE) > 0) {
            score += 10;
            if (corpus.getSocial().getPostCount() >= 10) score += 3;
            if (corpus.getSocial().getFollowingCount() >= 20) score += 2;
        }
        return Math.min(score, 100);
    }
}

package com.bloom.recommender.service.profile;

import com.bloom.recommender.config.RecommenderProperties;
import com.bloom.recommender.model.Category;
import com.bloom.recommender.model.Evidence;
import com.bloom.recommender.model.Segment;
import com.bloom.recommender.model.SignalCorpus;
import com.bloom.recommender.model.SignalSource;
import com.bloom.recommender.model.SocialEvidence;
import com.bloom.recommender.model.SocialStats;
import com.bloom.recommender.model.StructuredSignals;
import com.bloom.recommender.util.KeywordMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Merges conversation, social-profile and structured evidence into one {@link SignalCorpus}.
 *
 * <p>Conversation transcripts are split into messages on role-prefixed line boundaries
 * ({@code User:}, {@code Assistant:}, {@code Human:}, {@code AI:}). The message count, not the
 * amount of text, gates the minimum threshold; below it an {@link InsufficientSignalException}
 * is thrown rather than returning an empty corpus.
 */
@Component
public class SignalCorpusBuilder {
    private static final Logger log = LoggerFactory.getLogger(SignalCorpusBuilder.class);

    static final double CONVERSATION_WEIGHT = 0.85;
    static final double SOCIAL_WEIGHT = 0.15;
    static final double STRUCTURED_WEIGHT = 0.5;

    /** Distinct keyword hits a category needs in user-authored text to count as a topic */
    static final int MIN_TOPIC_HITS = 2;

    private static final Pattern MESSAGE_BOUNDARY = Pattern.compile(
            "\\r?\\n(?=\\s*(?:User|Assistant|Human|AI):)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ROLE_PREFIX = Pattern.compile(
            "^\\s*(?:User|Assistant|Human|AI):\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern USER_PREFIX = Pattern.compile(
            "^\\s*(?:User|Human):", Pattern.CASE_INSENSITIVE);

    private static final List<String> TREND_KEYWORDS = List.of("trend", "new", "launch", "alpha", "early");

    private final RecommenderProperties properties;

    public SignalCorpusBuilder(RecommenderProperties properties) {
        this.properties = properties;
    }

    public SignalCorpus build(Evidence evidence) {
        return build(evidence, properties.getMinMessages());
    }

    public SignalCorpus build(Evidence evidence, int minMessages) {
        List<String> messages = splitMessages(evidence.getConversation());
        int messageCount = messages.size();
        if (messageCount < minMessages) {
            log.info("Not enough conversation to build a profile: messages={} required={}", messageCount, minMessages);
            throw new InsufficientSignalException(messageCount, minMessages);
        }

        List<Segment> segments = new ArrayList<>();
        List<String> userMessages = new ArrayList<>();
        boolean anyRolePrefix = false;
        for (String m : messages) {
            boolean prefixed = ROLE_PREFIX.matcher(m).find();
            anyRolePrefix |= prefixed;
            String body = ROLE_PREFIX.matcher(m).replaceFirst("").trim();
            segments.add(new Segment(SignalSource.CONVERSATION, body, CONVERSATION_WEIGHT));
            if (USER_PREFIX.matcher(m).find()) userMessages.add(body);
        }
        // Unlabelled transcripts are treated as entirely user-authored
        if (!anyRolePrefix) {
            userMessages.clear();
            for (Segment s : segments) userMessages.add(s.getText());
        }

        SocialStats socialStats = SocialStats.NONE;
        SocialEvidence social = evidence.getSocial();
        if (social != null && !social.isEmpty()) {
            if (!social.getBio().isBlank()) {
                segments.add(new Segment(SignalSource.SOCIAL_PROFILE, social.getBio(), SOCIAL_WEIGHT));
            }
            int trendPosts = 0;
            for (String post : social.getPosts()) {
                if (post.isBlank()) continue;
                segments.add(new Segment(SignalSource.SOCIAL_PROFILE, post, SOCIAL_WEIGHT));
                if (!KeywordMatcher.matched(post.toLowerCase(Locale.ROOT), TREND_KEYWORDS).isEmpty()) trendPosts++;
            }
            if (!social.getFollowing().isEmpty()) {
                segments.add(new Segment(SignalSource.SOCIAL_PROFILE, String.join(" ", social.getFollowing()), SOCIAL_WEIGHT));
            }
            socialStats = new SocialStats(social.getPosts().size(), social.getFollowing().size(), trendPosts);
        }

        StructuredSignals structured = evidence.getStructured();
        if (structured != null && !structured.isEmpty()) {
            List<String> labels = new ArrayList<>(structured.getCounterparties());
            labels.addAll(structured.getGovernanceActions());
            if (!labels.isEmpty()) {
                segments.add(new Segment(SignalSource.STRUCTURED, String.join(" ", labels), STRUCTURED_WEIGHT));
            }
        }

        if (segments.stream().allMatch(Segment::isBlank)) {
            throw new InsufficientSignalException(0, minMessages);
        }

        List<String> topics = extractTopics(String.join(" ", userMessages));
        SignalCorpus corpus = new SignalCorpus(segments, messageCount, topics, structured, socialStats);
        log.info("Built signal corpus: messages={} segments={} topics={} sources={} conversationShare={}",
                messageCount, segments.size(), topics, corpus.sourcesPresent(),
                String.format(Locale.ROOT, "%.2f", corpus.weightShare(SignalSource.CONVERSATION)));
        return corpus;
    }

    /**
     * Splits a transcript into messages at line breaks followed by a role prefix.
     * Blank fragments are dropped; a transcript without role prefixes is a single message.
     */
    public static List<String> splitMessages(String transcript) {
        if (transcript == null || transcript.isBlank()) return List.of();
        List<String> out = new ArrayList<>();
        for (String part : MESSAGE_BOUNDARY.split(transcript.trim())) {
            if (!part.trim().isEmpty() && !ROLE_PREFIX.matcher(part).replaceFirst("").isBlank()) {
                out.add(part.trim());
            }
        }
        return out;
    }

    /**
     * Categories with at least {@link #MIN_TOPIC_HITS} distinct keyword hits in the given text,
     * strongest first.
     */
    static List<String> extractTopics(String userText) {
        String lower = userText.toLowerCase(Locale.ROOT);
        List<Map.Entry<Category, Integer>> scored = new ArrayList<>();
        for (Category c : Category.values()) {
            int distinct = KeywordMatcher.countDistinct(lower, c.getKeywords());
            if (distinct >= MIN_TOPIC_HITS) scored.add(Map.entry(c, distinct));
        }
        scored.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));
        List<String> topics = new ArrayList<>();
        for (Map.Entry<Category, Integer> e : scored) topics.add(e.getKey().getLabel());
        return topics;
    }
}

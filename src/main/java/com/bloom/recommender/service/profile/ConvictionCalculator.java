package com.bloom.recommender.service.profile;

import com.bloom.recommender.model.Category;
import com.bloom.recommender.model.Dimension;
import com.bloom.recommender.model.SignalCorpus;
import com.bloom.recommender.model.StructuredSignals;
import com.bloom.recommender.util.KeywordMatcher;

import java.util.ArrayList;
import java.util.List;

/**
 * Conviction: few deep commitments and repeated themes score high, many topics and constant
 * exploring score low. Baseline 50.
 */
public class ConvictionCalculator implements DimensionCalculator {
    static final int BASELINE = 50;

    @Override
    public Dimension dimension() {
        return Dimension.CONVICTION;
    }

    @Override
    public DimensionResult calculate(SignalCorpus corpus, StructuredSignals structured) {
        DimensionResult r = new DimensionResult(BASELINE);
        String text = corpus.fullText();
        List<String> topics = corpus.getTopics();

        r.apply(topicCountDelta(topics.size()), topics.size() + " conversation topics");

        List<Integer> mentions = topicMentions(topics, text);
        if (mentions.size() >= 2) {
            int top = mentions.get(0);
            int second = mentions.get(1);
            if (top >= 3 * second && top >= 3) {
                r.apply(20, "one dominant topic");
            } else if (top >= 2 * second && top >= 2) {
                r.apply(10, "a leading topic");
            } else if (top <= second + 1) {
                r.apply(-10, "attention split evenly between topics");
            }
            if (topics.size() >= 4 && top <= mentions.get(mentions.size() - 1) * 2) {
                r.apply(-10, "even spread across many topics");
            }
        }

        int exploring = KeywordMatcher.countDistinct(text, DimensionVocabulary.EXPLORATION);
        int committed = KeywordMatcher.countDistinct(text, DimensionVocabulary.COMMITMENT);
        r.apply(lexicalDelta(exploring - committed),
                "exploration vs. commitment language " + exploring + "/" + committed);

        if (structured != null && !structured.isEmpty()) {
            applyStructured(r, structured);
        }

        int following = corpus.getSocial().getFollowingCount();
        if (following > 0) {
            if (following < 100) r.apply(5, "follows a small circle");
            else if (following > 500) r.apply(-5, "follows a very wide circle");
        }
        return r;
    }

    static int topicCountDelta(int topicCount) {
        if (topicCount <= 1) return 15;
        if (topicCount == 2) return 5;
        if (topicCount >= 6) return -10;
        return 0;
    }

    /** Net exploration hits mapped to a symmetric adjustment between -25 and +25. */
    static int lexicalDelta(int net) {
        int magnitude;
        int n = Math.abs(net);
        if (n >= 4) magnitude = 25;
        else if (n >= 2) magnitude = 15;
        else if (n >= 1) magnitude = 5;
        else magnitude = 0;
        return net > 0 ? -magnitude : magnitude;
    }

    private static List<Integer> topicMentions(List<String> topics, String text) {
        List<Integer> counts = new ArrayList<>();
        for (String topic : topics) {
            int count = Category.fromLabel(topic)
                    .map(c -> KeywordMatcher.countAll(text, c.getKeywords()))
                    .orElseGet(() -> KeywordMatcher.countOccurrences(text, topic.toLowerCase()));
            counts.add(count);
        }
        counts.sort((a, b) -> Integer.compare(b, a));
        return counts;
    }

    private static void applyStructured(DimensionResult r, StructuredSignals s) {
        int unique = s.uniqueEntityCount();
        if (unique > 0) {
            if (unique <= 5) r.apply(20, unique + " distinct entities");
            else if (unique <= 10) r.apply(10, unique + " distinct entities");
            else if (unique > 30) r.apply(-20, unique + " distinct entities");

            double avg = s.averageInteractionsPerEntity();
            if (avg > 5) r.apply(15, "frequent repeat interactions");
            else if (avg > 2) r.apply(5, "some repeat interactions");
            else if (avg < 1.5) r.apply(-10, "mostly one-off interactions");
        }
        int assets = s.uniqueAssetCount();
        if (assets > 20) r.apply(-15, assets + " different assets held");
        else if (assets > 0 && assets < 5) r.apply(10, "concentrated holdings");
    }
}

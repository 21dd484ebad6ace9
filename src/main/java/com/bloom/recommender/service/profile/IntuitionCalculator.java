package com.bloom.recommender.service.profile;

import com.bloom.recommender.model.Dimension;
import com.bloom.recommender.model.SignalCorpus;
import com.bloom.recommender.model.StructuredSignals;
import com.bloom.recommender.util.KeywordMatcher;

import java.util.Locale;

/**
 * Intuition: vision and narrative language pushes up, data and metrics language pushes down.
 * Baseline 50, five points per net vocabulary hit.
 */
public class IntuitionCalculator implements DimensionCalculator {
    static final int BASELINE = 50;
    static final int POINTS_PER_NET_HIT = 5;

    @Override
    public Dimension dimension() {
        return Dimension.INTUITION;
    }

    @Override
    public DimensionResult calculate(SignalCorpus corpus, StructuredSignals structured) {
        DimensionResult r = new DimensionResult(BASELINE);
        String text = corpus.fullText();

        int vision = KeywordMatcher.countDistinct(text, DimensionVocabulary.VISION);
        int analysis = KeywordMatcher.countDistinct(text, DimensionVocabulary.ANALYSIS);
        r.apply((vision - analysis) * POINTS_PER_NET_HIT, "vision vs. analysis language " + vision + "/" + analysis);

        if (structured != null && !structured.isEmpty()) {
            int established = 0;
            int early = 0;
            for (String cp : structured.getCounterparties()) {
                String label = cp.toLowerCase(Locale.ROOT);
                if (!KeywordMatcher.matched(label, DimensionVocabulary.ESTABLISHED_MARKERS).isEmpty()) established++;
                if (!KeywordMatcher.matched(label, DimensionVocabulary.EARLY_MARKERS).isEmpty()) early++;
            }
            if (established > 10) r.apply(-10, "prefers established venues");
            else if (established < 3) r.apply(10, "rarely uses established venues");
            r.apply(Math.min(early * 2, 10), early + " early or experimental venues");
            if (structured.getTotalInteractions() > 100) r.apply(5, "high activity volume");
        }

        r.apply(corpus.getSocial().getTrendPostCount() * 2, "posts about trends and launches");
        return r;
    }
}

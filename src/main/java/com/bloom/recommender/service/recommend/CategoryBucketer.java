package com.bloom.recommender.service.recommend;

import com.bloom.recommender.config.RecommenderProperties;
import com.bloom.recommender.model.CandidateItem;
import com.bloom.recommender.model.Category;
import com.bloom.recommender.model.RankedRecommendation;
import com.bloom.recommender.model.ScoredCandidate;
import com.bloom.recommender.util.KeywordMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups ranked candidates into one bucket per profile category and trims each bucket.
 *
 * <p>A bucket keeps every candidate at or above the score threshold up to the ceiling, padded
 * with lower-scoring candidates to reach the floor when the bucket has that many at all.
 */
@Component
public class CategoryBucketer {
    private static final Logger log = LoggerFactory.getLogger(CategoryBucketer.class);

    static final int LABEL_TAG_POINTS = 10;
    static final int KEYWORD_POINTS = 2;

    private final RecommenderProperties properties;

    public CategoryBucketer(RecommenderProperties properties) {
        this.properties = properties;
    }

    /**
     * @param ranked            scored candidates, in any order
     * @param profileCategories the profile's categories, primary first; must not be empty
     * @return recommendations grouped by category in profile order, best first within a group
     */
    public List<RankedRecommendation> bucket(List<ScoredCandidate> ranked, List<Category> profileCategories) {
        if (profileCategories.isEmpty()) {
            throw new IllegalArgumentException("profileCategories must not be empty");
        }
        Map<Category, List<ScoredCandidate>> buckets = new LinkedHashMap<>();
        for (Category c : profileCategories) buckets.put(c, new ArrayList<>());

        for (ScoredCandidate sc : ranked) {
            buckets.get(assign(sc.getItem(), profileCategories)).add(sc);
        }

        List<RankedRecommendation> out = new ArrayList<>();
        for (Map.Entry<Category, List<ScoredCandidate>> e : buckets.entrySet()) {
            List<ScoredCandidate> items = e.getValue();
            items.sort(Comparator.comparingInt(ScoredCandidate::getMatchScore).reversed());
            int take = bucketSize(items);
            for (int i = 0; i < take; i++) out.add(new RankedRecommendation(items.get(i), e.getKey()));
            log.debug("Bucket {}: {} candidates, kept {}", e.getKey().getLabel(), items.size(), take);
        }
        return out;
    }

    /** Number of items to keep from a bucket sorted best first. */
    int bucketSize(List<ScoredCandidate> sorted) {
        int decent = 0;
        for (ScoredCandidate sc : sorted) {
            if (sc.getMatchScore() >= properties.getScoreThreshold()) decent++;
        }
        int max = properties.getMaxPerBucket();
        int floor = Math.min(properties.getMinPerBucket(), sorted.size());
        return Math.min(sorted.size(), Math.max(Math.min(decent, max), Math.min(floor, max)));
    }

    /** The profile category the candidate overlaps most; the primary category when none overlaps. */
    static Category assign(CandidateItem item, List<Category> profileCategories) {
        String text = item.searchText();
        Category best = profileCategories.get(0);
        int bestScore = 0;
        for (Category c : profileCategories) {
            int score = 0;
            for (String tag : item.getTags()) {
                if (tag != null && tag.trim().equalsIgnoreCase(c.getLabel())) score += LABEL_TAG_POINTS;
            }
            score += KEYWORD_POINTS * KeywordMatcher.countDistinct(text, c.getKeywords());
            if (score > bestScore) {
                best = c;
                bestScore = score;
            }
        }
        return best;
    }
}

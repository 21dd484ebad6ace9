package com.bloom.recommender.service.profile;

import com.bloom.recommender.config.RecommenderProperties;
import com.bloom.recommender.model.Category;
import com.bloom.recommender.model.CategoryTag;
import com.bloom.recommender.model.SignalCorpus;
import com.bloom.recommender.util.KeywordMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores every canonical category by total keyword occurrences in the corpus.
 *
 * <p>A category is only labelled once its accumulated score reaches the configured minimum, so
 * a single passing mention never labels anyone. When nothing qualifies the single
 * highest-scoring category is returned as a fallback, so a profile is never categoryless.
 */
@Component
public class CategoryDetector {
    private static final Logger log = LoggerFactory.getLogger(CategoryDetector.class);

    private final RecommenderProperties properties;

    public CategoryDetector(RecommenderProperties properties) {
        this.properties = properties;
    }

    public List<CategoryTag> detect(SignalCorpus corpus) {
        return detect(corpus.fullText());
    }

    List<CategoryTag> detect(String lowerText) {
        List<CategoryTag> all = new ArrayList<>();
        for (Category category : Category.values()) {
            all.add(new CategoryTag(category, KeywordMatcher.countAll(lowerText, category.getKeywords())));
        }
        // Stable sort: ties keep vocabulary order
        all.sort(Comparator.comparingInt(CategoryTag::getScore).reversed());
        log.debug("Category scores: {}", all);

        int min = properties.getMinCategoryScore();
        List<CategoryTag> qualified = new ArrayList<>();
        for (CategoryTag t : all) {
            if (t.qualifies(min) && qualified.size() < properties.getMaxCategories()) qualified.add(t);
        }
        if (qualified.isEmpty()) {
            log.info("No category reached score {}; falling back to {}", min, all.get(0));
            return List.of(all.get(0));
        }
        return qualified;
    }
}

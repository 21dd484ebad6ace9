package com.bloom.recommender.service.profile;

import com.bloom.recommender.config.RecommenderProperties;
import com.bloom.recommender.model.Category;
import com.bloom.recommender.model.CategoryTag;
import com.bloom.recommender.model.Evidence;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CategoryDetectorTest {

    private final RecommenderProperties props = new RecommenderProperties();
    private final SignalCorpusBuilder corpusBuilder = new SignalCorpusBuilder(props);
    private final CategoryDetector detector = new CategoryDetector(props);

    @Test
    public void wellnessOnlyConversationYieldsSingleWellnessTag() {
        List<CategoryTag> tags = detector.detect(corpusBuilder.build(Evidence.conversation(
                "User: I do meditation every morning\nUser: yoga helps me\nUser: mindfulness and better sleep matter to me")));

        assertEquals(1, tags.size());
        assertEquals(Category.WELLNESS, tags.get(0).getCategory());
        assertTrue(tags.get(0).getScore() >= 4, "score was " + tags.get(0).getScore());
    }

    @Test
    public void singleMentionDoesNotLabel() {
        List<CategoryTag> tags = detector.detect("i tried yoga once. anyway, crypto wallet defi token blockchain");
        assertEquals(1, tags.size());
        assertEquals(Category.CRYPTO, tags.get(0).getCategory());
    }

    @Test
    public void fallsBackToTopCategoryWhenNothingQualifies() {
        List<CategoryTag> tags = detector.detect("nothing relevant here");
        assertEquals(1, tags.size());
        assertEquals(0, tags.get(0).getScore());
        assertEquals(Category.AI_TOOLS, tags.get(0).getCategory());
    }

    @Test
    public void keepsAtMostThreeCategoriesStrongestFirst() {
        String text = "meditation yoga sleep fitness health "
                + "crypto defi wallet blockchain "
                + "design figma typography "
                + "investing trading portfolio";
        List<CategoryTag> tags = detector.detect(text);
        assertEquals(3, tags.size());
        assertEquals(Category.WELLNESS, tags.get(0).getCategory());
        assertEquals(Category.CRYPTO, tags.get(1).getCategory());
        for (int i = 1; i < tags.size(); i++) {
            assertTrue(tags.get(i - 1).getScore() >= tags.get(i).getScore());
        }
    }

    @Test
    public void minimumScoreIsConfigurable() {
        RecommenderProperties strict = new RecommenderProperties();
        strict.setMinCategoryScore(1);
        List<CategoryTag> tags = new CategoryDetector(strict).detect("just some yoga");
        assertEquals(Category.WELLNESS, tags.get(0).getCategory());
        assertEquals(1, tags.get(0).getScore());
    }
}

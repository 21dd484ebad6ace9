package com.bloom.recommender.service.profile;

import com.bloom.recommender.model.CategoryTag;
import com.bloom.recommender.model.DimensionScore;
import com.bloom.recommender.model.Evidence;
import com.bloom.recommender.model.PersonalityArchetype;
import com.bloom.recommender.model.Profile;
import com.bloom.recommender.model.SignalCorpus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for profile building: evidence -> corpus -> categories and dimensions ->
 * archetype -> profile.
 */
@Service
public class ProfileService {
    private static final Logger log = LoggerFactory.getLogger(ProfileService.class);

    private final SignalCorpusBuilder corpusBuilder;
    private final CategoryDetector categoryDetector;
    private final DimensionScorer dimensionScorer;
    private final PersonalityClassifier classifier;
    private final ProfileSummaryBuilder summaryBuilder;

    public ProfileService(SignalCorpusBuilder corpusBuilder,
                          CategoryDetector categoryDetector,
                          DimensionScorer dimensionScorer,
                          PersonalityClassifier classifier,
                          ProfileSummaryBuilder summaryBuilder) {
        this.corpusBuilder = corpusBuilder;
        this.categoryDetector = categoryDetector;
        this.dimensionScorer = dimensionScorer;
        this.classifier = classifier;
        this.summaryBuilder = summaryBuilder;
    }

    /**
     * @throws InsufficientSignalException when the conversation has fewer messages than configured
     */
    public Profile buildProfile(Evidence evidence) {
        return buildProfile(corpusBuilder.build(evidence));
    }

    public Profile buildProfile(SignalCorpus corpus) {
        List<CategoryTag> categories = categoryDetector.detect(corpus);
        DimensionScore dimensions = dimensionScorer.score(corpus);
        PersonalityArchetype archetype = classifier.classify(dimensions);

        List<String> interests = summaryBuilder.interests(corpus);
        Profile profile = new Profile(
                categories,
                dimensions,
                archetype,
                summaryBuilder.tagline(archetype, categories.get(0).getCategory()),
                summaryBuilder.description(archetype, categories, dimensions),
                interests,
                summaryBuilder.confidence(corpus, interests));
        log.info("Profile built: archetype={} categories={} confidence={}",
                archetype.getLabel(), categories, profile.getConfidence());
        return profile;
    }
}

package com.bloom.recommender.service.profile;

import com.bloom.recommender.config.RecommenderProperties;
import com.bloom.recommender.model.DimensionScore;
import com.bloom.recommender.model.PersonalityArchetype;
import org.springframework.stereotype.Component;

/**
 * Maps dimension scores to an archetype. Total and deterministic over [0,100]^3.
 *
 * <ol>
 *   <li>contribution above the cultivator threshold: Cultivator, regardless of the quadrant</li>
 *   <li>otherwise the conviction/intuition quadrant against the midpoint:
 *       high/high Visionary, low/high Explorer, high/low Optimizer, low/low Innovator</li>
 * </ol>
 */
@Component
public class PersonalityClassifier {
    private final RecommenderProperties properties;

    public PersonalityClassifier(RecommenderProperties properties) {
        this.properties = properties;
    }

    public PersonalityArchetype classify(DimensionScore dimensions) {
        if (dimensions.getContribution() > properties.getCultivatorThreshold()) {
            return PersonalityArchetype.CULTIVATOR;
        }
        int mid = properties.getQuadrantMidpoint();
        boolean highConviction = dimensions.getConviction() >= mid;
        boolean highIntuition = dimensions.getIntuition() >= mid;
        if (highConviction && highIntuition) return PersonalityArchetype.VISIONARY;
        if (highIntuition) return PersonalityArchetype.EXPLORER;
        if (highConviction) return PersonalityArchetype.OPTIMIZER;
        return PersonalityArchetype.INNOVATOR;
    }
}

package com.bloom.recommender.service.profile;

import com.bloom.recommender.model.Dimension;
import com.bloom.recommender.model.SignalCorpus;
import com.bloom.recommender.model.StructuredSignals;

/**
 * One behavioural axis of the profile.
 *
 * <p>Implementations start from a baseline and add independent factors. They must be pure
 * functions of their inputs: no hidden state, no I/O, same input always gives the same result.
 * Clamping to [0,100] is left to {@link DimensionScorer}.
 *
 * @see DimensionScorer
 */
public interface DimensionCalculator {
    Dimension dimension();

    /**
     * @param corpus the merged evidence
     * @param structured optional structured activity, may be {@code null}
     * @return the unclamped value and the factors that moved it
     */
    DimensionResult calculate(SignalCorpus corpus, StructuredSignals structured);

    default String getName() {
        return this.getClass().getSimpleName();
    }
}

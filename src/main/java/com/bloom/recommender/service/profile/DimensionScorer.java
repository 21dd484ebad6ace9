package com.bloom.recommender.service.profile;

import com.bloom.recommender.model.Dimension;
import com.bloom.recommender.model.DimensionScore;
import com.bloom.recommender.model.SignalCorpus;
import com.bloom.recommender.model.StructuredSignals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the three dimension scores from a corpus and optional structured signals.
 *
 * <p>Each {@link DimensionCalculator} runs independently; the scorer clamps every result to
 * [0,100] and keeps each calculator's factor list as the rationale.
 */
@Component
public class DimensionScorer {
    private static final Logger log = LoggerFactory.getLogger(DimensionScorer.class);

    private final List<DimensionCalculator> calculators;

    public DimensionScorer() {
        this.calculators = Arrays.asList(
            new ConvictionCalculator(),
            new IntuitionCalculator(),
            new ContributionCalculator()
        );
    }

    public DimensionScore score(SignalCorpus corpus) {
        return score(corpus, corpus.getStructured());
    }

    public DimensionScore score(SignalCorpus corpus, StructuredSignals structured) {
        Map<Dimension, Integer> values = new EnumMap<>(Dimension.class);
        Map<Dimension, String> rationale = new EnumMap<>(Dimension.class);
        for (DimensionCalculator calculator : calculators) {
            DimensionResult result = calculator.calculate(corpus, structured);
            values.put(calculator.dimension(), DimensionScore.clamp(result.getValue()));
            rationale.put(calculator.dimension(), result.rationale());
            log.debug("{} -> {} raw={} [{}]", calculator.getName(), calculator.dimension(),
                    result.getValue(), result.rationale());
        }
        DimensionScore score = new DimensionScore(
                values.get(Dimension.CONVICTION),
                values.get(Dimension.INTUITION),
                values.get(Dimension.CONTRIBUTION),
                rationale);
        log.info("Dimensions: conviction={} intuition={} contribution={}",
                score.getConviction(), score.getIntuition(), score.getContribution());
        return score;
    }
}

package com.bloom.recommender.service.recommend;

import com.bloom.recommender.model.CandidateItem;
import com.bloom.recommender.model.Category;
import com.bloom.recommender.model.Profile;
import com.bloom.recommender.model.RankedRecommendation;
import com.bloom.recommender.model.ScoredCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Recommendation pipeline: aggregate candidates from all sources, deduplicate, rank against the
 * profile and bucket by category. Only the aggregation step performs I/O; the rest are
 * in-memory transforms on the settled candidate pool.
 */
@Service
public class RecommendationService {
    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    private final List<ContentSourceAdapter> adapters;
    private final CandidateAggregator aggregator;
    private final Deduplicator deduplicator;
    private final PersonalizedRanker ranker;
    private final CategoryBucketer bucketer;

    public RecommendationService(List<ContentSourceAdapter> adapters,
                                 CandidateAggregator aggregator,
                                 Deduplicator deduplicator,
                                 PersonalizedRanker ranker,
                                 CategoryBucketer bucketer) {
        this.adapters = adapters;
        this.aggregator = aggregator;
        this.deduplicator = deduplicator;
        this.ranker = ranker;
        this.bucketer = bucketer;
    }

    /** Recommendations from the registered sources, in their {@code @Order}. */
    public Mono<List<RankedRecommendation>> recommend(Profile profile) {
        return recommend(profile, adapters);
    }

    public Mono<List<RankedRecommendation>> recommend(Profile profile, List<ContentSourceAdapter> sources) {
        List<Category> categories = profile.categoryList();
        return aggregator.fetch(sources, categories)
                .map(results -> {
                    List<CandidateItem> pool = deduplicator.dedupe(CandidateAggregator.candidates(results));
                    List<ScoredCandidate> ranked = ranker.rankAll(pool, profile);
                    List<RankedRecommendation> out = bucketer.bucket(ranked, categories);
                    log.info("Recommendations built: archetype={} categories={} pool={} returned={}",
                            profile.getArchetype().shortName(), categories.size(), pool.size(), out.size());
                    return out;
                });
    }

    public List<ContentSourceAdapter> getAdapters() { return adapters; }
}

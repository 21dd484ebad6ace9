package com.bloom.recommender.service.recommend;

import com.bloom.recommender.model.CandidateItem;
import com.bloom.recommender.model.Category;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * A content source queried for recommendation candidates, implemented once per source.
 *
 * <p>Implementations may fail in any way (error signal, synchronous exception, never
 * completing); the aggregator isolates each source, applies its own timeout and treats a
 * failure as an empty result for that source. Retry policy, if any, belongs here and not
 * in the aggregator.
 */
public interface ContentSourceAdapter {
    /** Stable source name, recorded on every candidate the source produces. */
    String name();

    /**
     * @param queryHints the profile's categories, strongest first
     * @return candidates for those categories
     */
    Flux<CandidateItem> fetch(List<Category> queryHints);
}

package com.bloom.recommender.service.recommend;

import com.bloom.recommender.config.RecommenderProperties;
import com.bloom.recommender.model.CandidateItem;
import com.bloom.recommender.model.Category;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Queries all content sources in parallel and waits for every one of them to settle.
 *
 * <p>Each source runs with its own timeout; an error, a timeout or a synchronous exception from
 * the adapter is captured into that source's {@link SourceResult} and never cancels the
 * siblings. Results come back in adapter order, which later serves as the deduplication
 * priority. Cancelling the returned {@code Mono} cancels all in-flight fetches.
 */
@Component
public class CandidateAggregator {
    private static final Logger log = LoggerFactory.getLogger(CandidateAggregator.class);

    private final RecommenderProperties properties;

    public CandidateAggregator(RecommenderProperties properties) {
        this.properties = properties;
    }

    public Mono<List<SourceResult>> fetch(List<ContentSourceAdapter> adapters, List<Category> queryHints) {
        if (adapters == null || adapters.isEmpty()) {
            return Mono.just(List.of());
        }
        Duration timeout = Duration.ofMillis(Math.max(1, properties.getSourceTimeoutMs()));
        return Flux.fromIterable(adapters)
                .flatMapSequential(adapter -> settle(adapter, queryHints, timeout), adapters.size())
                .collectList()
                .doOnNext(results -> {
                    int failed = 0;
                    for (SourceResult r : results) if (r.isFailed()) failed++;
                    log.info("Candidate fetch settled: sources={} failed={} candidates={}",
                            results.size(), failed, candidates(results).size());
                });
    }

    private Mono<SourceResult> settle(ContentSourceAdapter adapter, List<Category> queryHints, Duration timeout) {
        String name = adapter.name();
        long start = System.nanoTime();
        // subscribeOn keeps an adapter that blocks from serialising the others
        return Flux.defer(() -> adapter.fetch(queryHints))
                .subscribeOn(Schedulers.boundedElastic())
                .collectList()
                .timeout(timeout)
                .map(items -> {
                    long ms = elapsedMs(start);
                    log.info("Source {} returned {} candidates in {}ms", name, items.size(), ms);
                    return SourceResult.success(name, items, ms);
                })
                .onErrorResume(e -> {
                    long ms = elapsedMs(start);
                    SourceFetchException failure = toFailure(name, e, timeout);
                    log.warn("Source {} failed after {}ms, continuing without it: {}", name, ms, failure.getMessage());
                    return Mono.just(SourceResult.failure(name, failure, ms));
                });
    }

    /** All candidates of all sources, in source order. */
    public static List<CandidateItem> candidates(List<SourceResult> results) {
        List<CandidateItem> all = new ArrayList<>();
        for (SourceResult r : results) all.addAll(r.getItems());
        return all;
    }

    private static SourceFetchException toFailure(String name, Throwable e, Duration timeout) {
        if (e instanceof SourceFetchException sfe) return sfe;
        if (e instanceof TimeoutException) {
            return new SourceFetchException(name, "timed out after " + timeout.toMillis() + "ms", e);
        }
        return new SourceFetchException(name, e.toString(), e);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}

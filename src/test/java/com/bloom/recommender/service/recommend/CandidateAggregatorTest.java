package com.bloom.recommender.service.recommend;

import com.bloom.recommender.config.RecommenderProperties;
import com.bloom.recommender.model.CandidateItem;
import com.bloom.recommender.model.Category;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

public class CandidateAggregatorTest {

    static class StubSource implements ContentSourceAdapter {
        private final String name;
        private final Function<List<Category>, Flux<CandidateItem>> body;

        StubSource(String name, Function<List<Category>, Flux<CandidateItem>> body) {
            this.name = name;
            this.body = body;
        }

        @Override public String name() { return name; }
        @Override public Flux<CandidateItem> fetch(List<Category> queryHints) { return body.apply(queryHints); }
    }

    static CandidateItem item(String url, String source) {
        return new CandidateItem(url, "t", "", List.of(), null, source, 50.0);
    }

    private static CandidateAggregator aggregator(long timeoutMs) {
        RecommenderProperties props = new RecommenderProperties();
        props.setSourceTimeoutMs(timeoutMs);
        return new CandidateAggregator(props);
    }

    @Test
    public void failingAndHangingSourcesDoNotAbortTheOthers() {
        List<ContentSourceAdapter> sources = List.of(
                new StubSource("ok", hints -> Flux.just(item("https://x.dev/1", "ok"), item("https://x.dev/2", "ok"))),
                new StubSource("error", hints -> Flux.error(new IllegalStateException("boom"))),
                new StubSource("throws", hints -> { throw new IllegalArgumentException("sync"); }),
                new StubSource("hangs", hints -> Flux.never()),
                new StubSource("partial", hints -> Flux.concat(Flux.just(item("https://x.dev/3", "partial")),
                        Flux.error(new IllegalStateException("mid-stream")))));

        List<SourceResult> results = aggregator(300).fetch(sources, List.of(Category.AI_TOOLS)).block(Duration.ofSeconds(10));

        assertNotNull(results);
        assertEquals(List.of("ok", "error", "throws", "hangs", "partial"),
                results.stream().map(SourceResult::getSourceName).toList());
        assertFalse(results.get(0).isFailed());
        assertEquals(2, results.get(0).getItems().size());
        for (int i = 1; i < results.size(); i++) {
            assertTrue(results.get(i).isFailed(), results.get(i).getSourceName());
            assertTrue(results.get(i).getItems().isEmpty());
        }
        assertTrue(results.get(3).getFailure().getMessage().contains("timed out"));
        assertEquals("hangs", results.get(3).getFailure().getSourceName());
        assertEquals(2, CandidateAggregator.candidates(results).size());
    }

    @Test
    public void sourcesRunConcurrently() {
        List<ContentSourceAdapter> sources = List.of(
                new StubSource("a", hints -> Flux.just(item("https://x.dev/a", "a")).delayElements(Duration.ofMillis(400))),
                new StubSource("b", hints -> Flux.just(item("https://x.dev/b", "b")).delayElements(Duration.ofMillis(400))),
                new StubSource("c", hints -> Flux.just(item("https://x.dev/c", "c")).delayElements(Duration.ofMillis(400))));

        long start = System.nanoTime();
        List<SourceResult> results = aggregator(5000).fetch(sources, List.of()).block(Duration.ofSeconds(10));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertEquals(3, CandidateAggregator.candidates(results).size());
        assertTrue(elapsedMs < 1100, "took " + elapsedMs + "ms");
    }

    @Test
    public void blockingSourceDoesNotSerialiseTheOthers() {
        List<ContentSourceAdapter> sources = List.of(
                new StubSource("slow", hints -> {
                    try {
                        Thread.sleep(300);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return Flux.just(item("https://x.dev/s", "slow"));
                }),
                new StubSource("fast", hints -> Flux.just(item("https://x.dev/f", "fast"))));

        List<SourceResult> results = aggregator(5000).fetch(sources, List.of()).block(Duration.ofSeconds(10));
        assertEquals(List.of("https://x.dev/s", "https://x.dev/f"),
                CandidateAggregator.candidates(results).stream().map(CandidateItem::getCanonicalId).toList());
    }

    @Test
    public void noSourcesGiveNoResults() {
        assertTrue(aggregator(100).fetch(List.of(), List.of()).block().isEmpty());
    }
}

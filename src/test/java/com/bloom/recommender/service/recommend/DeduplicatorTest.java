package com.bloom.recommender.service.recommend;

import com.bloom.recommender.model.CandidateItem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DeduplicatorTest {

    private final Deduplicator dedup = new Deduplicator();

    private static CandidateItem item(String url, String source, Double score) {
        return new CandidateItem(url, "title", "", List.of(), null, source, score);
    }

    @Test
    public void higherScoreWinsRegardlessOfOrder() {
        List<CandidateItem> out = dedup.dedupe(List.of(
                item("https://github.com/acme/tool", "curated", 40.0),
                item("https://GitHub.com/acme/tool/", "github", 65.0)));
        assertEquals(1, out.size());
        assertEquals(65.0, out.get(0).getRawScore());
        assertEquals("github", out.get(0).getSourceName());

        List<CandidateItem> reversed = dedup.dedupe(List.of(
                item("https://github.com/acme/tool/", "github", 65.0),
                item("https://github.com/acme/tool", "curated", 40.0)));
        assertEquals(65.0, reversed.get(0).getRawScore());
    }

    @Test
    public void equalScoresKeepTheEarlierSource() {
        List<CandidateItem> out = dedup.dedupe(List.of(
                item("https://x.dev/a", "curated", 50.0),
                item("https://x.dev/a", "github", 50.0)));
        assertEquals("curated", out.get(0).getSourceName());

        List<CandidateItem> unscored = dedup.dedupe(List.of(
                item("https://x.dev/a", "curated", null),
                item("https://x.dev/a", "github", null)));
        assertEquals("curated", unscored.get(0).getSourceName());
    }

    @Test
    public void scoredBeatsUnscored() {
        List<CandidateItem> out = dedup.dedupe(List.of(
                item("https://x.dev/a", "curated", null),
                item("https://x.dev/a", "github", 1.0)));
        assertEquals("github", out.get(0).getSourceName());
    }

    @Test
    public void dropsCandidatesWithoutIdentity() {
        List<CandidateItem> out = dedup.dedupe(List.of(
                item("  ", "curated", 90.0),
                item(null, "curated", 90.0),
                item("https://x.dev/b", "github", 10.0)));
        assertEquals(1, out.size());
        assertEquals("https://x.dev/b", out.get(0).getCanonicalId());
    }

    @Test
    public void isIdempotentAndKeepsFirstSeenOrder() {
        List<CandidateItem> input = List.of(
                item("https://x.dev/c", "curated", 10.0),
                item("https://x.dev/a", "curated", 20.0),
                item("https://x.dev/c", "github", 30.0),
                item("https://x.dev/b", "github", 5.0));
        List<CandidateItem> once = dedup.dedupe(input);
        List<CandidateItem> twice = dedup.dedupe(once);

        assertEquals(3, once.size());
        assertEquals("https://x.dev/c", once.get(0).getCanonicalId());
        assertEquals(30.0, once.get(0).getRawScore());
        assertEquals(once, twice);
    }
}

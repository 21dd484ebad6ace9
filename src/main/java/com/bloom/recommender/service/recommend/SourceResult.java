package com.bloom.recommender.service.recommend;

import com.bloom.recommender.model.CandidateItem;

import java.util.List;

/**
 * Settled outcome of one source fetch: either the items it produced or the failure that
 * replaced them with an empty list.
 */
public final class SourceResult {
    private final String sourceName;
    private final List<CandidateItem> items;
    private final SourceFetchException failure;
    private final long elapsedMs;

    private SourceResult(String sourceName, List<CandidateItem> items, SourceFetchException failure, long elapsedMs) {
        this.sourceName = sourceName;
        this.items = items;
        this.failure = failure;
        this.elapsedMs = elapsedMs;
    }

    public static SourceResult success(String sourceName, List<CandidateItem> items, long elapsedMs) {
        return new SourceResult(sourceName, List.copyOf(items), null, elapsedMs);
    }

    public static SourceResult failure(String sourceName, SourceFetchException failure, long elapsedMs) {
        return new SourceResult(sourceName, List.of(), failure, elapsedMs);
    }

    public String getSourceName() { return sourceName; }
    public List<CandidateItem> getItems() { return items; }
    public SourceFetchException getFailure() { return failure; }
    public long getElapsedMs() { return elapsedMs; }

    public boolean isFailed() {
        return failure != null;
    }
}

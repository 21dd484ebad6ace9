package com.bloom.recommender.service.recommend;

/**
 * Failure of a single content source. Captured per source by the aggregator and never
 * propagated to callers of the recommendation pipeline.
 */
public class SourceFetchException extends RuntimeException {
    private final String sourceName;

    public SourceFetchException(String sourceName, String message, Throwable cause) {
        super(sourceName + ": " + message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() { return sourceName; }
}

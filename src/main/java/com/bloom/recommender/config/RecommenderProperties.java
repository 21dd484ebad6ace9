package com.bloom.recommender.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Thresholds and caps for profile scoring and recommendation grouping.
 *
 * Properties are prefixed with "recommender" in application.yml.
 */
@ConfigurationProperties(prefix = "recommender")
public class RecommenderProperties {
    /** Minimum number of conversation messages before a profile is attempted */
    private int minMessages = 3;
    /** Accumulated keyword hits a category needs to be labelled */
    private int minCategoryScore = 3;
    /** Maximum number of categories kept on a profile */
    private int maxCategories = 3;
    /** Contribution above this value classifies as Cultivator regardless of quadrant */
    private int cultivatorThreshold = 55;
    /** Quadrant midpoint for conviction and intuition */
    private int quadrantMidpoint = 50;
    /** Dimension value above which the ranker treats a dimension as "high" */
    private int highDimension = 65;
    /** Dimension value below which the ranker treats a dimension as "low" */
    private int lowDimension = 35;
    /** Match score a candidate needs to count as "decent" when sizing a bucket */
    private int scoreThreshold = 25;
    /** Bucket floor (bounded by the number of candidates available) */
    private int minPerBucket = 3;
    /** Bucket ceiling */
    private int maxPerBucket = 7;
    /** Independent timeout applied to each content source fetch (ms) */
    private long sourceTimeoutMs = 8000;

    public int getMinMessages() { return minMessages; }
    public void setMinMessages(int minMessages) { this.minMessages = minMessages; }

    public int getMinCategoryScore() { return minCategoryScore; }
    public void setMinCategoryScore(int minCategoryScore) { this.minCategoryScore = minCategoryScore; }

    public int getMaxCategories() { return maxCategories; }
    public void setMaxCategories(int maxCategories) { this.maxCategories = maxCategories; }

    public int getCultivatorThreshold() { return cultivatorThreshold; }
    public void setCultivatorThreshold(int cultivatorThreshold) { this.cultivatorThreshold = cultivatorThreshold; }

    public int getQuadrantMidpoint() { return quadrantMidpoint; }
    public void setQuadrantMidpoint(int quadrantMidpoint) { this.quadrantMidpoint = quadrantMidpoint; }

    public int getHighDimension() { return highDimension; }
    public void setHighDimension(int highDimension) { this.highDimension = highDimension; }

    public int getLowDimension() { return lowDimension; }
    public void setLowDimension(int lowDimension) { this.lowDimension = lowDimension; }

    public int getScoreThreshold() { return scoreThreshold; }
    public void setScoreThreshold(int scoreThreshold) { this.scoreThreshold = scoreThreshold; }

    public int getMinPerBucket() { return minPerBucket; }
    public void setMinPerBucket(int minPerBucket) { this.minPerBucket = minPerBucket; }

    public int getMaxPerBucket() { return maxPerBucket; }
    public void setMaxPerBucket(int maxPerBucket) { this.maxPerBucket = maxPerBucket; }

    public long getSourceTimeoutMs() { return sourceTimeoutMs; }
    public void setSourceTimeoutMs(long sourceTimeoutMs) { this.sourceTimeoutMs = sourceTimeoutMs; }
}

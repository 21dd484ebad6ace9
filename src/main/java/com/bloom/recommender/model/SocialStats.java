package com.bloom.recommender.model;

/**
 * Counts derived from social evidence at corpus build time.
 */
public final class SocialStats {
    public static final SocialStats NONE = new SocialStats(0, 0, 0);

    private final int postCount;
    private final int followingCount;
    private final int trendPostCount;

    public SocialStats(int postCount, int followingCount, int trendPostCount) {
        this.postCount = postCount;
        this.followingCount = followingCount;
        this.trendPostCount = trendPostCount;
    }

    public int getPostCount() { return postCount; }
    public int getFollowingCount() { return followingCount; }
    public int getTrendPostCount() { return trendPostCount; }
}

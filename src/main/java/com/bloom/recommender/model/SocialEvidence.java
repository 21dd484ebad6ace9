package com.bloom.recommender.model;

import java.util.List;
import java.util.Objects;

/**
 * Social-profile text handed over by an external collector: bio, recent posts and the
 * handles the person follows.
 */
public final class SocialEvidence {
    private final String bio;
    private final List<String> posts;
    private final List<String> following;

    public SocialEvidence(String bio, List<String> posts, List<String> following) {
        this.bio = bio == null ? "" : bio;
        this.posts = withoutNulls(posts);
        this.following = withoutNulls(following);
    }

    public String getBio() { return bio; }
    public List<String> getPosts() { return posts; }
    public List<String> getFollowing() { return following; }

    private static List<String> withoutNulls(List<String> values) {
        return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
    }

    public boolean isEmpty() {
        return bio.isBlank() && posts.isEmpty() && following.isEmpty();
    }
}

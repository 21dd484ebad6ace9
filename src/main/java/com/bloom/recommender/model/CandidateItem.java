package com.bloom.recommender.model;

import com.bloom.recommender.util.CanonicalIds;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A content item offered by one source. The canonical id is derived from the item URL so the
 * same item returned by several sources can be reconciled.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CandidateItem {
    private final String canonicalId;
    private final String url;
    private final String title;
    private final String description;
    private final List<String> tags;
    private final Integer popularity;
    private final String sourceName;
    private final Double rawScore;

    public CandidateItem(String url,
                         String title,
                         String description,
                         List<String> tags,
                         Integer popularity,
                         String sourceName,
                         Double rawScore) {
        this.canonicalId = CanonicalIds.fromUrl(url);
        this.url = url;
        this.title = title == null ? "" : title;
        this.description = description == null ? "" : description;
        this.tags = tags == null ? List.of() : tags.stream().filter(Objects::nonNull).toList();
        this.popularity = popularity;
        this.sourceName = sourceName;
        this.rawScore = rawScore;
    }

    public String getCanonicalId() { return canonicalId; }
    public String getUrl() { return url; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public List<String> getTags() { return tags; }
    public Integer getPopularity() { return popularity; }
    public String getSourceName() { return sourceName; }
    public Double getRawScore() { return rawScore; }

    /** Title, description and tags joined and lower-cased, used for keyword matching. */
    @JsonIgnore
    public String searchText() {
        return (title + " " + description + " " + String.join(" ", tags)).toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "CandidateItem{" + canonicalId + ", source=" + sourceName + ", rawScore=" + rawScore + "}";
    }
}

package com.bloom.recommender.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Behavioural profile produced from one evidence request: ranked categories, dimension scores
 * and the classified archetype, plus presentation fields derived from them.
 */
public final class Profile {
    private final List<CategoryTag> categories;
    private final DimensionScore dimensions;
    private final PersonalityArchetype archetype;
    private final String tagline;
    private final String description;
    private final List<String> interests;
    private final int confidence;

    public Profile(List<CategoryTag> categories,
                   DimensionScore dimensions,
                   PersonalityArchetype archetype,
                   String tagline,
                   String description,
                   List<String> interests,
                   int confidence) {
        if (categories == null || categories.isEmpty()) {
            throw new IllegalArgumentException("profile requires at least one category");
        }
        this.categories = List.copyOf(categories);
        this.dimensions = dimensions;
        this.archetype = archetype;
        this.tagline = tagline;
        this.description = description;
        this.interests = interests == null ? List.of() : List.copyOf(interests);
        this.confidence = confidence;
    }

    /** Minimal profile without presentation fields, for callers that already hold the scores. */
    public static Profile of(List<CategoryTag> categories, DimensionScore dimensions, PersonalityArchetype archetype) {
        return new Profile(categories, dimensions, archetype, null, null, List.of(), 0);
    }

    public List<CategoryTag> getCategories() { return categories; }
    public DimensionScore getDimensions() { return dimensions; }
    public PersonalityArchetype getArchetype() { return archetype; }
    public String getTagline() { return tagline; }
    public String getDescription() { return description; }
    public List<String> getInterests() { return interests; }
    public int getConfidence() { return confidence; }

    public Category primaryCategory() {
        return categories.get(0).getCategory();
    }

    public List<Category> categoryList() {
        List<Category> out = new ArrayList<>(categories.size());
        for (CategoryTag t : categories) out.add(t.getCategory());
        return out;
    }
}

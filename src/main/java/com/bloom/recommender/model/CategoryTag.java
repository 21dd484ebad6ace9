package com.bloom.recommender.model;

/**
 * A detected category and its accumulated keyword score.
 */
public final class CategoryTag {
    private final Category category;
    private final int score;

    public CategoryTag(Category category, int score) {
        this.category = category;
        this.score = score;
    }

    public Category getCategory() { return category; }
    public int getScore() { return score; }

    public String getLabel() {
        return category.getLabel();
    }

    public boolean qualifies(int minScore) {
        return score >= minScore;
    }

    @Override
    public String toString() {
        return category.getLabel() + "=" + score;
    }
}

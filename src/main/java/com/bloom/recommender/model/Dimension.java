package com.bloom.recommender.model;

public enum Dimension {
    CONVICTION,
    INTUITION,
    CONTRIBUTION
}

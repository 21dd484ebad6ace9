package com.bloom.recommender.model;

/**
 * Kind of evidence a corpus segment was built from.
 */
public enum SignalSource {
    CONVERSATION,
    SOCIAL_PROFILE,
    STRUCTURED
}

package com.bloom.recommender.service.profile;

/**
 * Raised when the evidence is too thin to form a profile. Callers use this to ask the person
 * for more input instead of showing a low-quality profile.
 */
public class InsufficientSignalException extends RuntimeException {
    private final int observedCount;
    private final int requiredCount;

    public InsufficientSignalException(int observedCount, int requiredCount) {
        super("Insufficient conversation data: " + observedCount + " messages found (minimum "
                + requiredCount + " required)");
        this.observedCount = observedCount;
        this.requiredCount = requiredCount;
    }

    public int getObservedCount() { return observedCount; }
    public int getRequiredCount() { return requiredCount; }
}

package com.bloom.recommender.model;

/**
 * Raw evidence for one profile request. Any part may be absent; the conversation transcript
 * is the only part that counts towards the minimum message threshold.
 */
public final class Evidence {
    private final String conversation;
    private final SocialEvidence social;
    private final StructuredSignals structured;

    public Evidence(String conversation, SocialEvidence social, StructuredSignals structured) {
        this.conversation = conversation;
        this.social = social;
        this.structured = structured;
    }

    public static Evidence conversation(String transcript) {
        return new Evidence(transcript, null, null);
    }

    public String getConversation() { return conversation; }
    public SocialEvidence getSocial() { return social; }
    public StructuredSignals getStructured() { return structured; }
}

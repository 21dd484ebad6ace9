package com.bloom.recommender.model;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Merged, tagged evidence evaluated by the category detector and the dimension scorer.
 *
 * <p>Instances are only produced by {@code SignalCorpusBuilder}, which guarantees at least one
 * non-blank segment and a message count at or above the configured minimum. The corpus is
 * immutable and lives for a single profile request.
 */
public final class SignalCorpus {
    private final List<Segment> segments;
    private final int messageCount;
    private final List<String> topics;
    private final StructuredSignals structured;
    private final SocialStats social;
    private final String fullText;

    public SignalCorpus(List<Segment> segments,
                        int messageCount,
                        List<String> topics,
                        StructuredSignals structured,
                        SocialStats social) {
        this.segments = List.copyOf(segments);
        this.messageCount = messageCount;
        this.topics = topics == null ? List.of() : List.copyOf(topics);
        this.structured = structured;
        this.social = social == null ? SocialStats.NONE : social;
        List<String> parts = new ArrayList<>(this.segments.size() + this.topics.size());
        parts.addAll(this.topics);
        for (Segment s : this.segments) parts.add(s.getText());
        this.fullText = String.join(" ", parts).toLowerCase(Locale.ROOT);
    }

    public List<Segment> getSegments() { return segments; }
    public int getMessageCount() { return messageCount; }
    public List<String> getTopics() { return topics; }
    public StructuredSignals getStructured() { return structured; }
    public SocialStats getSocial() { return social; }

    /** All segment text (plus detected topic names) joined and lower-cased. */
    public String fullText() {
        return fullText;
    }

    public boolean hasStructuredSignals() {
        return structured != null && !structured.isEmpty();
    }

    public Set<SignalSource> sourcesPresent() {
        Set<SignalSource> present = EnumSet.noneOf(SignalSource.class);
        for (Segment s : segments) {
            if (!s.isBlank()) present.add(s.getSource());
        }
        if (hasStructuredSignals()) present.add(SignalSource.STRUCTURED);
        return present;
    }

    public int segmentCount(SignalSource source) {
        int n = 0;
        for (Segment s : segments) {
            if (s.getSource() == source) n++;
        }
        return n;
    }

    /** Sum of segment weights per source relative to the total, 0 when the source is absent. */
    public double weightShare(SignalSource source) {
        double total = 0;
        double part = 0;
        for (Segment s : segments) {
            total += s.getWeight();
            if (s.getSource() == source) part += s.getWeight();
        }
        return total == 0 ? 0 : part / total;
    }
}

package com.bloom.recommender.model;

/**
 * One tagged piece of evidence text. A conversation contributes one segment per message,
 * a social profile one per bio/post, structured activity one summarising its labels.
 */
public final class Segment {
    private final SignalSource source;
    private final String text;
    private final double weight;

    public Segment(SignalSource source, String text, double weight) {
        this.source = source;
        this.text = text == null ? "" : text;
        this.weight = weight;
    }

    public SignalSource getSource() { return source; }
    public String getText() { return text; }
    public double getWeight() { return weight; }

    public boolean isBlank() {
        return text.isBlank();
    }

    @Override
    public String toString() {
        return "Segment{" + source + ", weight=" + weight + ", chars=" + text.length() + "}";
    }
}

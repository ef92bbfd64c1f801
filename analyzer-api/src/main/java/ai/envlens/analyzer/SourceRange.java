package ai.envlens.analyzer;

/**
 * Half-open interval {@code [start, end)} over {@link SourcePosition}s. Equality and hashing use only the four
 * numeric coordinates so ranges can be deduplicated in hash sets.
 */
public record SourceRange(SourcePosition start, SourcePosition end) {

    public SourceRange {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("range end " + end + " precedes start " + start);
        }
    }

    public static SourceRange of(int startLine, int startChar, int endLine, int endChar) {
        return new SourceRange(new SourcePosition(startLine, startChar), new SourcePosition(endLine, endChar));
    }

    public boolean contains(SourcePosition position) {
        return Ranges.containsPosition(this, position);
    }

    public boolean isEmpty() {
        return start.equals(end);
    }

    @Override
    public String toString() {
        return "[" + start + "-" + end + ")";
    }
}

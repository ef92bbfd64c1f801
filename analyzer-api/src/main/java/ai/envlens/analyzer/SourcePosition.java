package ai.envlens.analyzer;

/**
 * A zero-based (line, character) coordinate. The character column counts UTF-16 code units, which is what editors
 * send over the wire and what {@link String#charAt(int)} indexes.
 */
public record SourcePosition(int line, int character) implements Comparable<SourcePosition> {

    public SourcePosition {
        if (line < 0 || character < 0) {
            throw new IllegalArgumentException("negative position: " + line + ":" + character);
        }
    }

    public static SourcePosition of(int line, int character) {
        return new SourcePosition(line, character);
    }

    @Override
    public int compareTo(SourcePosition other) {
        int byLine = Integer.compare(line, other.line);
        return byLine != 0 ? byLine : Integer.compare(character, other.character);
    }

    public boolean isBefore(SourcePosition other) {
        return compareTo(other) < 0;
    }

    @Override
    public String toString() {
        return line + ":" + character;
    }
}

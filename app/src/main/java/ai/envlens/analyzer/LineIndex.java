package ai.envlens.analyzer;

import java.util.Arrays;

/**
 * Maps between tree-sitter UTF-8 byte offsets, string indexes and LSP positions (zero-based line, UTF-16 column).
 * Built once per document text.
 */
public final class LineIndex {
    private final String text;
    // byte offset at which each UTF-16 unit starts; a low surrogate shares its high surrogate's offset
    private final int[] byteOffsets;
    private final int[] lineStarts;

    public LineIndex(String text) {
        this.text = text;
        this.byteOffsets = new int[text.length() + 1];
        int bytes = 0;
        int lines = 1;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            byteOffsets[i] = bytes;
            if (Character.isHighSurrogate(c) && i + 1 < text.length() && Character.isLowSurrogate(text.charAt(i + 1))) {
                byteOffsets[++i] = bytes;
                bytes += 4;
            } else {
                bytes += c < 0x80 ? 1 : c < 0x800 ? 2 : 3;
            }
            if (c == '\n') {
                lines++;
            }
        }
        byteOffsets[text.length()] = bytes;

        this.lineStarts = new int[lines];
        int line = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lineStarts[line++] = i + 1;
            }
        }
    }

    public String text() {
        return text;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    public int byteLength() {
        return byteOffsets[text.length()];
    }

    /** String index of the character starting at {@code byteOffset}, clamped to the text. */
    public int charIndex(int byteOffset) {
        if (byteOffset <= 0) return 0;
        if (byteOffset >= byteLength()) return text.length();
        int idx = Arrays.binarySearch(byteOffsets, byteOffset);
        if (idx < 0) {
            return -idx - 1;
        }
        // step back to the first unit sharing this offset
        while (idx > 0 && byteOffsets[idx - 1] == byteOffset) {
            idx--;
        }
        return idx;
    }

    public SourcePosition positionOfChar(int charIndex) {
        int clamped = Math.max(0, Math.min(charIndex, text.length()));
        int line = Arrays.binarySearch(lineStarts, clamped);
        if (line < 0) {
            line = -line - 2;
        }
        return new SourcePosition(line, clamped - lineStarts[line]);
    }

    public SourcePosition positionOfByte(int byteOffset) {
        return positionOfChar(charIndex(byteOffset));
    }

    public SourceRange rangeOfBytes(int startByte, int endByte) {
        return new SourceRange(positionOfByte(startByte), positionOfByte(endByte));
    }

    /** String index of {@code position}; columns past the end of a line clamp to the line end. */
    public int charIndexOf(SourcePosition position) {
        if (position.line() >= lineStarts.length) {
            return text.length();
        }
        int start = lineStarts[position.line()];
        int lineEnd = position.line() + 1 < lineStarts.length ? lineStarts[position.line() + 1] - 1 : text.length();
        return Math.min(start + position.character(), lineEnd);
    }

    public String substringOfBytes(int startByte, int endByte) {
        return text.substring(charIndex(startByte), charIndex(endByte));
    }

    /** Text of the line holding {@code position}, up to the position. */
    public String linePrefix(SourcePosition position) {
        if (position.line() >= lineStarts.length) {
            return "";
        }
        return text.substring(lineStarts[position.line()], charIndexOf(position));
    }

    public SourceRange fullRange() {
        return new SourceRange(new SourcePosition(0, 0), positionOfChar(text.length()));
    }
}

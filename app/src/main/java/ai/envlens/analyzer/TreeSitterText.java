package ai.envlens.analyzer;

import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/** Small helpers over {@link TSNode}s paired with the {@link LineIndex} of their source. */
public final class TreeSitterText {
    private TreeSitterText() {}

    public static boolean isPresent(@Nullable TSNode node) {
        return node != null && !node.isNull();
    }

    public static String text(TSNode node, LineIndex index) {
        return index.substringOfBytes(node.getStartByte(), node.getEndByte());
    }

    public static SourceRange range(TSNode node, LineIndex index) {
        return index.rangeOfBytes(node.getStartByte(), node.getEndByte());
    }

    public static boolean sameNode(@Nullable TSNode a, @Nullable TSNode b) {
        if (!isPresent(a) || !isPresent(b)) {
            return false;
        }
        return a.getStartByte() == b.getStartByte()
                && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
    }

    @Nullable
    public static TSNode field(TSNode node, String fieldName) {
        var child = node.getChildByFieldName(fieldName);
        return isPresent(child) ? child : null;
    }

    @Nullable
    public static TSNode firstNamedChild(TSNode node) {
        return node.getNamedChildCount() > 0 ? node.getNamedChild(0) : null;
    }

    /** Text with all whitespace removed, so {@code process . env} and {@code process.env} compare equal. */
    public static String compact(String text) {
        var sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}

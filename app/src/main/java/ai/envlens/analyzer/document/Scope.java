package ai.envlens.analyzer.document;

import ai.envlens.analyzer.SourceRange;
import java.util.List;
import java.util.Map;

/**
 * A lexical scope. {@code bindings} maps each name to the last binding declared for it in this scope; earlier
 * declarations of the same name stay in the arena for position-sensitive lookups.
 *
 * @param parentId enclosing scope id, {@code -1} for the file scope
 */
public record Scope(int id, int parentId, SourceRange range, List<Integer> childIds, Map<String, Integer> bindings) {

    public static final int ROOT = 0;
    public static final int NO_PARENT = -1;

    public Scope {
        childIds = List.copyOf(childIds);
        bindings = Map.copyOf(bindings);
    }

    public boolean isRoot() {
        return parentId == NO_PARENT;
    }
}

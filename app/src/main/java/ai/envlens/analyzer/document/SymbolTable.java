package ai.envlens.analyzer.document;

import ai.envlens.analyzer.FileExports;
import ai.envlens.analyzer.ImportContext;
import ai.envlens.analyzer.Ranges;
import ai.envlens.analyzer.Reference;
import ai.envlens.analyzer.SourcePosition;
import ai.envlens.analyzer.SourceRange;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.jetbrains.annotations.Nullable;

/** Immutable result of analyzing one version of a document. */
public final class SymbolTable {

    public static final SymbolTable EMPTY = new SymbolTable(
            List.of(),
            List.of(new Scope(Scope.ROOT, Scope.NO_PARENT, SourceRange.of(0, 0, 0, 0), List.of(), Map.of())),
            List.of(),
            ImportContext.EMPTY,
            FileExports.EMPTY);

    private final List<Binding> bindings;
    private final List<Scope> scopes;
    private final List<Reference> references;
    private final ImportContext imports;
    private final FileExports exports;
    // per scope, every declaration of a name in declaration order
    private final Map<Integer, ListMultimap<String, Integer>> declarationsByScope;

    public SymbolTable(List<Binding> bindings, List<Scope> scopes, List<Reference> references, ImportContext imports,
                       FileExports exports) {
        this.bindings = List.copyOf(bindings);
        this.scopes = List.copyOf(scopes);
        this.references = List.copyOf(references);
        this.imports = imports;
        this.exports = exports;

        Map<Integer, ListMultimap<String, Integer>> index = new HashMap<>();
        for (var binding : this.bindings) {
            index.computeIfAbsent(binding.scopeId(), k -> ArrayListMultimap.create()).put(binding.name(), binding.id());
        }
        this.declarationsByScope = index.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> ImmutableListMultimap.copyOf(e.getValue())));
    }

    public List<Binding> bindings() {
        return bindings;
    }

    public Binding binding(int id) {
        return bindings.get(id);
    }

    public List<Scope> scopes() {
        return scopes;
    }

    public Scope rootScope() {
        return scopes.get(Scope.ROOT);
    }

    public List<Reference> references() {
        return references;
    }

    public ImportContext imports() {
        return imports;
    }

    public FileExports exports() {
        return exports;
    }

    public Optional<Reference> referenceAt(SourcePosition position) {
        return Ranges.mostSpecificAt(references, Reference::range, position);
    }

    public Scope innermostScopeAt(SourcePosition position) {
        var scope = rootScope();
        descend:
        while (true) {
            for (int childId : scope.childIds()) {
                var child = scopes.get(childId);
                if (Ranges.containsPosition(child.range(), position)) {
                    scope = child;
                    continue descend;
                }
            }
            return scope;
        }
    }

    /**
     * The binding {@code name} denotes at {@code position}: the latest declaration completed before the position in
     * the innermost enclosing scope that declares the name.
     */
    public Optional<Binding> lookup(String name, SourcePosition position) {
        var scope = innermostScopeAt(position);
        while (true) {
            var found = latestBefore(scope.id(), name, position);
            if (found != null) {
                return Optional.of(found);
            }
            if (scope.isRoot()) {
                return Optional.empty();
            }
            scope = scopes.get(scope.parentId());
        }
    }

    @Nullable
    private Binding latestBefore(int scopeId, String name, SourcePosition position) {
        var declarations = declarationsByScope.get(scopeId);
        if (declarations == null) {
            return null;
        }
        Binding latest = null;
        for (int id : declarations.get(name)) {
            var binding = bindings.get(id);
            if (!position.isBefore(binding.declarationRange().end())) {
                latest = binding;
            }
        }
        return latest;
    }

    /** Resolved variable names with the ranges where each is written out literally. */
    public Map<String, List<SourceRange>> literalOccurrences() {
        return references.stream()
                .filter(r -> r.canonicalName() != null && r.token().equals(r.canonicalName()))
                .collect(Collectors.groupingBy(
                        Reference::canonicalName,
                        Collectors.mapping(Reference::range, Collectors.toUnmodifiableList())));
    }
}

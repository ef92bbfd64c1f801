package ai.envlens.analyzer;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Names a file binds through import statements, keyed by local name. A later import of the same name wins. */
public final class ImportContext {

    public static final ImportContext EMPTY = new ImportContext(Map.of());

    public enum Kind {
        /** {@code import { a as b } from "m"}, {@code from m import a as b}, {@code use m::a}. */
        NAMED,
        /** {@code import a from "m"}, {@code const a = require("m")}. */
        DEFAULT,
        /** {@code import * as a from "m"}. */
        NAMESPACE,
        /** The module itself: {@code import os}, {@code import "os"} in Go. */
        MODULE
    }

    public record ImportBinding(String localName, String specifier, String originalName, Kind kind, SourceRange range) {

        /** Fully qualified name the local name stands for, e.g. {@code os.environ} for {@code from os import environ}. */
        public String qualifiedName(String separator) {
            return kind == Kind.NAMED ? specifier + separator + originalName : specifier;
        }
    }

    private final Map<String, ImportBinding> bindings;

    private ImportContext(Map<String, ImportBinding> bindings) {
        this.bindings = bindings;
    }

    public Optional<ImportBinding> get(String localName) {
        return Optional.ofNullable(bindings.get(localName));
    }

    public boolean contains(String localName) {
        return bindings.containsKey(localName);
    }

    public Collection<ImportBinding> all() {
        return bindings.values();
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    /**
     * Rewrites the leading name of a dotted (or {@code ::}-separated) expression through the imports, so that
     * {@code getenv} after {@code from os import getenv} reads {@code os.getenv}. Text whose head is not imported is
     * returned unchanged.
     */
    public String rewriteHead(String text, String separator) {
        int cut = text.indexOf(separator);
        String head = cut < 0 ? text : text.substring(0, cut);
        var binding = bindings.get(head);
        if (binding == null) {
            return text;
        }
        String qualified = binding.qualifiedName(separator);
        return cut < 0 ? qualified : qualified + text.substring(cut);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, ImportBinding> bindings = new LinkedHashMap<>();

        public Builder add(ImportBinding binding) {
            bindings.put(binding.localName(), binding);
            return this;
        }

        public ImportContext build() {
            return bindings.isEmpty() ? EMPTY : new ImportContext(Map.copyOf(bindings));
        }
    }
}

package ai.envlens.analyzer.document;

import ai.envlens.analyzer.SourceRange;
import org.jetbrains.annotations.Nullable;

/**
 * One declared name. Bindings live in a per-document arena and refer to earlier bindings by arena id, so chains are
 * walked by index without object cycles.
 *
 * @param envVar variable name of a {@link BindingKind#DIRECT_ENV_ACCESS}
 * @param objectName canonical environment object of an {@link BindingKind#OBJECT_ALIAS}, or of the source of a
 *     {@link BindingKind#DESTRUCTURED} binding that reads straight from it
 * @param key key read by a {@link BindingKind#DESTRUCTURED} binding
 * @param targetId arena id this binding forwards to, or {@code -1}
 * @param targetName imported name this binding forwards to when no local binding was found
 */
public record Binding(
        int id,
        String name,
        BindingKind kind,
        int scopeId,
        SourceRange nameRange,
        SourceRange declarationRange,
        @Nullable String envVar,
        @Nullable String objectName,
        @Nullable String key,
        int targetId,
        @Nullable String targetName,
        @Nullable String defaultValue) {

    public static final int NONE = -1;

    public boolean isEnvRelated() {
        return kind != BindingKind.OPAQUE;
    }

    static Binding direct(int id, String name, int scopeId, SourceRange nameRange, SourceRange decl, String envVar,
                          @Nullable String defaultValue) {
        return new Binding(id, name, BindingKind.DIRECT_ENV_ACCESS, scopeId, nameRange, decl, envVar, null, null,
                NONE, null, defaultValue);
    }

    static Binding objectAlias(int id, String name, int scopeId, SourceRange nameRange, SourceRange decl,
                               String objectName) {
        return new Binding(id, name, BindingKind.OBJECT_ALIAS, scopeId, nameRange, decl, null, objectName, null,
                NONE, null, null);
    }

    static Binding destructured(int id, String name, int scopeId, SourceRange nameRange, SourceRange decl,
                                @Nullable String objectName, String key, int targetId, @Nullable String targetName,
                                @Nullable String defaultValue) {
        return new Binding(id, name, BindingKind.DESTRUCTURED, scopeId, nameRange, decl, null, objectName, key,
                targetId, targetName, defaultValue);
    }

    static Binding reassignment(int id, String name, int scopeId, SourceRange nameRange, SourceRange decl,
                                int targetId, @Nullable String targetName) {
        return new Binding(id, name, BindingKind.REASSIGNMENT, scopeId, nameRange, decl, null, null, null,
                targetId, targetName, null);
    }

    static Binding opaque(int id, String name, int scopeId, SourceRange nameRange, SourceRange decl) {
        return new Binding(id, name, BindingKind.OPAQUE, scopeId, nameRange, decl, null, null, null, NONE, null, null);
    }
}

package ai.envlens.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * One occurrence that reads, or may read, an environment variable.
 *
 * @param token the text of the occurrence (a variable name, a binding name, or a property key)
 * @param canonicalName the resolved variable name if it could be settled from this file alone
 * @param range the occurrence range
 * @param kind how the occurrence reaches its variable
 * @param via the local binding or import name the occurrence goes through, if any
 * @param propertyKey key read off an aliased or imported environment object
 * @param defaultValue literal fallback value written next to a direct read
 * @param bindingId arena id of the binding behind {@code via}, or {@code -1}
 */
public record Reference(
        String token,
        @Nullable String canonicalName,
        SourceRange range,
        SourceKind kind,
        @Nullable String via,
        @Nullable String propertyKey,
        @Nullable String defaultValue,
        int bindingId) {

    public static final int NO_BINDING = -1;
}

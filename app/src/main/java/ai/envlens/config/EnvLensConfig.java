package ai.envlens.config;

import ai.envlens.analyzer.IndexingConfig;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Workspace settings read from {@code .envlens.json}. Every field is optional; missing fields take the defaults
 * below.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EnvLensConfig(
        @Nullable Long debounceMillis,
        @Nullable Long lookupTimeoutMillis,
        @Nullable Long refreshTimeoutMillis,
        @Nullable List<String> envFiles,
        @Nullable Indexing indexing,
        @Nullable Features features,
        @Nullable Masking masking,
        @Nullable InlayHints inlayHints) {

    public static final long DEFAULT_DEBOUNCE_MILLIS = 300;
    public static final long DEFAULT_LOOKUP_TIMEOUT_MILLIS = 5_000;
    public static final long DEFAULT_REFRESH_TIMEOUT_MILLIS = 10_000;

    public EnvLensConfig {
        debounceMillis = debounceMillis == null ? DEFAULT_DEBOUNCE_MILLIS : debounceMillis;
        lookupTimeoutMillis = lookupTimeoutMillis == null ? DEFAULT_LOOKUP_TIMEOUT_MILLIS : lookupTimeoutMillis;
        refreshTimeoutMillis = refreshTimeoutMillis == null ? DEFAULT_REFRESH_TIMEOUT_MILLIS : refreshTimeoutMillis;
        envFiles = envFiles == null ? List.of(".env") : List.copyOf(envFiles);
        indexing = indexing == null ? Indexing.DEFAULTS : indexing;
        features = features == null ? Features.DEFAULTS : features;
        masking = masking == null ? Masking.DEFAULTS : masking;
        inlayHints = inlayHints == null ? InlayHints.DEFAULTS : inlayHints;
    }

    public static EnvLensConfig defaults() {
        return new EnvLensConfig(null, null, null, null, null, null, null, null);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Indexing(
            @Nullable Boolean enabled,
            @Nullable Set<String> excludedDirectories,
            @Nullable Long maxFileBytes,
            @Nullable Integer threads) {

        static final Indexing DEFAULTS = new Indexing(null, null, null, null);

        public Indexing {
            enabled = enabled == null || enabled;
            excludedDirectories = excludedDirectories == null
                    ? IndexingConfig.DEFAULT_EXCLUDES
                    : Set.copyOf(excludedDirectories);
            maxFileBytes = maxFileBytes == null ? IndexingConfig.DEFAULT_MAX_FILE_BYTES : maxFileBytes;
            threads = threads == null || threads < 1 ? Runtime.getRuntime().availableProcessors() : threads;
        }

        public IndexingConfig toIndexingConfig(Path root) {
            return new IndexingConfig(root, excludedDirectories, maxFileBytes, threads);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Features(
            @Nullable Boolean hover,
            @Nullable Boolean definition,
            @Nullable Boolean references,
            @Nullable Boolean completion,
            @Nullable Boolean diagnostics,
            @Nullable Boolean workspaceSymbols,
            @Nullable Boolean inlayHints) {

        static final Features DEFAULTS = new Features(null, null, null, null, null, null, null);

        public Features {
            hover = hover == null || hover;
            definition = definition == null || definition;
            references = references == null || references;
            completion = completion == null || completion;
            diagnostics = diagnostics == null || diagnostics;
            workspaceSymbols = workspaceSymbols == null || workspaceSymbols;
            inlayHints = inlayHints == null || inlayHints;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Masking(@Nullable Boolean enabled, @Nullable String maskChar, @Nullable Integer showPrefix) {

        static final Masking DEFAULTS = new Masking(null, null, null);

        public Masking {
            enabled = enabled != null && enabled;
            maskChar = maskChar == null || maskChar.isEmpty() ? "*" : maskChar;
            showPrefix = showPrefix == null || showPrefix < 0 ? 0 : showPrefix;
        }
    }

    /**
     * Which references get a value hint and how long a hint may grow. {@code maxHintsPerLine} of zero means no
     * limit.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record InlayHints(
            @Nullable Integer maxValueLength,
            @Nullable Integer maxHintsPerLine,
            @Nullable Boolean directReferences,
            @Nullable Boolean bindingDeclarations,
            @Nullable Boolean bindingUsages,
            @Nullable Boolean propertyAccesses) {

        static final InlayHints DEFAULTS = new InlayHints(null, null, null, null, null, null);

        public InlayHints {
            maxValueLength = maxValueLength == null || maxValueLength < 1 ? 30 : maxValueLength;
            maxHintsPerLine = maxHintsPerLine == null || maxHintsPerLine < 0 ? 3 : maxHintsPerLine;
            directReferences = directReferences == null || directReferences;
            bindingDeclarations = bindingDeclarations == null || bindingDeclarations;
            bindingUsages = bindingUsages != null && bindingUsages;
            propertyAccesses = propertyAccesses == null || propertyAccesses;
        }
    }
}

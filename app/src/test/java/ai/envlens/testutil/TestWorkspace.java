package ai.envlens.testutil;

import ai.envlens.analyzer.EnvAnalyzer;
import ai.envlens.analyzer.IndexingConfig;
import ai.envlens.analyzer.LanguageRegistry;
import ai.envlens.analyzer.SourcePosition;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/** A throwaway workspace on disk with an analyzer rooted at it. */
public final class TestWorkspace implements AutoCloseable {
    public static final long TEST_DEBOUNCE_MILLIS = 20;

    private final Path root;
    private final EnvAnalyzer analyzer;

    public TestWorkspace(Path root) {
        this.root = root.toAbsolutePath().normalize();
        this.analyzer = new EnvAnalyzer(LanguageRegistry.withDefaults(), indexingConfig(), TEST_DEBOUNCE_MILLIS);
    }

    public Path root() {
        return root;
    }

    public EnvAnalyzer analyzer() {
        return analyzer;
    }

    public IndexingConfig indexingConfig() {
        return new IndexingConfig(root, IndexingConfig.DEFAULT_EXCLUDES, IndexingConfig.DEFAULT_MAX_FILE_BYTES, 2);
    }

    public IndexingConfig indexingConfig(Set<String> excludes) {
        return new IndexingConfig(root, excludes, IndexingConfig.DEFAULT_MAX_FILE_BYTES, 2);
    }

    /** Writes {@code content} to {@code relativePath}, creating parent directories. */
    public URI write(String relativePath, String content) {
        var file = root.resolve(relativePath);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return file.toUri();
    }

    /** Writes the file and opens it in the analyzer. */
    public URI open(String relativePath, String languageId, String content) {
        var uri = write(relativePath, content);
        analyzer.open(uri, languageId, 1, content);
        return uri;
    }

    public URI uri(String relativePath) {
        return root.resolve(relativePath).toUri();
    }

    public static SourcePosition at(int line, int character) {
        return SourcePosition.of(line, character);
    }

    @Override
    public void close() {
        analyzer.close();
    }
}

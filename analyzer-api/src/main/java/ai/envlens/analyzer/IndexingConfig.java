package ai.envlens.analyzer;

import java.nio.file.Path;
import java.util.Set;

/**
 * Parameters of one workspace scan.
 *
 * @param root workspace root; nothing outside it is read
 * @param excludedDirectories directory names skipped wherever they occur
 * @param maxFileBytes files larger than this are not indexed
 * @param threads number of files analyzed concurrently
 */
public record IndexingConfig(Path root, Set<String> excludedDirectories, long maxFileBytes, int threads) {

    public static final Set<String> DEFAULT_EXCLUDES = Set.of(
            "node_modules", ".git", "target", "build", "dist", "vendor", ".venv", "__pycache__");

    public static final long DEFAULT_MAX_FILE_BYTES = 1024L * 1024L;

    public IndexingConfig {
        excludedDirectories = Set.copyOf(excludedDirectories);
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1");
        }
    }
}

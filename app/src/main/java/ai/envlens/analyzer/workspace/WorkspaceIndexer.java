package ai.envlens.analyzer.workspace;

import ai.envlens.analyzer.IndexingConfig;
import ai.envlens.analyzer.IndexingSummary;
import ai.envlens.analyzer.LanguageRegistry;
import ai.envlens.analyzer.LineIndex;
import ai.envlens.analyzer.document.DocumentAnalyzer;
import ai.envlens.concurrent.CancellationToken;
import ai.envlens.util.ExecutorServiceUtil;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Scans the workspace and fills the {@link WorkspaceIndex}. Files are analyzed in parallel; cancellation is checked
 * before each file, so a cancelled scan stops after the files already in flight.
 */
public final class WorkspaceIndexer {
    private static final Logger logger = LogManager.getLogger(WorkspaceIndexer.class);

    private final LanguageRegistry registry;
    private final DocumentAnalyzer analyzer;
    private final WorkspaceIndex index;
    private final Predicate<URI> skip;

    /**
     * @param skip files the scan leaves alone, e.g. documents open in the editor whose text is newer than the disk
     */
    public WorkspaceIndexer(LanguageRegistry registry, DocumentAnalyzer analyzer, WorkspaceIndex index,
                            Predicate<URI> skip) {
        this.registry = registry;
        this.analyzer = analyzer;
        this.index = index;
        this.skip = skip;
    }

    public IndexingSummary indexWorkspace(IndexingConfig config, CancellationToken token) throws IOException {
        var files = collectFiles(config);
        logger.info("Indexing {} file(s) under {}", files.size(), config.root());
        if (files.isEmpty()) {
            return IndexingSummary.NONE;
        }

        var attempted = new AtomicInteger();
        var indexed = new AtomicInteger();
        var failed = new AtomicInteger();
        var executor = ExecutorServiceUtil.newFixedThreadExecutor(config.threads(), "envlens-index");
        try {
            var futures = files.stream()
                    .map(file -> CompletableFuture.runAsync(() -> {
                        if (token.isCancelled()) {
                            return;
                        }
                        attempted.incrementAndGet();
                        if (indexFile(file, config.maxFileBytes())) {
                            indexed.incrementAndGet();
                        } else {
                            failed.incrementAndGet();
                        }
                    }, executor))
                    .toArray(CompletableFuture[]::new);
            CompletableFuture.allOf(futures).join();
        } finally {
            executor.shutdownNow();
        }
        var summary = new IndexingSummary(attempted.get(), indexed.get(), failed.get(), token.isCancelled());
        logger.info("Indexing finished: {}", summary);
        return summary;
    }

    private List<Path> collectFiles(IndexingConfig config) throws IOException {
        var root = config.root().toAbsolutePath().normalize();
        var files = new ArrayList<Path>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                var name = dir.getFileName();
                if (!dir.equals(root) && name != null && config.excludedDirectories().contains(name.toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()
                        && attrs.size() <= config.maxFileBytes()
                        && registry.forPath(file).isPresent()
                        && !skip.test(file.toUri())) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                logger.warn("Skipping unreadable path {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        return files;
    }

    /** Analyzes one file from disk into the index; false if it could not be read or has no language profile. */
    public boolean indexFile(Path file, long maxFileBytes) {
        var profile = registry.forPath(file);
        if (profile.isEmpty()) {
            return false;
        }
        var uri = file.toUri();
        try {
            if (Files.size(file) > maxFileBytes) {
                logger.debug("Skipping {}: larger than {} bytes", file, maxFileBytes);
                return false;
            }
            // lenient decoding: malformed bytes become replacement characters
            var text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            var table = analyzer.analyze(uri, profile.get(), new LineIndex(text));
            index.put(uri, new WorkspaceIndex.IndexedFile(table.exports(), table.literalOccurrences()));
            return true;
        } catch (IOException e) {
            logger.warn("Failed to index {}: {}", file, e.getMessage());
            return false;
        }
    }

    public void remove(URI uri) {
        index.remove(uri);
    }
}

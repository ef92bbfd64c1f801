package ai.envlens.analyzer;

import ai.envlens.analyzer.document.DocumentAnalyzer;
import ai.envlens.analyzer.document.DocumentManager;
import ai.envlens.analyzer.document.DocumentSnapshot;
import ai.envlens.analyzer.resolution.CrossModuleResolver;
import ai.envlens.analyzer.resolution.ResolutionEngine;
import ai.envlens.analyzer.workspace.ModuleResolver;
import ai.envlens.analyzer.workspace.WorkspaceIndex;
import ai.envlens.analyzer.workspace.WorkspaceIndexer;
import ai.envlens.concurrent.BackgroundTaskManager;
import ai.envlens.concurrent.CancellationToken;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The analysis core behind the language server. Open documents are owned by a {@link DocumentManager}; every other
 * file of the workspace is known only through the {@link WorkspaceIndex}. Open documents always take precedence
 * over what the index read from disk.
 */
public final class EnvAnalyzer implements IEnvAnalyzer, AutoCloseable {
    private static final Logger logger = LogManager.getLogger(EnvAnalyzer.class);

    private static final String FILE_EVENTS = "workspace-files";

    private final LanguageRegistry registry;
    private final IndexingConfig indexing;
    private final DocumentManager documents;
    private final WorkspaceIndex index = new WorkspaceIndex();
    private final ModuleResolver modules;
    private final ResolutionEngine resolution;
    private final WorkspaceIndexer indexer;
    private final BackgroundTaskManager tasks = new BackgroundTaskManager();

    public EnvAnalyzer(LanguageRegistry registry, IndexingConfig indexing, long debounceMillis) {
        this.registry = registry;
        this.indexing = indexing;
        var analyzer = new DocumentAnalyzer();
        this.documents = new DocumentManager(registry, analyzer, debounceMillis);
        this.modules = new ModuleResolver(indexing.root());
        this.resolution = new ResolutionEngine(new CrossModuleResolver(modules, registry, this::exportsOf));
        this.indexer = new WorkspaceIndexer(registry, analyzer, index, documents::isOpen);
        documents.addListener(this::updateIndex);
    }

    public Path root() {
        return modules.root();
    }

    public LanguageRegistry registry() {
        return registry;
    }

    /** Called with every published snapshot, after the index has been updated from it. */
    public void addSnapshotListener(Consumer<DocumentSnapshot> listener) {
        documents.addListener(listener);
    }

    private void updateIndex(DocumentSnapshot snapshot) {
        if (snapshot.isSupported()) {
            var symbols = snapshot.symbols();
            index.put(snapshot.uri(), new WorkspaceIndex.IndexedFile(symbols.exports(), symbols.literalOccurrences()));
        }
    }

    @Override
    public void open(URI uri, String languageId, int version, String text) {
        documents.open(uri, languageId, version, text);
    }

    @Override
    public CompletableFuture<Boolean> change(URI uri, int version, String text) {
        return documents.change(uri, version, text);
    }

    /** Closes the document; the index falls back to the file's content on disk. */
    @Override
    public CompletableFuture<Void> close(URI uri) {
        documents.close(uri);
        return onFileEvent("close " + uri, () -> {
            if (documents.isOpen(uri)) {
                return;
            }
            var path = toPath(uri);
            if (path.isPresent() && Files.isRegularFile(path.get())) {
                indexer.indexFile(path.get(), indexing.maxFileBytes());
            } else {
                index.remove(uri);
            }
        });
    }

    public Optional<DocumentSnapshot> snapshot(URI uri) {
        return documents.get(uri);
    }

    @Override
    public Optional<Reference> referenceAt(URI uri, SourcePosition position) {
        return documents.referenceAt(uri, position);
    }

    @Override
    public Optional<String> completionContextAt(URI uri, SourcePosition position) {
        return documents.completionContextAt(uri, position);
    }

    @Override
    public Optional<Resolution> resolve(URI uri, SourcePosition position) {
        var snapshot = documents.get(uri);
        if (snapshot.isEmpty()) {
            return Optional.empty();
        }
        return snapshot.get().symbols().referenceAt(position)
                .flatMap(reference -> resolution.resolve(snapshot.get(), reference));
    }

    /** Every reference of an open document that resolves to a variable, in document order. */
    public List<ResolvedReference> resolvedReferences(URI uri) {
        var snapshot = documents.get(uri);
        if (snapshot.isEmpty()) {
            return List.of();
        }
        return resolvedReferences(snapshot.get());
    }

    public List<ResolvedReference> resolvedReferences(DocumentSnapshot snapshot) {
        var result = new ArrayList<ResolvedReference>();
        for (var reference : snapshot.symbols().references()) {
            resolution.resolve(snapshot, reference).ifPresent(r -> result.add(new ResolvedReference(reference, r)));
        }
        return result;
    }

    @Override
    public Optional<FileExports> exportsOf(URI uri) {
        var open = documents.get(uri);
        if (open.isPresent() && open.get().isSupported()) {
            return Optional.of(open.get().symbols().exports());
        }
        return index.exportsOf(uri);
    }

    @Override
    public Optional<URI> resolveModuleSpecifier(String specifier, URI importingUri, String languageId) {
        return registry.resolve(languageId, importingUri)
                .flatMap(profile -> modules.resolve(specifier, importingUri, profile));
    }

    /**
     * Where {@code name} is read: every resolved reference of the open documents, and the literal occurrences the
     * index recorded for all other files.
     */
    public List<Occurrence> referencesTo(String name) {
        var result = new ArrayList<Occurrence>();
        for (var snapshot : documents.snapshots()) {
            for (var resolved : resolvedReferences(snapshot)) {
                if (resolved.resolution().canonicalName().equals(name)) {
                    result.add(new Occurrence(snapshot.uri(), resolved.reference().range()));
                }
            }
        }
        for (var entry : index.entries()) {
            if (documents.isOpen(entry.getKey())) {
                continue;
            }
            for (var range : entry.getValue().occurrences().getOrDefault(name, List.of())) {
                result.add(new Occurrence(entry.getKey(), range));
            }
        }
        return result;
    }

    /** Every variable name read anywhere in the workspace, sorted. */
    public SortedSet<String> allVariableNames() {
        var names = new TreeSet<String>();
        for (var snapshot : documents.snapshots()) {
            resolvedReferences(snapshot).forEach(r -> names.add(r.resolution().canonicalName()));
        }
        for (var entry : index.entries()) {
            names.addAll(entry.getValue().occurrences().keySet());
        }
        return names;
    }

    @Override
    public IndexingSummary indexWorkspace(IndexingConfig config) throws IOException {
        var token = tasks.rootToken().child();
        try {
            return indexer.indexWorkspace(config, token);
        } finally {
            token.detach();
        }
    }

    /** Runs {@code work} in the background, after every earlier request passed to this method. */
    public <T> BackgroundTaskManager.Handle<T> runInBackground(String name, Function<CancellationToken, T> work) {
        return tasks.spawnInLane(name, name, work);
    }

    /** Indexes the workspace on a background thread; {@link #shutdown(Duration)} cancels it. */
    public BackgroundTaskManager.Handle<IndexingSummary> startBackgroundIndexing() {
        return tasks.spawn("workspace-index", this::indexWith);
    }

    private IndexingSummary indexWith(CancellationToken token) {
        try {
            return indexer.indexWorkspace(indexing, token);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * File events are applied in the background, one at a time in arrival order, so a create followed by a delete
     * never leaves the deleted file in the index. The future completes once the index reflects the event.
     */
    public CompletableFuture<Void> onWorkspaceFileCreated(URI uri) {
        modules.invalidate();
        return reindex("created " + uri, uri);
    }

    public CompletableFuture<Void> onWorkspaceFileChanged(URI uri) {
        return reindex("changed " + uri, uri);
    }

    public CompletableFuture<Void> onWorkspaceFileDeleted(URI uri) {
        modules.invalidate();
        return onFileEvent("deleted " + uri, () -> {
            if (!documents.isOpen(uri)) {
                index.remove(uri);
            }
        });
    }

    private CompletableFuture<Void> reindex(String name, URI uri) {
        return onFileEvent(name, () -> {
            if (documents.isOpen(uri)) {
                return;
            }
            toPath(uri).filter(Files::isRegularFile)
                    .ifPresent(path -> indexer.indexFile(path, indexing.maxFileBytes()));
        });
    }

    private CompletableFuture<Void> onFileEvent(String name, Runnable work) {
        return tasks.<Void>spawnInLane(FILE_EVENTS, name, token -> {
            work.run();
            return null;
        }).future();
    }

    private static Optional<Path> toPath(URI uri) {
        if (!"file".equalsIgnoreCase(uri.getScheme())) {
            return Optional.empty();
        }
        try {
            return Optional.of(Path.of(uri));
        } catch (IllegalArgumentException e) {
            logger.debug("Not a local file URI: {}", uri);
            return Optional.empty();
        }
    }

    public void shutdown(Duration timeout) {
        tasks.shutdown(timeout);
        documents.close();
    }

    @Override
    public void close() {
        shutdown(Duration.ofSeconds(5));
    }
}

package ai.envlens.analyzer.document;

import ai.envlens.analyzer.LanguageRegistry;
import ai.envlens.analyzer.LineIndex;
import ai.envlens.analyzer.Reference;
import ai.envlens.analyzer.SourcePosition;
import ai.envlens.util.ExecutorServiceUtil;
import java.net.URI;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Owns the open documents. Readers always see a complete, immutable {@link DocumentSnapshot}; edits are debounced
 * and every edit bumps a per-document generation, so an analysis that finishes after a newer edit is dropped
 * instead of published.
 */
public final class DocumentManager implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(DocumentManager.class);

    // identifier immediately before "." or "[" (optionally followed by a quote) and a partial name
    private static final Pattern ALIAS_TRIGGER = Pattern.compile("([A-Za-z_$][\\w$]*)\\s*(?:\\.|\\[\\s*[\"'`]?)[\\w$]*$");

    private final LanguageRegistry registry;
    private final DocumentAnalyzer analyzer;
    private final ScheduledExecutorService scheduler;
    private final long debounceMillis;
    private final Map<URI, Entry> entries = new ConcurrentHashMap<>();
    private final List<Consumer<DocumentSnapshot>> listeners = new CopyOnWriteArrayList<>();

    private static final class Entry {
        final AtomicLong generation = new AtomicLong();
        volatile DocumentSnapshot snapshot;
        @Nullable ScheduledFuture<?> pending;
        @Nullable CompletableFuture<Boolean> pendingResult;

        Entry(DocumentSnapshot snapshot) {
            this.snapshot = snapshot;
        }
    }

    public DocumentManager(LanguageRegistry registry, DocumentAnalyzer analyzer, long debounceMillis) {
        this.registry = registry;
        this.analyzer = analyzer;
        this.debounceMillis = debounceMillis;
        this.scheduler = ExecutorServiceUtil.newScheduledExecutor(1, "envlens-analysis");
    }

    /** Called with every published snapshot, on the thread that produced it. */
    public void addListener(Consumer<DocumentSnapshot> listener) {
        listeners.add(listener);
    }

    /** Analyzes synchronously; re-opening an open document replaces it. */
    public DocumentSnapshot open(URI uri, String languageId, int version, String text) {
        var snapshot = analyze(uri, languageId, version, text);
        var previous = entries.put(uri, new Entry(snapshot));
        if (previous != null) {
            supersede(previous);
        }
        publish(snapshot);
        return snapshot;
    }

    /**
     * Schedules analysis of a new full text after the debounce period. The future completes with {@code true} once
     * the version is published, or {@code false} if a later change, a close, or a failure prevented that.
     */
    public CompletableFuture<Boolean> change(URI uri, int version, String text) {
        var entry = entries.get(uri);
        if (entry == null) {
            logger.debug("Change for unopened document {}; opening it", uri);
            open(uri, "", version, text);
            return CompletableFuture.completedFuture(true);
        }
        var result = new CompletableFuture<Boolean>();
        synchronized (entry) {
            long generation = entry.generation.incrementAndGet();
            supersede(entry);
            String languageId = entry.snapshot.languageId();
            entry.pendingResult = result;
            entry.pending = scheduler.schedule(
                    () -> runAnalysis(uri, entry, generation, languageId, version, text, result),
                    debounceMillis,
                    TimeUnit.MILLISECONDS);
        }
        return result;
    }

    private void runAnalysis(URI uri, Entry entry, long generation, String languageId, int version, String text,
                             CompletableFuture<Boolean> result) {
        if (entry.generation.get() != generation) {
            result.complete(false);
            return;
        }
        try {
            var snapshot = analyze(uri, languageId, version, text);
            synchronized (entry) {
                if (entry.generation.get() != generation || entries.get(uri) != entry) {
                    logger.trace("Discarding superseded analysis of {} v{}", uri, version);
                    result.complete(false);
                    return;
                }
                entry.snapshot = snapshot;
                entry.pending = null;
                entry.pendingResult = null;
            }
            publish(snapshot);
            result.complete(true);
        } catch (RuntimeException e) {
            logger.error("Analysis of {} v{} failed", uri, version, e);
            result.complete(false);
        }
    }

    /** Cancels the pending analysis of {@code entry}; caller holds the entry lock or owns the entry exclusively. */
    private static void supersede(Entry entry) {
        if (entry.pending != null) {
            entry.pending.cancel(false);
            entry.pending = null;
        }
        if (entry.pendingResult != null) {
            entry.pendingResult.complete(false);
            entry.pendingResult = null;
        }
    }

    public void close(URI uri) {
        var entry = entries.remove(uri);
        if (entry != null) {
            synchronized (entry) {
                entry.generation.incrementAndGet();
                supersede(entry);
            }
        }
    }

    public boolean isOpen(URI uri) {
        return entries.containsKey(uri);
    }

    public Optional<DocumentSnapshot> get(URI uri) {
        var entry = entries.get(uri);
        return entry == null ? Optional.empty() : Optional.of(entry.snapshot);
    }

    public Collection<DocumentSnapshot> snapshots() {
        return entries.values().stream().map(e -> e.snapshot).toList();
    }

    public Optional<Reference> referenceAt(URI uri, SourcePosition position) {
        return get(uri).flatMap(s -> s.symbols().referenceAt(position));
    }

    /**
     * The token driving variable-name completion at {@code position}: a language trigger such as
     * {@code process.env.} or {@code os.getenv("}, or an in-scope alias of the environment object.
     */
    public Optional<String> completionContextAt(URI uri, SourcePosition position) {
        var snapshot = get(uri);
        if (snapshot.isEmpty() || snapshot.get().profile() == null) {
            return Optional.empty();
        }
        var doc = snapshot.get();
        var prefix = doc.lineIndex().linePrefix(position);
        for (var trigger : doc.profile().completionTriggers()) {
            if (trigger.matches(prefix)) {
                return Optional.of(trigger.baseToken());
            }
        }
        var matcher = ALIAS_TRIGGER.matcher(prefix);
        if (matcher.find()) {
            var name = matcher.group(1);
            var binding = doc.symbols().lookup(name, position);
            if (binding.isPresent() && binding.get().kind() == BindingKind.OBJECT_ALIAS) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }

    private DocumentSnapshot analyze(URI uri, String languageId, int version, String text) {
        var lineIndex = new LineIndex(text);
        var profile = registry.resolve(languageId, uri);
        if (profile.isEmpty()) {
            logger.debug("No language profile for {} ({}); analysis is empty", uri, languageId);
            return new DocumentSnapshot(uri, languageId, version, lineIndex, null, SymbolTable.EMPTY);
        }
        var symbols = analyzer.analyze(uri, profile.get(), lineIndex);
        return new DocumentSnapshot(uri, languageId, version, lineIndex, profile.get(), symbols);
    }

    private void publish(DocumentSnapshot snapshot) {
        for (var listener : listeners) {
            try {
                listener.accept(snapshot);
            } catch (RuntimeException e) {
                logger.warn("Snapshot listener failed for {}", snapshot.uri(), e);
            }
        }
    }

    @Override
    public void close() {
        for (var uri : List.copyOf(entries.keySet())) {
            close(uri);
        }
        scheduler.shutdownNow();
    }
}

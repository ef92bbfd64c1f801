package ai.envlens.analyzer;

import java.io.IOException;
import java.net.URI;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point of the analysis core. Every query answers "no result" with an empty {@link Optional} rather than an
 * exception.
 */
public interface IEnvAnalyzer {

    /** Hop limit for alias, reassignment, destructuring and import chains. */
    int MAX_CHAIN_DEPTH = 10;

    void open(URI uri, String languageId, int version, String text);

    /**
     * Replaces the text of an open document. Analysis runs after the debounce period; the returned future completes
     * with {@code false} if a newer change superseded this version before its analysis was published.
     */
    CompletableFuture<Boolean> change(URI uri, int version, String text);

    /** Closes the document; the returned future completes once the file's content on disk has been re-indexed. */
    CompletableFuture<Void> close(URI uri);

    Optional<Reference> referenceAt(URI uri, SourcePosition position);

    /** The base token driving a completion at {@code position}, e.g. {@code "env"} after {@code process.env.}. */
    Optional<String> completionContextAt(URI uri, SourcePosition position);

    Optional<Resolution> resolve(URI uri, SourcePosition position);

    Optional<FileExports> exportsOf(URI uri);

    Optional<URI> resolveModuleSpecifier(String specifier, URI importingUri, String languageId);

    IndexingSummary indexWorkspace(IndexingConfig config) throws IOException;
}

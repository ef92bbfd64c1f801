package ai.envlens.analyzer.workspace;

import ai.envlens.analyzer.FileExports;
import ai.envlens.analyzer.SourceRange;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;

/**
 * Per-file export and occurrence index of the workspace. The whole index is an immutable map swapped on every
 * update, so readers iterating {@link #entries()} see one consistent state while indexing carries on.
 */
public final class WorkspaceIndex {

    /**
     * @param occurrences resolved variable names with the ranges where the file writes them out
     */
    public record IndexedFile(FileExports exports, Map<String, List<SourceRange>> occurrences) {
        public IndexedFile {
            occurrences = Map.copyOf(occurrences);
        }
    }

    private final AtomicReference<PMap<URI, IndexedFile>> files = new AtomicReference<>(HashTreePMap.empty());

    public void put(URI uri, IndexedFile file) {
        files.updateAndGet(m -> m.plus(uri, file));
    }

    public void remove(URI uri) {
        files.updateAndGet(m -> m.minus(uri));
    }

    public Optional<IndexedFile> get(URI uri) {
        return Optional.ofNullable(files.get().get(uri));
    }

    public Optional<FileExports> exportsOf(URI uri) {
        return get(uri).map(IndexedFile::exports);
    }

    public Set<Map.Entry<URI, IndexedFile>> entries() {
        return files.get().entrySet();
    }

    public int size() {
        return files.get().size();
    }
}

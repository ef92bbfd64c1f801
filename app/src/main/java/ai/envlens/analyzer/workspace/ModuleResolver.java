package ai.envlens.analyzer.workspace;

import ai.envlens.analyzer.LanguageProfile;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Maps an import specifier to a workspace file: the specifier verbatim, then with each of the language's extensions,
 * then as a directory module ({@code index.ts}, {@code __init__.py}). Only files inside the workspace root are ever
 * returned. Results, including misses, are cached until {@link #invalidate()}.
 */
public final class ModuleResolver {
    private static final Logger logger = LogManager.getLogger(ModuleResolver.class);

    private final Path root;
    private final Map<CacheKey, Optional<URI>> cache = new ConcurrentHashMap<>();

    private record CacheKey(Path directory, String specifier, String languageId) {}

    public ModuleResolver(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    public Optional<URI> resolve(String specifier, URI importingUri, LanguageProfile profile) {
        if (specifier.isBlank() || !"file".equalsIgnoreCase(importingUri.getScheme())) {
            return Optional.empty();
        }
        var directory = Path.of(importingUri).toAbsolutePath().normalize().getParent();
        if (directory == null) {
            return Optional.empty();
        }
        return cache.computeIfAbsent(new CacheKey(directory, specifier, profile.id()),
                key -> lookup(specifier, directory, profile));
    }

    private Optional<URI> lookup(String specifier, Path directory, LanguageProfile profile) {
        for (var base : profile.moduleBases(specifier, directory, root)) {
            for (var candidate : candidates(base, profile)) {
                if (candidate.startsWith(root) && Files.isRegularFile(candidate)) {
                    logger.trace("Resolved {} from {} to {}", specifier, directory, candidate);
                    return Optional.of(candidate.toUri());
                }
            }
        }
        logger.trace("Could not resolve {} from {}", specifier, directory);
        return Optional.empty();
    }

    static List<Path> candidates(Path base, LanguageProfile profile) {
        var candidates = new ArrayList<Path>();
        candidates.add(base);
        var fileName = base.getFileName();
        if (fileName == null) {
            return candidates;
        }
        for (var ext : profile.moduleExtensions()) {
            candidates.add(base.resolveSibling(fileName + "." + ext));
        }
        for (var name : profile.directoryModuleNames()) {
            for (var ext : profile.moduleExtensions()) {
                candidates.add(base.resolve(name + "." + ext));
            }
        }
        return candidates;
    }

    /** Drops every cached result; called when files are created or deleted. */
    public void invalidate() {
        cache.clear();
    }
}

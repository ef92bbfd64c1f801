package ai.envlens.analyzer.resolution;

import ai.envlens.analyzer.ExportResolution;
import ai.envlens.analyzer.FileExports;
import ai.envlens.analyzer.ImportContext;
import ai.envlens.analyzer.LanguageProfile;
import ai.envlens.analyzer.LanguageRegistry;
import ai.envlens.analyzer.ModuleExport;
import ai.envlens.analyzer.workspace.ModuleResolver;
import java.net.URI;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Follows an imported name into the exporting file, through re-exports and {@code export *} forwarding, until it
 * reaches a variable. Shares the caller's {@link DepthBudget}; a module visited twice for the same name ends the walk.
 * Files missing from the export lookup resolve to nothing rather than being read on demand.
 */
public final class CrossModuleResolver {
    private static final Logger logger = LogManager.getLogger(CrossModuleResolver.class);

    private final ModuleResolver modules;
    private final LanguageRegistry registry;
    private final Function<URI, Optional<FileExports>> exports;

    public CrossModuleResolver(ModuleResolver modules, LanguageRegistry registry,
                               Function<URI, Optional<FileExports>> exports) {
        this.modules = modules;
        this.registry = registry;
        this.exports = exports;
    }

    /** The variable reached by reading {@code key} (or the value itself when null) off an imported local name. */
    public Optional<String> resolveImported(URI importer, LanguageProfile profile, ImportContext imports,
                                            String localName, @Nullable String key, DepthBudget budget) {
        var binding = imports.get(localName);
        if (binding.isEmpty() || !budget.tryHop()) {
            return Optional.empty();
        }
        var imported = binding.get();
        var target = modules.resolve(imported.specifier(), importer, profile);
        if (target.isEmpty()) {
            logger.debug("Import {} of {} does not resolve to a workspace file", imported.specifier(), importer);
            return Optional.empty();
        }
        var visited = new HashSet<String>();
        return switch (imported.kind()) {
            case NAMED -> follow(target.get(), imported.originalName(), key, budget, visited);
            case DEFAULT -> follow(target.get(), "default", key, budget, visited)
                    .or(() -> key == null ? Optional.empty() : follow(target.get(), key, null, budget, visited));
            case NAMESPACE -> key == null ? Optional.empty() : follow(target.get(), key, null, budget, visited);
            case MODULE -> Optional.empty();
        };
    }

    private Optional<String> follow(URI start, String startName, @Nullable String startKey, DepthBudget budget,
                                    Set<String> visited) {
        URI uri = start;
        String name = startName;
        String key = startKey;
        while (true) {
            if (!visited.add(uri + "#" + name + "#" + key)) {
                logger.debug("Export cycle through {}#{}", uri, name);
                return Optional.empty();
            }
            var fileExports = exports.apply(uri);
            if (fileExports.isEmpty()) {
                return Optional.empty();
            }
            ModuleExport export = name.equals("default")
                    ? fileExports.get().defaultExport()
                    : fileExports.get().namedExports().get(name);
            if (export == null) {
                return name.equals("default")
                        ? Optional.empty()
                        : throughWildcards(uri, fileExports.get(), name, key, budget, visited);
            }
            var resolution = export.resolution();
            if (resolution instanceof ExportResolution.EnvVar v) {
                return key == null && budget.trySpend(v.hops()) ? Optional.of(v.name()) : Optional.empty();
            }
            if (resolution instanceof ExportResolution.EnvObject o) {
                return key != null && budget.trySpend(o.hops()) ? Optional.of(key) : Optional.empty();
            }
            if (resolution instanceof ExportResolution.ReExport r) {
                if ((key != null && r.propertyKey() != null) || !budget.trySpend(r.hops()) || !budget.tryHop()) {
                    return Optional.empty();
                }
                var next = resolveFrom(uri, r.specifier());
                if (next.isEmpty()) {
                    return Optional.empty();
                }
                key = r.propertyKey() != null ? r.propertyKey() : key;
                name = r.originalName();
                uri = next.get();
                continue;
            }
            return Optional.empty();
        }
    }

    private Optional<String> throughWildcards(URI uri, FileExports fileExports, String name, @Nullable String key,
                                              DepthBudget budget, Set<String> visited) {
        for (var specifier : fileExports.wildcardReexports()) {
            if (!budget.tryHop()) {
                return Optional.empty();
            }
            var next = resolveFrom(uri, specifier);
            if (next.isPresent()) {
                var found = follow(next.get(), name, key, budget, visited);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<URI> resolveFrom(URI uri, String specifier) {
        return registry.forUri(uri).flatMap(profile -> modules.resolve(specifier, uri, profile));
    }
}

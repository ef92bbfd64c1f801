package ai.envlens.analyzer;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** Export index entry for one file. */
public record FileExports(
        Map<String, ModuleExport> namedExports,
        @Nullable ModuleExport defaultExport,
        List<String> wildcardReexports) {

    public static final FileExports EMPTY = new FileExports(Map.of(), null, List.of());

    public FileExports {
        namedExports = Map.copyOf(namedExports);
        wildcardReexports = List.copyOf(wildcardReexports);
    }

    public boolean isEmpty() {
        return namedExports.isEmpty() && defaultExport == null && wildcardReexports.isEmpty();
    }

    public Optional<ModuleExport> export(String name) {
        return Optional.ofNullable(namedExports.get(name));
    }
}

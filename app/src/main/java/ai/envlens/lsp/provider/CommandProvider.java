package ai.envlens.lsp.provider;

import ai.envlens.env.FileContext;
import ai.envlens.lsp.EnvLensSession;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.jetbrains.annotations.Nullable;

/** Workspace commands. Results are plain maps and lists so they serialize as JSON objects. */
public final class CommandProvider {
    public static final String LIST_ENV_VARIABLES = "envlens.listEnvVariables";
    public static final String GENERATE_ENV_EXAMPLE = "envlens.generateEnvExample";

    static final String EMPTY_EXAMPLE = "# No environment variables found in workspace\n";

    /**
     * Every variable with a value as seen from {@code filePath}, or from the workspace root when no path is given.
     * Values are masked the same way hovers mask them.
     */
    public Map<String, Object> listEnvVariables(EnvLensSession session, @Nullable String filePath) {
        var uri = filePath == null ? null : session.root().resolve(Path.of(filePath)).toUri();
        var variables = session.values().lookupAll(new FileContext(uri, session.root())).stream()
                .map(v -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("name", v.name());
                    entry.put("value", session.masker().display(v));
                    entry.put("source", v.source());
                    return entry;
                })
                .toList();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("variables", variables);
        result.put("count", variables.size());
        return result;
    }

    /** A {@code .env.example} body naming every variable that is defined or read, sorted, with empty values. */
    public Map<String, Object> generateEnvExample(EnvLensSession session) {
        var names = new TreeSet<String>();
        session.values().lookupAll(new FileContext(null, session.root())).forEach(v -> names.add(v.name()));
        names.addAll(session.analyzer().allVariableNames());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("content", names.isEmpty()
                ? EMPTY_EXAMPLE
                : names.stream().map(name -> name + "=").collect(Collectors.joining("\n", "", "\n")));
        result.put("count", names.size());
        return result;
    }

    public static List<String> commands() {
        return List.of(LIST_ENV_VARIABLES, GENERATE_ENV_EXAMPLE);
    }
}

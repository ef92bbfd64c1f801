package ai.envlens.analyzer.lang;

import ai.envlens.analyzer.CompletionTrigger;
import ai.envlens.analyzer.TreeSitterProfile;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterPython;

public class PythonProfile extends TreeSitterProfile {

    private static final List<CompletionTrigger> TRIGGERS = List.of(
            CompletionTrigger.of("os\\.environ\\[\\s*[\"'][\\w]*$", "environ"),
            CompletionTrigger.of("os\\.environ\\.get\\(\\s*[\"'][\\w]*$", "get"),
            CompletionTrigger.of("os\\.getenv\\(\\s*[\"'][\\w]*$", "getenv"));

    @Override
    public String id() {
        return "python";
    }

    @Override
    public Set<String> languageIds() {
        return Set.of("python");
    }

    @Override
    public List<String> extensions() {
        return List.of("py", "pyi");
    }

    @Override
    protected TSLanguage createTSLanguage() {
        return new TreeSitterPython();
    }

    @Override
    public Set<String> scopeNodeTypes() {
        return Set.of(
                "module", "function_definition", "class_definition", "lambda", "list_comprehension",
                "dictionary_comprehension", "set_comprehension", "generator_expression");
    }

    @Override
    protected Set<String> envObjects() {
        return Set.of("os.environ", "os.environb");
    }

    @Override
    protected Set<String> envAccessors() {
        return Set.of("os.getenv", "os.getenvb");
    }

    @Override
    public Set<String> objectAccessorMethods() {
        return Set.of("get", "setdefault", "pop");
    }

    @Override
    public boolean isEnvModule(String qualifiedName) {
        return qualifiedName.equals("os") || super.isEnvModule(qualifiedName);
    }

    @Override
    public List<CompletionTrigger> completionTriggers() {
        return TRIGGERS;
    }

    /**
     * {@code pkg.mod} is looked up beside the importer and at the workspace root; {@code .mod} and {@code ..mod}
     * climb from the importer's package.
     */
    @Override
    public List<Path> moduleBases(String specifier, Path importerDirectory, Path workspaceRoot) {
        int dots = 0;
        while (dots < specifier.length() && specifier.charAt(dots) == '.') {
            dots++;
        }
        String rest = specifier.substring(dots).replace('.', '/');
        if (dots == 0) {
            if (rest.isEmpty()) {
                return List.of();
            }
            var bases = new ArrayList<Path>();
            bases.add(importerDirectory.resolve(rest).normalize());
            bases.add(workspaceRoot.resolve(rest).normalize());
            return bases;
        }
        var base = importerDirectory;
        for (int i = 1; i < dots && base != null; i++) {
            base = base.getParent();
        }
        if (base == null) {
            return List.of();
        }
        return List.of(rest.isEmpty() ? base.normalize() : base.resolve(rest).normalize());
    }

    @Override
    public List<String> directoryModuleNames() {
        return List.of("__init__");
    }
}

package ai.envlens.analyzer.lang;

import ai.envlens.analyzer.CompletionTrigger;
import ai.envlens.analyzer.TreeSitterProfile;
import java.util.List;
import java.util.Set;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterJavascript;

public class JavascriptProfile extends TreeSitterProfile {

    static final Set<String> SCOPES = Set.of(
            "program", "function_declaration", "function_expression", "function", "generator_function_declaration",
            "generator_function", "arrow_function", "method_definition", "class_body", "statement_block",
            "for_statement", "for_in_statement", "catch_clause");

    static final Set<String> ENV_OBJECTS = Set.of(
            "process.env", "node:process.env", "import.meta.env", "Deno.env", "Bun.env");

    static final List<CompletionTrigger> TRIGGERS = List.of(
            CompletionTrigger.of("process\\.env\\.[\\w$]*$", "env"),
            CompletionTrigger.of("process\\.env\\[\\s*[\"'`][\\w$]*$", "env"),
            CompletionTrigger.of("import\\.meta\\.env\\.[\\w$]*$", "env"),
            CompletionTrigger.of("import\\.meta\\.env\\[\\s*[\"'`][\\w$]*$", "env"),
            CompletionTrigger.of("(?:Bun|Deno)\\.env\\.[\\w$]*$", "env"),
            CompletionTrigger.of("Deno\\.env\\.get\\(\\s*[\"'`][\\w$]*$", "get"));

    @Override
    public String id() {
        return "javascript";
    }

    @Override
    public Set<String> languageIds() {
        return Set.of("javascript", "javascriptreact");
    }

    @Override
    public List<String> extensions() {
        return List.of("js", "mjs", "cjs", "jsx");
    }

    @Override
    protected TSLanguage createTSLanguage() {
        return new TreeSitterJavascript();
    }

    @Override
    public Set<String> scopeNodeTypes() {
        return SCOPES;
    }

    @Override
    public Set<String> identifierNodeTypes() {
        return Set.of("identifier", "shorthand_property_identifier");
    }

    @Override
    protected Set<String> envObjects() {
        return ENV_OBJECTS;
    }

    @Override
    protected Set<String> envAccessors() {
        return Set.of("Deno.env.get");
    }

    @Override
    public boolean isEnvModule(String qualifiedName) {
        return qualifiedName.equals("process") || qualifiedName.equals("node:process") || super.isEnvModule(qualifiedName);
    }

    @Override
    public List<CompletionTrigger> completionTriggers() {
        return TRIGGERS;
    }

    /** TypeScript and JavaScript import each other freely. */
    @Override
    public List<String> moduleExtensions() {
        return List.of("ts", "tsx", "mts", "cts", "js", "jsx", "mjs", "cjs");
    }

    @Override
    public List<String> directoryModuleNames() {
        return List.of("index");
    }
}

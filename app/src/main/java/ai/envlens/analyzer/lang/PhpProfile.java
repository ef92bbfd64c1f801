package ai.envlens.analyzer.lang;

import ai.envlens.analyzer.CompletionTrigger;
import ai.envlens.analyzer.TreeSitterProfile;
import java.util.List;
import java.util.Set;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterPhp;

public class PhpProfile extends TreeSitterProfile {

    @Override
    public String id() {
        return "php";
    }

    @Override
    public Set<String> languageIds() {
        return Set.of("php");
    }

    @Override
    public List<String> extensions() {
        return List.of("php");
    }

    @Override
    protected TSLanguage createTSLanguage() {
        return new TreeSitterPhp();
    }

    @Override
    public Set<String> scopeNodeTypes() {
        return Set.of(
                "program", "function_definition", "method_declaration", "anonymous_function",
                "anonymous_function_creation_expression", "arrow_function", "class_declaration");
    }

    @Override
    public Set<String> identifierNodeTypes() {
        return Set.of("variable_name");
    }

    @Override
    protected Set<String> envObjects() {
        return Set.of("$_ENV", "$_SERVER", "getenv()");
    }

    @Override
    protected Set<String> envAccessors() {
        return Set.of("getenv", "env");
    }

    @Override
    protected boolean isInterpolated(String prefix, char quote, String content) {
        return quote == '"' && content.contains("$");
    }

    @Override
    public List<CompletionTrigger> completionTriggers() {
        return List.of(
                CompletionTrigger.of("\\$_(?:ENV|SERVER)\\[\\s*[\"'][\\w]*$", "_ENV"),
                CompletionTrigger.of("\\b(?:getenv|env)\\(\\s*[\"'][\\w]*$", "getenv"));
    }
}

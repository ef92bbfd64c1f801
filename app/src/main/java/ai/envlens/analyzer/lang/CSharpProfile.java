package ai.envlens.analyzer.lang;

import ai.envlens.analyzer.CompletionTrigger;
import ai.envlens.analyzer.TreeSitterProfile;
import java.util.List;
import java.util.Set;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterCSharp;

public class CSharpProfile extends TreeSitterProfile {

    @Override
    public String id() {
        return "csharp";
    }

    @Override
    public Set<String> languageIds() {
        return Set.of("csharp");
    }

    @Override
    public List<String> extensions() {
        return List.of("cs");
    }

    @Override
    protected TSLanguage createTSLanguage() {
        return new TreeSitterCSharp();
    }

    @Override
    public Set<String> scopeNodeTypes() {
        return Set.of(
                "compilation_unit", "class_declaration", "method_declaration", "constructor_declaration", "block",
                "lambda_expression", "local_function_statement");
    }

    @Override
    public boolean isDiscard(String name) {
        return name.equals("_");
    }

    @Override
    protected Set<String> envAccessors() {
        return Set.of("Environment.GetEnvironmentVariable", "System.Environment.GetEnvironmentVariable");
    }

    @Override
    protected boolean isInterpolated(String prefix, char quote, String content) {
        return prefix.contains("$");
    }

    @Override
    public List<CompletionTrigger> completionTriggers() {
        return List.of(CompletionTrigger.of("Environment\\.GetEnvironmentVariable\\(\\s*\"[\\w]*$", "Environment"));
    }
}

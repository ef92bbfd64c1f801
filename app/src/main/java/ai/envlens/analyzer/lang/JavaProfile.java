package ai.envlens.analyzer.lang;

import ai.envlens.analyzer.CompletionTrigger;
import ai.envlens.analyzer.TreeSitterProfile;
import java.util.List;
import java.util.Set;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterJava;

public class JavaProfile extends TreeSitterProfile {

    @Override
    public String id() {
        return "java";
    }

    @Override
    public Set<String> languageIds() {
        return Set.of("java");
    }

    @Override
    public List<String> extensions() {
        return List.of("java");
    }

    @Override
    protected TSLanguage createTSLanguage() {
        return new TreeSitterJava();
    }

    @Override
    public Set<String> scopeNodeTypes() {
        return Set.of(
                "program", "class_body", "method_declaration", "constructor_declaration", "block",
                "lambda_expression", "for_statement", "enhanced_for_statement", "catch_clause");
    }

    @Override
    protected Set<String> envObjects() {
        return Set.of("System.getenv()", "java.lang.System.getenv()");
    }

    @Override
    protected Set<String> envAccessors() {
        return Set.of("System.getenv", "java.lang.System.getenv");
    }

    @Override
    public Set<String> objectAccessorMethods() {
        return Set.of("get", "getOrDefault", "containsKey");
    }

    @Override
    public boolean isEnvModule(String qualifiedName) {
        return qualifiedName.equals("java.lang.System") || super.isEnvModule(qualifiedName);
    }

    @Override
    public List<CompletionTrigger> completionTriggers() {
        return List.of(
                CompletionTrigger.of("System\\.getenv\\(\\s*\"[\\w]*$", "System"),
                CompletionTrigger.of("System\\.getenv\\(\\)\\.get(?:OrDefault)?\\(\\s*\"[\\w]*$", "System"));
    }
}

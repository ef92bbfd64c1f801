package ai.envlens.analyzer.lang;

import ai.envlens.analyzer.CompletionTrigger;
import ai.envlens.analyzer.TreeSitterProfile;
import java.util.List;
import java.util.Set;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterGo;

public class GoProfile extends TreeSitterProfile {

    @Override
    public String id() {
        return "go";
    }

    @Override
    public Set<String> languageIds() {
        return Set.of("go");
    }

    @Override
    public List<String> extensions() {
        return List.of("go");
    }

    @Override
    protected TSLanguage createTSLanguage() {
        return new TreeSitterGo();
    }

    @Override
    public Set<String> scopeNodeTypes() {
        return Set.of("source_file", "function_declaration", "method_declaration", "func_literal", "block");
    }

    /** The blank identifier. */
    @Override
    public boolean isDiscard(String name) {
        return name.equals("_");
    }

    @Override
    protected Set<String> envAccessors() {
        return Set.of("os.Getenv", "os.LookupEnv", "syscall.Getenv");
    }

    @Override
    public boolean isEnvModule(String qualifiedName) {
        return qualifiedName.equals("os") || qualifiedName.equals("syscall");
    }

    @Override
    public List<CompletionTrigger> completionTriggers() {
        return List.of(CompletionTrigger.of("os\\.(?:Getenv|LookupEnv)\\(\\s*\"[\\w]*$", "Getenv"));
    }
}

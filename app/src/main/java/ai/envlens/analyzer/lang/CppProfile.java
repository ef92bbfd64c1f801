package ai.envlens.analyzer.lang;

import ai.envlens.analyzer.CompletionTrigger;
import ai.envlens.analyzer.TreeSitterProfile;
import java.util.List;
import java.util.Set;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterCpp;

/** C++ and, through the same grammar, C. */
public class CppProfile extends TreeSitterProfile {

    @Override
    public String id() {
        return "cpp";
    }

    @Override
    public Set<String> languageIds() {
        return Set.of("cpp", "c");
    }

    @Override
    public List<String> extensions() {
        return List.of("cpp", "cc", "cxx", "hpp", "hh", "c", "h");
    }

    @Override
    protected TSLanguage createTSLanguage() {
        return new TreeSitterCpp();
    }

    @Override
    public String memberSeparator() {
        return "::";
    }

    @Override
    public Set<String> scopeNodeTypes() {
        return Set.of("translation_unit", "function_definition", "compound_statement", "lambda_expression",
                "for_statement", "namespace_definition");
    }

    @Override
    protected Set<String> envAccessors() {
        return Set.of("getenv", "std::getenv", "secure_getenv", "_wgetenv");
    }

    @Override
    public List<CompletionTrigger> completionTriggers() {
        return List.of(CompletionTrigger.of("\\b(?:std::)?(?:secure_)?getenv\\(\\s*\"[\\w]*$", "getenv"));
    }
}

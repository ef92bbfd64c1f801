package ai.envlens.analyzer.lang;

import static ai.envlens.analyzer.TreeSitterText.field;

import ai.envlens.analyzer.CompletionTrigger;
import ai.envlens.analyzer.LineIndex;
import ai.envlens.analyzer.TreeSitterProfile;
import ai.envlens.analyzer.TreeSitterText;
import java.util.List;
import java.util.Set;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TreeSitterRust;

public class RustProfile extends TreeSitterProfile {

    // methods whose result still carries the variable's value
    private static final Set<String> PASS_THROUGH_METHODS = Set.of(
            "unwrap", "expect", "unwrap_or", "unwrap_or_default", "unwrap_or_else", "ok", "to_string", "into",
            "clone");

    @Override
    public String id() {
        return "rust";
    }

    @Override
    public Set<String> languageIds() {
        return Set.of("rust");
    }

    @Override
    public List<String> extensions() {
        return List.of("rs");
    }

    @Override
    protected TSLanguage createTSLanguage() {
        return new TreeSitterRust();
    }

    @Override
    public String memberSeparator() {
        return "::";
    }

    @Override
    public Set<String> scopeNodeTypes() {
        return Set.of("source_file", "function_item", "closure_expression", "block", "impl_item", "mod_item");
    }

    @Override
    protected Set<String> envAccessors() {
        return Set.of(
                "std::env::var", "std::env::var_os", "env::var", "env::var_os", "env!", "option_env!",
                "dotenvy::var", "dotenv::var");
    }

    @Override
    public boolean isEnvModule(String qualifiedName) {
        return qualifiedName.equals("std::env") || super.isEnvModule(qualifiedName);
    }

    @Override
    public TSNode unwrapValue(TSNode value, LineIndex index) {
        var current = super.unwrapValue(value, index);
        while (true) {
            if (current.getType().equals("try_expression") && current.getNamedChildCount() > 0) {
                current = current.getNamedChild(0);
                continue;
            }
            if (current.getType().equals("call_expression")) {
                var function = field(current, "function");
                if (function != null && function.getType().equals("field_expression")) {
                    var method = field(function, "field");
                    var receiver = field(function, "value");
                    if (method != null
                            && receiver != null
                            && PASS_THROUGH_METHODS.contains(TreeSitterText.text(method, index))) {
                        current = receiver;
                        continue;
                    }
                }
            }
            return current;
        }
    }

    @Override
    public List<CompletionTrigger> completionTriggers() {
        return List.of(
                CompletionTrigger.of("env::var(?:_os)?\\(\\s*\"[\\w]*$", "var"),
                CompletionTrigger.of("(?:option_)?env!\\(\\s*\"[\\w]*$", "env"));
    }
}

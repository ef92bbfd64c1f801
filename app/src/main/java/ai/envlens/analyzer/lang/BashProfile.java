package ai.envlens.analyzer.lang;

import ai.envlens.analyzer.CompletionTrigger;
import ai.envlens.analyzer.StringLiteral;
import ai.envlens.analyzer.TreeSitterProfile;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterBash;

/** Shell scripts: every {@code $NAME} or {@code ${NAME}} expansion reads the variable. */
public class BashProfile extends TreeSitterProfile {

    @Override
    public String id() {
        return "bash";
    }

    @Override
    public Set<String> languageIds() {
        return Set.of("shellscript", "bash", "sh");
    }

    @Override
    public List<String> extensions() {
        return List.of("sh", "bash", "zsh");
    }

    @Override
    protected TSLanguage createTSLanguage() {
        return new TreeSitterBash();
    }

    @Override
    public Set<String> scopeNodeTypes() {
        return Set.of("program");
    }

    @Override
    public Set<String> identifierNodeTypes() {
        return Set.of();
    }

    @Override
    public boolean bareKeysAreDirect() {
        return true;
    }

    /** Keys are bare {@code variable_name} nodes. */
    @Override
    public Optional<StringLiteral> stringLiteral(String literalText) {
        return literalText.isEmpty() ? Optional.empty() : Optional.of(new StringLiteral(literalText, 0));
    }

    @Override
    public List<CompletionTrigger> completionTriggers() {
        return List.of(CompletionTrigger.of("\\$\\{?[A-Za-z_]\\w*$", "$"));
    }
}

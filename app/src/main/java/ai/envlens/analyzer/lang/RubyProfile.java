package ai.envlens.analyzer.lang;

import ai.envlens.analyzer.CompletionTrigger;
import ai.envlens.analyzer.TreeSitterProfile;
import java.util.List;
import java.util.Set;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterRuby;

public class RubyProfile extends TreeSitterProfile {

    @Override
    public String id() {
        return "ruby";
    }

    @Override
    public Set<String> languageIds() {
        return Set.of("ruby");
    }

    @Override
    public List<String> extensions() {
        return List.of("rb", "rake");
    }

    @Override
    protected TSLanguage createTSLanguage() {
        return new TreeSitterRuby();
    }

    @Override
    public Set<String> scopeNodeTypes() {
        return Set.of("program", "method", "singleton_method", "class", "module", "block", "do_block", "lambda");
    }

    @Override
    protected Set<String> envObjects() {
        return Set.of("ENV");
    }

    @Override
    public Set<String> objectAccessorMethods() {
        return Set.of("fetch", "key?", "include?");
    }

    @Override
    protected boolean isInterpolated(String prefix, char quote, String content) {
        return quote == '"' && content.contains("#{");
    }

    @Override
    public List<CompletionTrigger> completionTriggers() {
        return List.of(
                CompletionTrigger.of("\\bENV\\[\\s*[\"'][\\w]*$", "ENV"),
                CompletionTrigger.of("\\bENV\\.fetch\\(\\s*[\"'][\\w]*$", "ENV"));
    }
}

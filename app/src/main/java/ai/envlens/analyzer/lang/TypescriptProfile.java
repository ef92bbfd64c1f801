package ai.envlens.analyzer.lang;

import ai.envlens.analyzer.QueryCategory;
import java.util.List;
import java.util.Set;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterTypescript;

/** TypeScript and TSX. TSX files parse with the TypeScript grammar; JSX elements then surface as parse errors. */
public class TypescriptProfile extends JavascriptProfile {

    @Override
    public String id() {
        return "typescript";
    }

    @Override
    public Set<String> languageIds() {
        return Set.of("typescript", "typescriptreact");
    }

    @Override
    public List<String> extensions() {
        return List.of("ts", "mts", "cts", "tsx");
    }

    @Override
    protected TSLanguage createTSLanguage() {
        return new TreeSitterTypescript();
    }

    @Override
    protected String queryDirectory() {
        return "javascript";
    }

    /** Parameters are typed nodes here, unlike JavaScript's bare identifiers. */
    @Override
    protected String queryDirectory(QueryCategory category) {
        return category == QueryCategory.PARAMETER ? id() : super.queryDirectory(category);
    }
}

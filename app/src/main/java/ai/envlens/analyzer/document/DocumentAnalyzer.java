package ai.envlens.analyzer.document;

import ai.envlens.analyzer.LanguageProfile;
import ai.envlens.analyzer.LineIndex;
import java.net.URI;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Parses a document and builds its {@link SymbolTable}. Stateless and thread-safe; parsers and queries are
 * thread-confined inside the profiles.
 */
public final class DocumentAnalyzer {
    private static final Logger logger = LogManager.getLogger(DocumentAnalyzer.class);

    /** Never throws: a document that cannot be analyzed has no references. */
    public SymbolTable analyze(URI uri, LanguageProfile profile, LineIndex lineIndex) {
        long start = System.nanoTime();
        try {
            var tree = profile.parse(lineIndex.text());
            if (tree == null) {
                logger.warn("Parser returned no tree for {}", uri);
                return SymbolTable.EMPTY;
            }
            var table = new AnalysisPass(profile, lineIndex, tree).run();
            logger.trace("Analyzed {} in {} us: {} bindings, {} references", uri,
                    (System.nanoTime() - start) / 1_000, table.bindings().size(), table.references().size());
            return table;
        } catch (RuntimeException e) {
            logger.warn("Analysis of {} failed; treating it as having no references", uri, e);
            return SymbolTable.EMPTY;
        }
    }
}

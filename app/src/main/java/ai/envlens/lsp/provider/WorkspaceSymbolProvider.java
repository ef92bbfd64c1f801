package ai.envlens.lsp.provider;

import ai.envlens.lsp.EnvLensSession;
import ai.envlens.lsp.LspConversions;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.eclipse.lsp4j.SymbolKind;
import org.eclipse.lsp4j.WorkspaceSymbol;
import org.eclipse.lsp4j.jsonrpc.messages.Either;

/** One symbol per variable name read in the workspace, located at its first occurrence. */
public final class WorkspaceSymbolProvider {
    static final int MAX_RESULTS = 500;

    public List<WorkspaceSymbol> symbols(EnvLensSession session, String query) {
        var needle = query.toLowerCase(Locale.ROOT);
        var result = new ArrayList<WorkspaceSymbol>();
        for (var name : session.analyzer().allVariableNames()) {
            if (result.size() >= MAX_RESULTS) {
                break;
            }
            if (!name.toLowerCase(Locale.ROOT).contains(needle)) {
                continue;
            }
            var occurrences = session.analyzer().referencesTo(name);
            if (occurrences.isEmpty()) {
                continue;
            }
            var location = LspConversions.toLocation(occurrences.get(0));
            result.add(new WorkspaceSymbol(name, SymbolKind.Variable, Either.forLeft(location)));
        }
        return result;
    }
}

package ai.envlens.lsp.provider;

import ai.envlens.analyzer.Occurrence;
import ai.envlens.analyzer.Ranges;
import ai.envlens.analyzer.SourceRange;
import ai.envlens.lsp.EnvLensSession;
import ai.envlens.lsp.LspConversions;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.WorkspaceEdit;
import org.eclipse.lsp4j.jsonrpc.ResponseErrorException;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseError;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseErrorCode;
import org.jetbrains.annotations.Nullable;

/**
 * Renames a variable wherever its name is written out. Local aliases and imported names keep their own names; only
 * the literal variable name changes.
 */
public final class RenameProvider {
    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    @Nullable
    public WorkspaceEdit rename(EnvLensSession session, URI uri, Position position, String newName) {
        if (!VALID_NAME.matcher(newName).matches()) {
            throw new ResponseErrorException(new ResponseError(
                    ResponseErrorCode.InvalidParams, "'" + newName + "' is not a valid variable name", null));
        }
        var resolution = session.analyzer().resolve(uri, LspConversions.toSourcePosition(position));
        if (resolution.isEmpty()) {
            return null;
        }
        var name = resolution.get().canonicalName();
        Map<String, List<SourceRange>> ranges = new LinkedHashMap<>();
        for (Occurrence occurrence : literalOccurrences(session, name)) {
            ranges.computeIfAbsent(occurrence.uri().toString(), k -> new ArrayList<>()).add(occurrence.range());
        }
        // clients reject a workspace edit that touches one range twice
        Map<String, List<TextEdit>> changes = new LinkedHashMap<>();
        ranges.forEach((target, found) -> changes.put(target, Ranges.dedup(found).stream()
                .map(range -> new TextEdit(LspConversions.toRange(range), newName))
                .toList()));
        return new WorkspaceEdit(changes);
    }

    private static List<Occurrence> literalOccurrences(EnvLensSession session, String name) {
        var analyzer = session.analyzer();
        var result = new ArrayList<Occurrence>();
        for (var occurrence : analyzer.referencesTo(name)) {
            var open = analyzer.snapshot(occurrence.uri());
            if (open.isEmpty()) {
                // the index only records literal occurrences
                result.add(occurrence);
                continue;
            }
            var literal = open.get().symbols().references().stream()
                    .anyMatch(r -> r.range().equals(occurrence.range()) && r.token().equals(name));
            if (literal) {
                result.add(occurrence);
            }
        }
        return result;
    }
}

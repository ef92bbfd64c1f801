package ai.envlens.lsp.provider;

import ai.envlens.lsp.EnvLensSession;
import ai.envlens.lsp.LspConversions;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionItemKind;
import org.eclipse.lsp4j.Position;

/**
 * Offers variable names after an environment access such as {@code process.env.} or {@code os.getenv("}: every
 * variable a value source defines plus every name read elsewhere in the workspace.
 */
public final class CompletionProvider {

    public List<CompletionItem> complete(EnvLensSession session, URI uri, Position position) {
        var context = session.analyzer().completionContextAt(uri, LspConversions.toSourcePosition(position));
        if (context.isEmpty()) {
            return List.of();
        }
        var items = new TreeMap<String, CompletionItem>();
        for (var variable : session.values().lookupAll(session.contextFor(uri))) {
            var item = new CompletionItem(variable.name());
            item.setKind(CompletionItemKind.Variable);
            item.setDetail(session.masker().display(variable) + "  (" + variable.source() + ")");
            items.put(variable.name(), item);
        }
        for (var name : session.analyzer().allVariableNames()) {
            items.computeIfAbsent(name, n -> {
                var item = new CompletionItem(n);
                item.setKind(CompletionItemKind.Variable);
                item.setDetail("not defined");
                return item;
            });
        }
        return new ArrayList<>(items.values());
    }
}

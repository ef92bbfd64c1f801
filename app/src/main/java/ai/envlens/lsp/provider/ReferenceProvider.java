package ai.envlens.lsp.provider;

import ai.envlens.lsp.EnvLensSession;
import ai.envlens.lsp.LspConversions;
import java.net.URI;
import java.util.List;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;

public final class ReferenceProvider {

    public List<Location> references(EnvLensSession session, URI uri, Position position) {
        var resolution = session.analyzer().resolve(uri, LspConversions.toSourcePosition(position));
        if (resolution.isEmpty()) {
            return List.of();
        }
        return session.analyzer().referencesTo(resolution.get().canonicalName()).stream()
                .map(LspConversions::toLocation)
                .toList();
    }
}

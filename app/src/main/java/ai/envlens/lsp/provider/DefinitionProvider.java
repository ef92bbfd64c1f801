package ai.envlens.lsp.provider;

import ai.envlens.lsp.EnvLensSession;
import ai.envlens.lsp.LspConversions;
import java.net.URI;
import java.util.List;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;

/**
 * Jumps to where a variable's value is defined, e.g. its line in {@code .env}. When no value source knows the
 * variable, a token reached through a local binding jumps to that binding's declaration instead.
 */
public final class DefinitionProvider {

    public List<Location> definition(EnvLensSession session, URI uri, Position position) {
        var pos = LspConversions.toSourcePosition(position);
        var resolution = session.analyzer().resolve(uri, pos);
        if (resolution.isEmpty()) {
            return List.of();
        }
        var value = session.values().lookup(resolution.get().canonicalName(), session.contextFor(uri));
        if (value.isPresent() && value.get().definingUri() != null && value.get().definingRange() != null) {
            return List.of(new Location(
                    value.get().definingUri().toString(), LspConversions.toRange(value.get().definingRange())));
        }
        var snapshot = session.analyzer().snapshot(uri);
        var reference = session.analyzer().referenceAt(uri, pos);
        if (snapshot.isEmpty() || reference.isEmpty() || reference.get().bindingId() < 0) {
            return List.of();
        }
        var binding = snapshot.get().symbols().binding(reference.get().bindingId());
        return List.of(new Location(uri.toString(), LspConversions.toRange(binding.nameRange())));
    }
}

package ai.envlens.lsp.provider;

import ai.envlens.analyzer.SourceKind;
import ai.envlens.lsp.EnvLensSession;
import ai.envlens.lsp.LspConversions;
import java.net.URI;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.MarkupContent;
import org.eclipse.lsp4j.MarkupKind;
import org.eclipse.lsp4j.Position;
import org.jetbrains.annotations.Nullable;

/** Shows the variable a token denotes, its (masked) value and where the value comes from. */
public final class HoverProvider {

    @Nullable
    public Hover hover(EnvLensSession session, URI uri, Position position) {
        var pos = LspConversions.toSourcePosition(position);
        var reference = session.analyzer().referenceAt(uri, pos);
        var resolution = session.analyzer().resolve(uri, pos);
        if (reference.isEmpty() || resolution.isEmpty()) {
            return null;
        }
        var name = resolution.get().canonicalName();
        var sb = new StringBuilder();
        sb.append("**`").append(name).append("`**");
        if (resolution.get().sourceKind() != SourceKind.DIRECT_REFERENCE) {
            sb.append(" _(").append(describe(resolution.get().sourceKind())).append(")_");
        }
        sb.append("\n\n");
        var value = session.values().lookup(name, session.contextFor(uri));
        if (value.isPresent()) {
            sb.append("```\n").append(session.masker().display(value.get())).append("\n```\n\n");
            sb.append("Source: `").append(value.get().source()).append('`');
        } else {
            sb.append("Not defined");
            var fallback = reference.get().defaultValue();
            if (fallback != null) {
                sb.append("; defaults to `").append(fallback).append('`');
            }
        }
        var hover = new Hover(new MarkupContent(MarkupKind.MARKDOWN, sb.toString()));
        hover.setRange(LspConversions.toRange(reference.get().range()));
        return hover;
    }

    private static String describe(SourceKind kind) {
        return switch (kind) {
            case DIRECT_REFERENCE -> "direct";
            case LOCAL_BINDING -> "local binding";
            case LOCAL_USAGE -> "local variable";
            case CROSS_MODULE_IMPORT -> "imported";
            case ENV_OBJECT_ALIAS -> "environment alias";
        };
    }
}

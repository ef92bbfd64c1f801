package ai.envlens.lsp.provider;

import ai.envlens.analyzer.Ranges;
import ai.envlens.analyzer.ResolvedReference;
import ai.envlens.analyzer.SourceKind;
import ai.envlens.config.EnvLensConfig;
import ai.envlens.env.ResolvedVariable;
import ai.envlens.lsp.EnvLensSession;
import ai.envlens.lsp.LspConversions;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.eclipse.lsp4j.InlayHint;
import org.eclipse.lsp4j.InlayHintKind;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.jsonrpc.messages.Either;

/**
 * Shows the (masked) value after each reference in the requested range, as {@code : "value"}. References whose
 * variable has no value get no hint.
 */
public final class InlayHintProvider {

    public List<InlayHint> hints(EnvLensSession session, URI uri, Range range) {
        var config = session.config().inlayHints();
        var requested = LspConversions.toSourceRange(range);
        var context = session.contextFor(uri);
        Map<String, Optional<ResolvedVariable>> values = new HashMap<>();
        Map<Integer, Integer> perLine = new HashMap<>();
        var hints = new ArrayList<InlayHint>();
        for (ResolvedReference resolved : session.analyzer().resolvedReferences(uri)) {
            var reference = resolved.reference();
            if (!Ranges.overlap(reference.range(), requested) || !shows(reference.kind(), config)) {
                continue;
            }
            var name = resolved.resolution().canonicalName();
            var value = values.computeIfAbsent(name, n -> session.values().lookup(n, context));
            if (value.isEmpty()) {
                continue;
            }
            var end = reference.range().end();
            if (config.maxHintsPerLine() > 0) {
                int count = perLine.merge(end.line(), 1, Integer::sum);
                if (count > config.maxHintsPerLine()) {
                    continue;
                }
            }
            var hint = new InlayHint(LspConversions.toPosition(end),
                    Either.forLeft(": \"" + format(session.masker().display(value.get()), config.maxValueLength())
                            + "\""));
            hint.setKind(InlayHintKind.Type);
            hint.setTooltip(Either.forLeft("Source: " + value.get().source()));
            hint.setPaddingLeft(false);
            hint.setPaddingRight(true);
            hints.add(hint);
        }
        return hints;
    }

    /** First line only, cut at {@code maxLength} characters; either cut is marked with {@code ...}. */
    static String format(String value, int maxLength) {
        int newline = value.indexOf('\n');
        var shown = newline >= 0 ? value.substring(0, newline) + "..." : value;
        return shown.length() > maxLength ? shown.substring(0, maxLength) + "..." : shown;
    }

    private static boolean shows(SourceKind kind, EnvLensConfig.InlayHints config) {
        return switch (kind) {
            case DIRECT_REFERENCE -> config.directReferences();
            case LOCAL_BINDING -> config.bindingDeclarations();
            case LOCAL_USAGE, CROSS_MODULE_IMPORT -> config.bindingUsages();
            case ENV_OBJECT_ALIAS -> config.propertyAccesses();
        };
    }
}

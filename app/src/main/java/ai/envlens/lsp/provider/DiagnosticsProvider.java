package ai.envlens.lsp.provider;

import ai.envlens.analyzer.ResolvedReference;
import ai.envlens.analyzer.document.DocumentSnapshot;
import ai.envlens.lsp.EnvLensSession;
import ai.envlens.lsp.LspConversions;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;

/**
 * Warns about variables that are read but have no value. Only literal reads are reported, so an alias used in ten
 * places yields a single warning at the place the name is written.
 */
public final class DiagnosticsProvider {
    public static final String SOURCE = "envlens";

    public List<Diagnostic> diagnose(EnvLensSession session, DocumentSnapshot snapshot) {
        if (!snapshot.isSupported()) {
            return List.of();
        }
        var context = session.contextFor(snapshot.uri());
        Map<String, Boolean> defined = new HashMap<>();
        var diagnostics = new ArrayList<Diagnostic>();
        for (ResolvedReference resolved : session.analyzer().resolvedReferences(snapshot)) {
            if (!resolved.isLiteral() || resolved.reference().defaultValue() != null) {
                continue;
            }
            var name = resolved.resolution().canonicalName();
            boolean isDefined = defined.computeIfAbsent(
                    name, n -> session.values().lookup(n, context).isPresent());
            if (!isDefined) {
                diagnostics.add(new Diagnostic(
                        LspConversions.toRange(resolved.reference().range()),
                        "Environment variable '" + name + "' is not defined",
                        DiagnosticSeverity.Warning,
                        SOURCE));
            }
        }
        return diagnostics;
    }
}

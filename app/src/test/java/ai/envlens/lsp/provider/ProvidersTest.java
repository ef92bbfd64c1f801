package ai.envlens.lsp.provider;

import static org.junit.jupiter.api.Assertions.*;

import ai.envlens.config.EnvLensConfig;
import ai.envlens.env.MaskingValueMasker;
import ai.envlens.env.ValueMasker;
import ai.envlens.lsp.EnvLensSession;
import ai.envlens.testutil.MapValueProvider;
import ai.envlens.testutil.TestWorkspace;
import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.InlayHint;
import org.eclipse.lsp4j.InlayHintKind;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.jsonrpc.ResponseErrorException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProvidersTest {
    private static final String APP = """
            const host = process.env.DB_HOST;
            const port = process.env.PORT || "3000";
            const missing = process.env.MISSING;
            console.log(host, port, missing);
            """;

    @TempDir
    Path dir;

    private TestWorkspace workspace;
    private EnvLensSession session;
    private URI app;

    @BeforeEach
    void setUp() {
        workspace = new TestWorkspace(dir);
        var values = new MapValueProvider(Map.of("DB_HOST", "db.internal", "API_KEY", "k"));
        session = new EnvLensSession(
                workspace.root(), EnvLensConfig.defaults(), workspace.analyzer(), values, ValueMasker.PLAIN);
        app = workspace.open("app.js", "javascript", APP);
    }

    @AfterEach
    void tearDown() {
        workspace.close();
    }

    @Test
    void diagnosticsFlagOnlyUndefinedLiteralReadsWithoutDefault() {
        var snapshot = workspace.analyzer().snapshot(app).orElseThrow();
        var diagnostics = new DiagnosticsProvider().diagnose(session, snapshot);
        assertEquals(1, diagnostics.size());
        var d = diagnostics.get(0);
        assertEquals("Environment variable 'MISSING' is not defined", d.getMessage());
        assertEquals(DiagnosticSeverity.Warning, d.getSeverity());
        assertEquals(DiagnosticsProvider.SOURCE, d.getSource());
        assertEquals(new Range(new Position(2, 28), new Position(2, 35)), d.getRange());
    }

    @Test
    void hoverShowsValueOrDefault() {
        var hover = new HoverProvider().hover(session, app, new Position(0, 27));
        assertNotNull(hover);
        var text = hover.getContents().getRight().getValue();
        assertTrue(text.contains("`DB_HOST`"), text);
        assertTrue(text.contains("db.internal"), text);
        assertTrue(text.contains("Source: `test`"), text);

        var viaDefault = new HoverProvider().hover(session, app, new Position(1, 26));
        assertNotNull(viaDefault);
        var defaultText = viaDefault.getContents().getRight().getValue();
        assertTrue(defaultText.contains("Not defined; defaults to `3000`"), defaultText);

        assertNull(new HoverProvider().hover(session, app, new Position(3, 2)));
    }

    @Test
    void hoverOnLocalUsageNamesTheVariable() {
        var hover = new HoverProvider().hover(session, app, new Position(3, 13));
        assertNotNull(hover);
        var text = hover.getContents().getRight().getValue();
        assertTrue(text.contains("`DB_HOST`"), text);
        assertTrue(text.contains("local variable"), text);
    }

    @Test
    void definitionFallsBackToTheLocalBinding() {
        var locations = new DefinitionProvider().definition(session, app, new Position(3, 13));
        assertEquals(1, locations.size());
        assertEquals(app.toString(), locations.get(0).getUri());
        assertEquals(new Position(0, 6), locations.get(0).getRange().getStart());

        assertTrue(new DefinitionProvider().definition(session, app, new Position(0, 27)).isEmpty());
    }

    @Test
    void completionMergesDefinedAndReadNames() {
        var other = workspace.open("other.js", "javascript", "process.env.");
        var items = new CompletionProvider().complete(session, other, new Position(0, 12));
        var labels = items.stream().map(CompletionItem::getLabel).toList();
        assertTrue(labels.containsAll(List.of("API_KEY", "DB_HOST", "MISSING", "PORT")), labels.toString());
        assertEquals(labels.stream().sorted().toList(), labels);

        assertTrue(new CompletionProvider().complete(session, app, new Position(3, 0)).isEmpty());
    }

    @Test
    void referencesAndRenameCoverEveryOccurrence() {
        var second = workspace.open("second.js", "javascript", "const h = process.env.DB_HOST;\n");

        var refs = new ReferenceProvider().references(session, app, new Position(0, 27));
        assertTrue(refs.stream().anyMatch(l -> l.getUri().equals(second.toString())));

        var edit = new RenameProvider().rename(session, app, new Position(0, 27), "DATABASE_HOST");
        assertNotNull(edit);
        var appEdits = edit.getChanges().get(app.toString());
        assertEquals(1, appEdits.size(), "the alias host keeps its name");
        assertEquals(new Range(new Position(0, 25), new Position(0, 32)), appEdits.get(0).getRange());
        assertEquals(1, edit.getChanges().get(second.toString()).size());

        assertThrows(ResponseErrorException.class,
                () -> new RenameProvider().rename(session, app, new Position(0, 27), "1-bad"));
    }

    @Test
    void workspaceSymbolsFilterByQuery() {
        var symbols = new WorkspaceSymbolProvider().symbols(session, "host");
        assertEquals(1, symbols.size());
        assertEquals("DB_HOST", symbols.get(0).getName());
        assertEquals(app.toString(), symbols.get(0).getLocation().getLeft().getUri());
    }

    @Test
    void renameTouchesEachRangeOnce() {
        var queue = workspace.open("queue.js", "javascript", "const { QUEUE } = process.env;\nstart(QUEUE);\n");
        var edit = new RenameProvider().rename(session, queue, new Position(1, 8), "JOBS");
        assertNotNull(edit);
        var ranges = edit.getChanges().get(queue.toString()).stream().map(TextEdit::getRange).toList();
        assertEquals(2, ranges.size());
        assertEquals(2, Set.copyOf(ranges).size());
    }

    @Test
    void inlayHintsShowValuesAfterDefinedReferences() {
        var hints = new InlayHintProvider().hints(session, app, new Range(new Position(0, 0), new Position(4, 0)));
        // host and DB_HOST on line 0; PORT and MISSING have no value; usages are off by default
        assertEquals(List.of(new Position(0, 10), new Position(0, 32)),
                hints.stream().map(InlayHint::getPosition).toList());
        var hint = hints.get(1);
        assertEquals(": \"db.internal\"", hint.getLabel().getLeft());
        assertEquals("Source: test", hint.getTooltip().getLeft());
        assertEquals(InlayHintKind.Type, hint.getKind());
        assertTrue(hint.getPaddingRight());

        assertTrue(new InlayHintProvider().hints(session, app, new Range(new Position(1, 0), new Position(3, 40)))
                .isEmpty());
    }

    @Test
    void inlayHintSettingsLimitKindsAndLineCount() {
        var config = new EnvLensConfig(null, null, null, null, null, null, null,
                new EnvLensConfig.InlayHints(null, 1, null, null, true, null));
        var masked = new EnvLensSession(workspace.root(), config, workspace.analyzer(),
                new MapValueProvider(Map.of("DB_HOST", "db.internal")), new MaskingValueMasker(true, "*", 2));
        var hints = new InlayHintProvider().hints(masked, app, new Range(new Position(0, 0), new Position(4, 0)));
        assertEquals(List.of(0, 3), hints.stream().map(h -> h.getPosition().getLine()).toList());
        assertTrue(hints.stream().allMatch(h -> h.getLabel().getLeft().equals(": \"db*********\"")));
    }

    @Test
    void inlayHintValuesKeepTheFirstLineAndAreCut() {
        assertEquals("short", InlayHintProvider.format("short", 30));
        assertEquals("line one...", InlayHintProvider.format("line one\nline two", 30));
        assertEquals("abcdefghij...", InlayHintProvider.format("abcdefghijklmnop", 10));
    }

    @Test
    void listEnvVariablesReportsMaskedValues() {
        var masked = new EnvLensSession(workspace.root(), EnvLensConfig.defaults(), workspace.analyzer(),
                new MapValueProvider(Map.of("API_KEY", "secret")), new MaskingValueMasker(true, "#", 1));
        var result = new CommandProvider().listEnvVariables(masked, "app.js");
        assertEquals(1, result.get("count"));
        assertEquals(List.of(Map.of("name", "API_KEY", "value", "s#####", "source", "test")), result.get("variables"));
    }

    @Test
    void envExampleListsDefinedAndReadNames() {
        var result = new CommandProvider().generateEnvExample(session);
        assertEquals("API_KEY=\nDB_HOST=\nMISSING=\nPORT=\n", result.get("content"));
        assertEquals(4, result.get("count"));

        try (var empty = new TestWorkspace(dir.resolve("empty"))) {
            var bare = new EnvLensSession(
                    empty.root(), EnvLensConfig.defaults(), empty.analyzer(), new MapValueProvider(Map.of()),
                    ValueMasker.PLAIN);
            var none = new CommandProvider().generateEnvExample(bare);
            assertEquals(CommandProvider.EMPTY_EXAMPLE, none.get("content"));
            assertEquals(0, none.get("count"));
        }
    }
}

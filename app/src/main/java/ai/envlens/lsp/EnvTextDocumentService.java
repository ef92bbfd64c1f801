package ai.envlens.lsp;

import ai.envlens.analyzer.document.DocumentSnapshot;
import ai.envlens.lsp.provider.CompletionProvider;
import ai.envlens.lsp.provider.DefinitionProvider;
import ai.envlens.lsp.provider.DiagnosticsProvider;
import ai.envlens.lsp.provider.HoverProvider;
import ai.envlens.lsp.provider.InlayHintProvider;
import ai.envlens.lsp.provider.ReferenceProvider;
import ai.envlens.lsp.provider.RenameProvider;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionList;
import org.eclipse.lsp4j.CompletionParams;
import org.eclipse.lsp4j.DefinitionParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.HoverParams;
import org.eclipse.lsp4j.InlayHint;
import org.eclipse.lsp4j.InlayHintParams;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.LocationLink;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.ReferenceParams;
import org.eclipse.lsp4j.RenameParams;
import org.eclipse.lsp4j.WorkspaceEdit;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.services.TextDocumentService;

/** Document sync and per-position requests. Requests are answered on the lsp4j thread from the latest snapshot. */
public class EnvTextDocumentService implements TextDocumentService {
    private static final Logger logger = LogManager.getLogger(EnvTextDocumentService.class);

    private final EnvLanguageServer server;
    private final HoverProvider hoverProvider = new HoverProvider();
    private final DefinitionProvider definitionProvider = new DefinitionProvider();
    private final ReferenceProvider referenceProvider = new ReferenceProvider();
    private final RenameProvider renameProvider = new RenameProvider();
    private final CompletionProvider completionProvider = new CompletionProvider();
    private final DiagnosticsProvider diagnosticsProvider = new DiagnosticsProvider();
    private final InlayHintProvider inlayHintProvider = new InlayHintProvider();
    // sessions whose snapshots already feed diagnostics
    private final Set<EnvLensSession> subscribed = ConcurrentHashMap.newKeySet();

    EnvTextDocumentService(EnvLanguageServer server) {
        this.server = server;
    }

    @Override
    public void didOpen(DidOpenTextDocumentParams params) {
        var doc = params.getTextDocument();
        server.session().ifPresent(session -> {
            subscribe(session);
            session.analyzer().open(LspConversions.toUri(doc.getUri()), doc.getLanguageId(), doc.getVersion(),
                    doc.getText());
        });
    }

    @Override
    public void didChange(DidChangeTextDocumentParams params) {
        var changes = params.getContentChanges();
        if (changes.isEmpty()) {
            return;
        }
        // full sync: the last event carries the whole text
        var text = changes.get(changes.size() - 1).getText();
        var doc = params.getTextDocument();
        server.session().ifPresent(session ->
                session.analyzer().change(LspConversions.toUri(doc.getUri()), doc.getVersion(), text));
    }

    @Override
    public void didClose(DidCloseTextDocumentParams params) {
        var uri = params.getTextDocument().getUri();
        server.session().ifPresent(session -> session.analyzer().close(LspConversions.toUri(uri)));
        server.client().ifPresent(client -> client.publishDiagnostics(new PublishDiagnosticsParams(uri, List.of())));
    }

    @Override
    public void didSave(DidSaveTextDocumentParams params) {
        logger.trace("Saved {}", params.getTextDocument().getUri());
    }

    private void subscribe(EnvLensSession session) {
        if (subscribed.add(session)) {
            session.analyzer().addSnapshotListener(snapshot -> publishDiagnostics(session, snapshot));
        }
    }

    private void publishDiagnostics(EnvLensSession session, DocumentSnapshot snapshot) {
        if (!session.config().features().diagnostics()) {
            return;
        }
        var client = server.client();
        if (client.isEmpty()) {
            return;
        }
        var diagnostics = diagnosticsProvider.diagnose(session, snapshot);
        var params = new PublishDiagnosticsParams(snapshot.uri().toString(), diagnostics);
        params.setVersion(snapshot.version());
        client.get().publishDiagnostics(params);
    }

    @Override
    public CompletableFuture<Hover> hover(HoverParams params) {
        return answer(null, session -> session.config().features().hover()
                ? hoverProvider.hover(session, LspConversions.toUri(params.getTextDocument().getUri()),
                        params.getPosition())
                : null);
    }

    @Override
    public CompletableFuture<Either<List<? extends Location>, List<? extends LocationLink>>> definition(
            DefinitionParams params) {
        return answer(Either.forLeft(List.of()), session -> Either.forLeft(session.config().features().definition()
                ? definitionProvider.definition(session, LspConversions.toUri(params.getTextDocument().getUri()),
                        params.getPosition())
                : List.of()));
    }

    @Override
    public CompletableFuture<List<? extends Location>> references(ReferenceParams params) {
        return answer(List.of(), session -> session.config().features().references()
                ? referenceProvider.references(session, LspConversions.toUri(params.getTextDocument().getUri()),
                        params.getPosition())
                : List.of());
    }

    @Override
    public CompletableFuture<WorkspaceEdit> rename(RenameParams params) {
        return answer(null, session -> renameProvider.rename(
                session, LspConversions.toUri(params.getTextDocument().getUri()), params.getPosition(),
                params.getNewName()));
    }

    @Override
    public CompletableFuture<Either<List<CompletionItem>, CompletionList>> completion(CompletionParams params) {
        return answer(Either.forLeft(List.of()), session -> Either.forLeft(session.config().features().completion()
                ? completionProvider.complete(session, LspConversions.toUri(params.getTextDocument().getUri()),
                        params.getPosition())
                : List.of()));
    }

    @Override
    public CompletableFuture<List<InlayHint>> inlayHint(InlayHintParams params) {
        return answer(List.of(), session -> session.config().features().inlayHints()
                ? inlayHintProvider.hints(session, LspConversions.toUri(params.getTextDocument().getUri()),
                        params.getRange())
                : List.of());
    }

    private <T> CompletableFuture<T> answer(T whenUninitialized, Function<EnvLensSession, T> body) {
        var session = server.session();
        if (session.isEmpty()) {
            return CompletableFuture.completedFuture(whenUninitialized);
        }
        return CompletableFuture.completedFuture(body.apply(session.get()));
    }
}

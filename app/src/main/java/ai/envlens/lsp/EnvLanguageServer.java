package ai.envlens.lsp;

import ai.envlens.lsp.provider.CommandProvider;
import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.lsp4j.CompletionOptions;
import org.eclipse.lsp4j.ExecuteCommandOptions;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.InitializedParams;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.ServerInfo;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.LanguageServer;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.jetbrains.annotations.Nullable;

/**
 * lsp4j entry point. The session is created on {@code initialize} once the workspace root is known; requests that
 * arrive before that get empty answers.
 */
public class EnvLanguageServer implements LanguageServer, LanguageClientAware {
    private static final Logger logger = LogManager.getLogger(EnvLanguageServer.class);

    static final List<String> COMPLETION_TRIGGERS = List.of(".", "[", "\"", "'", "(", "{", "$");

    private final EnvTextDocumentService textDocumentService;
    private final EnvWorkspaceService workspaceService;
    private volatile @Nullable EnvLensSession session;
    private volatile @Nullable LanguageClient client;
    private volatile int exitCode = 1;

    public EnvLanguageServer() {
        this.textDocumentService = new EnvTextDocumentService(this);
        this.workspaceService = new EnvWorkspaceService(this);
    }

    @Override
    public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
        var root = workspaceRoot(params);
        logger.info("Initializing for workspace {}", root);
        var created = EnvLensSession.start(root);
        session = created;

        var capabilities = new ServerCapabilities();
        capabilities.setTextDocumentSync(TextDocumentSyncKind.Full);
        var features = created.config().features();
        capabilities.setHoverProvider(features.hover());
        capabilities.setDefinitionProvider(features.definition());
        capabilities.setReferencesProvider(features.references());
        capabilities.setRenameProvider(features.references());
        capabilities.setWorkspaceSymbolProvider(features.workspaceSymbols());
        capabilities.setInlayHintProvider(features.inlayHints());
        capabilities.setExecuteCommandProvider(new ExecuteCommandOptions(CommandProvider.commands()));
        if (features.completion()) {
            capabilities.setCompletionProvider(new CompletionOptions(false, COMPLETION_TRIGGERS));
        }
        var result = new InitializeResult(capabilities);
        result.setServerInfo(new ServerInfo("envlens", EnvLanguageServer.class.getPackage().getImplementationVersion()));
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public void initialized(InitializedParams params) {
        var current = session;
        if (current != null && current.config().indexing().enabled()) {
            current.analyzer().startBackgroundIndexing();
        }
    }

    static Path workspaceRoot(InitializeParams params) {
        var folders = params.getWorkspaceFolders();
        if (folders != null && !folders.isEmpty()) {
            return Path.of(URI.create(folders.get(0).getUri()));
        }
        @SuppressWarnings("deprecation")
        var rootUri = params.getRootUri();
        if (rootUri != null) {
            return Path.of(URI.create(rootUri));
        }
        return Path.of("").toAbsolutePath();
    }

    @Override
    public CompletableFuture<Object> shutdown() {
        logger.info("Shutdown requested");
        var current = session;
        session = null;
        if (current != null) {
            current.close();
        }
        exitCode = 0;
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void exit() {
        logger.info("Exit requested; exit code {}", exitCode);
        System.exit(exitCode);
    }

    @Override
    public TextDocumentService getTextDocumentService() {
        return textDocumentService;
    }

    @Override
    public WorkspaceService getWorkspaceService() {
        return workspaceService;
    }

    @Override
    public void connect(LanguageClient client) {
        this.client = client;
    }

    Optional<EnvLensSession> session() {
        return Optional.ofNullable(session);
    }

    Optional<LanguageClient> client() {
        return Optional.ofNullable(client);
    }
}

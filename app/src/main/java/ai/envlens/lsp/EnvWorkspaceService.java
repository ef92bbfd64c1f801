package ai.envlens.lsp;

import ai.envlens.env.RefreshOptions;
import ai.envlens.lsp.provider.CommandProvider;
import ai.envlens.lsp.provider.WorkspaceSymbolProvider;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.ExecuteCommandParams;
import org.eclipse.lsp4j.SymbolInformation;
import org.eclipse.lsp4j.WorkspaceSymbol;
import org.eclipse.lsp4j.WorkspaceSymbolParams;
import org.eclipse.lsp4j.jsonrpc.ResponseErrorException;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseError;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseErrorCode;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.jetbrains.annotations.Nullable;

/** File watching, workspace symbol search and workspace commands. */
public class EnvWorkspaceService implements WorkspaceService {
    private static final Logger logger = LogManager.getLogger(EnvWorkspaceService.class);

    private final EnvLanguageServer server;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final WorkspaceSymbolProvider symbolProvider = new WorkspaceSymbolProvider();
    private final CommandProvider commandProvider = new CommandProvider();
    private volatile CompletableFuture<Void> lastFileEvents = CompletableFuture.completedFuture(null);

    EnvWorkspaceService(EnvLanguageServer server) {
        this.server = server;
    }

    @Override
    public CompletableFuture<Either<List<? extends SymbolInformation>, List<? extends WorkspaceSymbol>>> symbol(
            WorkspaceSymbolParams params) {
        var session = server.session();
        if (session.isEmpty() || !session.get().config().features().workspaceSymbols()) {
            return CompletableFuture.completedFuture(Either.forRight(List.of()));
        }
        var query = params.getQuery() == null ? "" : params.getQuery();
        return CompletableFuture.completedFuture(Either.forRight(symbolProvider.symbols(session.get(), query)));
    }

    @Override
    public CompletableFuture<Object> executeCommand(ExecuteCommandParams params) {
        var session = server.session();
        if (session.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        logger.debug("Executing {}", params.getCommand());
        Object result = switch (params.getCommand()) {
            case CommandProvider.LIST_ENV_VARIABLES ->
                    commandProvider.listEnvVariables(session.get(), stringArgument(params.getArguments()));
            case CommandProvider.GENERATE_ENV_EXAMPLE -> commandProvider.generateEnvExample(session.get());
            default -> throw new ResponseErrorException(new ResponseError(
                    ResponseErrorCode.InvalidParams, "Unknown command: " + params.getCommand(), null));
        };
        return CompletableFuture.completedFuture(result);
    }

    /** The first argument as a string. lsp4j hands arguments over as JSON elements, so they are read back as JSON. */
    @Nullable
    static String stringArgument(@Nullable List<Object> arguments) {
        if (arguments == null || arguments.isEmpty() || arguments.get(0) == null) {
            return null;
        }
        var first = arguments.get(0);
        if (first instanceof String s) {
            return s;
        }
        try {
            return MAPPER.readValue(first.toString(), String.class);
        } catch (JsonProcessingException e) {
            throw new ResponseErrorException(new ResponseError(
                    ResponseErrorCode.InvalidParams, "Expected a file path argument, got " + first, null));
        }
    }

    @Override
    public void didChangeConfiguration(DidChangeConfigurationParams params) {
        logger.debug("Ignoring client configuration change; settings are read from the workspace");
    }

    @Override
    public void didChangeWatchedFiles(DidChangeWatchedFilesParams params) {
        var session = server.session();
        if (session.isEmpty()) {
            return;
        }
        var analyzer = session.get().analyzer();
        var pending = new ArrayList<CompletableFuture<?>>();
        boolean valuesChanged = false;
        for (var event : params.getChanges()) {
            var uri = LspConversions.toUri(event.getUri());
            if (isEnvFile(session.get(), uri.getPath())) {
                valuesChanged = true;
                continue;
            }
            pending.add(switch (event.getType()) {
                case Created -> analyzer.onWorkspaceFileCreated(uri);
                case Changed -> analyzer.onWorkspaceFileChanged(uri);
                case Deleted -> analyzer.onWorkspaceFileDeleted(uri);
            });
        }
        if (valuesChanged) {
            logger.debug("Environment files changed; refreshing values");
            var values = session.get().values();
            pending.add(analyzer.runInBackground("refresh-values", token -> {
                if (!token.isCancelled()) {
                    values.refresh(new RefreshOptions(true));
                }
                return null;
            }).future());
        }
        lastFileEvents = CompletableFuture.allOf(pending.toArray(CompletableFuture[]::new));
    }

    /** Completes once the most recent batch of watched-file events has been applied. */
    CompletableFuture<Void> lastFileEvents() {
        return lastFileEvents;
    }

    private static boolean isEnvFile(EnvLensSession session, String path) {
        if (path == null) {
            return false;
        }
        var file = Path.of(path).getFileName();
        return file != null && session.config().envFiles().stream()
                .anyMatch(name -> Path.of(name).getFileName().toString().equals(file.toString()));
    }
}

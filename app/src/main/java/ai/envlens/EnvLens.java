package ai.envlens;

import ai.envlens.lsp.EnvLanguageServer;
import java.util.concurrent.ExecutionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.lsp4j.launch.LSPLauncher;

/** Runs the language server over stdin/stdout. All logging goes to stderr. */
public final class EnvLens {
    private static final Logger logger = LogManager.getLogger(EnvLens.class);

    private EnvLens() {}

    public static void main(String[] args) throws InterruptedException {
        var server = new EnvLanguageServer();
        var launcher = LSPLauncher.createServerLauncher(server, System.in, System.out);
        server.connect(launcher.getRemoteProxy());
        logger.info("EnvLens language server listening on stdio");
        try {
            launcher.startListening().get();
        } catch (ExecutionException e) {
            logger.error("Language server connection failed", e.getCause());
            System.exit(1);
        }
    }
}

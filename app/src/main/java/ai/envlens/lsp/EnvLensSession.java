package ai.envlens.lsp;

import ai.envlens.analyzer.EnvAnalyzer;
import ai.envlens.analyzer.LanguageRegistry;
import ai.envlens.config.ConfigLoader;
import ai.envlens.config.EnvLensConfig;
import ai.envlens.env.DotenvValueProvider;
import ai.envlens.env.EnvValueProvider;
import ai.envlens.env.FileContext;
import ai.envlens.env.MaskingValueMasker;
import ai.envlens.env.TimeoutEnvValueProvider;
import ai.envlens.env.ValueMasker;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Everything the request handlers share for one workspace: configuration, analyzer and value sources. */
public final class EnvLensSession implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(EnvLensSession.class);

    private final Path root;
    private final EnvLensConfig config;
    private final EnvAnalyzer analyzer;
    private final EnvValueProvider values;
    private final ValueMasker masker;

    public EnvLensSession(Path root, EnvLensConfig config, EnvAnalyzer analyzer, EnvValueProvider values,
                          ValueMasker masker) {
        this.root = root;
        this.config = config;
        this.analyzer = analyzer;
        this.values = values;
        this.masker = masker;
    }

    /** Builds a session from {@code .envlens.json} at {@code root}, with dotenv files as the value source. */
    public static EnvLensSession start(Path root) {
        var config = ConfigLoader.load(root);
        var analyzer = new EnvAnalyzer(
                LanguageRegistry.withDefaults(), config.indexing().toIndexingConfig(root), config.debounceMillis());
        var values = new TimeoutEnvValueProvider(
                new DotenvValueProvider(root, config.envFiles()),
                Duration.ofMillis(config.lookupTimeoutMillis()),
                Duration.ofMillis(config.refreshTimeoutMillis()));
        logger.info("Session started for {}", root);
        return new EnvLensSession(root, config, analyzer, values, MaskingValueMasker.from(config.masking()));
    }

    public Path root() {
        return root;
    }

    public EnvLensConfig config() {
        return config;
    }

    public EnvAnalyzer analyzer() {
        return analyzer;
    }

    public EnvValueProvider values() {
        return values;
    }

    public ValueMasker masker() {
        return masker;
    }

    public FileContext contextFor(URI uri) {
        return new FileContext(uri, root);
    }

    @Override
    public void close() {
        analyzer.shutdown(Duration.ofSeconds(5));
        if (values instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                logger.warn("Failed to close value provider", e);
            }
        }
    }
}

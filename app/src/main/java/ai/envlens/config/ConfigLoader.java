package ai.envlens.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Reads {@link EnvLensConfig} from the workspace root. Never fails: problems fall back to the defaults. */
public final class ConfigLoader {
    private static final Logger logger = LogManager.getLogger(ConfigLoader.class);

    public static final String CONFIG_FILE = ".envlens.json";

    private static final ObjectMapper MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ConfigLoader() {}

    public static EnvLensConfig load(Path workspaceRoot) {
        var file = workspaceRoot.resolve(CONFIG_FILE);
        if (!Files.isRegularFile(file)) {
            logger.debug("No {} in {}; using defaults", CONFIG_FILE, workspaceRoot);
            return EnvLensConfig.defaults();
        }
        try {
            var config = MAPPER.readValue(file.toFile(), EnvLensConfig.class);
            if (config == null) {
                return EnvLensConfig.defaults();
            }
            logger.info("Loaded configuration from {}", file);
            return config;
        } catch (IOException e) {
            logger.warn("Could not read {}; using defaults: {}", file, e.getMessage());
            return EnvLensConfig.defaults();
        }
    }
}

package ai.envlens.env;

import java.net.URI;
import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;

/** The file a lookup is made on behalf of; value sources may scope their answer to it. */
public record FileContext(@Nullable URI uri, Path workspaceRoot) {}

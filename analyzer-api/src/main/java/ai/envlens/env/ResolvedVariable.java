package ai.envlens.env;

import ai.envlens.analyzer.SourceRange;
import java.net.URI;
import org.jetbrains.annotations.Nullable;

/**
 * A variable value produced by a value source.
 *
 * @param source human readable origin, e.g. {@code ".env"} or {@code "shell"}
 * @param definingUri file the value was defined in, when it came from a file
 * @param definingRange range of the definition inside {@code definingUri}
 */
public record ResolvedVariable(
        String name, String value, String source, @Nullable URI definingUri, @Nullable SourceRange definingRange) {}

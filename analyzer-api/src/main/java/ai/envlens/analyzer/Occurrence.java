package ai.envlens.analyzer;

import java.net.URI;

/** A place in the workspace where a variable is read. */
public record Occurrence(URI uri, SourceRange range) {}

package ai.envlens.analyzer;

/** The canonical variable a position denotes and the route taken to reach it. */
public record Resolution(String canonicalName, SourceKind sourceKind) {}

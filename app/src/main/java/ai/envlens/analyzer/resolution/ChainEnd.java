package ai.envlens.analyzer.resolution;

import org.jetbrains.annotations.Nullable;

/** Where a local binding chain stops. */
public sealed interface ChainEnd permits ChainEnd.EnvVar, ChainEnd.EnvObject, ChainEnd.Imported, ChainEnd.None {

    ChainEnd NONE = new None();

    record EnvVar(String name) implements ChainEnd {}

    record EnvObject(String canonicalName) implements ChainEnd {}

    /** The chain leaves the file through an imported name, optionally reading {@code key} off it. */
    record Imported(String localName, @Nullable String key) implements ChainEnd {}

    /** Unrelated, shadowed, malformed, or deeper than the hop limit. */
    record None() implements ChainEnd {}
}

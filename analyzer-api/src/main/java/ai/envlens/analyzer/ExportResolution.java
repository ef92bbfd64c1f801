package ai.envlens.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * What one exported name of a module resolves to. {@code hops} counts the links the exporting file followed to reach
 * the result; an importer charges them to its own depth budget.
 */
public sealed interface ExportResolution
        permits ExportResolution.EnvVar,
                ExportResolution.EnvObject,
                ExportResolution.ReExport,
                ExportResolution.Opaque {

    default boolean isEnvRelated() {
        return !(this instanceof Opaque);
    }

    /** The export is a single variable read. */
    record EnvVar(String name, int hops) implements ExportResolution {
        public EnvVar(String name) {
            this(name, 0);
        }
    }

    /** The export is the whole environment object, e.g. {@code export const env = process.env}. */
    record EnvObject(String canonicalName, int hops) implements ExportResolution {
        public EnvObject(String canonicalName) {
            this(canonicalName, 0);
        }
    }

    /**
     * The export forwards a name imported from another module; {@code propertyKey} is set when the export reads a key
     * off that imported name.
     */
    record ReExport(String specifier, String originalName, @Nullable String propertyKey, int hops)
            implements ExportResolution {
        public ReExport(String specifier, String originalName, @Nullable String propertyKey) {
            this(specifier, originalName, propertyKey, 0);
        }
    }

    /** Not related to the environment, or not statically known. */
    record Opaque() implements ExportResolution {
        public static final Opaque INSTANCE = new Opaque();
    }
}

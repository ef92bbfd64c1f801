package ai.envlens.analyzer;

/** How a token reaches its canonical environment variable. */
public enum SourceKind {
    /** A literal read such as {@code process.env.X} or {@code os.getenv("X")}. */
    DIRECT_REFERENCE,
    /** The declared name of a local binding. */
    LOCAL_BINDING,
    /** A later use of a local binding. */
    LOCAL_USAGE,
    /** A name imported from another file of the workspace. */
    CROSS_MODULE_IMPORT,
    /** A property or subscript read through a local alias of the whole environment object. */
    ENV_OBJECT_ALIAS
}

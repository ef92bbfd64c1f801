package ai.envlens.analyzer;

/** Capture names shared by every {@code treesitter/<lang>/*.scm} query. */
public final class EnvCaptureNames {
    private EnvCaptureNames() {}

    // environment reads
    public static final String ENV_ACCESS = "env.access";
    public static final String ENV_OBJECT = "env.object";
    public static final String ENV_CALLEE = "env.callee";
    public static final String ENV_RECEIVER = "env.receiver";
    public static final String ENV_METHOD = "env.method";
    public static final String ENV_MACRO = "env.macro";
    public static final String ENV_KEY = "env.key";
    public static final String ENV_DEFAULT = "env.default";
    public static final String ENV_FALLBACK = "env.fallback";

    // single-name declarations and reassignments
    public static final String DECL_NAME = "decl.name";
    public static final String DECL_VALUE = "decl.value";
    public static final String DECL_DECLARATION = "decl.declaration";

    // formal parameters, which shadow outer names
    public static final String PARAM_NAME = "param.name";

    // object destructuring
    public static final String DESTRUCTURE_KEY = "destructure.key";
    public static final String DESTRUCTURE_NAME = "destructure.name";
    public static final String DESTRUCTURE_DEFAULT = "destructure.default";
    public static final String DESTRUCTURE_SOURCE = "destructure.source";
    public static final String DESTRUCTURE_DECLARATION = "destructure.declaration";

    // imports
    public static final String IMPORT_STATEMENT = "import.statement";
    public static final String IMPORT_SOURCE = "import.source";
    public static final String IMPORT_MODULE = "import.module";
    public static final String IMPORT_PATH = "import.path";
    public static final String IMPORT_NAME = "import.name";
    public static final String IMPORT_ALIAS = "import.alias";
    public static final String IMPORT_DEFAULT = "import.default";
    public static final String IMPORT_NAMESPACE = "import.namespace";
    public static final String IMPORT_SPECIFIER = "import.specifier";
    public static final String IMPORT_REQUIRE = "import.require";

    // exports
    public static final String EXPORT_STATEMENT = "export.statement";
    public static final String EXPORT_NAME = "export.name";
    public static final String EXPORT_VALUE = "export.value";
    public static final String EXPORT_LOCAL = "export.local";
    public static final String EXPORT_SPECIFIER = "export.specifier";
    public static final String EXPORT_WILDCARD = "export.wildcard";
    public static final String EXPORT_DEFAULT = "export.default";
    public static final String EXPORT_CJS_OBJECT = "export.cjs_object";
    public static final String EXPORT_CJS_TARGET = "export.cjs_target";
}

package ai.envlens.analyzer;

import java.util.Locale;

/** Query families a language profile may provide; a profile without a category simply finds nothing of that kind. */
public enum QueryCategory {
    DIRECT_CALL,
    SUBSCRIPT,
    OBJECT_ALIAS_DECL,
    DESTRUCTURE_DECL,
    IMPORT_STMT,
    EXPORT_STMT,
    PARAMETER;

    /** Resource file name, e.g. {@code object_alias_decl.scm}. */
    public String resourceName() {
        return name().toLowerCase(Locale.ROOT) + ".scm";
    }
}

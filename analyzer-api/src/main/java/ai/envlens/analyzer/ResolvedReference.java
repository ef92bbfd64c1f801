package ai.envlens.analyzer;

/** A reference of an open document together with the variable it was resolved to. */
public record ResolvedReference(Reference reference, Resolution resolution) {

    /** True when the variable name is written out at the reference rather than reached through a binding. */
    public boolean isLiteral() {
        return reference.token().equals(resolution.canonicalName());
    }
}

package ai.envlens.analyzer.document;

public enum BindingKind {
    /** {@code const a = process.env.A}: the binding holds one variable's value. */
    DIRECT_ENV_ACCESS,
    /** {@code const env = process.env}: the binding is the environment object itself. */
    OBJECT_ALIAS,
    /** {@code const { A } = env}, or {@code const a = env.A} through an alias: reads one key of another binding. */
    DESTRUCTURED,
    /** {@code const b = a}: forwards another binding or an imported name. */
    REASSIGNMENT,
    /** Unrelated to the environment; still shadows outer bindings of the same name. */
    OPAQUE
}

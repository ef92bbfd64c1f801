package ai.envlens.env;

/** Decides how a value is displayed. Only presentation code calls this. */
public interface ValueMasker {

    String display(ResolvedVariable variable);

    ValueMasker PLAIN = ResolvedVariable::value;
}

package ai.envlens.env;

import java.util.List;
import java.util.Optional;

/**
 * Resolves what an environment variable's value is. Implementations own source discovery, precedence and
 * interpolation; the analysis core only ever asks by canonical name.
 */
public interface EnvValueProvider {

    Optional<ResolvedVariable> lookup(String name, FileContext context);

    List<ResolvedVariable> lookupAll(FileContext context);

    void refresh(RefreshOptions options);
}

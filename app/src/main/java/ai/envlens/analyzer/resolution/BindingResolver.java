package ai.envlens.analyzer.resolution;

import ai.envlens.analyzer.document.Binding;
import java.util.function.IntFunction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Walks a binding chain inside one document. The walk is iterative; each followed link spends one hop of the
 * {@link DepthBudget}, and at most one pending key is carried (a key read off a key is not an environment read).
 */
public final class BindingResolver {
    private static final Logger logger = LogManager.getLogger(BindingResolver.class);

    private BindingResolver() {}

    public static ChainEnd walk(IntFunction<Binding> arena, int bindingId, @Nullable String pendingKey,
                                DepthBudget budget) {
        int current = bindingId;
        String key = pendingKey;
        while (true) {
            var binding = arena.apply(current);
            switch (binding.kind()) {
                case DIRECT_ENV_ACCESS -> {
                    if (key != null || binding.envVar() == null) {
                        return ChainEnd.NONE;
                    }
                    return new ChainEnd.EnvVar(binding.envVar());
                }
                case OBJECT_ALIAS -> {
                    if (key != null) {
                        return new ChainEnd.EnvVar(key);
                    }
                    return binding.objectName() == null ? ChainEnd.NONE : new ChainEnd.EnvObject(binding.objectName());
                }
                case OPAQUE -> {
                    return ChainEnd.NONE;
                }
                case REASSIGNMENT -> {
                    if (!budget.tryHop()) {
                        return exhausted(binding, budget);
                    }
                    if (binding.targetId() >= 0) {
                        current = binding.targetId();
                        continue;
                    }
                    return binding.targetName() != null
                            ? new ChainEnd.Imported(binding.targetName(), key)
                            : ChainEnd.NONE;
                }
                case DESTRUCTURED -> {
                    if (key != null || binding.key() == null) {
                        return ChainEnd.NONE;
                    }
                    if (!budget.tryHop()) {
                        return exhausted(binding, budget);
                    }
                    if (binding.objectName() != null) {
                        return new ChainEnd.EnvVar(binding.key());
                    }
                    key = binding.key();
                    if (binding.targetId() >= 0) {
                        current = binding.targetId();
                        continue;
                    }
                    return binding.targetName() != null
                            ? new ChainEnd.Imported(binding.targetName(), key)
                            : ChainEnd.NONE;
                }
                default -> throw new IllegalStateException("Unexpected binding kind " + binding.kind());
            }
        }
    }

    private static ChainEnd exhausted(Binding binding, DepthBudget budget) {
        logger.debug("Chain through {} exceeded {} hops", binding.name(), budget.limit());
        return ChainEnd.NONE;
    }
}

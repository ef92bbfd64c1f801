package ai.envlens.analyzer.resolution;

import ai.envlens.analyzer.Reference;
import ai.envlens.analyzer.Resolution;
import ai.envlens.analyzer.SourceKind;
import ai.envlens.analyzer.document.DocumentSnapshot;
import java.util.Optional;

/**
 * Settles the canonical name of a {@link Reference}. References already settled during analysis are returned as
 * they are; the rest are walked locally and then across modules under one shared {@link DepthBudget}.
 */
public final class ResolutionEngine {
    private final CrossModuleResolver crossModule;

    public ResolutionEngine(CrossModuleResolver crossModule) {
        this.crossModule = crossModule;
    }

    public Optional<Resolution> resolve(DocumentSnapshot snapshot, Reference reference) {
        if (reference.canonicalName() != null) {
            return Optional.of(new Resolution(reference.canonicalName(), reference.kind()));
        }
        var profile = snapshot.profile();
        if (profile == null) {
            return Optional.empty();
        }
        var symbols = snapshot.symbols();
        var budget = DepthBudget.standard();
        Optional<String> name = Optional.empty();
        if (reference.kind() == SourceKind.CROSS_MODULE_IMPORT && reference.via() != null) {
            name = crossModule.resolveImported(snapshot.uri(), profile, symbols.imports(), reference.via(),
                    reference.propertyKey(), budget);
        } else if (reference.bindingId() >= 0) {
            var key = reference.kind() == SourceKind.ENV_OBJECT_ALIAS ? reference.propertyKey() : null;
            var end = BindingResolver.walk(symbols::binding, reference.bindingId(), key, budget);
            if (end instanceof ChainEnd.EnvVar v) {
                name = Optional.of(v.name());
            } else if (end instanceof ChainEnd.Imported i) {
                name = crossModule.resolveImported(snapshot.uri(), profile, symbols.imports(), i.localName(), i.key(),
                        budget);
            }
        }
        return name.map(n -> new Resolution(n, reference.kind()));
    }
}

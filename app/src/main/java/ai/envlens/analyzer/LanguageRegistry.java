package ai.envlens.analyzer;

import ai.envlens.analyzer.lang.BashProfile;
import ai.envlens.analyzer.lang.CSharpProfile;
import ai.envlens.analyzer.lang.CppProfile;
import ai.envlens.analyzer.lang.GoProfile;
import ai.envlens.analyzer.lang.JavaProfile;
import ai.envlens.analyzer.lang.JavascriptProfile;
import ai.envlens.analyzer.lang.PhpProfile;
import ai.envlens.analyzer.lang.PythonProfile;
import ai.envlens.analyzer.lang.RubyProfile;
import ai.envlens.analyzer.lang.RustProfile;
import ai.envlens.analyzer.lang.TypescriptProfile;
import java.net.URI;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Language id and file extension lookup of {@link LanguageProfile}s. Immutable once built. */
public final class LanguageRegistry {
    private static final Logger logger = LogManager.getLogger(LanguageRegistry.class);

    private final List<LanguageProfile> profiles;
    private final Map<String, LanguageProfile> byLanguageId;
    private final Map<String, LanguageProfile> byExtension;

    public LanguageRegistry(List<LanguageProfile> profiles) {
        this.profiles = List.copyOf(profiles);
        var ids = new LinkedHashMap<String, LanguageProfile>();
        var extensions = new LinkedHashMap<String, LanguageProfile>();
        for (var profile : profiles) {
            for (var id : profile.languageIds()) {
                var previous = ids.putIfAbsent(id, profile);
                if (previous != null) {
                    logger.warn("Language id {} claimed by both {} and {}", id, previous, profile);
                }
            }
            for (var ext : profile.extensions()) {
                extensions.putIfAbsent(ext.toLowerCase(Locale.ROOT), profile);
            }
        }
        this.byLanguageId = Map.copyOf(ids);
        this.byExtension = Map.copyOf(extensions);
    }

    public static LanguageRegistry withDefaults() {
        return new LanguageRegistry(List.of(
                new JavascriptProfile(),
                new TypescriptProfile(),
                new PythonProfile(),
                new GoProfile(),
                new JavaProfile(),
                new RustProfile(),
                new PhpProfile(),
                new RubyProfile(),
                new CSharpProfile(),
                new CppProfile(),
                new BashProfile()));
    }

    public List<LanguageProfile> profiles() {
        return profiles;
    }

    public Optional<LanguageProfile> byLanguageId(String languageId) {
        return Optional.ofNullable(byLanguageId.get(languageId));
    }

    public Optional<LanguageProfile> forPath(Path path) {
        var fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        var name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return Optional.empty();
        }
        return Optional.ofNullable(byExtension.get(name.substring(dot + 1).toLowerCase(Locale.ROOT)));
    }

    public Optional<LanguageProfile> forUri(URI uri) {
        var path = uri.getPath();
        return path == null ? Optional.empty() : forPath(Path.of(path));
    }

    /** Profile for an opened document: the client's language id first, then the file extension. */
    public Optional<LanguageProfile> resolve(String languageId, URI uri) {
        return byLanguageId(languageId).or(() -> forUri(uri));
    }
}

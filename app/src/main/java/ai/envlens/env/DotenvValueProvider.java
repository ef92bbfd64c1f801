package ai.envlens.env;

import ai.envlens.analyzer.SourceRange;
import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.apache.commons.text.StringEscapeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Values from dotenv files at the workspace root. Files are read lazily and cached until {@link #refresh}; when a
 * name appears in several files the one listed later wins.
 */
public final class DotenvValueProvider implements EnvValueProvider {
    private static final Logger logger = LogManager.getLogger(DotenvValueProvider.class);

    private static final Pattern ENTRY = Pattern.compile("^\\s*(?:export\\s+)?([A-Za-z_][A-Za-z0-9_.]*)\\s*=\\s*(.*)$");

    private final Path workspaceRoot;
    private final List<String> envFiles;
    private volatile @Nullable Map<String, ResolvedVariable> cache;

    public DotenvValueProvider(Path workspaceRoot, List<String> envFiles) {
        this.workspaceRoot = workspaceRoot;
        this.envFiles = List.copyOf(envFiles);
    }

    @Override
    public Optional<ResolvedVariable> lookup(String name, FileContext context) {
        return Optional.ofNullable(variables().get(name));
    }

    @Override
    public List<ResolvedVariable> lookupAll(FileContext context) {
        return List.copyOf(variables().values());
    }

    @Override
    public void refresh(RefreshOptions options) {
        cache = null;
    }

    private Map<String, ResolvedVariable> variables() {
        var current = cache;
        if (current == null) {
            current = load();
            cache = current;
        }
        return current;
    }

    private Map<String, ResolvedVariable> load() {
        var variables = new LinkedHashMap<String, ResolvedVariable>();
        for (var name : envFiles) {
            var file = workspaceRoot.resolve(name);
            if (!Files.isRegularFile(file)) {
                continue;
            }
            try {
                for (var variable : parse(file, Files.readString(file, StandardCharsets.UTF_8))) {
                    variables.put(variable.name(), variable);
                }
            } catch (IOException e) {
                logger.warn("Could not read {}: {}", file, e.getMessage());
            }
        }
        logger.debug("Loaded {} variable(s) from {}", variables.size(), envFiles);
        return Map.copyOf(variables);
    }

    static List<ResolvedVariable> parse(Path file, String content) {
        var result = new ArrayList<ResolvedVariable>();
        var uri = file.toUri();
        var source = String.valueOf(file.getFileName());
        int line = 0;
        for (var raw : Splitter.on('\n').split(content)) {
            var text = raw.endsWith("\r") ? raw.substring(0, raw.length() - 1) : raw;
            var trimmed = text.strip();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                var m = ENTRY.matcher(text);
                if (m.matches()) {
                    var name = m.group(1);
                    int column = m.start(1);
                    var range = SourceRange.of(line, column, line, column + name.length());
                    result.add(new ResolvedVariable(name, unquote(m.group(2)), source, uri, range));
                }
            }
            line++;
        }
        return result;
    }

    /** Double-quoted values take Java-style escapes; single and back quotes are literal. */
    static String unquote(String value) {
        var v = value.strip();
        if (!v.isEmpty()) {
            char first = v.charAt(0);
            if (first == '"' || first == '\'' || first == '`') {
                int close = closingQuote(v, first);
                if (close > 0) {
                    var inner = v.substring(1, close);
                    return first == '"' ? StringEscapeUtils.unescapeJava(inner) : inner;
                }
            }
        }
        int comment = v.indexOf(" #");
        return comment >= 0 ? v.substring(0, comment).strip() : v;
    }

    /** Index of the quote closing the one at 0, or -1; a backslash escapes the next character inside double quotes. */
    private static int closingQuote(String v, char quote) {
        for (int i = 1; i < v.length(); i++) {
            char c = v.charAt(i);
            if (c == '\\' && quote == '"') {
                i++;
            } else if (c == quote) {
                return i;
            }
        }
        return -1;
    }
}

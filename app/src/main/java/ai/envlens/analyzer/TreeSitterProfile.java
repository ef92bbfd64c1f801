package ai.envlens.analyzer;

import static ai.envlens.analyzer.TreeSitterText.field;
import static ai.envlens.analyzer.TreeSitterText.firstNamedChild;
import static ai.envlens.analyzer.TreeSitterText.isPresent;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSQuery;
import org.treesitter.TSTree;

/**
 * Base of the tree-sitter backed profiles. Query sources are read once from {@code treesitter/<id>/<category>.scm};
 * parsers and compiled queries are thread-confined.
 */
public abstract class TreeSitterProfile implements LanguageProfile {
    private static final Logger log = LogManager.getLogger(TreeSitterProfile.class);

    protected static final Set<String> DEFAULT_NON_USAGE_FIELDS =
            Set.of("property", "attribute", "field", "name", "key", "label", "method");

    private static final Set<String> DEFAULT_WRAPPER_TYPES = Set.of(
            "parenthesized_expression", "as_expression", "non_null_expression", "satisfies_expression",
            "type_assertion", "equals_value_clause", "await_expression");

    private static final Set<String> FALLBACK_OPERATORS = Set.of("||", "??", "or");

    private final Map<QueryCategory, String> querySources = new EnumMap<>(QueryCategory.class);
    private final Set<QueryCategory> reportedFailures = ConcurrentHashMap.newKeySet();

    private final ThreadLocal<TSLanguage> tsLanguage = ThreadLocal.withInitial(this::createTSLanguage);
    private final ThreadLocal<TSParser> parser = ThreadLocal.withInitial(() -> {
        var p = new TSParser();
        if (!p.setLanguage(tsLanguage.get())) {
            throw new IllegalStateException("Failed to set tree-sitter language for " + id());
        }
        return p;
    });
    private final ThreadLocal<Map<QueryCategory, Optional<TSQuery>>> queries =
            ThreadLocal.withInitial(() -> new EnumMap<>(QueryCategory.class));

    protected TreeSitterProfile() {
        for (var category : QueryCategory.values()) {
            var source = loadResource("treesitter/" + queryDirectory(category) + "/" + category.resourceName());
            if (source != null) {
                querySources.put(category, source);
            }
        }
        log.debug("Profile {} loaded queries {}", id(), querySources.keySet());
    }

    protected abstract TSLanguage createTSLanguage();

    /** Resource directory holding this profile's queries; profiles sharing a grammar may share queries. */
    protected String queryDirectory() {
        return id();
    }

    protected String queryDirectory(QueryCategory category) {
        return queryDirectory();
    }

    @Override
    public TSTree parse(String text) {
        return parser.get().parseString(null, text);
    }

    @Override
    public Optional<TSQuery> query(QueryCategory category) {
        return queries.get().computeIfAbsent(category, this::compile);
    }

    private Optional<TSQuery> compile(QueryCategory category) {
        var source = querySources.get(category);
        if (source == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(new TSQuery(tsLanguage.get(), source));
        } catch (RuntimeException e) {
            if (reportedFailures.add(category)) {
                log.error("Failed to compile {} query for {}; treating it as absent", category, id(), e);
            }
            return Optional.empty();
        }
    }

    @Override
    public Set<String> identifierNodeTypes() {
        return Set.of("identifier");
    }

    protected Set<String> nonUsageFields() {
        return DEFAULT_NON_USAGE_FIELDS;
    }

    @Override
    public boolean isUsage(TSNode identifier) {
        var parent = identifier.getParent();
        if (!isPresent(parent)) {
            return true;
        }
        for (var fieldName : nonUsageFields()) {
            if (TreeSitterText.sameNode(field(parent, fieldName), identifier)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String memberSeparator() {
        return ".";
    }

    /** Canonical names of the language's environment objects. */
    protected Set<String> envObjects() {
        return Set.of();
    }

    /** Fully qualified callees that read one variable. */
    protected Set<String> envAccessors() {
        return Set.of();
    }

    @Override
    public Optional<String> canonicalEnvObject(String text, ImportContext imports) {
        var compact = TreeSitterText.compact(text);
        if (envObjects().contains(compact)) {
            return Optional.of(compact);
        }
        var rewritten = imports.rewriteHead(compact, memberSeparator());
        return envObjects().contains(rewritten) ? Optional.of(rewritten) : Optional.empty();
    }

    @Override
    public boolean isEnvAccessor(String callee, ImportContext imports) {
        var compact = TreeSitterText.compact(callee);
        return envAccessors().contains(compact)
                || envAccessors().contains(imports.rewriteHead(compact, memberSeparator()));
    }

    @Override
    public Set<String> objectAccessorMethods() {
        return Set.of();
    }

    @Override
    public boolean isEnvModule(String qualifiedName) {
        return envObjects().contains(qualifiedName) || envAccessors().contains(qualifiedName);
    }

    @Override
    public boolean isDiscard(String name) {
        return false;
    }

    @Override
    public boolean bareKeysAreDirect() {
        return false;
    }

    @Override
    public Optional<StringLiteral> stringLiteral(String literalText) {
        int i = 0;
        while (i < literalText.length() && Character.isLetter(literalText.charAt(i))) {
            i++;
        }
        String prefix = literalText.substring(0, i);
        while (i < literalText.length() && literalText.charAt(i) == '#') {
            i++;
        }
        int hashes = i - prefix.length();
        if (i >= literalText.length()) {
            return Optional.empty();
        }
        char quote = literalText.charAt(i);
        if (quote != '"' && quote != '\'' && quote != '`') {
            return Optional.empty();
        }
        int quoteLength = literalText.startsWith(String.valueOf(quote).repeat(3), i) ? 3 : 1;
        int start = i + quoteLength;
        int end = literalText.length() - quoteLength - hashes;
        if (end < start) {
            return Optional.empty();
        }
        String content = literalText.substring(start, end);
        if (isInterpolated(prefix, quote, content)) {
            return Optional.empty();
        }
        return Optional.of(new StringLiteral(content, start));
    }

    protected boolean isInterpolated(String prefix, char quote, String content) {
        return prefix.toLowerCase().contains("f") || (quote == '`' && content.contains("${"));
    }

    /** Node types that are transparent when classifying a value. */
    protected Set<String> wrapperTypes() {
        return DEFAULT_WRAPPER_TYPES;
    }

    @Override
    public TSNode unwrapValue(TSNode value, LineIndex index) {
        var current = value;
        while (true) {
            @Nullable TSNode next = null;
            if (wrapperTypes().contains(current.getType())) {
                next = firstNamedChild(current);
            } else if (isFallbackExpression(current, index)) {
                next = field(current, "left");
            }
            if (next == null) {
                return current;
            }
            current = next;
        }
    }

    /** {@code a || b}, {@code a ?? b}, {@code a or b}. */
    protected boolean isFallbackExpression(TSNode node, LineIndex index) {
        var operator = field(node, "operator");
        return operator != null && FALLBACK_OPERATORS.contains(TreeSitterText.text(operator, index));
    }

    @Override
    public List<CompletionTrigger> completionTriggers() {
        return List.of();
    }

    /** Relative specifiers only: {@code ./x}, {@code ../x}. */
    @Override
    public List<Path> moduleBases(String specifier, Path importerDirectory, Path workspaceRoot) {
        if (specifier.startsWith("./") || specifier.startsWith("../")) {
            return List.of(importerDirectory.resolve(specifier).normalize());
        }
        return List.of();
    }

    @Override
    public List<String> moduleExtensions() {
        return extensions();
    }

    @Override
    public List<String> directoryModuleNames() {
        return List.of();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id() + "]";
    }

    @Nullable
    private static String loadResource(String path) {
        try (InputStream in = TreeSitterProfile.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                return null;
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

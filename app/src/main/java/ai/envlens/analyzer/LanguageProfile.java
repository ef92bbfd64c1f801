package ai.envlens.analyzer;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.treesitter.TSNode;
import org.treesitter.TSQuery;
import org.treesitter.TSTree;

/**
 * Everything the language-neutral analysis needs to know about one language: how to parse it, which queries find
 * environment reads, and which names denote the environment.
 */
public interface LanguageProfile {

    /** Stable identifier, also the resource directory of the profile's queries. */
    String id();

    /** LSP language identifiers served by this profile. */
    Set<String> languageIds();

    /** File extensions without the dot. */
    List<String> extensions();

    TSTree parse(String text);

    /** The compiled query of a category for the calling thread, or empty if the language has none. */
    Optional<TSQuery> query(QueryCategory category);

    /** Node types that open a lexical scope. */
    Set<String> scopeNodeTypes();

    /** Node types of plain identifiers that may be usages of a binding. */
    Set<String> identifierNodeTypes();

    /** Whether {@code identifier} (of an identifier node type) is a usage rather than a member or declared name. */
    boolean isUsage(TSNode identifier);

    /** Separator between a module or object and a member, {@code "."} for most languages. */
    String memberSeparator();

    /** Canonical name of the environment object {@code text} denotes, e.g. {@code process.env}. */
    Optional<String> canonicalEnvObject(String text, ImportContext imports);

    /** Whether a call through {@code callee} with a string first argument reads that variable. */
    boolean isEnvAccessor(String callee, ImportContext imports);

    /** Methods of an environment object taking a variable name, e.g. {@code get} for {@code os.environ}. */
    Set<String> objectAccessorMethods();

    /** Whether an import of this qualified name is part of the language's own environment API. */
    boolean isEnvModule(String qualifiedName);

    /** Whether assigning to {@code name} throws the value away, like Go's {@code _}. */
    boolean isDiscard(String name);

    /** Whether a query match carrying only a key (no object or callee) is already a direct read. */
    boolean bareKeysAreDirect();

    /** Content of a plain string literal; empty for interpolated strings. */
    Optional<StringLiteral> stringLiteral(String literalText);

    /** Strips wrappers that do not change what a value is: parentheses, casts, {@code ||} fallbacks. */
    TSNode unwrapValue(TSNode value, LineIndex index);

    List<CompletionTrigger> completionTriggers();

    /**
     * Paths, without extension, that a module specifier may refer to, or an empty list when the specifier is not
     * resolvable inside the workspace (a package import).
     */
    List<Path> moduleBases(String specifier, Path importerDirectory, Path workspaceRoot);

    /** Extensions tried, in order, when a module specifier omits one. */
    List<String> moduleExtensions();

    /** File names, without extension, that stand for a directory module ({@code index}, {@code __init__}). */
    List<String> directoryModuleNames();
}

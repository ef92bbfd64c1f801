package ai.envlens.analyzer.document;

import static ai.envlens.analyzer.EnvCaptureNames.*;
import static ai.envlens.analyzer.TreeSitterText.compact;
import static ai.envlens.analyzer.TreeSitterText.field;

import ai.envlens.analyzer.ExportResolution;
import ai.envlens.analyzer.FileExports;
import ai.envlens.analyzer.ImportContext;
import ai.envlens.analyzer.LanguageProfile;
import ai.envlens.analyzer.LineIndex;
import ai.envlens.analyzer.ModuleExport;
import ai.envlens.analyzer.QueryCategory;
import ai.envlens.analyzer.QueryRunner;
import ai.envlens.analyzer.Ranges;
import ai.envlens.analyzer.Reference;
import ai.envlens.analyzer.SourceKind;
import ai.envlens.analyzer.SourcePosition;
import ai.envlens.analyzer.SourceRange;
import ai.envlens.analyzer.TreeSitterText;
import ai.envlens.analyzer.resolution.BindingResolver;
import ai.envlens.analyzer.resolution.ChainEnd;
import ai.envlens.analyzer.resolution.DepthBudget;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * One analysis of one document version. Facts from every query category are turned into events ordered by source
 * position: reads and usages fire at their start, declarations at their end, so a declaration only ever sees
 * bindings declared before it and never itself.
 */
final class AnalysisPass {
    private static final Logger logger = LogManager.getLogger(AnalysisPass.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][\\w$]*");
    private static final Set<String> FALLBACK_OPERATORS = Set.of("||", "??", "or");
    private static final Set<String> CJS_EXPORT_OBJECTS = Set.of("exports", "module.exports");

    private static final int DECLARATION = 0;
    private static final int ACCESS = 1;
    private static final int USAGE = 2;

    private final LanguageProfile profile;
    private final LineIndex index;
    // holds the native tree alive while its nodes are in use
    private final TSTree tree;
    private final TSNode root;
    private final String separator;
    private final boolean crossModule;

    private ImportContext imports = ImportContext.EMPTY;
    private final List<SourceRange> importStatements = new ArrayList<>();
    private final List<ScopeBuilder> scopes = new ArrayList<>();
    private final List<TSNode> identifiers = new ArrayList<>();
    private final List<Binding> arena = new ArrayList<>();
    private final Map<SourceRange, Reference> references = new LinkedHashMap<>();
    private final Map<Long, AccessResult> accessResults = new HashMap<>();
    private final Set<Integer> consumedStarts = new HashSet<>();
    private final Set<Long> declaredNames = new HashSet<>();

    private static final class ScopeBuilder {
        final int id;
        final int parentId;
        final SourceRange range;
        final List<Integer> children = new ArrayList<>();
        final Map<String, Integer> current = new HashMap<>();

        ScopeBuilder(int id, int parentId, SourceRange range) {
            this.id = id;
            this.parentId = parentId;
            this.range = range;
        }
    }

    private record Frame(TSNode node, int scopeId) {}

    private record Event(int offset, int priority, int order, Runnable action) {}

    private record AccessFact(
            TSNode access, @Nullable TSNode object, @Nullable String callee, TSNode key, @Nullable TSNode fallback) {}

    private record DeclarationFact(TSNode name, TSNode value, TSNode declaration) {}

    private record DestructureFact(
            TSNode key, @Nullable TSNode name, @Nullable TSNode fallback, TSNode source, TSNode declaration) {}

    private record Key(String text, SourceRange range) {}

    private enum AccessKind { DIRECT, ALIAS, IMPORTED }

    private record AccessResult(
            AccessKind kind, String key, int bindingId, @Nullable String importName, @Nullable String defaultValue) {}

    AnalysisPass(LanguageProfile profile, LineIndex index, TSTree tree) {
        this.profile = profile;
        this.index = index;
        this.tree = tree;
        this.root = tree.getRootNode();
        this.separator = profile.memberSeparator();
        this.crossModule = profile.query(QueryCategory.EXPORT_STMT).isPresent();
    }

    SymbolTable run() {
        collectImports();
        collectScopesAndIdentifiers();

        var events = new ArrayList<Event>();
        for (var fact : collectAccesses()) {
            events.add(new Event(fact.access().getStartByte(), ACCESS, events.size(), () -> onAccess(fact)));
        }
        for (var fact : collectDeclarations()) {
            events.add(new Event(fact.declaration().getEndByte(), DECLARATION, events.size(), () -> onDeclaration(fact)));
        }
        for (var fact : collectDestructures()) {
            events.add(new Event(fact.declaration().getEndByte(), DECLARATION, events.size(), () -> onDestructure(fact)));
        }
        for (var parameter : collectParameters()) {
            events.add(new Event(parameter.getEndByte(), DECLARATION, events.size(), () -> onParameter(parameter)));
        }
        for (var identifier : identifiers) {
            events.add(new Event(identifier.getStartByte(), USAGE, events.size(), () -> onUsage(identifier)));
        }
        events.sort(Comparator.comparingInt(Event::offset)
                .thenComparingInt(Event::priority)
                .thenComparingInt(Event::order));
        for (var event : events) {
            event.action().run();
        }

        var exports = crossModule ? extractExports() : FileExports.EMPTY;
        var sorted = new ArrayList<>(references.values());
        sorted.sort(Comparator.comparing((Reference r) -> r.range().start()).thenComparing(r -> r.range().end()));
        var frozenScopes = scopes.stream()
                .map(s -> new Scope(s.id, s.parentId, s.range, s.children, s.current))
                .toList();
        return new SymbolTable(arena, frozenScopes, sorted, imports, exports);
    }

    // ---------------------------------------------------------------- imports

    private void collectImports() {
        var builder = ImportContext.builder();
        for (var m : QueryRunner.matches(profile, QueryCategory.IMPORT_STMT, root)) {
            var statement = m.get(IMPORT_STATEMENT);
            if (statement == null) {
                continue;
            }
            var require = m.get(IMPORT_REQUIRE);
            if (require != null && !text(require).equals("require")) {
                continue;
            }
            var statementRange = range(statement);
            var alias = m.get(IMPORT_ALIAS);
            var source = m.get(IMPORT_SOURCE);
            String specifier = source == null ? null : literalOrText(source);

            ImportContext.ImportBinding binding = null;
            if (m.containsKey(IMPORT_MODULE)) {
                String module = compact(text(m.get(IMPORT_MODULE)));
                if (alias != null) {
                    binding = new ImportContext.ImportBinding(text(alias), module, module, ImportContext.Kind.MODULE,
                            statementRange);
                } else {
                    int dot = module.indexOf('.');
                    String head = dot < 0 ? module : module.substring(0, dot);
                    binding = new ImportContext.ImportBinding(head, head, head, ImportContext.Kind.MODULE,
                            statementRange);
                }
            } else if (m.containsKey(IMPORT_PATH)) {
                String path = compact(text(m.get(IMPORT_PATH)));
                int cut = path.lastIndexOf(separator);
                if (cut > 0) {
                    String original = path.substring(cut + separator.length());
                    String local = alias != null ? text(alias) : original;
                    binding = new ImportContext.ImportBinding(local, path.substring(0, cut), original,
                            ImportContext.Kind.NAMED, statementRange);
                }
            } else if (specifier != null && m.containsKey(IMPORT_NAME)) {
                String original = compact(text(m.get(IMPORT_NAME)));
                var specifierNode = m.get(IMPORT_SPECIFIER);
                var specifierAlias = specifierNode == null ? null : field(specifierNode, "alias");
                String local = specifierAlias != null ? text(specifierAlias) : alias != null ? text(alias) : original;
                binding = new ImportContext.ImportBinding(local, specifier, original, ImportContext.Kind.NAMED,
                        statementRange);
            } else if (specifier != null && m.containsKey(IMPORT_DEFAULT)) {
                binding = new ImportContext.ImportBinding(text(m.get(IMPORT_DEFAULT)), specifier, "default",
                        ImportContext.Kind.DEFAULT, statementRange);
            } else if (specifier != null && m.containsKey(IMPORT_NAMESPACE)) {
                binding = new ImportContext.ImportBinding(text(m.get(IMPORT_NAMESPACE)), specifier, "*",
                        ImportContext.Kind.NAMESPACE, statementRange);
            } else if (specifier != null) {
                // a bare path import: Go's import "os" or import o "os"
                var name = field(statement, "name");
                int slash = specifier.lastIndexOf('/');
                String local = name != null ? text(name) : specifier.substring(slash + 1);
                binding = new ImportContext.ImportBinding(local, specifier, specifier, ImportContext.Kind.MODULE,
                        statementRange);
            }
            if (binding != null) {
                importStatements.add(statementRange);
                builder.add(binding);
            }
        }
        imports = builder.build();
    }

    /** Whether reads through this import may reach another workspace file. */
    private boolean isForeignImport(ImportContext.ImportBinding binding) {
        return crossModule
                && binding.kind() != ImportContext.Kind.MODULE
                && !profile.isEnvModule(binding.specifier())
                && !profile.isEnvModule(binding.qualifiedName(separator));
    }

    private boolean insideImport(TSNode node) {
        var r = range(node);
        for (var statement : importStatements) {
            if (Ranges.encloses(statement, r)) {
                return true;
            }
        }
        return false;
    }

    // ------------------------------------------------------ scopes, identifiers

    private void collectScopesAndIdentifiers() {
        scopes.add(new ScopeBuilder(Scope.ROOT, Scope.NO_PARENT, index.fullRange()));
        var scopeTypes = profile.scopeNodeTypes();
        var identifierTypes = profile.identifierNodeTypes();

        var stack = new ArrayDeque<Frame>();
        pushChildren(stack, root, Scope.ROOT);
        while (!stack.isEmpty()) {
            var frame = stack.pop();
            var node = frame.node();
            int scopeId = frame.scopeId();
            var type = node.getType();
            if (scopeTypes.contains(type)) {
                var scope = new ScopeBuilder(scopes.size(), scopeId, range(node));
                scopes.get(scopeId).children.add(scope.id);
                scopes.add(scope);
                scopeId = scope.id;
            }
            if (identifierTypes.contains(type) && profile.isUsage(node)) {
                identifiers.add(node);
            }
            pushChildren(stack, node, scopeId);
        }
    }

    private static void pushChildren(ArrayDeque<Frame> stack, TSNode node, int scopeId) {
        for (int i = node.getNamedChildCount() - 1; i >= 0; i--) {
            stack.push(new Frame(node.getNamedChild(i), scopeId));
        }
    }

    private ScopeBuilder scopeAt(SourcePosition position) {
        var scope = scopes.get(Scope.ROOT);
        descend:
        while (true) {
            for (int childId : scope.children) {
                var child = scopes.get(childId);
                if (Ranges.containsPosition(child.range, position)) {
                    scope = child;
                    continue descend;
                }
            }
            return scope;
        }
    }

    @Nullable
    private Binding lookupCurrent(String name, SourcePosition position) {
        var scope = scopeAt(position);
        while (true) {
            var id = scope.current.get(name);
            if (id != null) {
                return arena.get(id);
            }
            if (scope.parentId == Scope.NO_PARENT) {
                return null;
            }
            scope = scopes.get(scope.parentId);
        }
    }

    private void insert(Binding binding) {
        arena.add(binding);
        scopes.get(binding.scopeId()).current.put(binding.name(), binding.id());
    }

    // ------------------------------------------------------------- collection

    private List<AccessFact> collectAccesses() {
        var byAccess = new LinkedHashMap<Long, AccessFact>();
        for (var category : List.of(QueryCategory.DIRECT_CALL, QueryCategory.SUBSCRIPT)) {
            for (var m : QueryRunner.matches(profile, category, root)) {
                var access = m.get(ENV_ACCESS);
                var key = m.get(ENV_KEY);
                if (access == null || key == null) {
                    continue;
                }
                String callee = null;
                if (m.containsKey(ENV_CALLEE)) {
                    callee = text(m.get(ENV_CALLEE));
                } else if (m.containsKey(ENV_RECEIVER) && m.containsKey(ENV_METHOD)) {
                    callee = text(m.get(ENV_RECEIVER)) + separator + text(m.get(ENV_METHOD));
                } else if (m.containsKey(ENV_MACRO)) {
                    callee = text(m.get(ENV_MACRO)) + "!";
                }
                var fallback = m.get(ENV_DEFAULT);
                var fallbackExpression = m.get(ENV_FALLBACK);
                if (fallback != null && fallbackExpression != null && !isFallbackOperator(fallbackExpression)) {
                    fallback = null;
                }
                var fact = new AccessFact(access, m.get(ENV_OBJECT), callee, key, fallback);
                var existing = byAccess.get(nodeKey(access));
                if (existing == null || (existing.fallback() == null && fallback != null)
                        || (existing.callee() != null && callee != null && callee.length() > existing.callee().length())) {
                    byAccess.put(nodeKey(access), fact);
                }
            }
        }
        return new ArrayList<>(byAccess.values());
    }

    private List<DeclarationFact> collectDeclarations() {
        var facts = new LinkedHashMap<Long, DeclarationFact>();
        for (var m : QueryRunner.matches(profile, QueryCategory.OBJECT_ALIAS_DECL, root)) {
            var name = m.get(DECL_NAME);
            var value = m.get(DECL_VALUE);
            if (name == null || value == null) {
                continue;
            }
            var declaration = m.getOrDefault(DECL_DECLARATION, value);
            if (insideImport(declaration)) {
                continue;
            }
            declaredNames.add(nodeKey(name));
            facts.putIfAbsent(nodeKey(name), new DeclarationFact(name, value, declaration));
        }
        return new ArrayList<>(facts.values());
    }

    private List<DestructureFact> collectDestructures() {
        var facts = new LinkedHashMap<Long, DestructureFact>();
        for (var m : QueryRunner.matches(profile, QueryCategory.DESTRUCTURE_DECL, root)) {
            var key = m.get(DESTRUCTURE_KEY);
            var source = m.get(DESTRUCTURE_SOURCE);
            var declaration = m.get(DESTRUCTURE_DECLARATION);
            if (key == null || source == null || declaration == null || insideImport(declaration)) {
                continue;
            }
            var name = m.get(DESTRUCTURE_NAME);
            var nameNode = name != null ? name : key;
            declaredNames.add(nodeKey(nameNode));
            facts.putIfAbsent(nodeKey(nameNode),
                    new DestructureFact(key, name, m.get(DESTRUCTURE_DEFAULT), source, declaration));
        }
        return new ArrayList<>(facts.values());
    }

    private List<TSNode> collectParameters() {
        var parameters = new LinkedHashMap<Long, TSNode>();
        for (var m : QueryRunner.matches(profile, QueryCategory.PARAMETER, root)) {
            var name = m.get(PARAM_NAME);
            if (name != null && !declaredNames.contains(nodeKey(name))) {
                declaredNames.add(nodeKey(name));
                parameters.putIfAbsent(nodeKey(name), name);
            }
        }
        return new ArrayList<>(parameters.values());
    }

    // ----------------------------------------------------------------- events

    private void onAccess(AccessFact fact) {
        var key = keyOf(fact.key());
        if (key == null) {
            return;
        }
        var at = position(fact.access());
        int start = fact.access().getStartByte();
        String defaultValue = fact.fallback() == null ? null : literalOrText(fact.fallback());

        AccessResult result = null;
        if (fact.callee() != null) {
            var callee = compact(fact.callee());
            if (profile.isEnvAccessor(callee, imports)) {
                result = direct(key, defaultValue);
            } else {
                int cut = callee.lastIndexOf(separator);
                if (cut > 0) {
                    var receiver = callee.substring(0, cut);
                    var method = callee.substring(cut + separator.length());
                    if (profile.objectAccessorMethods().contains(method)) {
                        if (profile.canonicalEnvObject(receiver, imports).isPresent()) {
                            result = direct(key, defaultValue);
                        } else if (IDENTIFIER.matcher(receiver).matches()) {
                            result = throughName(receiver, key, at, start, defaultValue);
                        }
                    }
                }
            }
        } else if (fact.object() != null) {
            var object = fact.object();
            if (profile.canonicalEnvObject(text(object), imports).isPresent()) {
                result = direct(key, defaultValue);
            } else if (isIdentifier(object)) {
                result = throughName(compact(text(object)), key, at, start, defaultValue);
            }
        } else if (profile.bareKeysAreDirect()) {
            result = direct(key, defaultValue);
        }
        if (result != null) {
            accessResults.put(nodeKey(fact.access()), result);
        }
    }

    private AccessResult direct(Key key, @Nullable String defaultValue) {
        addReference(new Reference(key.text(), key.text(), key.range(), SourceKind.DIRECT_REFERENCE, null, null,
                defaultValue, Reference.NO_BINDING));
        return new AccessResult(AccessKind.DIRECT, key.text(), Binding.NONE, null, defaultValue);
    }

    /** A key read off a local alias or an imported name. */
    @Nullable
    private AccessResult throughName(String name, Key key, SourcePosition at, int start, @Nullable String defaultValue) {
        var binding = lookupCurrent(name, at);
        if (binding != null) {
            if (!binding.isEnvRelated() || binding.kind() == BindingKind.DIRECT_ENV_ACCESS) {
                return null;
            }
            var end = BindingResolver.walk(arena::get, binding.id(), key.text(), DepthBudget.standard());
            String canonical;
            if (end instanceof ChainEnd.EnvVar v) {
                canonical = v.name();
            } else if (end instanceof ChainEnd.Imported) {
                canonical = null;
            } else {
                return null;
            }
            consumedStarts.add(start);
            addReference(new Reference(key.text(), canonical, key.range(), SourceKind.ENV_OBJECT_ALIAS, name,
                    key.text(), defaultValue, binding.id()));
            return new AccessResult(AccessKind.ALIAS, key.text(), binding.id(), null, defaultValue);
        }
        var imported = imports.get(name);
        if (imported.isPresent() && isForeignImport(imported.get())) {
            consumedStarts.add(start);
            addReference(new Reference(key.text(), null, key.range(), SourceKind.CROSS_MODULE_IMPORT, name,
                    key.text(), defaultValue, Reference.NO_BINDING));
            return new AccessResult(AccessKind.IMPORTED, key.text(), Binding.NONE, name, defaultValue);
        }
        return null;
    }

    private void onDeclaration(DeclarationFact fact) {
        var name = compact(text(fact.name()));
        if (profile.isDiscard(name)) {
            return;
        }
        var nameRange = range(fact.name());
        var declarationRange = range(fact.declaration());
        int scopeId = scopeAt(nameRange.start()).id;
        int id = arena.size();
        var value = profile.unwrapValue(fact.value(), index);

        Binding binding;
        var access = accessResults.get(nodeKey(value));
        if (access != null) {
            binding = switch (access.kind()) {
                case DIRECT -> Binding.direct(id, name, scopeId, nameRange, declarationRange, access.key(),
                        access.defaultValue());
                case ALIAS -> Binding.destructured(id, name, scopeId, nameRange, declarationRange, null, access.key(),
                        access.bindingId(), null, access.defaultValue());
                case IMPORTED -> Binding.destructured(id, name, scopeId, nameRange, declarationRange, null,
                        access.key(), Binding.NONE, access.importName(), access.defaultValue());
            };
        } else {
            var object = profile.canonicalEnvObject(text(value), imports);
            if (object.isPresent()) {
                binding = Binding.objectAlias(id, name, scopeId, nameRange, declarationRange, object.get());
            } else if (isIdentifier(value)) {
                binding = forwardTo(id, name, scopeId, nameRange, declarationRange, value);
            } else {
                binding = Binding.opaque(id, name, scopeId, nameRange, declarationRange);
            }
        }
        insert(binding);
        addBindingReference(binding);
    }

    private Binding forwardTo(int id, String name, int scopeId, SourceRange nameRange, SourceRange declarationRange,
                              TSNode value) {
        var targetName = compact(text(value));
        var target = lookupCurrent(targetName, position(value));
        if (target != null) {
            return target.isEnvRelated()
                    ? Binding.reassignment(id, name, scopeId, nameRange, declarationRange, target.id(), null)
                    : Binding.opaque(id, name, scopeId, nameRange, declarationRange);
        }
        var imported = imports.get(targetName);
        if (imported.isPresent() && isForeignImport(imported.get())) {
            return Binding.reassignment(id, name, scopeId, nameRange, declarationRange, Binding.NONE, targetName);
        }
        return Binding.opaque(id, name, scopeId, nameRange, declarationRange);
    }

    private void onDestructure(DestructureFact fact) {
        var key = keyOf(fact.key());
        var nameNode = fact.name() != null ? fact.name() : fact.key();
        var name = compact(text(nameNode));
        if (profile.isDiscard(name)) {
            return;
        }
        var nameRange = range(nameNode);
        var declarationRange = range(fact.declaration());
        int scopeId = scopeAt(nameRange.start()).id;
        int id = arena.size();
        String defaultValue = fact.fallback() == null ? null : literalOrText(fact.fallback());
        var source = profile.unwrapValue(fact.source(), index);

        Binding binding = Binding.opaque(id, name, scopeId, nameRange, declarationRange);
        if (key != null) {
            var object = profile.canonicalEnvObject(text(source), imports);
            if (object.isPresent()) {
                addReference(new Reference(key.text(), key.text(), key.range(), SourceKind.DIRECT_REFERENCE, null,
                        null, defaultValue, Reference.NO_BINDING));
                binding = Binding.destructured(id, name, scopeId, nameRange, declarationRange, object.get(),
                        key.text(), Binding.NONE, null, defaultValue);
            } else if (isIdentifier(source)) {
                var sourceName = compact(text(source));
                var target = lookupCurrent(sourceName, position(source));
                if (target != null && target.isEnvRelated()) {
                    binding = Binding.destructured(id, name, scopeId, nameRange, declarationRange, null, key.text(),
                            target.id(), null, defaultValue);
                } else if (target == null) {
                    var imported = imports.get(sourceName);
                    if (imported.isPresent() && isForeignImport(imported.get())) {
                        binding = Binding.destructured(id, name, scopeId, nameRange, declarationRange, null,
                                key.text(), Binding.NONE, sourceName, defaultValue);
                    }
                }
            }
        }
        insert(binding);
        addBindingReference(binding);
    }

    /** A parameter hides outer bindings of its name for the rest of its function. */
    private void onParameter(TSNode parameter) {
        var name = compact(text(parameter));
        if (profile.isDiscard(name)) {
            return;
        }
        var nameRange = range(parameter);
        insert(Binding.opaque(arena.size(), name, scopeAt(nameRange.start()).id, nameRange, nameRange));
    }

    private void onUsage(TSNode identifier) {
        int start = identifier.getStartByte();
        if (consumedStarts.contains(start) || declaredNames.contains(nodeKey(identifier)) || insideImport(identifier)) {
            return;
        }
        var name = compact(text(identifier));
        var range = range(identifier);
        var binding = lookupCurrent(name, range.start());
        if (binding != null) {
            if (binding.kind() == BindingKind.OPAQUE || binding.kind() == BindingKind.OBJECT_ALIAS) {
                return;
            }
            var end = BindingResolver.walk(arena::get, binding.id(), null, DepthBudget.standard());
            if (end instanceof ChainEnd.EnvVar v) {
                addReference(new Reference(name, v.name(), range, SourceKind.LOCAL_USAGE, name, null,
                        binding.defaultValue(), binding.id()));
            } else if (end instanceof ChainEnd.Imported) {
                addReference(new Reference(name, null, range, SourceKind.LOCAL_USAGE, name, null,
                        binding.defaultValue(), binding.id()));
            }
            return;
        }
        var imported = imports.get(name);
        if (imported.isPresent()
                && isForeignImport(imported.get())
                && imported.get().kind() != ImportContext.Kind.NAMESPACE) {
            addReference(new Reference(name, null, range, SourceKind.CROSS_MODULE_IMPORT, name, null, null,
                    Reference.NO_BINDING));
        }
    }

    private void addBindingReference(Binding binding) {
        if (binding.kind() == BindingKind.OPAQUE || binding.kind() == BindingKind.OBJECT_ALIAS) {
            return;
        }
        var end = BindingResolver.walk(arena::get, binding.id(), null, DepthBudget.standard());
        String canonical;
        if (end instanceof ChainEnd.EnvVar v) {
            canonical = v.name();
        } else if (end instanceof ChainEnd.Imported) {
            canonical = null;
        } else {
            return;
        }
        addReference(new Reference(binding.name(), canonical, binding.nameRange(), SourceKind.LOCAL_BINDING,
                binding.name(), binding.key(), binding.defaultValue(), binding.id()));
    }

    private void addReference(Reference reference) {
        references.putIfAbsent(reference.range(), reference);
    }

    // ---------------------------------------------------------------- exports

    private FileExports extractExports() {
        var named = new LinkedHashMap<String, ModuleExport>();
        ModuleExport defaultExport = null;
        var wildcards = new ArrayList<String>();
        for (var m : QueryRunner.matches(profile, QueryCategory.EXPORT_STMT, root)) {
            var wildcard = m.get(EXPORT_WILDCARD);
            if (wildcard != null) {
                wildcards.add(literalOrText(wildcard));
                continue;
            }
            var local = m.get(EXPORT_LOCAL);
            if (local != null) {
                var specifier = m.get(EXPORT_SPECIFIER);
                var statement = m.get(EXPORT_STATEMENT);
                var aliasNode = specifier == null ? null : field(specifier, "alias");
                var localName = literalOrText(local);
                var exported = aliasNode == null ? localName : literalOrText(aliasNode);
                var source = statement == null ? null : field(statement, "source");
                ExportResolution resolution = source != null
                        ? new ExportResolution.ReExport(literalOrText(source), localName, null)
                        : resolveLocalName(localName);
                var export = new ModuleExport(exported, localName.equals(exported) ? null : localName, resolution,
                        range(specifier != null ? specifier : local), exported.equals("default"));
                if (export.isDefault()) {
                    defaultExport = export;
                } else {
                    named.put(exported, export);
                }
                continue;
            }
            var name = m.get(EXPORT_NAME);
            var value = m.get(EXPORT_VALUE);
            if (name != null && value != null) {
                var cjsObject = m.get(EXPORT_CJS_OBJECT);
                if (cjsObject != null && !CJS_EXPORT_OBJECTS.contains(compact(text(cjsObject)))) {
                    continue;
                }
                var exported = compact(text(name));
                var declared = cjsObject == null ? scopes.get(Scope.ROOT).current.get(exported) : null;
                var resolution = declared != null ? bindingExport(arena.get(declared)) : classifyExportValue(value);
                named.put(exported, new ModuleExport(exported, null, resolution, range(name), false));
                continue;
            }
            var defaultValue = m.get(EXPORT_DEFAULT);
            if (defaultValue != null) {
                var target = m.get(EXPORT_CJS_TARGET);
                if (target != null && !compact(text(target)).equals("module.exports")) {
                    continue;
                }
                defaultExport = new ModuleExport("default", null, classifyExportValue(defaultValue),
                        range(defaultValue), true);
            }
        }
        var exports = new FileExports(named, defaultExport, wildcards);
        logger.trace("Extracted {} named exports, {} wildcard re-exports", named.size(), wildcards.size());
        return exports;
    }

    private ExportResolution resolveLocalName(String name) {
        var id = scopes.get(Scope.ROOT).current.get(name);
        if (id != null) {
            return bindingExport(arena.get(id));
        }
        return imports.get(name).map(i -> importExport(i, null, 0)).orElse(ExportResolution.Opaque.INSTANCE);
    }

    private ExportResolution bindingExport(Binding binding) {
        if (binding.kind() == BindingKind.OPAQUE) {
            return ExportResolution.Opaque.INSTANCE;
        }
        var budget = DepthBudget.standard();
        return chainExport(BindingResolver.walk(arena::get, binding.id(), null, budget), budget.hops());
    }

    /** Carries the hops spent reaching {@code end} so an importer can charge them. */
    private ExportResolution chainExport(ChainEnd end, int hops) {
        if (end instanceof ChainEnd.EnvVar v) {
            return new ExportResolution.EnvVar(v.name(), hops);
        }
        if (end instanceof ChainEnd.EnvObject o) {
            return new ExportResolution.EnvObject(o.canonicalName(), hops);
        }
        if (end instanceof ChainEnd.Imported i) {
            return imports.get(i.localName())
                    .map(binding -> importExport(binding, i.key(), hops))
                    .orElse(ExportResolution.Opaque.INSTANCE);
        }
        return ExportResolution.Opaque.INSTANCE;
    }

    private ExportResolution importExport(ImportContext.ImportBinding binding, @Nullable String key, int hops) {
        if (!isForeignImport(binding)) {
            return ExportResolution.Opaque.INSTANCE;
        }
        return switch (binding.kind()) {
            case NAMED -> new ExportResolution.ReExport(binding.specifier(), binding.originalName(), key, hops);
            case DEFAULT -> new ExportResolution.ReExport(binding.specifier(), "default", key, hops);
            case NAMESPACE -> key != null
                    ? new ExportResolution.ReExport(binding.specifier(), key, null, hops)
                    : ExportResolution.Opaque.INSTANCE;
            case MODULE -> ExportResolution.Opaque.INSTANCE;
        };
    }

    private ExportResolution classifyExportValue(TSNode node) {
        var value = profile.unwrapValue(node, index);
        var access = accessResults.get(nodeKey(value));
        if (access != null) {
            return switch (access.kind()) {
                case DIRECT -> new ExportResolution.EnvVar(access.key());
                case ALIAS -> {
                    var budget = DepthBudget.standard();
                    var end = BindingResolver.walk(arena::get, access.bindingId(), access.key(), budget);
                    yield chainExport(end, budget.hops());
                }
                case IMPORTED -> imports.get(access.importName())
                        .map(binding -> importExport(binding, access.key(), 0))
                        .orElse(ExportResolution.Opaque.INSTANCE);
            };
        }
        var object = profile.canonicalEnvObject(text(value), imports);
        if (object.isPresent()) {
            return new ExportResolution.EnvObject(object.get());
        }
        if (isIdentifier(value)) {
            return resolveLocalName(compact(text(value)));
        }
        return ExportResolution.Opaque.INSTANCE;
    }

    // ---------------------------------------------------------------- helpers

    @Nullable
    private Key keyOf(TSNode keyNode) {
        var raw = text(keyNode);
        var literal = profile.stringLiteral(raw);
        String content;
        int offset;
        if (literal.isPresent()) {
            content = literal.get().content();
            offset = literal.get().offset();
        } else if (IDENTIFIER.matcher(raw).matches()) {
            content = raw;
            offset = 0;
        } else {
            return null;
        }
        if (content.isEmpty()) {
            return null;
        }
        int startChar = index.charIndex(keyNode.getStartByte()) + offset;
        var keyRange = new SourceRange(index.positionOfChar(startChar), index.positionOfChar(startChar + content.length()));
        return new Key(content, keyRange);
    }

    private String literalOrText(TSNode node) {
        var raw = text(node);
        return profile.stringLiteral(raw).map(l -> l.content()).orElse(compact(raw));
    }

    private boolean isFallbackOperator(TSNode expression) {
        var operator = field(expression, "operator");
        return operator != null && FALLBACK_OPERATORS.contains(text(operator));
    }

    private boolean isIdentifier(TSNode node) {
        return profile.identifierNodeTypes().contains(node.getType());
    }

    private String text(TSNode node) {
        return TreeSitterText.text(node, index);
    }

    private SourceRange range(TSNode node) {
        return TreeSitterText.range(node, index);
    }

    private SourcePosition position(TSNode node) {
        return index.positionOfByte(node.getStartByte());
    }

    private static long nodeKey(TSNode node) {
        return ((long) node.getStartByte() << 32) | (node.getEndByte() & 0xffffffffL);
    }
}

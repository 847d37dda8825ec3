package ai.phprefactor.analyzer;

import ai.phprefactor.analyzer.php.PhpNode;
import ai.phprefactor.analyzer.php.NamespaceAwareVisitor;
import ai.phprefactor.analyzer.php.PhpTree;
import ai.phprefactor.analyzer.php.TypeRef;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Definitions, method definitions, inheritance edges and the coarse usage index for a set of PHP files.
 *
 * <p>Mutations ({@link #scanFile}, {@link #removeFile}, {@link #clear}) are expected from a single thread at a time;
 * queries may run concurrently with them and observe each file either before or after its update. Names are matched
 * case-insensitively, as PHP does for classes and methods.
 */
public final class SymbolIndex implements ISymbolIndex {
    private static final Logger logger = LogManager.getLogger(SymbolIndex.class);

    private final Map<String, List<SymbolDefinition>> definitions = new ConcurrentHashMap<>();
    private final Map<String, List<SymbolDefinition>> methods = new ConcurrentHashMap<>();
    private final Map<ProjectFile, List<InheritanceEdge>> edges = new ConcurrentHashMap<>();
    private final Map<String, Set<ProjectFile>> usages = new ConcurrentHashMap<>();
    private final Map<ProjectFile, FileEntries> entriesByFile = new ConcurrentHashMap<>();

    /** What one file contributed, so it can be removed again. */
    private record FileEntries(Set<String> definitionKeys, Set<String> methodKeys, Set<String> usageKeys) {}

    public record IndexStats(int files, int definitions, int methods, int inheritanceEdges, int usageNames) {}

    /**
     * Replaces everything recorded for {@code file} with what the tree declares. Scanning an unchanged file again
     * leaves the index unchanged.
     */
    public void scanFile(ProjectFile file, PhpTree tree) {
        removeFile(file);
        var collector = new Collector(file);
        tree.root().accept(collector);

        var definitionKeys = new LinkedHashSet<String>();
        for (var def : collector.definitions) {
            var key = key(def.name());
            boolean duplicateInFile = definitions.getOrDefault(key, List.of()).stream()
                    .anyMatch(d -> d.file().equals(file) && d.name().equalsIgnoreCase(def.name()));
            if (duplicateInFile) {
                continue;
            }
            definitions.merge(key, List.of(def), SymbolIndex::concat);
            definitionKeys.add(key);
        }
        var methodKeys = new LinkedHashSet<String>();
        for (var method : collector.methods) {
            var key = methodKey(simpleName(Objects.requireNonNull(method.parentSymbol())), method.name());
            methods.merge(key, List.of(method), SymbolIndex::concat);
            methodKeys.add(key);
        }
        if (!collector.edges.isEmpty()) {
            edges.put(file, List.copyOf(collector.edges));
        }
        var usageKeys = new LinkedHashSet<String>();
        for (var name : collector.usedNames) {
            var key = key(name);
            usages.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).add(file);
            usageKeys.add(key);
        }
        entriesByFile.put(file, new FileEntries(definitionKeys, methodKeys, usageKeys));
        logger.trace(
                "Indexed {}: {} definitions, {} methods, {} names",
                file,
                definitionKeys.size(),
                collector.methods.size(),
                usageKeys.size());
    }

    /** Forgets every definition, method, edge and usage attributed to the file. */
    public void removeFile(ProjectFile file) {
        var entries = entriesByFile.remove(file);
        if (entries == null) {
            return;
        }
        for (var key : entries.definitionKeys()) {
            definitions.computeIfPresent(key, (k, list) -> withoutFile(list, file));
        }
        for (var key : entries.methodKeys()) {
            methods.computeIfPresent(key, (k, list) -> withoutFile(list, file));
        }
        edges.remove(file);
        for (var key : entries.usageKeys()) {
            usages.computeIfPresent(key, (k, files) -> {
                files.remove(file);
                return files.isEmpty() ? null : files;
            });
        }
    }

    public void clear() {
        definitions.clear();
        methods.clear();
        edges.clear();
        usages.clear();
        entriesByFile.clear();
    }

    @Override
    public List<SymbolDefinition> lookupDefinitions(String name) {
        return definitions.getOrDefault(key(simpleName(stripLeadingSeparator(name))), List.of());
    }

    /** Definitions for a possibly qualified name, exact FQN matches first. */
    public List<SymbolDefinition> findDefinition(String name) {
        var fqn = stripLeadingSeparator(name);
        return lookupDefinitions(fqn).stream()
                .sorted(Comparator.comparing((SymbolDefinition d) -> !d.fullyQualifiedName().equalsIgnoreCase(fqn)))
                .toList();
    }

    @Override
    public List<SymbolDefinition> lookupMethod(String classFqn, String methodName) {
        var fqn = stripLeadingSeparator(classFqn);
        var candidates = methods.getOrDefault(methodKey(simpleName(fqn), methodName), List.of());
        if (fqn.indexOf('\\') < 0) {
            return candidates;
        }
        return candidates.stream()
                .filter(m -> fqn.equalsIgnoreCase(m.parentSymbol()))
                .toList();
    }

    @Override
    public List<String> implementationsOf(String interfaceName) {
        return edges.values().stream()
                .flatMap(List::stream)
                .filter(e -> e.implementsType(interfaceName))
                .map(InheritanceEdge::className)
                .distinct()
                .toList();
    }

    @Override
    public List<SymbolDefinition> implementorsOf(String interfaceName) {
        var result = new ArrayList<SymbolDefinition>();
        for (var edge : allEdges()) {
            if (edge.implementsType(interfaceName)) {
                definitionFor(edge).ifPresent(result::add);
            }
        }
        return result;
    }

    @Override
    public List<SymbolDefinition> subclassesOf(String className) {
        var result = new ArrayList<SymbolDefinition>();
        for (var edge : allEdges()) {
            if (edge.extendsType(className)) {
                definitionFor(edge).ifPresent(result::add);
            }
        }
        return result;
    }

    private Optional<SymbolDefinition> definitionFor(InheritanceEdge edge) {
        return lookupDefinitions(edge.className()).stream()
                .filter(d -> d.file().equals(edge.file()) && d.fullyQualifiedName().equals(edge.classFqn()))
                .findFirst();
    }

    @Override
    public Set<ProjectFile> filesUsing(String shortName) {
        var files = usages.get(key(simpleName(stripLeadingSeparator(shortName))));
        return files == null ? Set.of() : Set.copyOf(files);
    }

    @Override
    public List<SymbolDefinition> definitionsInFile(ProjectFile file) {
        var entries = entriesByFile.get(file);
        if (entries == null) {
            return List.of();
        }
        return entries.definitionKeys().stream()
                .flatMap(k -> definitions.getOrDefault(k, List.of()).stream())
                .filter(d -> d.file().equals(file))
                .toList();
    }

    @Override
    public Collection<InheritanceEdge> inheritanceEdges() {
        return allEdges();
    }

    private List<InheritanceEdge> allEdges() {
        return edges.values().stream().flatMap(List::stream).toList();
    }

    @Override
    public Set<ProjectFile> indexedFiles() {
        return Set.copyOf(entriesByFile.keySet());
    }

    @Override
    public boolean isEmpty() {
        return entriesByFile.isEmpty();
    }

    public IndexStats stats() {
        return new IndexStats(
                entriesByFile.size(),
                definitions.values().stream().mapToInt(List::size).sum(),
                methods.values().stream().mapToInt(List::size).sum(),
                edges.values().stream().mapToInt(List::size).sum(),
                usages.size());
    }

    private static List<SymbolDefinition> concat(List<SymbolDefinition> a, List<SymbolDefinition> b) {
        var merged = new ArrayList<SymbolDefinition>(a.size() + b.size());
        merged.addAll(a);
        merged.addAll(b);
        return List.copyOf(merged);
    }

    private static @Nullable List<SymbolDefinition> withoutFile(List<SymbolDefinition> list, ProjectFile file) {
        var remaining = list.stream().filter(d -> !d.file().equals(file)).collect(Collectors.toList());
        return remaining.isEmpty() ? null : List.copyOf(remaining);
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private static String methodKey(String className, String methodName) {
        return key(className) + "::" + key(methodName);
    }

    static String simpleName(String name) {
        return InheritanceEdge.simpleName(name);
    }

    private static String stripLeadingSeparator(String name) {
        return name.startsWith("\\") ? name.substring(1) : name;
    }

    /** Walks one file tracking the current namespace and enclosing class-like. */
    private static final class Collector extends NamespaceAwareVisitor {
        private final ProjectFile file;
        private final List<SymbolDefinition> definitions = new ArrayList<>();
        private final List<SymbolDefinition> methods = new ArrayList<>();
        private final List<InheritanceEdge> edges = new ArrayList<>();
        private final Set<String> usedNames = new LinkedHashSet<>();
        // FQN of the enclosing class-like, or "" inside function bodies
        private final Deque<String> classStack = new ArrayDeque<>();

        Collector(ProjectFile file) {
            this.file = file;
        }

        @Override
        public void visitClassLike(PhpNode.ClassLike node) {
            var fqn = qualify(node.name());
            var def = SymbolDefinition.classLike(node.name(), fqn, node.kind(), file, node.nameSpan());
            definitions.add(def);

            String extendsName = null;
            var implementsNames = new LinkedHashSet<String>();
            if (node.kind() == SymbolKind.INTERFACE) {
                node.extendsTypes().forEach(t -> implementsNames.add(t.withoutLeadingSeparator()));
            } else if (!node.extendsTypes().isEmpty()) {
                extendsName = node.extendsTypes().get(0).withoutLeadingSeparator();
            }
            node.implementsTypes().forEach(t -> implementsNames.add(t.withoutLeadingSeparator()));
            edges.add(new InheritanceEdge(node.name(), fqn, file, extendsName, implementsNames));

            node.extendsTypes().forEach(this::use);
            node.implementsTypes().forEach(this::use);

            classStack.push(fqn);
            visitChildren(node);
            classStack.pop();
        }

        @Override
        public void visitFunctionLike(PhpNode.FunctionLike node) {
            var owner = classStack.peek();
            if (node.kind() == PhpNode.FunctionKind.METHOD
                    && owner != null
                    && !owner.isEmpty()
                    && node.name() != null
                    && node.nameSpan() != null) {
                methods.add(SymbolDefinition.method(node.name(), owner, file, node.nameSpan()));
            }
            node.returnTypes().forEach(this::use);
            classStack.push("");
            visitChildren(node);
            classStack.pop();
        }

        @Override
        public void visitParameter(PhpNode.Parameter node) {
            node.types().forEach(this::use);
            visitChildren(node);
        }

        @Override
        public void visitPropertyDeclaration(PhpNode.PropertyDeclaration node) {
            node.types().forEach(this::use);
            visitChildren(node);
        }

        @Override
        public void visitNewExpression(PhpNode.NewExpression node) {
            if (node.type() != null) {
                use(node.type());
            }
            visitChildren(node);
        }

        @Override
        public void visitStaticCall(PhpNode.StaticCall node) {
            if (node.scope() != null) {
                use(node.scope());
            }
            visitChildren(node);
        }

        @Override
        public void visitStaticLookup(PhpNode.StaticLookup node) {
            if (node.scope() != null) {
                use(node.scope());
            }
            visitChildren(node);
        }

        @Override
        public void visitUseDeclaration(PhpNode.UseDeclaration node) {
            for (var clause : node.clauses()) {
                usedNames.add(simpleName(clause.name()));
                usedNames.add(clause.localName());
            }
        }

        @Override
        public void visitNameReference(PhpNode.NameReference node) {
            use(node.name());
        }

        private void use(TypeRef ref) {
            if (!ref.isBuiltin()) {
                usedNames.add(ref.simpleName());
            }
        }
    }
}

package ai.phprefactor.refactor;

import ai.phprefactor.analyzer.EditBatch;
import ai.phprefactor.analyzer.EditOperation;
import ai.phprefactor.analyzer.IProject;
import ai.phprefactor.analyzer.ISymbolIndex;
import ai.phprefactor.analyzer.InheritanceEdge;
import ai.phprefactor.analyzer.OverlappingEditException;
import ai.phprefactor.analyzer.ProjectFile;
import ai.phprefactor.analyzer.SourceSpan;
import ai.phprefactor.analyzer.SymbolDefinition;
import ai.phprefactor.analyzer.SymbolKind;
import ai.phprefactor.analyzer.SymbolReference;
import ai.phprefactor.analyzer.TextRange;
import ai.phprefactor.analyzer.php.ImportTable;
import ai.phprefactor.analyzer.php.NamespaceAwareVisitor;
import ai.phprefactor.analyzer.php.PhpNode;
import ai.phprefactor.analyzer.php.PhpParseException;
import ai.phprefactor.analyzer.php.PhpParser;
import ai.phprefactor.analyzer.php.PhpTree;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Renames a method in its class (or interface and all implementors) and at every call site whose receiver is shown by
 * {@link ScopeTracker} to have one of those types. Candidate files are chosen by a textual search for
 * {@code ->name} or {@code ::name} before anything is parsed.
 */
public final class MethodRenamePlanner {
    private static final Logger logger = LogManager.getLogger(MethodRenamePlanner.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_\\x80-\\x{10FFFF}][A-Za-z0-9_\\x80-\\x{10FFFF}]*");

    /**
     * @param cursor zero-based range the user invoked the rename from; null to use the first class-like in the file that
     *     declares the method
     */
    public record Request(ProjectFile file, String oldName, String newName, @Nullable TextRange cursor) {}

    /** The class-like being renamed in, as found at the cursor. */
    private record Target(String fqn, String name, SymbolKind kind) {}

    private final IProject project;
    private final ISymbolIndex index;
    private final PhpParser parser;

    public MethodRenamePlanner(IProject project, ISymbolIndex index, PhpParser parser) {
        this.project = project;
        this.index = index;
        this.parser = parser;
    }

    public RefactorResult plan(Request request) {
        if (request.newName().isBlank()) {
            return RefactorResult.refused("New method name must not be empty");
        }
        var newName = request.newName().trim();
        if (!IDENTIFIER.matcher(newName).matches()) {
            return RefactorResult.refused("'%s' is not a valid method name".formatted(newName));
        }
        if (newName.equals(request.oldName())) {
            return new RefactorResult.Success(EditBatch.empty());
        }

        var located = locate(request.file(), request.oldName(), request.cursor());
        if (located.refusal() != null) {
            return RefactorResult.refused(located.refusal());
        }
        var batch = EditBatch.builder();
        for (var reference : located.references()) {
            batch.add(new EditOperation(reference.file(), reference.range(), newName));
        }
        try {
            return new RefactorResult.Success(batch.build());
        } catch (OverlappingEditException e) {
            logger.error("Rename produced overlapping edits", e);
            return RefactorResult.refused(e.getMessage());
        }
    }

    /**
     * Declarations and type-matched calls of the method a rename from the same cursor would touch, sorted by file and
     * position. Empty when no class-like at the cursor declares the method.
     */
    public List<SymbolReference> findReferences(ProjectFile file, String methodName, @Nullable TextRange cursor) {
        var located = locate(file, methodName, cursor);
        if (located.refusal() != null) {
            logger.debug("No references for {}: {}", methodName, located.refusal());
            return List.of();
        }
        return located.references().stream().sorted().toList();
    }

    /** Either the references found or why none could be looked for. */
    private record Located(@Nullable String refusal, List<SymbolReference> references) {
        static Located refused(String reason) {
            return new Located(reason, List.of());
        }
    }

    private Located locate(ProjectFile file, String methodName, @Nullable TextRange cursor) {
        PhpTree cursorTree;
        try {
            cursorTree = parser.parse(file);
        } catch (PhpParseException e) {
            return Located.refused("Cannot parse %s: %s".formatted(file, e.getMessage()));
        } catch (IOException e) {
            return Located.refused("Cannot read %s: %s".formatted(file, e.getMessage()));
        }

        var target = findTarget(cursorTree, methodName, cursor);
        if (target == null) {
            return Located.refused(
                    "No class, interface or trait declaring '%s' found at the cursor".formatted(methodName));
        }
        logger.debug("Looking up {}::{}", target.fqn(), methodName);

        Map<ProjectFile, PhpTree> trees = new HashMap<>();
        trees.put(file, cursorTree);
        var implementors =
                target.kind() == SymbolKind.INTERFACE ? implementorsOf(target, trees) : List.<SymbolDefinition>of();
        var targetType = TargetType.of(
                target.fqn(),
                implementors.stream().map(SymbolDefinition::fullyQualifiedName).toList(),
                target.kind() == SymbolKind.INTERFACE,
                fqn -> index.lookupDefinitions(fqn).stream().anyMatch(d -> d.fullyQualifiedName().equalsIgnoreCase(fqn)));

        var candidates = new LinkedHashSet<ProjectFile>();
        candidates.add(file);
        index.lookupDefinitions(target.name()).stream()
                .filter(d -> d.fullyQualifiedName().equalsIgnoreCase(target.fqn()))
                .forEach(d -> candidates.add(d.file()));
        implementors.forEach(d -> candidates.add(d.file()));
        candidates.addAll(filesMentioningCall(methodName));

        var references = new ArrayList<SymbolReference>();
        for (var candidate : candidates) {
            var tree = parsed(candidate, trees);
            if (tree == null) {
                continue;
            }
            for (var span : DeclarationFinder.methodNameSpans(tree, targetType, methodName)) {
                references.add(new SymbolReference(candidate, span.toTextRange(), SymbolReference.Kind.DECLARATION));
            }
            for (var call : ScopeTracker.findCalls(tree, targetType, methodName)) {
                references.add(new SymbolReference(candidate, call.nameSpan().toTextRange(), SymbolReference.Kind.CALL));
            }
        }
        return new Located(null, references);
    }

    private @Nullable Target findTarget(PhpTree tree, String methodName, @Nullable TextRange cursor) {
        var finder = new CursorFinder(tree, methodName, cursor);
        tree.root().accept(finder);
        if (cursor != null) {
            if (finder.enclosing == null) {
                return null;
            }
            if (!finder.onMember && !finder.declaring.contains(finder.enclosing)) {
                return null;
            }
            return finder.enclosing;
        }
        return finder.firstDeclaring;
    }

    /**
     * Implementors of the interface and, transitively, of interfaces extending it. The index matches supertypes by short
     * name only, so each candidate is kept only if one of its declared supertypes resolves to the interface's FQN in the
     * candidate's own file.
     */
    private List<SymbolDefinition> implementorsOf(Target target, Map<ProjectFile, PhpTree> trees) {
        var result = new LinkedHashMap<String, SymbolDefinition>();
        Deque<String> pending = new ArrayDeque<>();
        pending.add(target.fqn());
        Set<String> seen = new LinkedHashSet<>();
        while (!pending.isEmpty()) {
            var interfaceFqn = pending.poll();
            if (!seen.add(interfaceFqn.toLowerCase(Locale.ROOT))) {
                continue;
            }
            for (var candidate : index.implementorsOf(InheritanceEdge.simpleName(interfaceFqn))) {
                if (!declaresSupertype(candidate, interfaceFqn, trees)) {
                    logger.debug("{} implements another {}", candidate.fullyQualifiedName(), interfaceFqn);
                    continue;
                }
                result.putIfAbsent(candidate.fullyQualifiedName().toLowerCase(Locale.ROOT), candidate);
                if (candidate.kind() == SymbolKind.INTERFACE) {
                    pending.add(candidate.fullyQualifiedName());
                }
            }
        }
        return new ArrayList<>(result.values());
    }

    private boolean declaresSupertype(SymbolDefinition candidate, String interfaceFqn, Map<ProjectFile, PhpTree> trees) {
        var tree = parsed(candidate.file(), trees);
        if (tree == null) {
            return false;
        }
        var resolver = new SupertypeResolver(tree.importTable(), candidate.fullyQualifiedName());
        tree.root().accept(resolver);
        return resolver.supertypes.stream().anyMatch(interfaceFqn::equalsIgnoreCase);
    }

    /** Parses each file at most once per plan; null when the file cannot be read or parsed. */
    private @Nullable PhpTree parsed(ProjectFile file, Map<ProjectFile, PhpTree> trees) {
        var cached = trees.get(file);
        if (cached != null) {
            return cached;
        }
        try {
            var tree = parser.parse(file);
            trees.put(file, tree);
            return tree;
        } catch (PhpParseException e) {
            logger.warn("Skipping {} during rename: {}", file, e.getMessage());
        } catch (IOException e) {
            logger.warn("Unable to read {} during rename: {}", file, e.getMessage());
        }
        return null;
    }

    private Set<ProjectFile> filesMentioningCall(String methodName) {
        var needles = List.of("->" + methodName.toLowerCase(Locale.ROOT), "::" + methodName.toLowerCase(Locale.ROOT));
        var result = new LinkedHashSet<ProjectFile>();
        for (var file : project.getAllFiles()) {
            try {
                var text = file.read().toLowerCase(Locale.ROOT);
                if (needles.stream().anyMatch(text::contains)) {
                    result.add(file);
                }
            } catch (IOException e) {
                logger.warn("Unable to read {}: {}", file, e.getMessage());
            }
        }
        return result;
    }

    /** Locates the class-like around the cursor and whether the cursor is on a definition or call of the method. */
    private static final class CursorFinder extends NamespaceAwareVisitor {
        private final String oldName;
        private final int cursorStart;
        private final int cursorEnd;
        private final boolean hasCursor;
        private final Deque<Target> stack = new ArrayDeque<>();
        @Nullable
        Target enclosing;
        @Nullable
        Target firstDeclaring;
        final Set<Target> declaring = new LinkedHashSet<>();
        boolean onMember;

        CursorFinder(PhpTree tree, String oldName, @Nullable TextRange cursor) {
            this.oldName = oldName;
            this.hasCursor = cursor != null;
            if (cursor != null) {
                this.cursorStart = tree.source().offsetOf(cursor.start());
                this.cursorEnd = tree.source().offsetOf(cursor.end());
            } else {
                this.cursorStart = -1;
                this.cursorEnd = -1;
            }
        }

        private boolean underCursor(SourceSpan span) {
            return hasCursor && span.contains(cursorStart) && span.contains(cursorEnd);
        }

        @Override
        public void visitClassLike(PhpNode.ClassLike node) {
            var target = new Target(qualify(node.name()), node.name(), node.kind());
            if (underCursor(node.span())) {
                // innermost wins since nested declarations are visited later
                enclosing = target;
            }
            stack.push(target);
            visitChildren(node);
            stack.pop();
        }

        @Override
        public void visitFunctionLike(PhpNode.FunctionLike node) {
            var owner = stack.peek();
            if (node.kind() == PhpNode.FunctionKind.METHOD
                    && owner != null
                    && oldName.equalsIgnoreCase(node.name())) {
                if (firstDeclaring == null) {
                    firstDeclaring = owner;
                }
                declaring.add(owner);
                if (node.nameSpan() != null && underCursor(node.nameSpan())) {
                    onMember = true;
                }
            }
            visitChildren(node);
        }

        @Override
        public void visitMethodCall(PhpNode.MethodCall node) {
            if (oldName.equalsIgnoreCase(node.methodName()) && underCursor(node.nameSpan())) {
                onMember = true;
            }
            visitChildren(node);
        }

        @Override
        public void visitStaticCall(PhpNode.StaticCall node) {
            if (oldName.equalsIgnoreCase(node.methodName()) && underCursor(node.nameSpan())) {
                onMember = true;
            }
            visitChildren(node);
        }
    }

    /** Resolved FQNs of the interfaces one class-like implements, or extends when it is an interface itself. */
    private static final class SupertypeResolver extends NamespaceAwareVisitor {
        private final ImportTable imports;
        private final String classFqn;
        final List<String> supertypes = new ArrayList<>();

        SupertypeResolver(ImportTable imports, String classFqn) {
            this.imports = imports;
            this.classFqn = classFqn;
        }

        @Override
        public void visitClassLike(PhpNode.ClassLike node) {
            if (qualify(node.name()).equalsIgnoreCase(classFqn)) {
                node.implementsTypes().forEach(t -> supertypes.add(imports.resolve(t, currentNamespace())));
                if (node.kind() == SymbolKind.INTERFACE) {
                    node.extendsTypes().forEach(t -> supertypes.add(imports.resolve(t, currentNamespace())));
                }
            }
            visitChildren(node);
        }
    }
}

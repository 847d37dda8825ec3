package ai.phprefactor.refactor;

import ai.phprefactor.analyzer.php.ImportTable;
import ai.phprefactor.analyzer.php.PhpNode;
import ai.phprefactor.analyzer.php.NamespaceAwareVisitor;
import ai.phprefactor.analyzer.php.PhpTree;
import ai.phprefactor.analyzer.php.TypeRef;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Finds the calls of one method whose receiver provably has the target type, using a single forward pass of local
 * type inference per function body.
 *
 * <p>Types come from parameter hints, {@code new} expressions, copies between variables and typed properties read
 * through {@code $this}. Receivers that are themselves calls are never resolved, and a variable assigned anything of
 * unknown type loses its binding, as does a variable reassigned to another type inside a nested block. The analysis is deliberately unsound in the direction of missing calls: a call is
 * reported only when its receiver type is known.
 */
public final class ScopeTracker extends NamespaceAwareVisitor {

    /** Enclosing class-like: its FQN, resolved parent FQN and declared property types. */
    private record ClassContext(String fqn, @Nullable String parentFqn, Map<String, String> propertyTypes) {}

    private final TargetType target;
    private final String methodName;
    private final ImportTable imports;
    private final List<CallSite> calls = new ArrayList<>();
    private final Deque<ClassContext> classes = new ArrayDeque<>();
    private Scope scope = Scope.root();

    private ScopeTracker(PhpTree tree, TargetType target, String methodName) {
        this.target = target;
        this.methodName = methodName.toLowerCase(Locale.ROOT);
        this.imports = tree.importTable();
    }

    public static List<CallSite> findCalls(PhpTree tree, TargetType target, String methodName) {
        var tracker = new ScopeTracker(tree, target, methodName);
        tree.root().accept(tracker);
        return tracker.calls;
    }

    @Override
    public void visitClassLike(PhpNode.ClassLike node) {
        var fqn = qualify(node.name());
        var parentFqn = node.extendsTypes().isEmpty() ? null : resolve(node.extendsTypes().get(0));
        classes.push(new ClassContext(fqn, parentFqn, propertyTypes(node)));
        var saved = scope;
        scope = Scope.root();
        visitChildren(node);
        scope = saved;
        classes.pop();
    }

    private Map<String, String> propertyTypes(PhpNode.ClassLike node) {
        var types = new HashMap<String, String>();
        for (var member : node.members()) {
            if (member instanceof PhpNode.PropertyDeclaration property) {
                singleClassType(property.types()).ifPresent(t -> property.names().forEach(n -> types.put(n, t)));
            } else if (member instanceof PhpNode.FunctionLike method && "__construct".equalsIgnoreCase(method.name())) {
                for (var parameter : method.parameters()) {
                    if (parameter.promoted()) {
                        singleClassType(parameter.types()).ifPresent(t -> types.put(parameter.name(), t));
                    }
                }
            }
        }
        return types;
    }

    @Override
    public void visitFunctionLike(PhpNode.FunctionLike node) {
        var saved = scope;
        // arrow functions capture the enclosing scope by value; everything else starts fresh
        scope = node.kind() == PhpNode.FunctionKind.ARROW_FUNCTION ? scope.child() : Scope.root();
        for (var parameter : node.parameters()) {
            parameter.accept(this);
            scope.bind(parameter.name(), singleClassType(parameter.types()));
        }
        for (var statement : node.body()) {
            statement.accept(this);
        }
        scope = saved;
    }

    @Override
    public void visitBlock(PhpNode.Block node) {
        scope = scope.child();
        visitChildren(node);
        scope = scope.exitInto();
    }

    @Override
    public void visitAssignment(PhpNode.Assignment node) {
        node.value().accept(this);
        if (node.target() instanceof PhpNode.Variable variable) {
            scope.bind(variable.name(), typeOf(node.value()));
        } else {
            node.target().accept(this);
        }
    }

    @Override
    public void visitMethodCall(PhpNode.MethodCall node) {
        visitChildren(node);
        if (!node.methodName().toLowerCase(Locale.ROOT).equals(methodName)) {
            return;
        }
        var receiverType = typeOf(node.receiver());
        if (receiverType.isPresent() && target.accepts(receiverType.get())) {
            calls.add(new CallSite(node.nameSpan(), node.span(), CallSite.Kind.INSTANCE));
        }
    }

    @Override
    public void visitStaticCall(PhpNode.StaticCall node) {
        visitChildren(node);
        if (!node.methodName().toLowerCase(Locale.ROOT).equals(methodName) || node.scope() == null) {
            return;
        }
        if (staticScopeMatches(node.scope())) {
            calls.add(new CallSite(node.nameSpan(), node.span(), CallSite.Kind.STATIC));
        }
    }

    private boolean staticScopeMatches(TypeRef scopeRef) {
        var current = classes.peek();
        var lower = scopeRef.text().toLowerCase(Locale.ROOT);
        if (lower.equals("self") || lower.equals("static")) {
            return current != null && target.accepts(current.fqn());
        }
        if (lower.equals("parent")) {
            return current != null && current.parentFqn() != null && target.accepts(current.parentFqn());
        }
        return target.accepts(resolve(scopeRef), scopeRef);
    }

    /** Static type of an expression, when it can be shown without tracking return types. */
    private Optional<String> typeOf(PhpNode expression) {
        if (expression instanceof PhpNode.Variable variable) {
            if (variable.isThis()) {
                var current = classes.peek();
                return current == null ? Optional.empty() : Optional.of(current.fqn());
            }
            return scope.lookup(variable.name());
        }
        if (expression instanceof PhpNode.NewExpression creation && creation.type() != null) {
            return Optional.ofNullable(typeName(creation.type()));
        }
        if (expression instanceof PhpNode.PropertyLookup lookup
                && lookup.object() instanceof PhpNode.Variable owner
                && owner.isThis()) {
            var current = classes.peek();
            return current == null ? Optional.empty() : Optional.ofNullable(current.propertyTypes().get(lookup.property()));
        }
        if (expression instanceof PhpNode.Assignment assignment) {
            return typeOf(assignment.value());
        }
        return Optional.empty();
    }

    /** The one class named by a type hint, ignoring {@code null}; empty for primitives and real unions. */
    private Optional<String> singleClassType(List<TypeRef> types) {
        String found = null;
        for (var type : types) {
            if (type.isBuiltin() && !type.isRelativeScope()) {
                continue;
            }
            if (found != null) {
                return Optional.empty();
            }
            found = typeName(type);
            if (found == null) {
                return Optional.empty();
            }
        }
        return Optional.ofNullable(found);
    }

    /**
     * Resolved FQN for a written class name, with {@code self}/{@code static}/{@code parent} mapped through the
     * enclosing class. Names that merely end like an accepted FQN are mapped onto it.
     */
    private @Nullable String typeName(TypeRef ref) {
        var current = classes.peek();
        var lower = ref.text().toLowerCase(Locale.ROOT);
        if (lower.equals("self") || lower.equals("static")) {
            return current == null ? null : current.fqn();
        }
        if (lower.equals("parent")) {
            return current == null ? null : current.parentFqn();
        }
        var resolved = resolve(ref);
        return target.accepts(resolved, ref) ? target.fqn() : resolved;
    }

    private String resolve(TypeRef ref) {
        return imports.resolve(ref, currentNamespace());
    }
}

package ai.phprefactor.analyzer.php;

import java.util.ArrayList;
import java.util.List;

/** Every place a file names a class, tagged with how the name is used and the namespace in effect there. */
public final class TypeReferences {

    public enum Context {
        PARAMETER_TYPE,
        PROPERTY_TYPE,
        RETURN_TYPE,
        INSTANTIATION,
        STATIC_ACCESS,
        EXTENDS,
        IMPLEMENTS,
        OTHER;

        /** Sites where an unimported class name is reported as a missing import. */
        public boolean isTypeSite() {
            return this != OTHER;
        }
    }

    public record Reference(TypeRef ref, Context context, String namespace) {}

    private TypeReferences() {}

    public static List<Reference> collect(PhpTree tree) {
        var collector = new Collector();
        tree.root().accept(collector);
        return collector.references;
    }

    private static final class Collector extends NamespaceAwareVisitor {
        private final List<Reference> references = new ArrayList<>();

        private void add(TypeRef ref, Context context) {
            references.add(new Reference(ref, context, currentNamespace()));
        }

        @Override
        public void visitClassLike(PhpNode.ClassLike node) {
            node.extendsTypes().forEach(t -> add(t, Context.EXTENDS));
            node.implementsTypes().forEach(t -> add(t, Context.IMPLEMENTS));
            visitChildren(node);
        }

        @Override
        public void visitFunctionLike(PhpNode.FunctionLike node) {
            node.returnTypes().forEach(t -> add(t, Context.RETURN_TYPE));
            visitChildren(node);
        }

        @Override
        public void visitParameter(PhpNode.Parameter node) {
            node.types().forEach(t -> add(t, Context.PARAMETER_TYPE));
            visitChildren(node);
        }

        @Override
        public void visitPropertyDeclaration(PhpNode.PropertyDeclaration node) {
            node.types().forEach(t -> add(t, Context.PROPERTY_TYPE));
            visitChildren(node);
        }

        @Override
        public void visitNewExpression(PhpNode.NewExpression node) {
            if (node.type() != null) {
                add(node.type(), Context.INSTANTIATION);
            }
            visitChildren(node);
        }

        @Override
        public void visitStaticCall(PhpNode.StaticCall node) {
            if (node.scope() != null) {
                add(node.scope(), Context.STATIC_ACCESS);
            }
            visitChildren(node);
        }

        @Override
        public void visitStaticLookup(PhpNode.StaticLookup node) {
            if (node.scope() != null) {
                add(node.scope(), Context.STATIC_ACCESS);
            }
            visitChildren(node);
        }

        @Override
        public void visitNameReference(PhpNode.NameReference node) {
            add(node.name(), Context.OTHER);
        }
    }
}

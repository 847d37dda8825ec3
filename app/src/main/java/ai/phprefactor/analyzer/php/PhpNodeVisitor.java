package ai.phprefactor.analyzer.php;

/**
 * Visitor over {@link PhpNode}. Every method defaults to descending into the node's child slots, so implementations
 * override only the kinds they care about and call {@link #visitChildren} to keep walking.
 */
public interface PhpNodeVisitor {
    default void visitChildren(PhpNode node) {
        for (var child : node.children()) {
            child.accept(this);
        }
    }

    default void visitProgram(PhpNode.Program node) {
        visitChildren(node);
    }

    default void visitNamespace(PhpNode.Namespace node) {
        visitChildren(node);
    }

    default void visitClassLike(PhpNode.ClassLike node) {
        visitChildren(node);
    }

    default void visitFunctionLike(PhpNode.FunctionLike node) {
        visitChildren(node);
    }

    default void visitParameter(PhpNode.Parameter node) {
        visitChildren(node);
    }

    default void visitPropertyDeclaration(PhpNode.PropertyDeclaration node) {
        visitChildren(node);
    }

    default void visitNewExpression(PhpNode.NewExpression node) {
        visitChildren(node);
    }

    default void visitPropertyLookup(PhpNode.PropertyLookup node) {
        visitChildren(node);
    }

    default void visitMethodCall(PhpNode.MethodCall node) {
        visitChildren(node);
    }

    default void visitStaticCall(PhpNode.StaticCall node) {
        visitChildren(node);
    }

    default void visitStaticLookup(PhpNode.StaticLookup node) {
        visitChildren(node);
    }

    default void visitUseDeclaration(PhpNode.UseDeclaration node) {}

    default void visitAssignment(PhpNode.Assignment node) {
        visitChildren(node);
    }

    default void visitVariable(PhpNode.Variable node) {}

    default void visitNameReference(PhpNode.NameReference node) {}

    default void visitBlock(PhpNode.Block node) {
        visitChildren(node);
    }

    default void visitOther(PhpNode.Other node) {
        visitChildren(node);
    }
}

package ai.phprefactor.refactor;

import ai.phprefactor.analyzer.SourceSpan;
import ai.phprefactor.analyzer.php.PhpNode;
import ai.phprefactor.analyzer.php.NamespaceAwareVisitor;
import ai.phprefactor.analyzer.php.PhpTree;
import java.util.ArrayList;
import java.util.List;

/** Locates method declarations inside class-likes of the target type in a freshly parsed file. */
final class DeclarationFinder {
    private DeclarationFinder() {}

    static List<SourceSpan> methodNameSpans(PhpTree tree, TargetType target, String methodName) {
        var spans = new ArrayList<SourceSpan>();
        tree.root().accept(new NamespaceAwareVisitor() {
            @Override
            public void visitClassLike(PhpNode.ClassLike node) {
                if (target.accepts(qualify(node.name()))) {
                    for (var member : node.members()) {
                        if (member instanceof PhpNode.FunctionLike method
                                && method.kind() == PhpNode.FunctionKind.METHOD
                                && methodName.equalsIgnoreCase(method.name())
                                && method.nameSpan() != null) {
                            spans.add(method.nameSpan());
                        }
                    }
                }
                visitChildren(node);
            }
        });
        return spans;
    }
}

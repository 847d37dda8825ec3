package ai.phprefactor.analyzer.php;

/**
 * Base visitor that keeps {@link #currentNamespace()} in step with the walk. A statement-form namespace applies to the
 * following siblings; a braced namespace applies to its block only.
 */
public abstract class NamespaceAwareVisitor implements PhpNodeVisitor {
    private String namespace = "";

    protected final String currentNamespace() {
        return namespace;
    }

    /** FQN of a name declared in the current namespace. */
    protected final String qualify(String name) {
        return ImportTable.join(namespace, name);
    }

    @Override
    public void visitNamespace(PhpNode.Namespace node) {
        if (node.braced()) {
            var saved = namespace;
            namespace = node.name();
            visitChildren(node);
            namespace = saved;
        } else {
            namespace = node.name();
        }
    }
}

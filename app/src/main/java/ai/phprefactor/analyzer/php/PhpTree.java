package ai.phprefactor.analyzer.php;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** A parsed file: its text and the normalized syntax tree. */
public record PhpTree(String pathHint, SourceText source, PhpNode.Program root) {

    /** Namespace declarations in source order. */
    public List<PhpNode.Namespace> namespaces() {
        var result = new ArrayList<PhpNode.Namespace>();
        for (var node : root.children()) {
            if (node instanceof PhpNode.Namespace ns) {
                result.add(ns);
            }
        }
        return result;
    }

    /** Name of the first declared namespace; empty when the file lives in the global namespace. */
    public String namespaceName() {
        return namespaces().stream().findFirst().map(PhpNode.Namespace::name).orElse("");
    }

    /** Import statements at file or namespace level, in source order. */
    public List<PhpNode.UseDeclaration> imports() {
        var result = new ArrayList<PhpNode.UseDeclaration>();
        collectTopLevel(root.children(), PhpNode.UseDeclaration.class, result);
        return result;
    }

    /** Class, interface, trait and enum declarations at file or namespace level. */
    public List<PhpNode.ClassLike> classLikes() {
        var result = new ArrayList<PhpNode.ClassLike>();
        collectTopLevel(root.children(), PhpNode.ClassLike.class, result);
        return result;
    }

    /** The first class-like declaration; by convention the type the file is named after. */
    public Optional<PhpNode.ClassLike> primaryClassLike() {
        return classLikes().stream().findFirst();
    }

    public ImportTable importTable() {
        return ImportTable.of(imports());
    }

    private static <T extends PhpNode> void collectTopLevel(List<PhpNode> nodes, Class<T> type, List<T> out) {
        for (var node : nodes) {
            if (type.isInstance(node)) {
                out.add(type.cast(node));
            } else if (node instanceof PhpNode.Namespace ns) {
                collectTopLevel(ns.children(), type, out);
            } else if (node instanceof PhpNode.Other other && "declare_statement".equals(other.type())) {
                collectTopLevel(other.children(), type, out);
            }
        }
    }
}

package ai.phprefactor.analyzer;

import ai.phprefactor.analyzer.php.NamespaceAwareVisitor;
import ai.phprefactor.analyzer.php.PhpNode;
import ai.phprefactor.analyzer.php.PhpParseException;
import ai.phprefactor.analyzer.php.PhpParser;
import ai.phprefactor.analyzer.php.PhpTree;
import ai.phprefactor.analyzer.php.TypeReferences;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Finds where a class-like is declared, imported and named. Candidate files come from the coarse usage index; every
 * name is then resolved through its own file's imports and namespace, so a same-named class elsewhere never matches.
 */
public final class ClassReferenceFinder {
    private static final Logger logger = LogManager.getLogger(ClassReferenceFinder.class);

    private final ISymbolIndex index;
    private final PhpParser parser;

    public ClassReferenceFinder(ISymbolIndex index, PhpParser parser) {
        this.index = index;
        this.parser = parser;
    }

    /** References sorted by file and position. */
    public List<SymbolReference> find(String classFqn) {
        var fqn = classFqn.startsWith("\\") ? classFqn.substring(1) : classFqn;
        var simpleName = InheritanceEdge.simpleName(fqn);
        var candidates = new TreeSet<ProjectFile>(index.filesUsing(simpleName));
        index.lookupDefinitions(simpleName).stream()
                .filter(d -> d.fullyQualifiedName().equalsIgnoreCase(fqn))
                .forEach(d -> candidates.add(d.file()));

        var result = new ArrayList<SymbolReference>();
        for (var file : candidates) {
            PhpTree tree;
            try {
                tree = parser.parse(file);
            } catch (PhpParseException e) {
                logger.warn("Skipping {} while finding references: {}", file, e.getMessage());
                continue;
            } catch (IOException e) {
                logger.warn("Unable to read {}: {}", file, e.getMessage());
                continue;
            }
            collect(file, tree, fqn, result);
        }
        var sorted = result.stream().distinct().sorted().toList();
        logger.debug("Found {} references to {} in {} candidate files", sorted.size(), fqn, candidates.size());
        return sorted;
    }

    private static void collect(ProjectFile file, PhpTree tree, String fqn, List<SymbolReference> out) {
        tree.root().accept(new NamespaceAwareVisitor() {
            @Override
            public void visitClassLike(PhpNode.ClassLike node) {
                if (qualify(node.name()).equalsIgnoreCase(fqn)) {
                    out.add(new SymbolReference(file, node.nameSpan().toTextRange(), SymbolReference.Kind.DECLARATION));
                }
                visitChildren(node);
            }
        });
        for (var declaration : tree.imports()) {
            if (declaration.kind() != PhpNode.UseKind.CLASS) {
                continue;
            }
            for (var clause : declaration.clauses()) {
                if (clause.name().equalsIgnoreCase(fqn)) {
                    out.add(new SymbolReference(file, clause.nameSpan().toTextRange(), SymbolReference.Kind.IMPORT));
                }
            }
        }
        var imports = tree.importTable();
        for (var reference : TypeReferences.collect(tree)) {
            var ref = reference.ref();
            if (!ref.isBuiltin() && imports.resolve(ref, reference.namespace()).equalsIgnoreCase(fqn)) {
                out.add(new SymbolReference(file, ref.span().toTextRange(), SymbolReference.Kind.TYPE));
            }
        }
    }
}

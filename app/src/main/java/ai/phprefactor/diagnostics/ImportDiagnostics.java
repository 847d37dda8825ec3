package ai.phprefactor.diagnostics;

import ai.phprefactor.analyzer.ISymbolIndex;
import ai.phprefactor.analyzer.ImportDiagnostic;
import ai.phprefactor.analyzer.ProjectFile;
import ai.phprefactor.analyzer.php.ImportTable;
import ai.phprefactor.analyzer.php.PhpParseException;
import ai.phprefactor.analyzer.php.PhpParser;
import ai.phprefactor.analyzer.php.PhpTree;
import ai.phprefactor.analyzer.php.TypeRef;
import ai.phprefactor.analyzer.php.TypeReferences;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reports class names used as type hints, instantiations, static lookups or inheritance targets that the file can only
 * see if someone adds an import. A name is fine when it is built in, qualified, imported, or defined in the file's own
 * namespace.
 */
public final class ImportDiagnostics {
    private static final Logger logger = LogManager.getLogger(ImportDiagnostics.class);

    private final ISymbolIndex index;
    private final PhpParser parser;

    public ImportDiagnostics(ISymbolIndex index, PhpParser parser) {
        this.index = index;
        this.parser = parser;
    }

    /** Diagnostics for the given content of the file; empty if it does not parse. */
    public List<ImportDiagnostic> diagnose(ProjectFile file, String content) {
        PhpTree tree;
        try {
            tree = parser.parse(content, file.toString());
        } catch (PhpParseException e) {
            logger.debug("No import diagnostics for {}: {}", file, e.getMessage());
            return List.of();
        }
        return diagnose(file, tree);
    }

    public List<ImportDiagnostic> diagnose(ProjectFile file, PhpTree tree) {
        var imports = tree.importTable();
        var declaredHere = tree.classLikes().stream().map(c -> c.name()).toList();
        var result = new ArrayList<ImportDiagnostic>();
        for (var reference : TypeReferences.collect(tree)) {
            if (!reference.context().isTypeSite()) {
                continue;
            }
            var ref = reference.ref();
            if (isVisible(ref, reference.namespace(), imports, declaredHere)) {
                continue;
            }
            result.add(ImportDiagnostic.missingImport(file, ref.span(), ref.text()));
        }
        return result;
    }

    private boolean isVisible(TypeRef ref, String namespace, ImportTable imports, List<String> declaredHere) {
        if (ref.isBuiltin() || ref.isQualified() || imports.imports(ref.text())) {
            return true;
        }
        if (declaredHere.stream().anyMatch(ref.text()::equalsIgnoreCase)) {
            return true;
        }
        var sameNamespace = ImportTable.join(namespace, ref.text());
        return index.lookupDefinitions(ref.text()).stream()
                .anyMatch(d -> d.fullyQualifiedName().equalsIgnoreCase(sameNamespace));
    }
}

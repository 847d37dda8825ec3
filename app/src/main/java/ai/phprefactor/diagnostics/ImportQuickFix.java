package ai.phprefactor.diagnostics;

import ai.phprefactor.analyzer.EditOperation;
import ai.phprefactor.analyzer.ISymbolIndex;
import ai.phprefactor.analyzer.ImportDiagnostic;
import ai.phprefactor.analyzer.php.SourceText;
import ai.phprefactor.refactor.ImportEditor;
import java.util.ArrayList;
import java.util.List;

/** Offers one "import X" fix per known class whose short name matches a missing-import diagnostic. */
public final class ImportQuickFix {

    public record Fix(String title, String fullyQualifiedName, EditOperation edit) {}

    private final ISymbolIndex index;

    public ImportQuickFix(ISymbolIndex index) {
        this.index = index;
    }

    public List<Fix> fixesFor(ImportDiagnostic diagnostic, String content) {
        if (!ImportDiagnostic.MISSING_IMPORT.equals(diagnostic.code())) {
            return List.of();
        }
        var source = SourceText.of(content);
        var fixes = new ArrayList<Fix>();
        for (var definition : index.lookupDefinitions(diagnostic.name())) {
            var fqn = definition.fullyQualifiedName();
            if (fixes.stream().anyMatch(f -> f.fullyQualifiedName().equalsIgnoreCase(fqn))) {
                continue;
            }
            ImportEditor.addImports(diagnostic.file(), source, List.of(fqn))
                    .ifPresent(edit -> fixes.add(new Fix("Import '" + fqn + "'", fqn, edit)));
        }
        return fixes;
    }
}

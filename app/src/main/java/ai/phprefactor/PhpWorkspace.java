package ai.phprefactor;

import ai.phprefactor.analyzer.ClassReferenceFinder;
import ai.phprefactor.analyzer.ISymbolIndex;
import ai.phprefactor.analyzer.ImportDiagnostic;
import ai.phprefactor.analyzer.ProjectFile;
import ai.phprefactor.analyzer.SymbolDefinition;
import ai.phprefactor.analyzer.SymbolReference;
import ai.phprefactor.analyzer.TextPosition;
import ai.phprefactor.analyzer.TextRange;
import ai.phprefactor.analyzer.composer.ComposerNamespaceResolver;
import ai.phprefactor.analyzer.php.ImportTable;
import ai.phprefactor.analyzer.php.PhpParseException;
import ai.phprefactor.analyzer.php.PhpParser;
import ai.phprefactor.analyzer.php.SourceText;
import ai.phprefactor.analyzer.php.TypeReferences;
import ai.phprefactor.diagnostics.ImportDiagnostics;
import ai.phprefactor.diagnostics.ImportQuickFix;
import ai.phprefactor.diagnostics.PhpstanRunner;
import ai.phprefactor.refactor.ClassFileGenerator;
import ai.phprefactor.refactor.FileMovePlanner;
import ai.phprefactor.refactor.MethodRenamePlanner;
import ai.phprefactor.refactor.RefactorResult;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Entry point for hosts: one project, its index service, and the queries and refactorings that run against them.
 * Queries read whatever the index holds at the time; refactorings re-parse the files they touch.
 */
public final class PhpWorkspace implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(PhpWorkspace.class);

    private final PhpProject project;
    private final PhpParser parser = new PhpParser();
    private final ComposerNamespaceResolver namespaces;
    private final IndexManager indexManager;
    private final PhpstanRunner phpstan;

    public PhpWorkspace(PhpProject project) {
        this.project = project;
        this.namespaces = new ComposerNamespaceResolver(project.getRoot());
        this.indexManager = new IndexManager(project, parser);
        this.phpstan = new PhpstanRunner(project.getRoot(), project.getSettings());
    }

    public static PhpWorkspace open(Path root) {
        return new PhpWorkspace(PhpProject.open(root));
    }

    public PhpProject getProject() {
        return project;
    }

    public IndexManager getIndexManager() {
        return indexManager;
    }

    public ComposerNamespaceResolver getNamespaceResolver() {
        return namespaces;
    }

    public PhpstanRunner getPhpstan() {
        return phpstan;
    }

    public ISymbolIndex index() {
        return indexManager.getIndex();
    }

    /** Scans the whole project and waits for the scan to finish. */
    public ISymbolIndex indexAll() {
        return indexManager.startFullScan(IndexManager.ProgressListener.NONE).join();
    }

    public CompletableFuture<Void> fileChanged(ProjectFile file) {
        if (file.getFileName().equals(ComposerNamespaceResolver.COMPOSER_JSON)) {
            namespaces.invalidate();
        }
        return file.isPhp() ? indexManager.updateFile(file) : CompletableFuture.completedFuture(null);
    }

    public CompletableFuture<Void> fileDeleted(ProjectFile file) {
        return indexManager.removeFile(file);
    }

    // ---- navigation ----

    /**
     * Definitions of the class name at the position. Definitions whose FQN matches the name as resolved through the
     * file's imports and namespace come first; other same-named definitions follow.
     */
    public List<SymbolDefinition> definitionsAt(ProjectFile file, TextPosition position) throws IOException {
        var content = file.read();
        try {
            var tree = parser.parse(content, file.toString());
            int offset = tree.source().offsetOf(position);
            var imports = tree.importTable();
            for (var reference : TypeReferences.collect(tree)) {
                var ref = reference.ref();
                if (!ref.span().contains(offset) || ref.isBuiltin()) {
                    continue;
                }
                var fqn = imports.resolve(ref, reference.namespace());
                return ranked(ref.simpleName(), fqn);
            }
            var word = wordAt(content, offset);
            if (word.isEmpty()) {
                return List.of();
            }
            var fqn = imports.lookup(word).orElse(ImportTable.join(tree.namespaceName(), word));
            return ranked(word, fqn);
        } catch (PhpParseException e) {
            logger.debug("Falling back to word lookup in {}: {}", file, e.getMessage());
            var word = wordAt(content, SourceText.of(content).offsetOf(position));
            return word.isEmpty() ? List.of() : index().lookupDefinitions(word);
        }
    }

    private List<SymbolDefinition> ranked(String simpleName, String fqn) {
        var result = new ArrayList<>(index().lookupDefinitions(simpleName));
        result.sort(Comparator.comparing(d -> !d.fullyQualifiedName().equalsIgnoreCase(fqn)));
        return result;
    }

    private static String wordAt(String content, int offset) {
        int start = offset;
        while (start > 0 && isNameChar(content.charAt(start - 1))) {
            start--;
        }
        int end = offset;
        while (end < content.length() && isNameChar(content.charAt(end))) {
            end++;
        }
        return content.substring(start, end);
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    public List<SymbolDefinition> implementationsOf(String interfaceName) {
        return index().implementorsOf(interfaceName);
    }

    public Set<ProjectFile> filesReferencing(String shortName) {
        return index().filesUsing(shortName);
    }

    /**
     * Where the class-like is declared, imported and named or, given a method name, where that method is declared and
     * called on receivers of the class (or, for an interface, of its implementors). Empty when the index does not know
     * the class.
     */
    public List<SymbolReference> references(String classFqn, @Nullable String methodName) {
        if (methodName == null) {
            return new ClassReferenceFinder(index(), parser).find(classFqn);
        }
        var fqn = classFqn.startsWith("\\") ? classFqn.substring(1) : classFqn;
        var definition = index().lookupDefinitions(fqn).stream()
                .filter(d -> d.fullyQualifiedName().equalsIgnoreCase(fqn))
                .findFirst();
        if (definition.isEmpty()) {
            logger.debug("No definition of {} to look up {} in", fqn, methodName);
            return List.of();
        }
        var declaration = definition.get();
        return new MethodRenamePlanner(project, index(), parser)
                .findReferences(declaration.file(), methodName, declaration.span().toTextRange());
    }

    // ---- refactorings ----

    public RefactorResult renameMethod(ProjectFile file, String oldName, String newName, @Nullable TextRange cursor) {
        var planner = new MethodRenamePlanner(project, index(), parser);
        return planner.plan(new MethodRenamePlanner.Request(file, oldName, newName, cursor));
    }

    /** Plans the edits after {@code from} was moved to {@code to} on disk, then re-indexes both paths. */
    public RefactorResult fileMoved(ProjectFile from, ProjectFile to) {
        project.invalidateAllFiles();
        var result = new FileMovePlanner(project, index(), namespaces, parser).plan(from, to);
        indexManager.moveFile(from, to);
        return result;
    }

    // ---- diagnostics ----

    public List<ImportDiagnostic> importDiagnostics(ProjectFile file) throws IOException {
        return new ImportDiagnostics(index(), parser).diagnose(file, file.read());
    }

    public List<ImportQuickFix.Fix> quickFixes(ImportDiagnostic diagnostic) throws IOException {
        return new ImportQuickFix(index()).fixesFor(diagnostic, diagnostic.file().read());
    }

    public ClassFileGenerator classFileGenerator() {
        return new ClassFileGenerator(namespaces);
    }

    @Override
    public void close() {
        indexManager.close();
    }
}

package ai.phprefactor.refactor;

import ai.phprefactor.analyzer.EditBatch;
import ai.phprefactor.analyzer.EditOperation;
import ai.phprefactor.analyzer.IProject;
import ai.phprefactor.analyzer.ISymbolIndex;
import ai.phprefactor.analyzer.InheritanceEdge;
import ai.phprefactor.analyzer.OverlappingEditException;
import ai.phprefactor.analyzer.ProjectFile;
import ai.phprefactor.analyzer.TextPosition;
import ai.phprefactor.analyzer.TextRange;
import ai.phprefactor.analyzer.composer.NamespaceResolver;
import ai.phprefactor.analyzer.php.ImportTable;
import ai.phprefactor.analyzer.php.PhpNode;
import ai.phprefactor.analyzer.php.PhpParseException;
import ai.phprefactor.analyzer.php.PhpParser;
import ai.phprefactor.analyzer.php.PhpTree;
import ai.phprefactor.analyzer.php.SourceText;
import ai.phprefactor.analyzer.php.TypeReferences;
import ai.phprefactor.analyzer.php.UseClause;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Plans the edits that keep a project consistent after a PHP file was moved or renamed on disk. The moved file gets
 * the namespace its new location maps to (and, when it was named after its class, the new class name); every other
 * file that imports, fully qualifies or implicitly sees the class is rewritten to the new name.
 *
 * <p>The physical move has already happened when this runs, so the moved file is read from its new location.
 */
public final class FileMovePlanner {
    private static final Logger logger = LogManager.getLogger(FileMovePlanner.class);

    private static final Pattern NAMESPACE_STATEMENT = Pattern.compile("namespace\\s+([^;]+);");

    private final IProject project;
    private final ISymbolIndex index;
    private final NamespaceResolver namespaces;
    private final PhpParser parser;

    public FileMovePlanner(IProject project, ISymbolIndex index, NamespaceResolver namespaces, PhpParser parser) {
        this.project = project;
        this.index = index;
        this.namespaces = namespaces;
        this.parser = parser;
    }

    /** What the moved file declared and what it is about to become. */
    private record Move(
            ProjectFile newFile,
            String fromNamespace,
            String toNamespace,
            String oldName,
            String newName,
            boolean namespaceChanged) {
        String oldFqn() {
            return ImportTable.join(fromNamespace, oldName);
        }

        String newFqn() {
            return ImportTable.join(toNamespace, newName);
        }

        boolean renamed() {
            return !oldName.equals(newName);
        }
    }

    public RefactorResult plan(ProjectFile oldFile, ProjectFile newFile) {
        if (!oldFile.isPhp() || !newFile.isPhp()) {
            return new RefactorResult.Success(EditBatch.empty());
        }
        String content;
        try {
            content = newFile.read();
        } catch (IOException e) {
            return RefactorResult.refused("Cannot read %s: %s".formatted(newFile, e.getMessage()));
        }
        var source = SourceText.of(content);
        PhpTree tree = null;
        try {
            tree = parser.parse(content, newFile.toString());
        } catch (PhpParseException e) {
            logger.warn("Moved file {} does not parse, falling back to text replacement: {}", newFile, e.getMessage());
        }

        var oldNamespace = namespaces.resolve(oldFile);
        var newNamespace = namespaces.resolve(newFile);
        var declared = tree != null ? tree.namespaceName() : declaredNamespace(content);
        boolean namespaceChanged = oldNamespace.isPresent()
                && newNamespace.isPresent()
                && !oldNamespace.get().equals(newNamespace.get());

        var batch = EditBatch.builder();
        if (namespaceChanged) {
            batch.add(namespaceEdit(newFile, source, tree, newNamespace.get()));
        }
        if (tree == null) {
            return build(batch);
        }

        var primary = tree.primaryClassLike();
        var oldName = primary.map(PhpNode.ClassLike::name).orElse(oldFile.stem());
        var newName = oldName;
        if (primary.isPresent() && oldName.equals(oldFile.stem()) && !newFile.stem().equals(oldFile.stem())) {
            newName = newFile.stem();
            batch.add(EditOperation.replace(newFile, primary.get().nameSpan(), newName));
        }
        var move = namespaceChanged
                ? new Move(newFile, oldNamespace.get(), newNamespace.get(), oldName, newName, true)
                : new Move(newFile, declared, declared, oldName, newName, false);
        if (primary.isEmpty() || move.oldFqn().equalsIgnoreCase(move.newFqn())) {
            return build(batch);
        }
        logger.debug("Propagating move of {} to {}", move.oldFqn(), move.newFqn());

        updateMovedFile(move, tree, batch);
        for (var file : project.getAllFiles()) {
            if (file.equals(newFile) || file.equals(oldFile)) {
                continue;
            }
            updateReferencingFile(move, file, batch);
        }
        return build(batch);
    }

    private static RefactorResult build(EditBatch.Builder batch) {
        try {
            return new RefactorResult.Success(batch.build());
        } catch (OverlappingEditException e) {
            logger.error("Move produced overlapping edits", e);
            return RefactorResult.refused(e.getMessage());
        }
    }

    // ---- the moved file ----

    private static EditOperation namespaceEdit(
            ProjectFile file, SourceText source, @Nullable PhpTree tree, String newNamespace) {
        var statement = "namespace " + newNamespace + ";";
        if (tree != null) {
            var existing = tree.namespaces().stream().findFirst();
            if (existing.isPresent()) {
                var ns = existing.get();
                if (!ns.braced()) {
                    return EditOperation.replace(file, ns.span(), statement);
                }
                if (ns.nameSpan() != null) {
                    return EditOperation.replace(file, ns.nameSpan(), newNamespace);
                }
                var afterKeyword = source.position(ns.span().startOffset() + "namespace".length());
                return EditOperation.insert(file, afterKeyword, " " + newNamespace);
            }
        } else {
            var matcher = NAMESPACE_STATEMENT.matcher(source.text());
            if (matcher.find()) {
                return EditOperation.replace(file, source.span(matcher.start(), matcher.end()), statement);
            }
        }
        return insertNamespace(file, source, statement);
    }

    private static EditOperation insertNamespace(ProjectFile file, SourceText source, String statement) {
        var separator = source.lineSeparator();
        for (int i = 0; i < source.lineCount(); i++) {
            var line = source.line(i);
            int tag = line.indexOf("<?php");
            if (tag < 0) {
                continue;
            }
            if (!line.substring(tag + 5).isBlank()) {
                var afterTag = new TextPosition(i, tag + 5);
                return EditOperation.insert(file, afterTag, separator + separator + statement + separator + separator);
            }
            if (i + 1 >= source.lineCount()) {
                return EditOperation.insert(
                        file, new TextPosition(i, line.length()), separator + separator + statement + separator);
            }
            boolean nextBlank = source.line(i + 1).isBlank();
            var text = separator + statement + separator + (nextBlank ? "" : separator);
            return EditOperation.insert(file, new TextPosition(i + 1, 0), text);
        }
        return EditOperation.insert(
                file, new TextPosition(0, 0), "<?php" + separator + separator + statement + separator + separator);
    }

    private static String declaredNamespace(String content) {
        var matcher = NAMESPACE_STATEMENT.matcher(content);
        return matcher.find() ? matcher.group(1).trim() : "";
    }

    /**
     * Inside the moved file: imports of classes that now share its namespace become redundant, classes of the old
     * namespace it used without importing need imports, and its own references follow a class rename.
     */
    private void updateMovedFile(Move move, PhpTree tree, EditBatch.Builder batch) {
        var file = move.newFile();
        var imports = tree.importTable();
        if (move.renamed()) {
            var selfFqn = ImportTable.join(tree.namespaceName(), move.oldName());
            renameSimpleReferences(move, file, tree, imports, selfFqn, batch);
        }
        if (!move.namespaceChanged() || tree.namespaces().isEmpty()) {
            return;
        }

        var redundant = new ArrayList<String>();
        for (var declaration : tree.imports()) {
            if (declaration.kind() != PhpNode.UseKind.CLASS || declaration.groupPrefix() != null) {
                continue;
            }
            for (var clause : declaration.clauses()) {
                if (clause.alias() == null && namespaceOf(clause.name()).equalsIgnoreCase(move.toNamespace())) {
                    redundant.add(clause.name());
                }
            }
        }
        var siblings = new LinkedHashSet<String>();
        for (var reference : TypeReferences.collect(tree)) {
            var ref = reference.ref();
            if (ref.isQualified() || ref.isBuiltin() || ref.isRelativeScope() || imports.imports(ref.text())) {
                continue;
            }
            if (ref.text().equalsIgnoreCase(move.oldName())) {
                continue;
            }
            var siblingFqn = ImportTable.join(move.fromNamespace(), ref.text());
            if (isKnownClass(siblingFqn)) {
                siblings.add(siblingFqn);
            }
        }
        ImportEditor.rewrite(file, tree.source(), siblings, redundant).ifPresent(batch::add);
    }

    // ---- other files ----

    private void updateReferencingFile(Move move, ProjectFile file, EditBatch.Builder batch) {
        String content;
        try {
            content = file.read();
        } catch (IOException e) {
            logger.warn("Unable to read {} during move: {}", file, e.getMessage());
            return;
        }
        if (!content.toLowerCase(Locale.ROOT).contains(move.oldName().toLowerCase(Locale.ROOT))) {
            return;
        }
        PhpTree tree;
        try {
            tree = parser.parse(content, file.toString());
        } catch (PhpParseException e) {
            logger.warn("Skipping {} during move: {}", file, e.getMessage());
            return;
        }

        var fileNamespace = tree.namespaceName();
        var imports = tree.importTable();
        boolean importsUnaliased = false;
        for (var declaration : tree.imports()) {
            if (declaration.kind() != PhpNode.UseKind.CLASS) {
                continue;
            }
            var matching = declaration.clauses().stream()
                    .filter(c -> c.name().equalsIgnoreCase(move.oldFqn()))
                    .toList();
            if (matching.isEmpty()) {
                continue;
            }
            importsUnaliased |= matching.stream().anyMatch(c -> c.alias() == null);
            rewriteImport(move, file, tree.source(), fileNamespace, declaration, matching, batch);
        }

        var references = TypeReferences.collect(tree);
        for (var reference : references) {
            var ref = reference.ref();
            if (ref.isQualified() && imports.resolve(ref, reference.namespace()).equalsIgnoreCase(move.oldFqn())) {
                batch.add(EditOperation.replace(file, ref.span(), "\\" + move.newFqn()));
            }
        }

        boolean implicit = fileNamespace.equalsIgnoreCase(move.fromNamespace())
                && !imports.imports(move.oldName())
                && !imports.importsFqn(move.oldFqn());
        if (implicit && move.namespaceChanged() && !fileNamespace.equalsIgnoreCase(move.toNamespace())) {
            boolean usesShortName = references.stream()
                    .map(TypeReferences.Reference::ref)
                    .anyMatch(ref -> !ref.isQualified() && ref.text().equalsIgnoreCase(move.oldName()));
            if (usesShortName) {
                ImportEditor.addImports(file, tree.source(), List.of(move.newFqn())).ifPresent(batch::add);
            }
        }
        if (move.renamed() && (importsUnaliased || implicit)) {
            renameSimpleReferences(move, file, tree, imports, move.oldFqn(), batch);
        }
    }

    private void rewriteImport(
            Move move,
            ProjectFile file,
            SourceText source,
            String fileNamespace,
            PhpNode.UseDeclaration declaration,
            List<UseClause> matching,
            EditBatch.Builder batch) {
        boolean selfImport = namespaceOf(move.newFqn()).equalsIgnoreCase(fileNamespace);
        if (declaration.groupPrefix() != null) {
            batch.add(EditOperation.replace(
                    file, declaration.span(), regroup(move, source, declaration, matching, selfImport)));
            return;
        }
        var clause = matching.get(0);
        if (declaration.clauses().size() == 1 && selfImport && clause.alias() == null) {
            batch.add(new EditOperation(file, wholeLines(source, declaration), ""));
            return;
        }
        for (var match : matching) {
            var written = source.slice(match.nameSpan());
            var prefix = written.startsWith("\\") ? "\\" : "";
            batch.add(EditOperation.replace(file, match.nameSpan(), prefix + move.newFqn()));
        }
    }

    /** A grouped import with the moved class taken out of the group and imported on its own line. */
    private static String regroup(
            Move move,
            SourceText source,
            PhpNode.UseDeclaration declaration,
            List<UseClause> matching,
            boolean selfImport) {
        var remaining = declaration.clauses().stream()
                .filter(c -> !matching.contains(c))
                .map(c -> source.slice(c.span()).trim())
                .toList();
        var statements = new ArrayList<String>();
        if (!remaining.isEmpty()) {
            statements.add("use " + declaration.groupPrefix() + "\\{" + String.join(", ", remaining) + "};");
        }
        for (var clause : matching) {
            if (selfImport && clause.alias() == null) {
                continue;
            }
            var alias = clause.alias() == null ? "" : " as " + clause.alias();
            statements.add("use " + move.newFqn() + alias + ";");
        }
        return String.join(source.lineSeparator(), statements);
    }

    /** The statement's lines including the terminator of its last line. */
    private static TextRange wholeLines(SourceText source, PhpNode.UseDeclaration declaration) {
        var span = declaration.span();
        var start = new TextPosition(span.startLine() - 1, 0);
        if (span.endLine() < source.lineCount()) {
            return new TextRange(start, new TextPosition(span.endLine(), 0));
        }
        return new TextRange(start, new TextPosition(span.endLine() - 1, source.line(span.endLine() - 1).length()));
    }

    private static void renameSimpleReferences(
            Move move, ProjectFile file, PhpTree tree, ImportTable imports, String resolvesTo, EditBatch.Builder batch) {
        for (var reference : TypeReferences.collect(tree)) {
            var ref = reference.ref();
            if (ref.isQualified() || !ref.text().equalsIgnoreCase(move.oldName())) {
                continue;
            }
            if (imports.resolve(ref, reference.namespace()).equalsIgnoreCase(resolvesTo)) {
                batch.add(EditOperation.replace(file, ref.span(), move.newName()));
            }
        }
    }

    private boolean isKnownClass(String fqn) {
        return index.lookupDefinitions(InheritanceEdge.simpleName(fqn)).stream()
                .anyMatch(d -> d.fullyQualifiedName().equalsIgnoreCase(fqn));
    }

    private static String namespaceOf(String fqn) {
        int sep = fqn.lastIndexOf('\\');
        return sep < 0 ? "" : fqn.substring(0, sep);
    }
}

package ai.phprefactor.cli;

import ai.phprefactor.PhpWorkspace;
import ai.phprefactor.analyzer.EditBatch;
import ai.phprefactor.analyzer.ProjectFile;
import ai.phprefactor.analyzer.SymbolKind;
import ai.phprefactor.analyzer.TextPosition;
import ai.phprefactor.analyzer.TextRange;
import ai.phprefactor.diagnostics.PhpstanDiagnostic;
import ai.phprefactor.refactor.EditApplier;
import ai.phprefactor.refactor.RefactorResult;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "php-refactor",
        mixinStandardHelpOptions = true,
        description = "Index a PHP project and plan type-aware refactorings.",
        subcommands = {
            PhpRefactorCli.IndexCommand.class,
            PhpRefactorCli.DefinitionCommand.class,
            PhpRefactorCli.ImplementationsCommand.class,
            PhpRefactorCli.ReferencesCommand.class,
            PhpRefactorCli.RenameMethodCommand.class,
            PhpRefactorCli.MoveCommand.class,
            PhpRefactorCli.DiagnosticsCommand.class,
            PhpRefactorCli.NewClassCommand.class
        })
public final class PhpRefactorCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(PhpRefactorCli.class);

    @CommandLine.Option(names = "--project", description = "Path to the project root.", scope = CommandLine.ScopeType.INHERIT)
    private Path projectPath = Path.of(".");

    @CommandLine.Spec
    @Nullable
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PhpRefactorCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (spec != null) {
            spec.commandLine().usage(spec.commandLine().getOut());
        }
        return 0;
    }

    PhpWorkspace openWorkspace() {
        var root = projectPath.toAbsolutePath().normalize();
        logger.debug("Opening project at {}", root);
        return PhpWorkspace.open(root);
    }

    /** Shared parent access and edit output for the subcommands. */
    abstract static class Subcommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        @Nullable
        PhpRefactorCli parent;

        @CommandLine.Spec
        @Nullable
        CommandLine.Model.CommandSpec spec;

        PhpWorkspace workspace() {
            if (parent == null) {
                throw new IllegalStateException("Subcommand used without its parent command");
            }
            return parent.openWorkspace();
        }

        PrintWriter out() {
            return spec == null ? new PrintWriter(System.out, true) : spec.commandLine().getOut();
        }

        PrintWriter err() {
            return spec == null ? new PrintWriter(System.err, true) : spec.commandLine().getErr();
        }

        ProjectFile file(PhpWorkspace workspace, String path) {
            var resolved = workspace.getProject().getRoot().resolve(path);
            return workspace.getProject()
                    .toProjectFile(resolved)
                    .orElseThrow(() -> new CommandLine.ParameterException(
                            spec == null ? new CommandLine(this) : spec.commandLine(),
                            "%s is outside the project".formatted(path)));
        }

        int report(RefactorResult result, boolean apply) throws IOException {
            if (result instanceof RefactorResult.Refused refused) {
                err().println("Refused: " + refused.reason());
                return 2;
            }
            var edits = result.editsOrEmpty();
            printEdits(edits);
            if (apply && !edits.isEmpty()) {
                var written = EditApplier.applyToDisk(edits);
                out().printf("Updated %d file(s)%n", written.size());
            }
            return 0;
        }

        void printEdits(EditBatch edits) {
            if (edits.isEmpty()) {
                out().println("No changes");
                return;
            }
            for (var entry : edits.byFile().entrySet()) {
                out().println(entry.getKey());
                for (var op : entry.getValue()) {
                    out().printf("  %s -> \"%s\"%n", op.range(), op.replacementText().replace("\n", "\\n"));
                }
            }
        }
    }

    @CommandLine.Command(name = "index", description = "Scan the project and print index statistics.")
    static final class IndexCommand extends Subcommand {
        @Override
        public Integer call() {
            try (var workspace = workspace()) {
                workspace.indexAll();
                var stats = workspace.getIndexManager().getIndex().stats();
                out().printf(
                        "%d files, %d class-likes, %d methods, %d inheritance edges%n",
                        stats.files(), stats.definitions(), stats.methods(), stats.inheritanceEdges());
                return 0;
            }
        }
    }

    @CommandLine.Command(name = "definition", description = "Find the definition of the class name at a position.")
    static final class DefinitionCommand extends Subcommand {
        @CommandLine.Parameters(index = "0", description = "File, relative to the project root.")
        String path = "";

        @CommandLine.Parameters(index = "1", description = "One-based line.")
        int line;

        @CommandLine.Parameters(index = "2", description = "One-based column.")
        int column;

        @Override
        public Integer call() throws IOException {
            try (var workspace = workspace()) {
                workspace.indexAll();
                var definitions = workspace.definitionsAt(
                        file(workspace, path), new TextPosition(line - 1, Math.max(0, column - 1)));
                if (definitions.isEmpty()) {
                    err().println("No definition found");
                    return 1;
                }
                definitions.forEach(d -> out().printf(
                        "%s %s:%d%n", d.fullyQualifiedName(), d.file(), d.span().startLine()));
                return 0;
            }
        }
    }

    @CommandLine.Command(name = "implementations", description = "List the classes implementing an interface.")
    static final class ImplementationsCommand extends Subcommand {
        @CommandLine.Parameters(index = "0", description = "Interface name, short or fully qualified.")
        String interfaceName = "";

        @Override
        public Integer call() {
            try (var workspace = workspace()) {
                workspace.indexAll();
                workspace.implementationsOf(interfaceName).forEach(d -> out().printf(
                        "%s %s:%d%n", d.fullyQualifiedName(), d.file(), d.span().startLine()));
                return 0;
            }
        }
    }

    @CommandLine.Command(name = "references", description = "List where a class, or one of its methods, is used.")
    static final class ReferencesCommand extends Subcommand {
        @CommandLine.Parameters(index = "0", description = "Fully qualified class name.")
        String className = "";

        @CommandLine.Option(names = "--method", description = "Method of the class to look up instead of the class.")
        @Nullable
        String method;

        @Override
        public Integer call() {
            try (var workspace = workspace()) {
                workspace.indexAll();
                var references = workspace.references(className, method);
                if (references.isEmpty()) {
                    err().println("No references found");
                    return 1;
                }
                references.forEach(r -> out().printf(
                        "%s:%d:%d %s%n",
                        r.file(),
                        r.range().start().line() + 1,
                        r.range().start().column() + 1,
                        r.kind().name().toLowerCase(Locale.ROOT)));
                return 0;
            }
        }
    }

    @CommandLine.Command(name = "rename-method", description = "Rename a method and its type-matched call sites.")
    static final class RenameMethodCommand extends Subcommand {
        @CommandLine.Parameters(index = "0", description = "File containing the method or a call to it.")
        String path = "";

        @CommandLine.Parameters(index = "1", description = "Current method name.")
        String oldName = "";

        @CommandLine.Parameters(index = "2", description = "New method name.")
        String newName = "";

        @CommandLine.Option(names = "--line", description = "One-based line of the cursor.")
        @Nullable
        Integer line;

        @CommandLine.Option(names = "--column", description = "One-based column of the cursor.", defaultValue = "1")
        int column = 1;

        @CommandLine.Option(names = "--apply", description = "Write the edits instead of only printing them.")
        boolean apply;

        @Override
        public Integer call() throws IOException {
            try (var workspace = workspace()) {
                workspace.indexAll();
                var file = file(workspace, path);
                TextRange cursor = null;
                if (line != null) {
                    var at = new TextPosition(line - 1, Math.max(0, column - 1));
                    cursor = TextRange.empty(at);
                }
                return report(workspace.renameMethod(file, oldName, newName, cursor), apply);
            }
        }
    }

    @CommandLine.Command(
            name = "move",
            description = "Move a PHP file and update its namespace, class name and references. "
                    + "Without --apply the file is moved back after planning.")
    static final class MoveCommand extends Subcommand {
        @CommandLine.Parameters(index = "0", description = "Current path.")
        String from = "";

        @CommandLine.Parameters(index = "1", description = "New path.")
        String to = "";

        @CommandLine.Option(names = "--apply", description = "Keep the move and write the edits.")
        boolean apply;

        @Override
        public Integer call() throws IOException {
            try (var workspace = workspace()) {
                workspace.indexAll();
                var source = file(workspace, from);
                var target = file(workspace, to);
                if (target.exists()) {
                    err().println(target + " already exists");
                    return 1;
                }
                var targetParent = target.absPath().getParent();
                if (targetParent != null) {
                    Files.createDirectories(targetParent);
                }
                Files.move(source.absPath(), target.absPath());
                try {
                    var result = workspace.fileMoved(source, target);
                    return report(result, apply);
                } finally {
                    if (!apply) {
                        Files.move(target.absPath(), source.absPath());
                    }
                }
            }
        }
    }

    @CommandLine.Command(name = "diagnostics", description = "Report class names that need an import.")
    static final class DiagnosticsCommand extends Subcommand {
        @CommandLine.Parameters(index = "0", description = "File to check.")
        String path = "";

        @CommandLine.Option(names = "--phpstan", description = "Also run phpstan if it is enabled and installed.")
        boolean phpstan;

        @Override
        public Integer call() throws IOException, InterruptedException {
            try (var workspace = workspace()) {
                workspace.indexAll();
                var file = file(workspace, path);
                var diagnostics = workspace.importDiagnostics(file);
                for (var diagnostic : diagnostics) {
                    out().printf(
                            "%s:%d:%d %s [%s]%n",
                            file,
                            diagnostic.span().startLine(),
                            diagnostic.span().startColumn() + 1,
                            diagnostic.message(),
                            diagnostic.source());
                    for (var fix : workspace.quickFixes(diagnostic)) {
                        out().println("  fix: " + fix.title());
                    }
                }
                int count = diagnostics.size();
                if (phpstan && workspace.getPhpstan().isActive()) {
                    for (var d : workspace.getPhpstan().analyse(file)) {
                        out().printf("%s:%d %s [%s]%n", file, d.line() + 1, d.message(), PhpstanDiagnostic.SOURCE);
                        count++;
                    }
                }
                return count == 0 ? 0 : 1;
            }
        }
    }

    @CommandLine.Command(name = "new-class", description = "Create a class skeleton in the namespace of its path.")
    static final class NewClassCommand extends Subcommand {
        @CommandLine.Parameters(index = "0", description = "Path of the new file, e.g. src/Service/Mailer.php.")
        String path = "";

        @CommandLine.Option(
                names = "--kind",
                description = "One of ${COMPLETION-CANDIDATES}.",
                defaultValue = "CLASS")
        SymbolKind kind = SymbolKind.CLASS;

        @Override
        public Integer call() throws IOException {
            try (var workspace = workspace()) {
                var file = file(workspace, path);
                workspace.classFileGenerator().create(file, kind);
                out().println("Created " + file);
                return 0;
            }
        }
    }
}

package ai.phprefactor.cli;

import static ai.phprefactor.testutil.InlineTestProjectCreator.APP_COMPOSER_JSON;
import static org.junit.jupiter.api.Assertions.*;

import ai.phprefactor.testutil.InlineTestProjectCreator;
import ai.phprefactor.testutil.InlineTestProjectCreator.TestPhpProject;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class PhpRefactorCliTest {

    private static final String GREETER =
            """
            <?php

            namespace App\\Services;

            class Greeter
            {
                public function greet(string $name): string
                {
                    return 'Hello ' . $name;
                }
            }
            """;

    private static final String HOME =
            """
            <?php

            namespace App\\Http;

            use App\\Services\\Greeter;

            class Home
            {
                public function show(Greeter $greeter, Request $request): string
                {
                    return $greeter->greet('you');
                }
            }
            """;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private static TestPhpProject project() throws IOException {
        return InlineTestProjectCreator.code(APP_COMPOSER_JSON, "composer.json")
                .addFileContents(GREETER, "src/Services/Greeter.php")
                .addFileContents(HOME, "src/Http/Home.php")
                .build();
    }

    private int run(TestPhpProject project, String... args) {
        var cli = new CommandLine(new PhpRefactorCli());
        cli.setOut(new PrintWriter(out, true));
        cli.setErr(new PrintWriter(err, true));
        var full = new String[args.length + 2];
        full[0] = "--project";
        full[1] = project.getRoot().toString();
        System.arraycopy(args, 0, full, 2, args.length);
        return cli.execute(full);
    }

    @Test
    void indexPrintsStatistics() throws IOException {
        try (var project = project()) {
            assertEquals(0, run(project, "index"));
            assertTrue(out.toString().startsWith("2 files, 2 class-likes, 2 methods, 2 inheritance edges"), out.toString());
        }
    }

    @Test
    void renamePrintsEditsWithoutApplying() throws IOException {
        try (var project = project()) {
            assertEquals(0, run(project, "rename-method", "src/Services/Greeter.php", "greet", "welcome"));

            assertTrue(out.toString().contains("\"welcome\""));
            assertEquals(HOME, project.read("src/Http/Home.php"));
        }
    }

    @Test
    void renameWithApplyWritesFiles() throws IOException {
        try (var project = project()) {
            assertEquals(0, run(project, "rename-method", "src/Services/Greeter.php", "greet", "welcome", "--apply"));

            assertTrue(out.toString().contains("Updated 2 file(s)"));
            assertTrue(project.read("src/Http/Home.php").contains("$greeter->welcome('you')"));
        }
    }

    @Test
    void refusedRenameExitsWithTwo() throws IOException {
        try (var project = project()) {
            assertEquals(2, run(project, "rename-method", "src/Services/Greeter.php", "greet", "not valid"));
            assertTrue(err.toString().startsWith("Refused:"));
        }
    }

    @Test
    void moveWithoutApplyRestoresTheFile() throws IOException {
        try (var project = project()) {
            assertEquals(0, run(project, "move", "src/Services/Greeter.php", "src/Greeting/Greeter.php"));

            assertTrue(out.toString().contains("namespace App\\Greeting;"));
            assertTrue(Files.exists(project.getRoot().resolve("src/Services/Greeter.php")));
            assertFalse(Files.exists(project.getRoot().resolve("src/Greeting/Greeter.php")));
            assertEquals(HOME, project.read("src/Http/Home.php"));
        }
    }

    @Test
    void moveWithApplyUpdatesReferences() throws IOException {
        try (var project = project()) {
            assertEquals(0, run(project, "move", "src/Services/Greeter.php", "src/Greeting/Greeter.php", "--apply"));

            assertTrue(project.read("src/Greeting/Greeter.php").contains("namespace App\\Greeting;"));
            assertTrue(project.read("src/Http/Home.php").contains("use App\\Greeting\\Greeter;"));
        }
    }

    @Test
    void diagnosticsReportMissingImports() throws IOException {
        try (var project = project()) {
            assertEquals(1, run(project, "diagnostics", "src/Http/Home.php"));
            assertTrue(out.toString().contains("Class 'Request' is not imported."), out.toString());

            assertEquals(0, run(project, "diagnostics", "src/Services/Greeter.php"));
        }
    }

    @Test
    void newClassWritesASkeleton() throws IOException {
        try (var project = project()) {
            assertEquals(0, run(project, "new-class", "src/Contracts/Greets.php", "--kind", "INTERFACE"));

            assertEquals(
                    "<?php\n\nnamespace App\\Contracts;\n\ninterface Greets\n{\n}\n",
                    project.read("src/Contracts/Greets.php"));
        }
    }

    @Test
    void referencesListsClassAndMethodUsages() throws IOException {
        try (var project = project()) {
            assertEquals(0, run(project, "references", "App\\Services\\Greeter"));
            var classOutput = out.toString();
            assertTrue(classOutput.contains("src/Services/Greeter.php:5:7 declaration"), classOutput);
            assertTrue(classOutput.contains("src/Http/Home.php:5:5 import"), classOutput);
            assertTrue(classOutput.contains("src/Http/Home.php:9:26 type"), classOutput);

            out.getBuffer().setLength(0);
            assertEquals(0, run(project, "references", "App\\Services\\Greeter", "--method", "greet"));
            var methodOutput = out.toString();
            assertTrue(methodOutput.contains("src/Services/Greeter.php:7:21 declaration"), methodOutput);
            assertTrue(methodOutput.contains("src/Http/Home.php:11:26 call"), methodOutput);

            assertEquals(1, run(project, "references", "App\\Services\\Missing"));
            assertTrue(err.toString().contains("No references found"));
        }
    }
}

package ai.phprefactor.refactor;

import static ai.phprefactor.testutil.InlineTestProjectCreator.APP_COMPOSER_JSON;
import static org.junit.jupiter.api.Assertions.*;

import ai.phprefactor.analyzer.TextRange;
import ai.phprefactor.analyzer.php.SourceText;
import ai.phprefactor.testutil.InlineTestProjectCreator;
import ai.phprefactor.testutil.InlineTestProjectCreator.TestPhpProject;
import java.io.IOException;
import org.junit.jupiter.api.Test;

class MethodRenamePlannerTest {

    private static final String MAILER =
            """
            <?php

            namespace App\\Services;

            class Mailer
            {
                public function send(string $to): bool
                {
                    return $this->deliver($to);
                }

                public static function create(): static
                {
                    return new static();
                }

                public static function fresh(): self
                {
                    return static::create();
                }

                private function deliver(string $to): bool
                {
                    return true;
                }
            }
            """;

    private static final String SMS =
            """
            <?php

            namespace App\\Services;

            class Sms
            {
                public function send(string $to): bool
                {
                    return false;
                }
            }
            """;

    private static final String CONTROLLER =
            """
            <?php

            namespace App\\Http;

            use App\\Services\\Mailer;
            use App\\Services\\Sms;

            class Controller
            {
                public function __construct(private Mailer $mailer) {}

                public function notify(Sms $sms): void
                {
                    $this->mailer->send('a');
                    $sms->send('b');
                    $local = new Mailer();
                    $local->send('c');
                    $copy = $local;
                    $copy->send('d');
                    Mailer::create()->send('e');
                }
            }
            """;

    private static TestPhpProject servicesProject() throws IOException {
        return InlineTestProjectCreator.code(APP_COMPOSER_JSON, "composer.json")
                .addFileContents(MAILER, "src/Services/Mailer.php")
                .addFileContents(SMS, "src/Services/Sms.php")
                .addFileContents(CONTROLLER, "src/Http/Controller.php")
                .build();
    }

    private static RefactorResult.Success applied(RefactorResult result) throws IOException {
        var success = assertInstanceOf(RefactorResult.Success.class, result);
        EditApplier.applyToDisk(success.edits());
        return success;
    }

    @Test
    void renamesDeclarationAndTypedCallSitesOnly() throws IOException {
        try (var project = servicesProject()) {
            var workspace = project.workspace();
            workspace.indexAll();

            var result = applied(workspace.renameMethod(project.file("src/Services/Mailer.php"), "send", "dispatch", null));

            assertEquals(4, result.edits().size());
            var mailer = project.read("src/Services/Mailer.php");
            assertTrue(mailer.contains("public function dispatch(string $to): bool"));
            assertFalse(mailer.contains("function send"));

            var controller = project.read("src/Http/Controller.php");
            assertTrue(controller.contains("$this->mailer->dispatch('a');"));
            assertTrue(controller.contains("$sms->send('b');"));
            assertTrue(controller.contains("$local->dispatch('c');"));
            assertTrue(controller.contains("$copy->dispatch('d');"));
            // the receiver is a call result, whose type is not inferred
            assertTrue(controller.contains("Mailer::create()->send('e');"));

            assertEquals(SMS, project.read("src/Services/Sms.php"));
        }
    }

    @Test
    void renamesStaticCallsThroughClassNameAndStatic() throws IOException {
        try (var project = servicesProject()) {
            var workspace = project.workspace();
            workspace.indexAll();

            applied(workspace.renameMethod(project.file("src/Services/Mailer.php"), "create", "make", null));

            var mailer = project.read("src/Services/Mailer.php");
            assertTrue(mailer.contains("public static function make(): static"));
            assertTrue(mailer.contains("return static::make();"));
            assertTrue(project.read("src/Http/Controller.php").contains("Mailer::make()->send('e');"));
        }
    }

    @Test
    void interfaceRenameReachesImplementors() throws IOException {
        try (var project = InlineTestProjectCreator.code(APP_COMPOSER_JSON, "composer.json")
                .addFileContents(
                        """
                        <?php
                        namespace App\\Contracts;

                        interface Notifier
                        {
                            public function send(string $message): void;
                        }
                        """,
                        "src/Contracts/Notifier.php")
                .addFileContents(
                        """
                        <?php
                        namespace App\\Services;

                        use App\\Contracts\\Notifier;

                        class EmailNotifier implements Notifier
                        {
                            public function send(string $message): void {}
                        }
                        """,
                        "src/Services/EmailNotifier.php")
                .addFileContents(
                        """
                        <?php
                        namespace App\\Services;

                        class Unrelated
                        {
                            public function send(): void {}
                        }
                        """,
                        "src/Services/Unrelated.php")
                .addFileContents(
                        """
                        <?php
                        namespace App\\Http;

                        use App\\Contracts\\Notifier;
                        use App\\Services\\EmailNotifier;
                        use App\\Services\\Unrelated;

                        function run(Notifier $n, EmailNotifier $e, Unrelated $u): void
                        {
                            $n->send('x');
                            $e->send('y');
                            $u->send();
                        }
                        """,
                        "src/Http/hooks.php")
                .build()) {
            var workspace = project.workspace();
            workspace.indexAll();

            applied(workspace.renameMethod(project.file("src/Contracts/Notifier.php"), "send", "notify", null));

            assertTrue(project.read("src/Contracts/Notifier.php").contains("public function notify(string $message): void;"));
            assertTrue(project.read("src/Services/EmailNotifier.php").contains("public function notify(string $message)"));
            assertTrue(project.read("src/Services/Unrelated.php").contains("public function send(): void"));
            var hooks = project.read("src/Http/hooks.php");
            assertTrue(hooks.contains("$n->notify('x');"));
            assertTrue(hooks.contains("$e->notify('y');"));
            assertTrue(hooks.contains("$u->send();"));
        }
    }

    @Test
    void implementorOfAnotherInterfaceWithTheSameShortNameIsLeftAlone() throws IOException {
        var otherHandler =
                """
                <?php
                namespace App\\B;

                interface Handler
                {
                    public function handle(): void;
                }
                """;
        var impl =
                """
                <?php
                namespace App\\B;

                class Impl implements Handler
                {
                    public function handle(): void {}
                }
                """;
        try (var project = InlineTestProjectCreator.code(APP_COMPOSER_JSON, "composer.json")
                .addFileContents(
                        """
                        <?php
                        namespace App\\A;

                        interface Handler
                        {
                            public function handle(): void;
                        }
                        """,
                        "src/A/Handler.php")
                .addFileContents(otherHandler, "src/B/Handler.php")
                .addFileContents(impl, "src/B/Impl.php")
                .addFileContents(
                        """
                        <?php
                        namespace App\\A;

                        class Job implements Handler
                        {
                            public function handle(): void {}
                        }
                        """,
                        "src/A/Job.php")
                .addFileContents(
                        """
                        <?php
                        namespace App\\C;

                        class Task implements \\App\\A\\Handler
                        {
                            public function handle(): void {}
                        }
                        """,
                        "src/C/Task.php")
                .build()) {
            var workspace = project.workspace();
            workspace.indexAll();

            var result = applied(workspace.renameMethod(project.file("src/A/Handler.php"), "handle", "process", null));

            assertEquals(3, result.edits().size());
            assertTrue(project.read("src/A/Handler.php").contains("public function process(): void;"));
            assertTrue(project.read("src/A/Job.php").contains("public function process(): void {}"));
            assertTrue(project.read("src/C/Task.php").contains("public function process(): void {}"));
            assertEquals(otherHandler, project.read("src/B/Handler.php"));
            assertEquals(impl, project.read("src/B/Impl.php"));
        }
    }

    @Test
    void reassignmentInsideABlockMakesTheReceiverAmbiguous() throws IOException {
        var run =
                """
                <?php
                namespace App;

                function run(bool $flag): void
                {
                    $c = new User();
                    if ($flag) {
                        $c = new Order();
                    }
                    $c->handle();
                    $d = new User();
                    if ($flag) {
                        $d->handle();
                    }
                    $d->handle();
                }
                """;
        try (var project = InlineTestProjectCreator.code(APP_COMPOSER_JSON, "composer.json")
                .addFileContents(
                        """
                        <?php
                        namespace App;

                        class User
                        {
                            public function handle(): void {}
                        }
                        """,
                        "src/User.php")
                .addFileContents(
                        """
                        <?php
                        namespace App;

                        class Order
                        {
                            public function handle(): void {}
                        }
                        """,
                        "src/Order.php")
                .addFileContents(run, "src/Run.php")
                .build()) {
            var workspace = project.workspace();
            workspace.indexAll();

            var result = applied(workspace.renameMethod(project.file("src/User.php"), "handle", "process", null));

            assertEquals(3, result.edits().size());
            var updated = project.read("src/Run.php");
            assertTrue(updated.contains("    $c->handle();\n    $d = new User();"));
            assertEquals(run.replace("$d->handle();", "$d->process();"), updated);
            assertTrue(project.read("src/Order.php").contains("public function handle(): void {}"));
        }
    }

    @Test
    void cursorPicksTheEnclosingClass() throws IOException {
        var text =
                """
                <?php

                class First
                {
                    public function run(): void {}
                }

                class Second
                {
                    public function run(): void {}
                }
                """;
        try (var project = InlineTestProjectCreator.code(text, "Jobs.php").build()) {
            var workspace = project.workspace();
            workspace.indexAll();
            int offset = text.indexOf("run", text.indexOf("class Second"));
            var cursor = TextRange.empty(SourceText.of(text).position(offset));

            applied(workspace.renameMethod(project.file("Jobs.php"), "run", "execute", cursor));

            var updated = project.read("Jobs.php");
            assertEquals(text.replace("class Second\n{\n    public function run()", "class Second\n{\n    public function execute()"), updated);
        }
    }

    @Test
    void refusesInvalidNames() throws IOException {
        try (var project = servicesProject()) {
            var workspace = project.workspace();
            workspace.indexAll();
            var file = project.file("src/Services/Mailer.php");

            assertInstanceOf(RefactorResult.Refused.class, workspace.renameMethod(file, "send", "  ", null));
            assertInstanceOf(RefactorResult.Refused.class, workspace.renameMethod(file, "send", "1send", null));
            assertInstanceOf(RefactorResult.Refused.class, workspace.renameMethod(file, "send", "send-it", null));
        }
    }

    @Test
    void refusesWhenNoClassDeclaresTheMethod() throws IOException {
        try (var project = servicesProject()) {
            var workspace = project.workspace();
            workspace.indexAll();

            var result = workspace.renameMethod(project.file("src/Services/Mailer.php"), "missing", "other", null);

            var refused = assertInstanceOf(RefactorResult.Refused.class, result);
            assertTrue(refused.reason().contains("missing"));
        }
    }

    @Test
    void cursorOutsideAnyClassIsRefused() throws IOException {
        try (var project = servicesProject()) {
            var workspace = project.workspace();
            workspace.indexAll();

            var result = workspace.renameMethod(
                    project.file("src/Services/Mailer.php"), "send", "dispatch", TextRange.of(0, 0, 0, 0));

            assertInstanceOf(RefactorResult.Refused.class, result);
        }
    }

    @Test
    void sameNameIsANoOp() throws IOException {
        try (var project = servicesProject()) {
            var workspace = project.workspace();
            workspace.indexAll();

            var result = workspace.renameMethod(project.file("src/Services/Mailer.php"), "send", "send", null);

            assertTrue(result.isSuccess());
            assertTrue(result.editsOrEmpty().isEmpty());
        }
    }
}

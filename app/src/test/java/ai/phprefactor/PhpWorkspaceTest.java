package ai.phprefactor;

import static ai.phprefactor.testutil.InlineTestProjectCreator.APP_COMPOSER_JSON;
import static org.junit.jupiter.api.Assertions.*;

import ai.phprefactor.analyzer.SymbolDefinition;
import ai.phprefactor.analyzer.SymbolReference;
import ai.phprefactor.analyzer.TextPosition;
import ai.phprefactor.analyzer.TextRange;
import ai.phprefactor.analyzer.php.SourceText;
import ai.phprefactor.testutil.InlineTestProjectCreator;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class PhpWorkspaceTest {

    private static final String CHECKOUT =
            """
            <?php

            namespace App\\Http;

            use App\\Billing\\Invoice;

            class Checkout
            {
                public function pay(Invoice $invoice): Receipt
                {
                    return new Receipt($invoice);
                }
            }
            """;

    private static TextPosition positionOf(String text, String needle) {
        return SourceText.of(text).position(text.indexOf(needle) + 1);
    }

    @Test
    void definitionsAtPrefersTheResolvedClass() throws Exception {
        try (var project = InlineTestProjectCreator.code(APP_COMPOSER_JSON, "composer.json")
                .addFileContents(CHECKOUT, "src/Http/Checkout.php")
                .addFileContents("<?php\nnamespace App\\Legacy;\n\nclass Invoice {}\n", "src/Legacy/Invoice.php")
                .addFileContents("<?php\nnamespace App\\Billing;\n\nclass Invoice {}\n", "src/Billing/Invoice.php")
                .addFileContents("<?php\nnamespace App\\Http;\n\nclass Receipt {}\n", "src/Http/Receipt.php")
                .build()) {
            var workspace = project.workspace();
            workspace.indexAll();
            var file = project.file("src/Http/Checkout.php");

            var invoices = workspace.definitionsAt(file, positionOf(CHECKOUT, "Invoice $invoice"));
            assertEquals(2, invoices.size());
            assertEquals("App\\Billing\\Invoice", invoices.get(0).fullyQualifiedName());

            var receipts = workspace.definitionsAt(file, positionOf(CHECKOUT, "Receipt($invoice)"));
            assertEquals(
                    "App\\Http\\Receipt",
                    receipts.stream().map(SymbolDefinition::fullyQualifiedName).findFirst().orElseThrow());

            assertTrue(workspace.definitionsAt(file, new TextPosition(1, 0)).isEmpty());
        }
    }

    @Test
    void classReferencesFollowEachFilesImports() throws Exception {
        try (var project = InlineTestProjectCreator.code(APP_COMPOSER_JSON, "composer.json")
                .addFileContents(CHECKOUT, "src/Http/Checkout.php")
                .addFileContents("<?php\nnamespace App\\Billing;\n\nclass Invoice {}\n", "src/Billing/Invoice.php")
                .addFileContents("<?php\nnamespace App\\Legacy;\n\nclass Invoice {}\n", "src/Legacy/Invoice.php")
                .addFileContents(
                        """
                        <?php
                        namespace App\\Legacy;

                        class Archive
                        {
                            public function store(Invoice $invoice): void {}
                        }
                        """,
                        "src/Legacy/Archive.php")
                .addFileContents(
                        """
                        <?php
                        namespace App\\Billing;

                        class Ledger
                        {
                            public function open(): Invoice
                            {
                                return new \\App\\Billing\\Invoice();
                            }
                        }
                        """,
                        "src/Billing/Ledger.php")
                .build()) {
            var workspace = project.workspace();
            workspace.indexAll();

            var references = workspace.references("App\\Billing\\Invoice", null);

            assertEquals(
                    List.of(
                            SymbolReference.Kind.DECLARATION,
                            SymbolReference.Kind.TYPE,
                            SymbolReference.Kind.TYPE,
                            SymbolReference.Kind.IMPORT,
                            SymbolReference.Kind.TYPE),
                    references.stream().map(SymbolReference::kind).toList());
            assertEquals(project.file("src/Billing/Invoice.php"), references.get(0).file());
            assertEquals(TextRange.of(3, 6, 3, 13), references.get(0).range());
            assertEquals(project.file("src/Http/Checkout.php"), references.get(4).file());
            assertEquals(8, references.get(4).range().start().line());
            assertTrue(references.stream().noneMatch(r -> r.file().equals(project.file("src/Legacy/Archive.php"))));
        }
    }

    @Test
    void methodReferencesOnlyCountReceiversOfTheClass() throws Exception {
        try (var project = InlineTestProjectCreator.code(APP_COMPOSER_JSON, "composer.json")
                .addFileContents(
                        "<?php\nnamespace App\\Mail;\n\nclass Mailer\n{\n    public function send(): void {}\n}\n",
                        "src/Mail/Mailer.php")
                .addFileContents(
                        "<?php\nnamespace App\\Mail;\n\nclass Fax\n{\n    public function send(): void {}\n}\n",
                        "src/Mail/Fax.php")
                .addFileContents(
                        """
                        <?php
                        namespace App\\Mail;

                        class Outbox
                        {
                            public function flush(Mailer $mailer, Fax $fax): void
                            {
                                $mailer->send();
                                $fax->send();
                            }
                        }
                        """,
                        "src/Mail/Outbox.php")
                .build()) {
            var workspace = project.workspace();
            workspace.indexAll();

            var references = workspace.references("\\App\\Mail\\Mailer", "send");

            assertEquals(2, references.size());
            assertEquals(SymbolReference.Kind.DECLARATION, references.get(0).kind());
            assertEquals(project.file("src/Mail/Mailer.php"), references.get(0).file());
            assertEquals(SymbolReference.Kind.CALL, references.get(1).kind());
            assertEquals(TextRange.of(7, 17, 7, 21), references.get(1).range());

            assertTrue(workspace.references("App\\Mail\\Mailer", "missing").isEmpty());
            assertTrue(workspace.references("App\\Mail\\Nowhere", "send").isEmpty());
        }
    }

    @Test
    void implementationsAndReferencingFiles() throws Exception {
        try (var project = InlineTestProjectCreator.code(
                        "<?php\nnamespace App;\n\ninterface Shape {}\n", "src/Shape.php")
                .addFileContents("<?php\nnamespace App;\n\nclass Circle implements Shape {}\n", "src/Circle.php")
                .addFileContents("<?php\nnamespace App;\n\nclass Square implements Shape {}\n", "src/Square.php")
                .build()) {
            var workspace = project.workspace();
            workspace.indexAll();

            assertEquals(2, workspace.implementationsOf("Shape").size());
            assertEquals(2, workspace.filesReferencing("Shape").size());

            Files.delete(project.getRoot().resolve("src/Square.php"));
            workspace.fileDeleted(project.file("src/Square.php")).get(10, TimeUnit.SECONDS);

            assertEquals(1, workspace.implementationsOf("Shape").size());
        }
    }

    @Test
    void editedFilesAreReindexed() throws Exception {
        try (var project = InlineTestProjectCreator.code("<?php\nclass Old {}\n", "Thing.php").build()) {
            var workspace = project.workspace();
            workspace.indexAll();

            Files.writeString(project.getRoot().resolve("Thing.php"), "<?php\nclass Fresh {}\n");
            workspace.fileChanged(project.file("Thing.php")).get(10, TimeUnit.SECONDS);

            assertTrue(workspace.index().lookupDefinitions("Old").isEmpty());
            assertEquals(1, workspace.index().lookupDefinitions("Fresh").size());
        }
    }

    @Test
    void composerChangesAreSeenByTheNamespaceResolver() throws Exception {
        try (var project = InlineTestProjectCreator.code("<?php\n", "lib/Models/User.php").build()) {
            var workspace = project.workspace();
            var user = project.file("lib/Models/User.php");
            assertTrue(workspace.getNamespaceResolver().resolve(user).isEmpty());

            Files.writeString(
                    project.getRoot().resolve("composer.json"), "{\"autoload\": {\"psr-4\": {\"Lib\\\\\": \"lib/\"}}}");
            workspace.fileChanged(project.file("composer.json")).get(10, TimeUnit.SECONDS);

            assertEquals("Lib\\Models", workspace.getNamespaceResolver().resolve(user).orElseThrow());
        }
    }
}

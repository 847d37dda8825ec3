package ai.phprefactor.refactor;

import static org.junit.jupiter.api.Assertions.*;

import ai.phprefactor.analyzer.php.SourceText;
import java.util.List;
import org.junit.jupiter.api.Test;

class ImportBlockTest {

    private static ImportBlock detect(String text) {
        return ImportBlock.detect(SourceText.of(text));
    }

    @Test
    void findsLeadingImportsWithBlankLinesBetween() {
        var block = detect(
                """
                <?php

                namespace App\\Http;

                use App\\Models\\User;

                use App\\Services\\Mailer as Mail;
                use function strlen;

                class Controller
                {
                    use Loggable;
                }
                """);

        assertTrue(block.exists());
        assertEquals(4, block.firstLine());
        assertEquals(7, block.lastLine());
        assertEquals(2, block.namespaceLine());
        assertEquals(3, block.insertLine());
        assertEquals(
                List.of("use App\\Models\\User;", "use App\\Services\\Mailer as Mail;", "use function strlen;"),
                block.statements());
    }

    @Test
    void multiLineGroupIsOneStatement() {
        var block = detect(
                """
                <?php
                namespace App;
                use App\\Models\\{
                    User,
                    Post
                };
                use App\\Other;
                """);

        assertEquals(2, block.firstLine());
        assertEquals(6, block.lastLine());
        assertEquals(2, block.statements().size());
        assertNull(ImportBlock.importedName(block.statements().get(0)));
        assertEquals("App\\Other", ImportBlock.importedName(block.statements().get(1)));
    }

    @Test
    void traitUsesInsideAClassAreNotImports() {
        var block = detect(
                """
                <?php
                namespace App;

                final class Repo
                {
                    use HasCache;
                }
                """);

        assertFalse(block.exists());
        assertEquals(2, block.insertLine());
        assertTrue(block.statements().isEmpty());
    }

    @Test
    void blockEndsAtFirstOtherStatement() {
        var block = detect(
                """
                <?php
                use A\\B;
                $x = 1;
                use C\\D;
                """);

        assertEquals(List.of("use A\\B;"), block.statements());
        assertEquals(1, block.lastLine());
    }

    @Test
    void withoutNamespaceNewImportsGoAfterTheOpeningTag() {
        var block = detect("<?php\n\nfunction helper() {}\n");

        assertEquals(-1, block.namespaceLine());
        assertEquals(1, block.insertLine());
    }

    @Test
    void importedNameOfSingleStatements() {
        assertEquals("A\\B", ImportBlock.importedName("use \\A\\B;"));
        assertEquals("A\\B", ImportBlock.importedName("use A\\B as C;"));
        assertEquals("A\\B", ImportBlock.importedName("USE A\\B;"));
        assertNull(ImportBlock.importedName("use A\\B, C\\D;"));
        assertNull(ImportBlock.importedName("use const A\\LIMIT;"));
    }
}

package ai.phprefactor.refactor;

import static org.junit.jupiter.api.Assertions.*;

import ai.phprefactor.analyzer.EditBatch;
import ai.phprefactor.analyzer.EditOperation;
import ai.phprefactor.analyzer.ProjectFile;
import ai.phprefactor.analyzer.TextPosition;
import ai.phprefactor.analyzer.TextRange;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EditApplierTest {

    @TempDir
    Path root;

    @Test
    void appliesEditsAgainstTheOriginalPositions() {
        var file = new ProjectFile(root, "A.php");
        var text = "<?php\n$a->send();\n$b->send();\n";

        var result = EditApplier.apply(
                text,
                List.of(
                        new EditOperation(file, TextRange.of(1, 4, 1, 8), "dispatch"),
                        new EditOperation(file, TextRange.of(2, 4, 2, 8), "go")));

        assertEquals("<?php\n$a->dispatch();\n$b->go();\n", result);
    }

    @Test
    void insertsAtOnePositionKeepTheirOrder() {
        var file = new ProjectFile(root, "A.php");
        var at = new TextPosition(0, 5);

        var result = EditApplier.apply(
                "<?php", List.of(EditOperation.insert(file, at, "\nfirst"), EditOperation.insert(file, at, "\nsecond")));

        assertEquals("<?php\nfirst\nsecond", result);
    }

    @Test
    void writesEveryFileOfABatch() throws IOException {
        Files.writeString(root.resolve("A.php"), "<?php\nclass A {}\n");
        Files.writeString(root.resolve("B.php"), "<?php\nclass B {}\n");
        var a = new ProjectFile(root, "A.php");
        var b = new ProjectFile(root, "B.php");
        var batch = EditBatch.builder()
                .add(new EditOperation(a, TextRange.of(1, 6, 1, 7), "Alpha"))
                .add(new EditOperation(b, TextRange.of(1, 6, 1, 7), "Beta"))
                .build();

        var written = EditApplier.applyToDisk(batch);

        assertEquals(2, written.size());
        assertEquals("<?php\nclass Alpha {}\n", a.read());
        assertEquals("<?php\nclass Beta {}\n", b.read());
    }
}

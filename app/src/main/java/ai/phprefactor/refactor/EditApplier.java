package ai.phprefactor.refactor;

import ai.phprefactor.analyzer.EditBatch;
import ai.phprefactor.analyzer.EditOperation;
import ai.phprefactor.analyzer.ProjectFile;
import ai.phprefactor.analyzer.php.SourceText;
import ai.phprefactor.util.AtomicWrites;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Applies an {@link EditBatch}. Positions in a batch refer to the text as it was when the batch was planned, so the
 * operations of a file are applied back to front.
 */
public final class EditApplier {
    private static final Logger logger = LogManager.getLogger(EditApplier.class);

    private EditApplier() {}

    /** The text after applying the given operations, which must all belong to one file. */
    public static String apply(String text, List<EditOperation> operations) {
        var source = SourceText.of(text);
        var ordered = new ArrayList<>(operations);
        ordered.sort(Comparator.comparing(EditOperation::range));
        // reversing a stable sort applies later inserts at one position first, keeping them after earlier ones
        Collections.reverse(ordered);
        var result = new StringBuilder(text);
        for (var op : ordered) {
            int start = source.offsetOf(op.range().start());
            int end = source.offsetOf(op.range().end());
            result.replace(start, end, op.replacementText());
        }
        return result.toString();
    }

    /** Rewrites every file touched by the batch; returns the files written. */
    public static List<ProjectFile> applyToDisk(EditBatch batch) throws IOException {
        var written = new ArrayList<ProjectFile>();
        for (var entry : batch.byFile().entrySet()) {
            var file = entry.getKey();
            var updated = apply(file.read(), entry.getValue());
            AtomicWrites.atomicOverwrite(file.absPath(), updated);
            written.add(file);
            logger.debug("Applied {} edits to {}", entry.getValue().size(), file);
        }
        return written;
    }
}

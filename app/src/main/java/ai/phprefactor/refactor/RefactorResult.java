package ai.phprefactor.refactor;

import ai.phprefactor.analyzer.EditBatch;

/** Outcome of a single-target refactoring: the edits to apply, or the reason nothing was produced. */
public sealed interface RefactorResult {

    record Success(EditBatch edits) implements RefactorResult {}

    record Refused(String reason) implements RefactorResult {}

    static RefactorResult refused(String reason) {
        return new Refused(reason);
    }

    /** Edits for a success, otherwise an empty batch. */
    default EditBatch editsOrEmpty() {
        if (this instanceof Success success) {
            return success.edits();
        }
        return EditBatch.empty();
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }
}

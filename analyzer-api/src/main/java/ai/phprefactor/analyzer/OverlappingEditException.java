package ai.phprefactor.analyzer;

public class OverlappingEditException extends IllegalStateException {
    private final EditOperation first;
    private final EditOperation second;

    public OverlappingEditException(EditOperation first, EditOperation second) {
        super("Overlapping edits in %s: %s and %s".formatted(first.file(), first.range(), second.range()));
        this.first = first;
        this.second = second;
    }

    public EditOperation getFirst() {
        return first;
    }

    public EditOperation getSecond() {
        return second;
    }
}

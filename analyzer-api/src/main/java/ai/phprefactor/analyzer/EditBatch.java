package ai.phprefactor.analyzer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The edits produced by one refactoring request, grouped per file and sorted by position. Exact duplicates are
 * collapsed; overlapping ranges within a file are rejected when the batch is built.
 */
public final class EditBatch {
    private static final EditBatch EMPTY = new EditBatch(Map.of());

    private final Map<ProjectFile, List<EditOperation>> byFile;

    private EditBatch(Map<ProjectFile, List<EditOperation>> byFile) {
        this.byFile = byFile;
    }

    public static EditBatch empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EditBatch of(List<EditOperation> operations) {
        var builder = builder();
        operations.forEach(builder::add);
        return builder.build();
    }

    public boolean isEmpty() {
        return byFile.isEmpty();
    }

    public int size() {
        return byFile.values().stream().mapToInt(List::size).sum();
    }

    public Set<ProjectFile> files() {
        return byFile.keySet();
    }

    public List<EditOperation> editsFor(ProjectFile file) {
        return byFile.getOrDefault(file, List.of());
    }

    public Map<ProjectFile, List<EditOperation>> byFile() {
        return byFile;
    }

    /** All operations, files in insertion order and operations in position order within a file. */
    public List<EditOperation> operations() {
        var all = new ArrayList<EditOperation>();
        byFile.values().forEach(all::addAll);
        return all;
    }

    public EditBatch merge(EditBatch other) {
        var builder = builder();
        operations().forEach(builder::add);
        other.operations().forEach(builder::add);
        return builder.build();
    }

    @Override
    public String toString() {
        return "EditBatch" + operations();
    }

    public static final class Builder {
        private final Map<ProjectFile, Set<EditOperation>> pending = new LinkedHashMap<>();

        private Builder() {}

        public Builder add(EditOperation op) {
            pending.computeIfAbsent(op.file(), f -> new LinkedHashSet<>()).add(op);
            return this;
        }

        public Builder addAll(List<EditOperation> ops) {
            ops.forEach(this::add);
            return this;
        }

        public boolean isEmpty() {
            return pending.isEmpty();
        }

        /**
         * @throws OverlappingEditException if two operations in one file overlap
         */
        public EditBatch build() {
            if (pending.isEmpty()) {
                return EMPTY;
            }
            var result = new LinkedHashMap<ProjectFile, List<EditOperation>>();
            for (var entry : pending.entrySet()) {
                // stable sort keeps insertion order for several inserts at one position
                var sorted = new ArrayList<>(entry.getValue());
                sorted.sort(Comparator.comparing(EditOperation::range));
                EditOperation furthest = null;
                for (var cur : sorted) {
                    if (furthest != null && furthest.range().overlaps(cur.range())) {
                        throw new OverlappingEditException(furthest, cur);
                    }
                    if (furthest == null || cur.range().end().compareTo(furthest.range().end()) > 0) {
                        furthest = cur;
                    }
                }
                result.put(entry.getKey(), Collections.unmodifiableList(sorted));
            }
            return new EditBatch(Collections.unmodifiableMap(result));
        }
    }
}

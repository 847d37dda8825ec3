package ai.phprefactor.analyzer.composer;

import com.google.common.base.Splitter;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.jetbrains.annotations.Nullable;

/**
 * PSR-4 entries of one composer.json, in declaration order ({@code autoload} before {@code autoload-dev}).
 *
 * @param entries prefix and directory pairs; directories are relative to the composer.json directory, use forward
 *     slashes and carry no leading {@code ./} or trailing slash
 */
public record Psr4Mapping(List<Entry> entries) {
    private static final Splitter PATH_SPLITTER = Splitter.on('/').omitEmptyStrings();

    public record Entry(String prefix, String directory) {}

    public Psr4Mapping {
        entries = List.copyOf(entries);
    }

    public static String normalizeDirectory(String dir) {
        var normalized = dir.replace('\\', '/').trim();
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized.equals(".") ? "" : normalized;
    }

    /**
     * Namespace for a directory relative to the mapping root. The entry with the longest matching directory wins; of
     * equally long directories the first declared one is kept.
     */
    public Optional<String> namespaceFor(String relativeDir) {
        var dir = normalizeDirectory(relativeDir);
        @Nullable Entry best = null;
        for (var entry : entries) {
            if (!isAncestor(entry.directory(), dir)) {
                continue;
            }
            if (best == null || entry.directory().length() > best.directory().length()) {
                best = entry;
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        var remainder = best.directory().isEmpty() ? dir : dir.substring(best.directory().length());
        var segments = StreamSupport.stream(PATH_SPLITTER.split(remainder).spliterator(), false)
                .collect(Collectors.toList());
        var prefix = trimSeparators(best.prefix());
        var namespace = segments.isEmpty()
                ? prefix
                : (prefix.isEmpty() ? "" : prefix + "\\") + String.join("\\", segments);
        return Optional.of(namespace);
    }

    private static boolean isAncestor(String directory, String dir) {
        return directory.isEmpty() || dir.equals(directory) || dir.startsWith(directory + "/");
    }

    private static String trimSeparators(String prefix) {
        var trimmed = prefix;
        while (trimmed.endsWith("\\")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        while (trimmed.startsWith("\\")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed;
    }
}

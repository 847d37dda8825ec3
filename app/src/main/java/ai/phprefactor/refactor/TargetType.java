package ai.phprefactor.refactor;

import ai.phprefactor.analyzer.php.TypeRef;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * The class whose method is being renamed, together with every type a receiver may have for a call to count: the
 * class itself and, for an interface, its implementors.
 *
 * @param knownType tells whether a resolved FQN names a class the index knows; a written name only falls back to a
 *     suffix match against the accepted FQNs when its resolved FQN is unknown
 */
public record TargetType(String fqn, Set<String> acceptedFqns, boolean isInterface, Predicate<String> knownType) {

    public TargetType {
        acceptedFqns = acceptedFqns.stream().map(TargetType::key).collect(Collectors.toUnmodifiableSet());
    }

    public static TargetType of(String fqn, Collection<String> implementorFqns, boolean isInterface, Predicate<String> knownType) {
        var accepted = new LinkedHashSet<String>();
        accepted.add(fqn);
        accepted.addAll(implementorFqns);
        return new TargetType(fqn, accepted, isInterface, knownType);
    }

    public boolean accepts(String resolvedFqn) {
        return acceptedFqns.contains(key(resolvedFqn));
    }

    /** Resolved FQN match, or a qualified-suffix match of the written name when the resolved FQN is unknown. */
    public boolean accepts(String resolvedFqn, TypeRef written) {
        if (accepts(resolvedFqn)) {
            return true;
        }
        if (written.isFullyQualified() || knownType.test(resolvedFqn)) {
            return false;
        }
        var suffix = "\\" + key(written.text());
        return acceptedFqns.stream().anyMatch(a -> a.endsWith(suffix));
    }

    private static String key(String fqn) {
        var stripped = fqn.startsWith("\\") ? fqn.substring(1) : fqn;
        return stripped.toLowerCase(Locale.ROOT);
    }
}

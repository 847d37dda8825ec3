package ai.phprefactor.refactor;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Local variable types for one lexical level. Lookups fall through to the parent and writes land in this level. PHP has
 * no block scope, so a block's bindings are folded back into its parent by {@link #exitInto()} when the block ends.
 */
final class Scope {
    @Nullable
    private final Scope parent;

    // an empty Optional marks a variable assigned something of unknown type, hiding outer bindings
    private final Map<String, Optional<String>> bindings = new HashMap<>();

    Scope(@Nullable Scope parent) {
        this.parent = parent;
    }

    static Scope root() {
        return new Scope(null);
    }

    Scope child() {
        return new Scope(this);
    }

    void bind(String variable, Optional<String> fqn) {
        bindings.put(variable, fqn);
    }

    /**
     * Leaves a nested block. A variable the block bound to a type other than the one visible outside may hold either
     * afterwards, so the parent marks it unknown.
     */
    Scope exitInto() {
        if (parent == null) {
            throw new IllegalStateException("Root scope has no enclosing block");
        }
        for (var entry : bindings.entrySet()) {
            if (!parent.lookup(entry.getKey()).equals(entry.getValue())) {
                parent.bind(entry.getKey(), Optional.empty());
            }
        }
        return parent;
    }

    Optional<String> lookup(String variable) {
        for (Scope s = this; s != null; s = s.parent) {
            var bound = s.bindings.get(variable);
            if (bound != null) {
                return bound;
            }
        }
        return Optional.empty();
    }
}

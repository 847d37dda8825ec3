package ai.phprefactor.refactor;

import ai.phprefactor.analyzer.SourceSpan;

/** A call whose receiver was shown to have the target type. {@code nameSpan} covers just the method name. */
public record CallSite(SourceSpan nameSpan, SourceSpan span, Kind kind) {
    public enum Kind {
        INSTANCE,
        STATIC
    }
}

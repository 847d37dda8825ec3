package ai.phprefactor.analyzer;

public enum SymbolKind {
    CLASS,
    INTERFACE,
    TRAIT,
    ENUM,
    METHOD;

    public boolean isClassLike() {
        return this != METHOD;
    }
}

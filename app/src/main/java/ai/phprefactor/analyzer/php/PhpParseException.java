package ai.phprefactor.analyzer.php;

/** The source text is not valid PHP as far as the grammar is concerned. */
public class PhpParseException extends Exception {
    private final String pathHint;
    private final int line;

    public PhpParseException(String pathHint, int line, String message) {
        super("%s:%d: %s".formatted(pathHint, line, message));
        this.pathHint = pathHint;
        this.line = line;
    }

    public String getPathHint() {
        return pathHint;
    }

    /** 1-based line of the first syntax error. */
    public int getLine() {
        return line;
    }
}

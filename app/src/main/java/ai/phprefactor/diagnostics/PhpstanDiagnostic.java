package ai.phprefactor.diagnostics;

import ai.phprefactor.analyzer.ProjectFile;

/**
 * One message reported by phpstan.
 *
 * @param line zero-based line; phpstan reports positions per line only
 */
public record PhpstanDiagnostic(ProjectFile file, int line, String message, boolean ignorable) {
    public static final String SOURCE = "phpstan";
}

package ai.phprefactor.analyzer.php;

import ai.phprefactor.analyzer.ProjectFile;
import java.io.IOException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSParser;
import org.treesitter.TreeSitterPhp;

/** Parses PHP source with TreeSitter and adapts the result into a {@link PhpTree}. Safe for use from any thread. */
public final class PhpParser {
    private static final Logger logger = LogManager.getLogger(PhpParser.class);

    private final ThreadLocal<TSParser> threadLocalParser = ThreadLocal.withInitial(() -> {
        var parser = new TSParser();
        if (!parser.setLanguage(new TreeSitterPhp())) {
            logger.error("Failed to set language on TSParser for {}", TreeSitterPhp.class.getSimpleName());
        }
        return parser;
    });

    /**
     * @param pathHint used in error messages only
     * @throws PhpParseException if the grammar reports a syntax error anywhere in the file
     */
    public PhpTree parse(String sourceText, String pathHint) throws PhpParseException {
        var source = SourceText.of(sourceText);
        var tree = threadLocalParser.get().parseString(null, sourceText);
        var root = tree.getRootNode();
        if (root == null || root.isNull()) {
            throw new PhpParseException(pathHint, 1, "parser produced no tree");
        }
        var error = PhpTreeAdapter.findError(root);
        if (error.isPresent()) {
            int line = source.spanForBytes(error.get().getStartByte(), error.get().getEndByte()).startLine();
            logger.debug("Syntax error in {} at line {}", pathHint, line);
            throw new PhpParseException(pathHint, line, "syntax error");
        }
        var adapter = new PhpTreeAdapter(source);
        return new PhpTree(pathHint, source, adapter.program(root));
    }

    public PhpTree parse(ProjectFile file) throws IOException, PhpParseException {
        return parse(file.read(), file.toString());
    }
}

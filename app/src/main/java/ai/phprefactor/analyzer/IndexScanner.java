package ai.phprefactor.analyzer;

import ai.phprefactor.analyzer.php.PhpParseException;
import ai.phprefactor.analyzer.php.PhpParser;
import java.io.IOException;
import java.util.Collection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Parses files and feeds them to a {@link SymbolIndex}. A file that cannot be read or parsed is left out. */
public final class IndexScanner {
    private static final Logger logger = LogManager.getLogger(IndexScanner.class);

    private final PhpParser parser;

    public IndexScanner(PhpParser parser) {
        this.parser = parser;
    }

    /**
     * Re-scans one file into the index.
     *
     * @return false if the file was dropped from the index because it could not be read or parsed
     */
    public boolean scanInto(SymbolIndex index, ProjectFile file) {
        if (!file.exists()) {
            index.removeFile(file);
            return false;
        }
        try {
            index.scanFile(file, parser.parse(file));
            return true;
        } catch (PhpParseException e) {
            logger.warn("Skipping {}: {}", file, e.getMessage());
        } catch (IOException e) {
            logger.warn("Unable to read {}: {}", file, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected failure indexing {}", file, e);
        }
        index.removeFile(file);
        return false;
    }

    /** Synchronous scan of every file into a fresh index. */
    public SymbolIndex scanAll(Collection<ProjectFile> files) {
        var index = new SymbolIndex();
        int indexed = 0;
        for (var file : files) {
            if (scanInto(index, file)) {
                indexed++;
            }
        }
        logger.info("Indexed {} of {} files", indexed, files.size());
        return index;
    }
}

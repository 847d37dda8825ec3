package ai.phprefactor.diagnostics;

import ai.phprefactor.ProjectSettings;
import ai.phprefactor.analyzer.ProjectFile;
import ai.phprefactor.util.ProcessRunner;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runs phpstan on single files and maps its JSON report to {@link PhpstanDiagnostic}s. Uses the project's
 * {@code vendor/bin/phpstan} when present, else {@code phpstan} from the PATH. Once the executable turns out to be
 * missing the runner stays inactive for the rest of the session.
 */
public final class PhpstanRunner {
    private static final Logger logger = LogManager.getLogger(PhpstanRunner.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final Path projectRoot;
    private final ProjectSettings settings;
    private final AtomicBoolean active;

    public PhpstanRunner(Path projectRoot, ProjectSettings settings) {
        this.projectRoot = projectRoot;
        this.settings = settings;
        this.active = new AtomicBoolean(settings.isPhpstanEnabled());
    }

    public boolean isActive() {
        return active.get();
    }

    public String executable() {
        var vendored = projectRoot.resolve("vendor").resolve("bin").resolve("phpstan");
        return Files.isRegularFile(vendored) ? vendored.toString() : "phpstan";
    }

    List<String> command(ProjectFile file) {
        var command = new ArrayList<String>(List.of(
                executable(),
                "analyse",
                "--error-format=json",
                "--no-progress",
                "--level=" + settings.phpstanLevel()));
        settings.phpstanConfigFile().ifPresent(config -> {
            command.add("-c");
            command.add(config);
        });
        command.add(file.toUnixPath());
        return command;
    }

    /**
     * @return the file's diagnostics; empty when the runner is inactive
     * @throws ProcessRunner.FailureException if phpstan exits with an internal error
     * @throws ProcessRunner.TimeoutException if phpstan runs longer than the configured timeout
     */
    public List<PhpstanDiagnostic> analyse(ProjectFile file) throws IOException, InterruptedException {
        if (!active.get()) {
            return List.of();
        }
        ProcessRunner.Result result;
        try {
            result = ProcessRunner.run(command(file), projectRoot, settings.phpstanTimeout());
        } catch (ProcessRunner.StartupException e) {
            logger.warn("phpstan not available, disabling it for this session: {}", e.getMessage());
            active.set(false);
            return List.of();
        }
        // 0: clean, 1: errors reported; anything else means phpstan itself failed
        if (result.exitCode() > 1) {
            throw new ProcessRunner.FailureException(
                    "phpstan exited with code %d".formatted(result.exitCode()), result.stderr(), result.exitCode());
        }
        return parseReport(result.stdout(), file);
    }

    static List<PhpstanDiagnostic> parseReport(String json, ProjectFile file) throws IOException {
        if (json.isBlank()) {
            return List.of();
        }
        var root = objectMapper.readTree(json);
        var fileReport = reportFor(root.path("files"), file);
        if (fileReport == null) {
            return List.of();
        }
        var diagnostics = new ArrayList<PhpstanDiagnostic>();
        for (var message : fileReport.path("messages")) {
            int line = Math.max(0, message.path("line").asInt(1) - 1);
            diagnostics.add(new PhpstanDiagnostic(
                    file, line, message.path("message").asText(""), message.path("ignorable").asBoolean(true)));
        }
        return diagnostics;
    }

    /** phpstan keys its report by absolute path; fall back to suffix and file-name matches, then a lone entry. */
    private static @Nullable JsonNode reportFor(JsonNode files, ProjectFile file) {
        if (!files.isObject() || files.isEmpty()) {
            return null;
        }
        var absolute = file.absPath().toString();
        var relative = file.toUnixPath();
        JsonNode byName = null;
        for (Iterator<Map.Entry<String, JsonNode>> it = files.fields(); it.hasNext(); ) {
            var entry = it.next();
            var key = entry.getKey().replace('\\', '/');
            if (key.equals(absolute.replace('\\', '/')) || key.endsWith("/" + relative) || key.equals(relative)) {
                return entry.getValue();
            }
            if (byName == null && Path.of(key).getFileName().toString().equals(file.getFileName())) {
                byName = entry.getValue();
            }
        }
        if (byName != null) {
            return byName;
        }
        return files.size() == 1 ? files.elements().next() : null;
    }
}

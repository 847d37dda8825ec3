package ai.phprefactor.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Runs external tools with a hard timeout, collecting stdout and stderr separately. */
public final class ProcessRunner {
    private static final Logger logger = LogManager.getLogger(ProcessRunner.class);

    public record Result(int exitCode, String stdout, String stderr) {}

    private ProcessRunner() {}

    /**
     * @throws StartupException if the executable cannot be started, typically because it does not exist
     * @throws TimeoutException if the process does not finish in time; it is killed
     */
    public static Result run(List<String> command, Path workingDirectory, Duration timeout)
            throws IOException, InterruptedException {
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout duration cannot be negative: " + timeout);
        }
        var commandLine = String.join(" ", command);
        logger.trace("command: {}", commandLine);
        var pb = new ProcessBuilder(command).directory(workingDirectory.toFile());

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new StartupException(
                    "unable to start `%s` in %s (%s)".formatted(commandLine, workingDirectory, e.getMessage()), "");
        }
        process.getOutputStream().close();

        var stdoutFuture = CompletableFuture.supplyAsync(() -> readStream(process.getInputStream()));
        var stderrFuture = CompletableFuture.supplyAsync(() -> readStream(process.getErrorStream()));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new TimeoutException(
                        "process '%s' did not complete within %s".formatted(commandLine, timeout),
                        collect(stderrFuture));
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            stdoutFuture.cancel(true);
            stderrFuture.cancel(true);
            logger.warn("Process '{}' interrupted.", commandLine);
            throw e;
        }
        return new Result(process.exitValue(), collect(stdoutFuture), collect(stderrFuture));
    }

    private static String readStream(InputStream in) {
        var lines = new ArrayList<String>();
        try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            logger.error("Error reading stream", e);
        }
        return String.join("\n", lines);
    }

    private static String collect(CompletableFuture<String> future) throws InterruptedException {
        try {
            return future.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException | java.util.concurrent.TimeoutException e) {
            logger.warn("Unable to collect process output: {}", e.getMessage());
            future.cancel(true);
            return "";
        }
    }

    /** A process that could not be run to a usable result. Carries whatever output it produced. */
    public abstract static class SubprocessException extends IOException {
        private final String output;

        protected SubprocessException(String message, String output) {
            super(message);
            this.output = output;
        }

        public String getOutput() {
            return output;
        }
    }

    public static class StartupException extends SubprocessException {
        public StartupException(String message, String output) {
            super(message, output);
        }
    }

    public static class TimeoutException extends SubprocessException {
        public TimeoutException(String message, String output) {
            super(message, output);
        }
    }

    public static class FailureException extends SubprocessException {
        private final int exitCode;

        public FailureException(String message, String output, int exitCode) {
            super(message, output);
            this.exitCode = exitCode;
        }

        public int getExitCode() {
            return exitCode;
        }
    }
}

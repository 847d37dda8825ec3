package ai.phprefactor;

import ai.phprefactor.analyzer.IndexScanner;
import ai.phprefactor.analyzer.ProjectFile;
import ai.phprefactor.analyzer.SymbolIndex;
import ai.phprefactor.analyzer.php.PhpParser;
import ai.phprefactor.util.ExecutorServiceUtil;
import com.google.common.base.Stopwatch;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Owns the project's {@link SymbolIndex} and serializes every mutation on one index thread.
 *
 * <p>A full scan runs in time slices: after each slice it re-queues itself behind any pending single-file updates, so
 * saves are not starved by a large workspace scan. The scan builds a fresh index and only replaces the live one once
 * every file has been visited; files updated meanwhile are replayed onto the new index before the swap.
 */
public final class IndexManager implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(IndexManager.class);

    public static final Duration DEFAULT_TIME_SLICE = Duration.ofMillis(50);

    @FunctionalInterface
    public interface ProgressListener {
        void onProgress(int scanned, int total);

        ProgressListener NONE = (scanned, total) -> {};
    }

    private final PhpProject project;
    private final IndexScanner scanner;
    private final Duration timeSlice;
    private final ExecutorService indexExecutor = ExecutorServiceUtil.newSingleThreadExecutor("php-index");
    private final AtomicBoolean indexing = new AtomicBoolean(false);

    private volatile SymbolIndex index = new SymbolIndex();

    @Nullable
    private volatile ScanPass currentPass;

    public IndexManager(PhpProject project, PhpParser parser) {
        this(project, parser, DEFAULT_TIME_SLICE);
    }

    public IndexManager(PhpProject project, PhpParser parser, Duration timeSlice) {
        this.project = project;
        this.scanner = new IndexScanner(parser);
        this.timeSlice = timeSlice;
    }

    /** The live index. Replaced wholesale when a full scan completes, so hold on to it only per request. */
    public SymbolIndex getIndex() {
        return index;
    }

    public boolean isIndexing() {
        return indexing.get();
    }

    /**
     * Starts a full workspace scan. If one is already running no second pass is started and the running pass's
     * future is returned.
     */
    public CompletableFuture<SymbolIndex> startFullScan(ProgressListener listener) {
        if (!indexing.compareAndSet(false, true)) {
            logger.debug("Full scan requested while already indexing; ignoring");
            var running = currentPass;
            return running != null ? running.future : CompletableFuture.completedFuture(index);
        }
        var pass = new ScanPass(project.getAllFiles(), listener);
        currentPass = pass;
        logger.info("Starting full scan of {} files", pass.total);
        indexExecutor.execute(pass::runSlice);
        return pass.future;
    }

    /** Clears cached file lists and replays a full scan. */
    public CompletableFuture<SymbolIndex> rebuild(ProgressListener listener) {
        project.invalidateAllFiles();
        return startFullScan(listener);
    }

    /** Abandons the running full scan; the live index stays as it was before the scan started. */
    public void cancelScan() {
        var pass = currentPass;
        if (pass != null) {
            pass.cancelled = true;
        }
    }

    /** Re-scan after a save, create or change. */
    public CompletableFuture<Void> updateFile(ProjectFile file) {
        return CompletableFuture.runAsync(
                () -> {
                    if (project.isIncluded(file)) {
                        scanner.scanInto(index, file);
                    } else {
                        index.removeFile(file);
                    }
                    markDirty(file);
                },
                indexExecutor);
    }

    public CompletableFuture<Void> removeFile(ProjectFile file) {
        return CompletableFuture.runAsync(
                () -> {
                    index.removeFile(file);
                    markDirty(file);
                },
                indexExecutor);
    }

    /** Prunes the old path and indexes the new one. */
    public CompletableFuture<Void> moveFile(ProjectFile from, ProjectFile to) {
        project.invalidateAllFiles();
        return removeFile(from).thenCompose(v -> updateFile(to));
    }

    private void markDirty(ProjectFile file) {
        var pass = currentPass;
        if (pass != null) {
            pass.dirty.add(file);
        }
    }

    @Override
    public void close() {
        cancelScan();
        indexExecutor.shutdown();
        try {
            if (!indexExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                indexExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            indexExecutor.shutdownNow();
        }
    }

    /** State of one full scan; only ever touched on the index thread apart from the cancel flag. */
    private final class ScanPass {
        private final Deque<ProjectFile> remaining;
        private final int total;
        private final ProgressListener listener;
        private final SymbolIndex staging = new SymbolIndex();
        private final Set<ProjectFile> dirty = new LinkedHashSet<>();
        private final CompletableFuture<SymbolIndex> future = new CompletableFuture<>();
        private int scanned;
        private volatile boolean cancelled;

        ScanPass(Set<ProjectFile> files, ProgressListener listener) {
            this.remaining = new ArrayDeque<>(files);
            this.total = files.size();
            this.listener = listener;
        }

        void runSlice() {
            if (cancelled) {
                abandon("scan cancelled");
                return;
            }
            var stopwatch = Stopwatch.createStarted();
            try {
                while (!remaining.isEmpty() && stopwatch.elapsed().compareTo(timeSlice) < 0) {
                    var file = remaining.poll();
                    scanner.scanInto(staging, file);
                    scanned++;
                }
                listener.onProgress(scanned, total);
            } catch (RuntimeException e) {
                finish();
                logger.error("Full scan failed", e);
                future.completeExceptionally(e);
                return;
            }
            if (!remaining.isEmpty()) {
                if (cancelled || indexExecutor.isShutdown()) {
                    abandon("scan cancelled");
                    return;
                }
                // yield: let queued single-file updates run before the next slice
                try {
                    indexExecutor.execute(this::runSlice);
                } catch (RejectedExecutionException e) {
                    abandon("index executor shut down");
                }
                return;
            }
            for (var file : dirty) {
                if (project.isIncluded(file)) {
                    scanner.scanInto(staging, file);
                } else {
                    staging.removeFile(file);
                }
            }
            index = staging;
            finish();
            logger.info("Full scan complete: {}", staging.stats());
            future.complete(staging);
        }

        private void abandon(String reason) {
            finish();
            logger.info("Full scan stopped after {} of {} files: {}", scanned, total, reason);
            future.completeExceptionally(new CancellationException(reason));
        }

        private void finish() {
            currentPass = null;
            indexing.set(false);
        }
    }
}

package com.largomodo.romaudit.core;

import com.largomodo.romaudit.archive.ArchiveEntry;
import com.largomodo.romaudit.core.domain.BatchSummary;
import com.largomodo.romaudit.core.domain.VerificationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Verifies many machines concurrently with fail-soft error handling.
 * <p>
 * Fixed pool sized to the thread count with a bounded queue ({@code 2 * threads});
 * CallerRunsPolicy throttles submission when the queue is full. Every machine is an independent
 * unit: a failure is reported through the observer and never stops the others.
 * <p>
 * {@link #cancel()} stops scheduling new machines. Machines already running finish, including any
 * hash in progress, so every report delivered before or after cancellation is complete.
 */
public class BatchVerifier {

    private static final Logger log = LoggerFactory.getLogger(BatchVerifier.class);

    private final VerificationEngine engine;
    private final ArchiveSource archives;
    private final int threads;
    private volatile boolean cancelled;

    /**
     * @param engine   engine verifying each machine
     * @param archives lists the entries of an archive by name
     * @param threads  worker thread count, at least 1
     */
    public BatchVerifier(VerificationEngine engine, ArchiveSource archives, int threads) {
        if (engine == null || archives == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got: " + threads);
        }
        this.engine = engine;
        this.archives = archives;
        this.threads = threads;
    }

    /**
     * Verify the given machines and block until all scheduled work is done.
     */
    public BatchSummary run(List<String> machines, PackagingPolicy policy, VerificationObserver observer) {
        ExecutorService executor = new ThreadPoolExecutor(
                threads,
                threads,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(2 * threads),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        final AtomicInteger complete = new AtomicInteger(0);
        final AtomicInteger fixable = new AtomicInteger(0);
        final AtomicInteger incomplete = new AtomicInteger(0);
        final AtomicInteger unverifiable = new AtomicInteger(0);
        final AtomicInteger failed = new AtomicInteger(0);
        final AtomicInteger skipped = new AtomicInteger(0);

        try {
            for (String machine : machines) {
                if (cancelled) {
                    skipped.incrementAndGet();
                    continue;
                }
                executor.submit(() -> {
                    if (cancelled) {
                        skipped.incrementAndGet();
                        return null;
                    }
                    try {
                        MDC.put("machine", machine);
                        observer.onStart(machine);
                        VerificationReport report = verifyOne(machine, policy);
                        switch (report.status()) {
                            case COMPLETE -> complete.incrementAndGet();
                            case FIXABLE -> fixable.incrementAndGet();
                            case INCOMPLETE -> incomplete.incrementAndGet();
                            case UNVERIFIABLE -> unverifiable.incrementAndGet();
                        }
                        observer.onReport(report);
                    } catch (Exception e) {
                        // Keep the worker alive, the batch continues
                        failed.incrementAndGet();
                        observer.onFailure(machine, e);
                    } finally {
                        MDC.clear();
                    }
                    return null;
                });
            }
        } finally {
            // Standard two-phase shutdown: graceful then forceful
            executor.shutdown();
            try {
                if (!executor.awaitTermination(1, TimeUnit.HOURS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        BatchSummary summary = new BatchSummary(complete.get(), fixable.get(), incomplete.get(),
                unverifiable.get(), failed.get(), skipped.get());
        log.info("Batch complete: {} complete, {} fixable, {} incomplete, {} unverifiable, {} failed, {} skipped",
                summary.complete(), summary.fixable(), summary.incomplete(), summary.unverifiable(),
                summary.failed(), summary.skipped());
        return summary;
    }

    private VerificationReport verifyOne(String machine, PackagingPolicy policy) {
        String archive;
        try {
            archive = engine.getResolution().archiveOf(machine, policy);
        } catch (CatalogIntegrityException e) {
            // The engine turns this into an UNVERIFIABLE report
            return engine.verify(machine, List.of(), policy);
        }
        try {
            return engine.verify(machine, archives.entries(archive), policy);
        } catch (IOException e) {
            log.warn("Cannot open archive {}: {}", archive, e.getMessage());
            return engine.verifyUnreadable(machine, policy, e);
        }
    }

    /**
     * Stop scheduling new machines. Safe to call from any thread, including a shutdown hook.
     */
    public void cancel() {
        if (!cancelled) {
            log.info("Cancellation requested, letting in-flight machines finish...");
        }
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Supplies archive entries to the batch.
     */
    @FunctionalInterface
    public interface ArchiveSource {
        List<ArchiveEntry> entries(String archive) throws IOException;
    }
}

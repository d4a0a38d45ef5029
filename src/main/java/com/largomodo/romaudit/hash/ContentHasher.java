package com.largomodo.romaudit.hash;

import com.largomodo.romaudit.archive.ArchiveEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Run-scoped memo of entry hashes keyed by physical location.
 * <p>
 * Concurrent callers asking for the same entry share one computation: the first caller runs the
 * hash, the others block on its result. Failures are memoized too, so an unreadable entry is
 * reported identically by every caller. One instance per verification run.
 */
public class ContentHasher {

    private static final Logger logger = LoggerFactory.getLogger(ContentHasher.class);

    private final ChecksumFunction function;
    private final ConcurrentMap<String, FutureTask<HashedContent>> memo = new ConcurrentHashMap<>();
    private final AtomicInteger computed = new AtomicInteger();

    public ContentHasher(ChecksumFunction function) {
        if (function == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.function = function;
    }

    /**
     * Hash the entry's bytes, at most once per location for the lifetime of this hasher.
     *
     * @throws IOException if the entry can not be read (now or on the first attempt)
     */
    public HashedContent hash(ArchiveEntry entry) throws IOException {
        FutureTask<HashedContent> task = new FutureTask<>(() -> compute(entry));
        FutureTask<HashedContent> existing = memo.putIfAbsent(entry.location(), task);
        if (existing == null) {
            existing = task;
            task.run();
        }
        try {
            return existing.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while hashing " + entry.location(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UncheckedIOException) {
                throw ((UncheckedIOException) cause).getCause();
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IOException("Failed to hash " + entry.location(), cause);
        }
    }

    /**
     * True when the entry was already hashed successfully.
     */
    public boolean isHashed(ArchiveEntry entry) {
        FutureTask<HashedContent> task = memo.get(entry.location());
        if (task == null || !task.isDone()) {
            return false;
        }
        try {
            task.get();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            return false;
        }
    }

    /**
     * Number of entries actually read from disk so far.
     */
    public int computedCount() {
        return computed.get();
    }

    private HashedContent compute(ArchiveEntry entry) {
        logger.debug("Hashing {}", entry.location());
        computed.incrementAndGet();
        try (InputStream in = entry.open()) {
            return function.hash(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

package de.mirkosertic.archivesync.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded thread pool for parsing index chunks.
 * The submitting thread runs tasks itself when the queue is full.
 */
public class IndexLoadExecutor implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(IndexLoadExecutor.class);

    private final ThreadPoolExecutor executor;

    public IndexLoadExecutor(final int workers) {
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "index-loader-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                workers,
                workers,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(workers * 4),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        logger.debug("IndexLoadExecutor initialized with {} threads", workers);
    }

    public <T> Future<T> submit(final Callable<T> task) {
        return executor.submit(task);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("IndexLoadExecutor did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for IndexLoadExecutor to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

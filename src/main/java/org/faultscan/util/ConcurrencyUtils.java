package org.faultscan.util;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility methods for handling worker pools and futures.
 */
public final class ConcurrencyUtils {

    private static final Logger LOGGER = Logger.getLogger(ConcurrencyUtils.class.getName());
    private static final Duration SHUTDOWN_WAIT_TIMEOUT = Duration.ofSeconds(60);

    private ConcurrencyUtils() {
    } // Prevent instantiation

    /**
     * Creates a ThreadFactory for named, non-daemon platform threads: prefix0, prefix1, ...
     */
    public static ThreadFactory createPlatformThreadFactory(final String prefix) {
        final AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            final Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        };
    }

    /**
     * Gracefully shuts down an ExecutorService.
     */
    public static void shutdownExecutorService(final ExecutorService executor, final String name) {
        if (executor == null) return;
        LOGGER.log(Level.FINE, "Attempting graceful shutdown of executor: {0}", name);

        executor.shutdown(); // Disable new tasks
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_TIMEOUT.toSeconds(), TimeUnit.SECONDS)) {
                final List<Runnable> droppedTasks = executor.shutdownNow();
                LOGGER.warning(String.format("Executor %s did not terminate in %ds, forced shutdown dropped %d waiting tasks",
                        name, SHUTDOWN_WAIT_TIMEOUT.toSeconds(), droppedTasks.size()));

                if (!executor.awaitTermination(SHUTDOWN_WAIT_TIMEOUT.toSeconds(), TimeUnit.SECONDS))
                    LOGGER.severe("Executor " + name + " did not terminate even after forcing.");
            } else
                LOGGER.log(Level.FINE, "Executor {0} terminated gracefully.", name);

        } catch (final InterruptedException ie) {
            LOGGER.warning("Shutdown wait for executor " + name + " interrupted. Forcing shutdown now.");
            executor.shutdownNow();
            Thread.currentThread().interrupt(); // Preserve interrupt status
        }
    }

    /**
     * Waits for a list of CompletableFutures to complete and collects the results of those that succeeded.
     * Failed or cancelled futures are logged and left out of the result.
     */
    public static <T> List<T> waitForCompletableFuturesAndCollect(
            final String levelName,
            final List<CompletableFuture<T>> futures,
            final Object identifier) {

        final String idStr = identifier != null ? identifier.toString() : "N/A";
        if (futures.isEmpty()) {
            LOGGER.log(Level.FINE, "No {0} job to wait for (ID: {1}).", new Object[]{levelName, idStr});
            return Collections.emptyList();
        }

        final CompletableFuture<Void> allOf = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        try {
            allOf.join();
        } catch (final CancellationException | CompletionException e) {
            LOGGER.log(Level.WARNING, "{0} jobs (ID: {1}) did not all complete normally: {2}",
                    new Object[]{levelName, idStr, e.getMessage()});
        }

        final List<T> results = new ArrayList<>();
        for (final CompletableFuture<T> future : futures) {
            try {
                results.add(future.join());
            } catch (final CompletionException e) {
                final Throwable cause = e.getCause() != null ? e.getCause() : e;
                LOGGER.log(Level.SEVERE, levelName + " job (ID: " + idStr + ") completed exceptionally", cause);
            } catch (final CancellationException e) {
                LOGGER.log(Level.WARNING, "{0} job (ID: {1}) was cancelled.", new Object[]{levelName, idStr});
            }
        }

        LOGGER.log(Level.FINE, "Collected {0} {1} results (out of {2} submitted).",
                new Object[]{results.size(), levelName, futures.size()});
        return results; // Return potentially partial results
    }
}

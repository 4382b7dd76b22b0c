package org.faultscan.processing;

import org.faultscan.metrics.BatchRunInfo;
import org.faultscan.metrics.Status;
import org.faultscan.model.LogEntry;
import org.faultscan.util.ConcurrencyUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a {@link RecordProcessor} over every entry of a batch on a fixed pool of platform threads.
 * <p>
 * Workers claim consecutive chunks of indexes from a shared cursor until the batch is exhausted,
 * so each entry is processed exactly once by exactly one worker. Entries are mutated in place;
 * nothing else is shared between workers apart from the cursor and the progress lock.
 * A failure on one entry resets that entry to default outputs and does not stop the run.
 */
public class BatchRunner {

    private static final Logger LOGGER = Logger.getLogger(BatchRunner.class.getName());

    public static final int DEFAULT_CHUNK_SIZE = 10;
    public static final int DEFAULT_PROGRESS_INTERVAL = 100;

    private final RecordProcessor processor;
    private final int numThreads;
    private final int chunkSize;
    private final int progressInterval;
    private final ProgressListener progressListener;
    private final Object progressLock = new Object();

    public BatchRunner(RecordProcessor processor, int numThreads) {
        this(processor, numThreads, DEFAULT_CHUNK_SIZE, DEFAULT_PROGRESS_INTERVAL, ProgressListener.console());
    }

    public BatchRunner(RecordProcessor processor, int numThreads, int chunkSize, int progressInterval,
                       ProgressListener progressListener) {
        this.processor = Objects.requireNonNull(processor, "Record processor cannot be null");
        this.progressListener = Objects.requireNonNull(progressListener, "Progress listener cannot be null");
        if (numThreads < 1) throw new IllegalArgumentException("numThreads must be >= 1, got " + numThreads);
        if (chunkSize < 1) throw new IllegalArgumentException("chunkSize must be >= 1, got " + chunkSize);
        if (progressInterval < 1)
            throw new IllegalArgumentException("progressInterval must be >= 1, got " + progressInterval);
        this.numThreads = numThreads;
        this.chunkSize = chunkSize;
        this.progressInterval = progressInterval;
    }

    public int getNumThreads() {
        return numThreads;
    }

    public BatchRunInfo run(final List<LogEntry> batch) {
        Objects.requireNonNull(batch, "Batch cannot be null");
        final Instant runStart = Instant.now();
        final AtomicInteger cursor = new AtomicInteger(0);

        final ThreadFactory workerFactory = ConcurrencyUtils.createPlatformThreadFactory("BatchWorker-");
        final ExecutorService workerExecutor = Executors.newFixedThreadPool(numThreads, workerFactory);
        final List<CompletableFuture<WorkerResult>> workerFutures = new ArrayList<>(numThreads);
        final List<WorkerResult> workerResults;

        LOGGER.info(String.format("Processing %d records with %d workers (chunk size %d)",
                batch.size(), numThreads, chunkSize));
        try {
            for (int w = 0; w < numThreads; w++) {
                workerFutures.add(CompletableFuture.supplyAsync(() -> drain(batch, cursor), workerExecutor));
            }
            workerResults = ConcurrencyUtils.waitForCompletableFuturesAndCollect("Worker", workerFutures, "batch");
        } finally {
            ConcurrencyUtils.shutdownExecutorService(workerExecutor, "BatchWorkerExecutor");
        }

        int processed = 0;
        int failed = 0;
        for (WorkerResult result : workerResults) {
            processed += result.processed();
            failed += result.failed();
        }

        final Status status;
        if (workerResults.size() < workerFutures.size() || processed != batch.size()) {
            LOGGER.severe(String.format("Batch run incomplete: %d/%d workers finished, %d/%d records processed",
                    workerResults.size(), workerFutures.size(), processed, batch.size()));
            status = Status.FAIL;
        } else {
            status = failed == 0 ? Status.PASS : Status.PARTIAL;
        }
        return new BatchRunInfo(status, processed, failed, numThreads, Duration.between(runStart, Instant.now()));
    }

    private WorkerResult drain(final List<LogEntry> batch, final AtomicInteger cursor) {
        final int total = batch.size();
        int processed = 0;
        int failed = 0;
        int start;
        while ((start = cursor.getAndAdd(chunkSize)) < total) {
            final int end = Math.min(start + chunkSize, total);
            for (int i = start; i < end; i++) {
                if (!processOne(batch.get(i))) failed++;
                processed++;
                if (i > 0 && i % progressInterval == 0) {
                    synchronized (progressLock) {
                        progressListener.onProgress(i, total);
                    }
                }
            }
        }
        return new WorkerResult(processed, failed);
    }

    private boolean processOne(final LogEntry entry) {
        try {
            processor.process(entry);
            return true;
        } catch (final RuntimeException e) {
            LOGGER.log(Level.WARNING, "Failed to process line " + entry.lineId() + ", leaving default outputs", e);
            entry.resetOutputs();
            return false;
        }
    }

    private record WorkerResult(int processed, int failed) {
    }
}

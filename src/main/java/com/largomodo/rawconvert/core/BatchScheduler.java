package com.largomodo.rawconvert.core;

import com.largomodo.rawconvert.core.event.ConversionEvent;
import com.largomodo.rawconvert.core.event.EventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one batch of work items on a fixed-size worker pool.
 * <p>
 * Strategy: every item is submitted up front; completions are collected in the order the
 * pool finishes them (not submission order). Each collected completion is checked against
 * the cancellation token: once cancelled, the scheduler reports the abort and stops
 * counting. Items still queued at that point run through the processor's entry check and
 * are skipped without work; items already running finish their attempt before the run
 * reports completion.
 * <p>
 * Event sequence of a run:
 * <pre>
 * Status("Found N raw files. Using W threads.")
 * (Preview | Status(error))*  interleaved with  Progress(1..k, N)
 * [Status("Aborted by user.")]
 * Status("Conversion complete.")
 * </pre>
 * The scheduler itself never fails: per-item errors are absorbed by the
 * {@link WorkItemProcessor}, and anything that still escapes a worker is reported as a
 * status line.
 */
public class BatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

    public static final String ABORTED_MESSAGE = "Aborted by user.";
    public static final String COMPLETE_MESSAGE = "Conversion complete.";
    static final String SCHEDULER_THREAD_NAME = "rawconvert-scheduler";

    /** MDC key carrying the file a worker is processing. */
    public static final String MDC_FILE_KEY = "file";

    // Graceful shutdown window before in-flight workers are interrupted
    private static final long SHUTDOWN_TIMEOUT_MINUTES = 5;

    private final WorkItemProcessor processor;

    public BatchScheduler(WorkItemProcessor processor) {
        this.processor = Objects.requireNonNull(processor, "processor is required");
    }

    /**
     * Start a run on a dedicated scheduler thread with a fresh cancellation token.
     *
     * @return handle used to abort the run or wait for its terminal status
     */
    public BatchRun start(List<WorkItem> items, RunConfiguration config, EventSink sink) {
        BatchRun batchRun = new BatchRun(new CancellationToken());
        Thread thread = new Thread(() -> {
            try {
                run(items, config, batchRun.token(), sink);
            } finally {
                batchRun.markDone();
            }
        }, SCHEDULER_THREAD_NAME);
        thread.setDaemon(true);
        thread.start();
        return batchRun;
    }

    /**
     * Process all items and publish progress, blocking the calling thread until every
     * completion is collected or cancellation is observed.
     *
     * @param items  the batch, one entry per source file
     * @param config validated run settings
     * @param token  cancellation state of this run
     * @param sink   destination of all events of the run
     */
    public void run(List<WorkItem> items, RunConfiguration config, CancellationToken token, EventSink sink) {
        int total = items.size();
        Instant startTime = Instant.now();
        sink.publish(new ConversionEvent.Status(
                "Found " + total + " raw files. Using " + config.workerCount() + " threads."));
        log.info("Starting batch: {} files, {} workers, output to {}",
                total, config.workerCount(), config.outputDir());

        ThreadPoolExecutor executor = newWorkerPool(config.workerCount());
        CompletionService<WorkItem> completions = new ExecutorCompletionService<>(executor);

        // Only touched by the scheduler thread: filled during submission, read while collecting
        Map<Future<WorkItem>, WorkItem> inFlight = new HashMap<>();

        int completed = 0;
        boolean aborted = false;
        boolean interrupted = false;
        try {
            for (WorkItem item : items) {
                Future<WorkItem> future = completions.submit(() -> processInContext(item, config, token, sink));
                inFlight.put(future, item);
            }

            for (int i = 0; i < total; i++) {
                Future<WorkItem> done = completions.take();
                if (token.isSet()) {
                    aborted = true;
                    log.info("Cancellation observed after {} of {} files", completed, total);
                    sink.publish(new ConversionEvent.Status(ABORTED_MESSAGE));
                    break;
                }
                reportEscapedFailure(done, inFlight.remove(done), sink);
                completed++;
                sink.publish(new ConversionEvent.Progress(completed, total));
            }
        } catch (InterruptedException e) {
            // Interrupting the scheduler is an abort request from the host; the flag is
            // restored once the workers have drained
            interrupted = true;
            token.set();
            if (!aborted) {
                aborted = true;
                sink.publish(new ConversionEvent.Status(ABORTED_MESSAGE));
            }
        } finally {
            awaitWorkers(executor);
            log.info("Batch finished: {} of {} files in {} ms{}", completed, total,
                    Duration.between(startTime, Instant.now()).toMillis(), aborted ? " (aborted)" : "");
            sink.publish(new ConversionEvent.Status(COMPLETE_MESSAGE));
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private WorkItem processInContext(WorkItem item, RunConfiguration config,
                                      CancellationToken token, EventSink sink) {
        MDC.put(MDC_FILE_KEY, item.fileName());
        try {
            return processor.process(item, config, token, sink);
        } finally {
            MDC.remove(MDC_FILE_KEY);
        }
    }

    /**
     * Surface a worker that died outside the processor's own error handling
     * (e.g. OutOfMemoryError while decoding). The item still counts as finished.
     */
    private void reportEscapedFailure(Future<WorkItem> done, WorkItem item, EventSink sink)
            throws InterruptedException {
        try {
            done.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String name = item != null ? item.fileName() : "unknown file";
            log.error("FAILED: {} - {}", name, WorkItemProcessor.describe(cause), cause);
            sink.publish(new ConversionEvent.Status(
                    WorkItemProcessor.PROCESSING_ERROR_PREFIX + name + ": " + WorkItemProcessor.describe(cause)));
        }
    }

    /**
     * Fixed pool: exactly {@code workers} threads, unbounded queue so every item can be
     * submitted before collection starts.
     */
    private static ThreadPoolExecutor newWorkerPool(int workers) {
        return new ThreadPoolExecutor(
                workers,
                workers,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new WorkerThreadFactory()
        );
    }

    /**
     * Graceful shutdown, then forceful after the timeout. Also used on abort: queued items
     * return at once from the processor's entry check, so the wait covers only the items
     * that were already running.
     */
    private static void awaitWorkers(ThreadPoolExecutor executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_MINUTES, TimeUnit.MINUTES)) {
                log.warn("Workers still running after {} minutes, interrupting", SHUTDOWN_TIMEOUT_MINUTES);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "rawconvert-worker-" + counter.getAndIncrement());
            // Not inherited from the daemon scheduler thread: a running conversion keeps the JVM alive
            thread.setDaemon(false);
            return thread;
        }
    }
}

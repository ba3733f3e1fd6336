package com.largomodo.rawconvert.core;

import com.largomodo.rawconvert.core.event.ConversionEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for batch scheduling: progress accounting, cancellation checkpoints,
 * failure isolation and worker pool bounds.
 */
@Timeout(value = 30, unit = TimeUnit.SECONDS)
class BatchSchedulerTest {

    private static final Path INPUT = Path.of("/photos/in");
    private static final Path OUTPUT = Path.of("/photos/out");

    private FakeConversionFacade facade;
    private BatchScheduler scheduler;

    @BeforeEach
    void setUp() {
        facade = new FakeConversionFacade();
        scheduler = new BatchScheduler(new WorkItemProcessor(facade));
    }

    @Test
    void testThreeItemsTwoWorkersScenario() {
        RecordingSink sink = new RecordingSink();

        scheduler.run(items("a.nef", "b.nef", "c.nef"), config(2), new CancellationToken(), sink);

        List<String> statuses = sink.statuses();
        assertEquals("Found 3 raw files. Using 2 threads.", statuses.get(0));
        assertEquals(BatchScheduler.COMPLETE_MESSAGE, statuses.get(statuses.size() - 1));
        assertEquals(2, statuses.size(), "No errors expected, only summary and completion");

        assertEquals(3, sink.previews().size());
        assertProgress(sink.progress(), 3, 3);

        List<ConversionEvent> events = sink.events();
        assertEquals(new ConversionEvent.Status(BatchScheduler.COMPLETE_MESSAGE), events.get(events.size() - 1),
                "Completion must be the final event");
        assertEquals(3, facade.written().size());
        assertTrue(facade.written().containsKey(OUTPUT.resolve("a.jpg")));
        assertTrue(facade.written().containsKey(OUTPUT.resolve("b.jpg")));
        assertTrue(facade.written().containsKey(OUTPUT.resolve("c.jpg")));
    }

    @Test
    void testProgressStrictlyIncreasesToTotal() {
        facade.delay(5);
        RecordingSink sink = new RecordingSink();

        scheduler.run(items(12), config(4), new CancellationToken(), sink);

        assertProgress(sink.progress(), 12, 12);
    }

    @Test
    void testEmptyBatchStillCompletes() {
        RecordingSink sink = new RecordingSink();

        scheduler.run(List.of(), config(3), new CancellationToken(), sink);

        assertEquals(List.of("Found 0 raw files. Using 3 threads.", BatchScheduler.COMPLETE_MESSAGE),
                sink.statuses());
        assertTrue(sink.progress().isEmpty());
    }

    @Test
    void testAbortAfterKCompletionsStopsProgress() {
        int total = 6;
        int k = 2;
        CancellationToken token = new CancellationToken();
        // Set the token from the scheduler's own publish call, i.e. after the K-th
        // completion is recorded and before the next one is examined
        RecordingSink sink = new RecordingSink(event -> {
            if (event instanceof ConversionEvent.Progress p && p.completed() == k) {
                token.set();
            }
        });

        scheduler.run(items(total), config(2), token, sink);

        assertProgress(sink.progress(), k, total);

        List<String> statuses = sink.statuses();
        int abortIndex = statuses.indexOf(BatchScheduler.ABORTED_MESSAGE);
        int completeIndex = statuses.indexOf(BatchScheduler.COMPLETE_MESSAGE);
        assertTrue(abortIndex > 0, "Abort status must be published");
        assertEquals(statuses.size() - 1, completeIndex, "Completion must be the last status");
        assertTrue(abortIndex < completeIndex, "Abort status precedes completion status");
        assertEquals(1, statuses.stream().filter(BatchScheduler.COMPLETE_MESSAGE::equals).count());
        assertEquals(1, statuses.stream().filter(BatchScheduler.ABORTED_MESSAGE::equals).count());

        List<ConversionEvent> events = sink.events();
        int abortEvent = events.indexOf(new ConversionEvent.Status(BatchScheduler.ABORTED_MESSAGE));
        assertTrue(events.subList(abortEvent, events.size()).stream()
                        .noneMatch(e -> e instanceof ConversionEvent.Progress),
                "No progress after the abort status");
    }

    @Test
    void testCancelledBeforeStartSkipsAllWork() {
        CancellationToken token = new CancellationToken();
        token.set();
        RecordingSink sink = new RecordingSink();

        scheduler.run(items(5), config(2), token, sink);

        assertEquals(0, facade.decodeCalls(), "Items must be skipped at processor entry");
        assertTrue(sink.previews().isEmpty());
        assertTrue(sink.progress().isEmpty());
        assertTrue(facade.written().isEmpty());
        assertEquals(List.of("Found 5 raw files. Using 2 threads.",
                        BatchScheduler.ABORTED_MESSAGE,
                        BatchScheduler.COMPLETE_MESSAGE),
                sink.statuses());
    }

    @Test
    void testDecodeFailureIsReportedAndOthersProgress() {
        facade.corrupt("b.nef");
        RecordingSink sink = new RecordingSink();

        scheduler.run(items("a.nef", "b.nef", "c.nef"), config(2), new CancellationToken(), sink);

        List<String> statuses = sink.statuses();
        assertTrue(statuses.contains("Error generating preview for b.nef: corrupt raw data"), statuses.toString());
        assertTrue(statuses.contains("Error processing b.nef: corrupt raw data"), statuses.toString());
        assertProgress(sink.progress(), 3, 3);
        assertEquals(2, facade.written().size());
        assertFalse(facade.written().containsKey(OUTPUT.resolve("b.jpg")));
        assertEquals(BatchScheduler.COMPLETE_MESSAGE, statuses.get(statuses.size() - 1));
    }

    @Test
    void testPreviewFailureStillConverts() {
        facade.unpreviewable("b.nef");
        RecordingSink sink = new RecordingSink();

        scheduler.run(items("a.nef", "b.nef"), config(1), new CancellationToken(), sink);

        assertTrue(sink.statuses().contains("Error generating preview for b.nef: thumbnail encoder unavailable"));
        assertTrue(facade.written().containsKey(OUTPUT.resolve("b.jpg")), "Conversion must run after a preview failure");
        assertEquals(1, sink.previews().size());
    }

    @Test
    void testEscapedWorkerErrorIsReportedAsStatus() {
        facade.escaping("b.nef", new OutOfMemoryError("simulated heap exhaustion"));
        RecordingSink sink = new RecordingSink();

        scheduler.run(items("a.nef", "b.nef", "c.nef"), config(2), new CancellationToken(), sink);

        assertTrue(sink.statuses().contains("Error processing b.nef: simulated heap exhaustion"),
                sink.statuses().toString());
        assertProgress(sink.progress(), 3, 3);
        assertEquals(BatchScheduler.COMPLETE_MESSAGE, sink.statuses().get(sink.statuses().size() - 1));
    }

    @Test
    void testWorkerPoolIsBounded() {
        facade.delay(20);
        RecordingSink sink = new RecordingSink();

        scheduler.run(items(10), config(3), new CancellationToken(), sink);

        assertTrue(facade.maxActive() <= 3, "At most 3 concurrent decodes, saw " + facade.maxActive());
        assertTrue(facade.decodeThreads().stream().allMatch(name -> name.startsWith("rawconvert-worker-")),
                "Work must run on pool threads: " + facade.decodeThreads());
        long distinctThreads = facade.decodeThreads().stream().distinct().count();
        assertTrue(distinctThreads <= 3, "Pool must not exceed configured size: " + distinctThreads);
    }

    @Test
    void testWorkerMdcCarriesFileName() {
        RecordingSink sink = new RecordingSink();

        scheduler.run(items("a.nef", "b.nef"), config(2), new CancellationToken(), sink);

        assertEquals("a.nef", facade.mdcByFile().get("a.nef"));
        assertEquals("b.nef", facade.mdcByFile().get("b.nef"));
    }

    @Test
    void testResizeAndQualityReachTheEncoder() {
        RunConfiguration config = new RunConfiguration(INPUT, OUTPUT, 70, true, 64, 48, 1);

        scheduler.run(items("a.nef"), config, new CancellationToken(), new RecordingSink());

        assertArrayEquals(new byte[]{64, 48, 70}, facade.written().get(OUTPUT.resolve("a.jpg")));
    }

    @Test
    void testStartAbortWhileItemInFlight() throws InterruptedException {
        CountDownLatch release = facade.gate("a.nef");
        RecordingSink sink = new RecordingSink();

        BatchRun run = scheduler.start(items("a.nef", "b.nef", "c.nef"), config(1), sink);
        assertTrue(facade.firstDecode().await(10, TimeUnit.SECONDS), "First item should start");
        assertFalse(run.isDone());

        run.abort();
        release.countDown();

        assertTrue(run.await(10, TimeUnit.SECONDS), "Run should finish after abort");
        assertTrue(run.isDone());
        assertTrue(run.isAborted());

        List<String> statuses = sink.statuses();
        assertTrue(statuses.contains(BatchScheduler.ABORTED_MESSAGE));
        assertEquals(BatchScheduler.COMPLETE_MESSAGE, statuses.get(statuses.size() - 1));
        assertTrue(sink.progress().isEmpty(), "Abort observed at the first completion");

        // In-flight item finishes its attempt; queued items are skipped
        assertTrue(facade.written().containsKey(OUTPUT.resolve("a.jpg")));
        assertFalse(facade.written().containsKey(OUTPUT.resolve("b.jpg")));
        assertFalse(facade.written().containsKey(OUTPUT.resolve("c.jpg")));
    }

    @Test
    void testStartRunsOnSchedulerThreadWithFreshToken() throws InterruptedException {
        RecordingSink first = new RecordingSink();
        BatchRun run1 = scheduler.start(items(2), config(2), first);
        run1.abort();
        assertTrue(run1.await(10, TimeUnit.SECONDS));

        RecordingSink second = new RecordingSink();
        BatchRun run2 = scheduler.start(items(2), config(2), second);
        assertTrue(run2.await(10, TimeUnit.SECONDS));

        assertNotSame(run1.token(), run2.token());
        assertFalse(run2.isAborted());
        assertProgress(second.progress(), 2, 2);
    }

    @Test
    void testAbortWaitsForRunningItemsBeforeCompleting() throws InterruptedException {
        CountDownLatch releaseA = facade.gate("a.nef");
        CountDownLatch releaseB = facade.gate("b.nef");
        RecordingSink sink = new RecordingSink();

        BatchRun run = scheduler.start(items("a.nef", "b.nef", "c.nef"), config(2), sink);
        assertTrue(facade.entered("a.nef").await(10, TimeUnit.SECONDS));
        assertTrue(facade.entered("b.nef").await(10, TimeUnit.SECONDS));

        run.abort();
        releaseA.countDown();

        assertFalse(run.await(300, TimeUnit.MILLISECONDS), "Run must wait for b.nef, still converting");
        assertTrue(sink.statuses().contains(BatchScheduler.ABORTED_MESSAGE), "Abort reported at once");
        assertFalse(sink.statuses().contains(BatchScheduler.COMPLETE_MESSAGE));

        releaseB.countDown();
        assertTrue(run.await(10, TimeUnit.SECONDS));

        assertTrue(facade.written().containsKey(OUTPUT.resolve("a.jpg")));
        assertTrue(facade.written().containsKey(OUTPUT.resolve("b.jpg")), "In-flight item finishes its attempt");
        assertFalse(facade.written().containsKey(OUTPUT.resolve("c.jpg")), "Queued item is skipped");

        List<ConversionEvent> events = sink.events();
        assertEquals(new ConversionEvent.Status(BatchScheduler.COMPLETE_MESSAGE), events.get(events.size() - 1),
                "No event of the run may follow completion");
        assertEquals(2, sink.previews().size());
        assertEquals(Set.of(false), facade.daemonWorkers(), "Workers must not be daemon threads");
    }

    @Test
    void testInterruptedSchedulerAborts() throws InterruptedException {
        CountDownLatch release = facade.gate("a.nef");
        CancellationToken token = new CancellationToken();
        RecordingSink sink = new RecordingSink();
        AtomicBoolean interruptRestored = new AtomicBoolean();

        Thread schedulerThread = new Thread(() -> {
            scheduler.run(items("a.nef"), config(1), token, sink);
            interruptRestored.set(Thread.currentThread().isInterrupted());
        });
        schedulerThread.start();
        assertTrue(facade.firstDecode().await(10, TimeUnit.SECONDS));

        schedulerThread.interrupt();
        release.countDown();
        schedulerThread.join(10_000);

        assertFalse(schedulerThread.isAlive());
        assertTrue(token.isSet(), "Interrupt must cancel the run");
        assertTrue(interruptRestored.get(), "Interrupt flag must be restored for the caller");
        assertEquals(List.of("Found 1 raw files. Using 1 threads.",
                        BatchScheduler.ABORTED_MESSAGE,
                        BatchScheduler.COMPLETE_MESSAGE),
                sink.statuses());
        assertTrue(facade.written().containsKey(OUTPUT.resolve("a.jpg")), "Running item is not cut off");
    }

    private static void assertProgress(List<ConversionEvent.Progress> progress, int expectedCount, int total) {
        assertEquals(expectedCount, progress.size(), "Progress events: " + progress);
        for (int i = 0; i < progress.size(); i++) {
            assertEquals(i + 1, progress.get(i).completed(), "Progress must count 1.." + expectedCount);
            assertEquals(total, progress.get(i).total());
        }
    }

    private static RunConfiguration config(int workers) {
        return new RunConfiguration(INPUT, OUTPUT, 85, false, 800, 600, workers);
    }

    private static List<WorkItem> items(String... names) {
        List<WorkItem> items = new ArrayList<>();
        for (String name : names) {
            items.add(new WorkItem(name));
        }
        return items;
    }

    private static List<WorkItem> items(int count) {
        return IntStream.rangeClosed(1, count)
                .mapToObj(i -> new WorkItem(String.format("DSC_%04d.NEF", i)))
                .collect(Collectors.toList());
    }
}

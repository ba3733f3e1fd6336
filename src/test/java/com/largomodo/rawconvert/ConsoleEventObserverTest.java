package com.largomodo.rawconvert;

import com.largomodo.rawconvert.core.BatchScheduler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleEventObserverTest {

    @Test
    void testCountsErrorStatusesAndTerminalMessages() {
        ConsoleEventObserver observer = new ConsoleEventObserver(null);

        observer.onStatus("Found 2 raw files. Using 4 threads.");
        observer.onStatus("Error generating preview for a.nef: corrupt");
        observer.onStatus("Error processing a.nef: corrupt");
        observer.onStatus(BatchScheduler.ABORTED_MESSAGE);
        observer.onStatus(BatchScheduler.COMPLETE_MESSAGE);

        assertEquals(2, observer.errorCount());
        assertTrue(observer.aborted());
    }

    @Test
    void testCleanRunIsNotAnError() {
        ConsoleEventObserver observer = new ConsoleEventObserver(null);

        observer.onStatus("Found 2 raw files. Using 4 threads.");
        observer.onProgress(1, 2);
        observer.onProgress(2, 2);
        observer.onStatus(BatchScheduler.COMPLETE_MESSAGE);

        assertEquals(0, observer.errorCount());
        assertFalse(observer.aborted());
    }

    @Test
    void testLatestPreviewReplacesFile(@TempDir Path tempDir) throws IOException {
        Path previewFile = tempDir.resolve("preview.jpg");
        ConsoleEventObserver observer = new ConsoleEventObserver(previewFile);

        observer.onPreview("a.nef", new byte[]{1, 2, 3});
        observer.onPreview("b.nef", new byte[]{4, 5});

        assertArrayEquals(new byte[]{4, 5}, Files.readAllBytes(previewFile));
        assertFalse(Files.exists(tempDir.resolve("preview.jpg.tmp")));
    }

    @Test
    void testUnwritablePreviewDoesNotFail(@TempDir Path tempDir) {
        ConsoleEventObserver observer = new ConsoleEventObserver(tempDir.resolve("missing-dir/preview.jpg"));

        assertDoesNotThrow(() -> observer.onPreview("a.nef", new byte[]{1}));
        assertEquals(0, observer.errorCount(), "A preview file problem is not a conversion error");
    }
}

package com.largomodo.rawconvert;

import com.largomodo.rawconvert.core.BatchScheduler;
import com.largomodo.rawconvert.core.ConversionObserver;
import com.largomodo.rawconvert.core.WorkItemProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Command-line rendering of the event stream.
 * <p>
 * Status lines go to the log as-is, progress as "completed/total converted...", and the
 * latest preview is written to a file when one was requested. Also keeps the tallies
 * the command needs for its exit code.
 * <p>
 * Invoked only from the event channel's dispatcher thread; the tallies are read by the
 * main thread after the channel is closed, which orders the accesses.
 */
class ConsoleEventObserver implements ConversionObserver {

    private static final Logger log = LoggerFactory.getLogger(ConsoleEventObserver.class);

    private final Path previewFile;

    private volatile int errorCount;
    private volatile boolean aborted;

    /**
     * @param previewFile where the latest preview is written, or null to discard previews
     */
    ConsoleEventObserver(Path previewFile) {
        this.previewFile = previewFile;
    }

    @Override
    public void onStatus(String message) {
        if (message.startsWith(WorkItemProcessor.PREVIEW_ERROR_PREFIX)
                || message.startsWith(WorkItemProcessor.PROCESSING_ERROR_PREFIX)) {
            errorCount++;
            log.warn(message);
            return;
        }
        if (BatchScheduler.ABORTED_MESSAGE.equals(message)) {
            aborted = true;
        }
        log.info(message);
    }

    @Override
    public void onProgress(int completed, int total) {
        if (total > 0) {
            log.info("{}/{} converted...", completed, total);
        }
    }

    @Override
    public void onPreview(String fileName, byte[] image) {
        if (previewFile == null) {
            log.debug("Preview of {} ({} bytes)", fileName, image.length);
            return;
        }
        try {
            // Write next to the target and move, so viewers never see a half-written preview
            Path tmp = previewFile.resolveSibling(previewFile.getFileName() + ".tmp");
            Files.write(tmp, image);
            Files.move(tmp, previewFile, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Preview of {} written to {}", fileName, previewFile);
        } catch (IOException e) {
            log.warn("Could not write preview of {} to {}: {}", fileName, previewFile, e.getMessage());
        }
    }

    int errorCount() {
        return errorCount;
    }

    boolean aborted() {
        return aborted;
    }
}

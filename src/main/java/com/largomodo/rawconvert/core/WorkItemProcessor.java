package com.largomodo.rawconvert.core;

import com.largomodo.rawconvert.core.event.ConversionEvent;
import com.largomodo.rawconvert.core.event.EventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Per-file conversion pipeline.
 * <p>
 * Two independent phases per item:
 * 1. Preview: decode, shrink to fit {@value #PREVIEW_MAX_SIZE}px, publish as JPEG bytes
 * 2. Conversion: decode again, optionally resize, write JPEG next to the other outputs
 * <p>
 * Each phase catches its own failures and reports them as a status event, so a file that
 * cannot be previewed is still converted and a file that cannot be converted never stops
 * the batch. Nothing thrown by the facade escapes {@link #process}.
 * <p>
 * Stateless; one instance is shared by all workers of a run.
 */
public class WorkItemProcessor {

    private static final Logger log = LoggerFactory.getLogger(WorkItemProcessor.class);

    /** Bounding box of preview thumbnails, in pixels. */
    public static final int PREVIEW_MAX_SIZE = 500;

    public static final String PREVIEW_ERROR_PREFIX = "Error generating preview for ";
    public static final String PROCESSING_ERROR_PREFIX = "Error processing ";

    private final ConversionFacade facade;

    public WorkItemProcessor(ConversionFacade facade) {
        this.facade = Objects.requireNonNull(facade, "facade is required");
    }

    /**
     * Run both phases for one item.
     * <p>
     * Returns immediately, without events, when the run is already cancelled.
     *
     * @param item   source file to convert
     * @param config run settings
     * @param token  cancellation state of the run
     * @param sink   destination of preview and error events
     * @return the item, signalling that its attempt is finished (not that it succeeded)
     */
    public WorkItem process(WorkItem item, RunConfiguration config, CancellationToken token, EventSink sink) {
        if (token.isSet()) {
            log.debug("Skipping {}: run cancelled", item.fileName());
            return item;
        }

        Path source = item.resolveIn(config.inputDir());
        log.info("Processing: {}", item.fileName());

        generatePreview(item, source, sink);
        convert(item, source, config, sink);

        return item;
    }

    private void generatePreview(WorkItem item, Path source, EventSink sink) {
        try {
            BufferedImage image = facade.decode(source);
            byte[] preview = facade.thumbnail(image, PREVIEW_MAX_SIZE, PREVIEW_MAX_SIZE);
            sink.publish(new ConversionEvent.Preview(item.fileName(), preview));
            log.debug("Preview ready for {} ({} bytes)", item.fileName(), preview.length);
        } catch (Exception e) {
            log.warn("Preview failed for {}: {}", item.fileName(), describe(e));
            sink.publish(new ConversionEvent.Status(
                    PREVIEW_ERROR_PREFIX + item.fileName() + ": " + describe(e)));
        }
    }

    private void convert(WorkItem item, Path source, RunConfiguration config, EventSink sink) {
        Path target = config.outputDir().resolve(item.outputName());
        try {
            BufferedImage image = facade.decode(source);
            Dimension resizeTo = config.resize()
                    ? new Dimension(config.targetWidth(), config.targetHeight())
                    : null;
            facade.write(image, target, resizeTo, config.quality());
            log.debug("Wrote {}", target);
        } catch (Exception e) {
            log.error("FAILED: {} - {}", item.fileName(), describe(e));
            sink.publish(new ConversionEvent.Status(
                    PROCESSING_ERROR_PREFIX + item.fileName() + ": " + describe(e)));
        }
    }

    /**
     * Cause text for status lines: the exception message, or its type when there is none.
     */
    static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}

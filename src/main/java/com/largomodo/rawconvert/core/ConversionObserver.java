package com.largomodo.rawconvert.core;

/**
 * Consumer of conversion events.
 * <p>
 * Each method corresponds to one {@link com.largomodo.rawconvert.core.event.ConversionEvent}
 * variant and is called by {@code ConversionEvent.dispatchTo}. All methods have default
 * no-op implementations, allowing consumers to override only the events they care about.
 * </p>
 * <p>
 * When registered on an {@link com.largomodo.rawconvert.core.event.EventChannel}, methods
 * are invoked from the channel's single dispatcher thread, one event at a time.
 * </p>
 * <p>
 * Example usage:
 * </p>
 * <pre>{@code
 * ConversionObserver observer = new ConversionObserver() {
 *     @Override
 *     public void onProgress(int completed, int total) {
 *         System.out.println(completed + "/" + total + " converted...");
 *     }
 * };
 * }</pre>
 *
 * @see WorkItemProcessor
 * @see BatchScheduler
 */
public interface ConversionObserver {

    /**
     * Called for status lines: batch summary, per-file errors, abort and completion.
     *
     * @param message the status text
     */
    default void onStatus(String message) {}

    /**
     * Called each time the scheduler records a finished item.
     *
     * @param completed number of items finished so far
     * @param total     number of items in the batch
     */
    default void onProgress(int completed, int total) {}

    /**
     * Called when a thumbnail of a source file is available.
     *
     * @param fileName the source file the preview was generated from
     * @param image    JPEG-encoded thumbnail
     */
    default void onPreview(String fileName, byte[] image) {}
}

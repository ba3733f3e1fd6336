package com.largomodo.rawconvert.core.event;

import com.largomodo.rawconvert.core.ConversionObserver;

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * Notification published during a conversion run.
 * <p>
 * Closed set of three payload shapes. Consumers decode an event with
 * {@link #dispatchTo(ConversionObserver)}, which calls the observer method matching the
 * variant; adding a variant forces it to declare its own dispatch.
 */
public sealed interface ConversionEvent
        permits ConversionEvent.Status, ConversionEvent.Progress, ConversionEvent.Preview {

    /**
     * Deliver this event to the observer callback for its variant.
     */
    void dispatchTo(ConversionObserver observer);

    /**
     * Human-readable status line (batch summary, per-file error, abort, completion).
     */
    record Status(String message) implements ConversionEvent {

        public Status {
            Objects.requireNonNull(message, "message is required");
        }

        @Override
        public void dispatchTo(ConversionObserver observer) {
            observer.onStatus(message);
        }
    }

    /**
     * Aggregate progress: {@code completed} of {@code total} items have finished their attempt.
     */
    record Progress(int completed, int total) implements ConversionEvent {

        public Progress {
            if (completed < 0 || total < 0 || completed > total) {
                throw new IllegalArgumentException(
                        "Invalid progress " + completed + "/" + total);
            }
        }

        /**
         * Completed fraction in [0, 1]; 0 for an empty batch.
         */
        public double fraction() {
            return total == 0 ? 0.0 : (double) completed / total;
        }

        @Override
        public void dispatchTo(ConversionObserver observer) {
            observer.onProgress(completed, total);
        }
    }

    /**
     * Encoded thumbnail (JPEG) of one source file.
     * <p>
     * The image bytes are copied on the way in and out, so a published preview cannot be
     * altered by its producer or by another reader.
     */
    record Preview(String fileName, byte[] image) implements ConversionEvent {

        public Preview {
            Objects.requireNonNull(fileName, "fileName is required");
            Objects.requireNonNull(image, "image is required");
            image = image.clone();
        }

        @Override
        public byte[] image() {
            return image.clone();
        }

        public int size() {
            return image.length;
        }

        public String toBase64() {
            return Base64.getEncoder().encodeToString(image);
        }

        @Override
        public void dispatchTo(ConversionObserver observer) {
            observer.onPreview(fileName, image.clone());
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Preview other
                    && fileName.equals(other.fileName)
                    && Arrays.equals(image, other.image);
        }

        @Override
        public int hashCode() {
            return 31 * fileName.hashCode() + Arrays.hashCode(image);
        }

        @Override
        public String toString() {
            return "Preview[fileName=" + fileName + ", size=" + image.length + "]";
        }
    }
}

package com.largomodo.rawconvert.core;

import java.nio.file.Path;

/**
 * Immutable settings of one conversion run.
 * <p>
 * Validated on construction: an instance that exists is safe to hand to the scheduler.
 * Target dimensions are validated even when resizing is off, matching the form they come
 * from where all numeric fields are always submitted together.
 *
 * @param inputDir     directory holding the raw source files
 * @param outputDir    directory receiving the converted JPEG files
 * @param quality      JPEG quality, 1 (smallest) to 100 (best)
 * @param resize       whether converted images are scaled to the target dimensions
 * @param targetWidth  width of resized output, in pixels
 * @param targetHeight height of resized output, in pixels
 * @param workerCount  number of concurrent worker threads
 */
public record RunConfiguration(Path inputDir,
                               Path outputDir,
                               int quality,
                               boolean resize,
                               int targetWidth,
                               int targetHeight,
                               int workerCount) {

    public static final int DEFAULT_QUALITY = 85;
    public static final int DEFAULT_WORKER_COUNT = 4;
    public static final int DEFAULT_WIDTH = 800;
    public static final int DEFAULT_HEIGHT = 600;

    public static final int MIN_QUALITY = 1;
    public static final int MAX_QUALITY = 100;

    static final String NOT_INTEGERS_MESSAGE =
            "Quality, Width, Height, and Thread Count must be integers.";

    public RunConfiguration {
        if (inputDir == null) {
            throw new ConfigurationException("Input folder is required");
        }
        if (outputDir == null) {
            throw new ConfigurationException("Output folder is required");
        }
        if (quality < MIN_QUALITY || quality > MAX_QUALITY) {
            throw new ConfigurationException(
                    "Quality must be between " + MIN_QUALITY + " and " + MAX_QUALITY + ", got: " + quality);
        }
        requirePositive("Width", targetWidth);
        requirePositive("Height", targetHeight);
        requirePositive("Thread Count", workerCount);
    }

    /**
     * Build a configuration from the raw text of form fields.
     * <p>
     * Surrounding whitespace is ignored. Any non-integer numeric field fails with a single
     * message naming all four numeric fields.
     *
     * @throws ConfigurationException if any field is missing, non-numeric or out of range
     */
    public static RunConfiguration parse(String inputDir, String outputDir,
                                         String quality, boolean resize,
                                         String width, String height, String workerCount) {
        if (inputDir == null || inputDir.isBlank()) {
            throw new ConfigurationException("Input folder is required");
        }
        if (outputDir == null || outputDir.isBlank()) {
            throw new ConfigurationException("Output folder is required");
        }

        int q;
        int w;
        int h;
        int t;
        try {
            q = Integer.parseInt(trim(quality));
            w = Integer.parseInt(trim(width));
            h = Integer.parseInt(trim(height));
            t = Integer.parseInt(trim(workerCount));
        } catch (NumberFormatException e) {
            throw new ConfigurationException(NOT_INTEGERS_MESSAGE, e);
        }

        return new RunConfiguration(Path.of(inputDir.trim()), Path.of(outputDir.trim()),
                q, resize, w, h, t);
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }

    private static void requirePositive(String field, int value) {
        if (value <= 0) {
            throw new ConfigurationException(field + " must be a positive integer, got: " + value);
        }
    }
}

package com.largomodo.rawconvert.core;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One source file of a batch, identified by its name inside the run's input directory.
 * <p>
 * Stateless: the item is resolved against the input directory only when a worker picks it up.
 *
 * @param fileName file name relative to the input directory (e.g. "DSC_0001.NEF")
 */
public record WorkItem(String fileName) {

    /** Extension of converted output files. */
    public static final String OUTPUT_EXTENSION = "jpg";

    public WorkItem {
        Objects.requireNonNull(fileName, "fileName is required");
        if (fileName.isBlank()) {
            throw new IllegalArgumentException("fileName must not be blank");
        }
    }

    public Path resolveIn(Path inputDir) {
        return inputDir.resolve(fileName);
    }

    /**
     * Base name of the source file with the extension removed: "DSC_0001.NEF" → "DSC_0001".
     * Names without an extension (or dot-files) are returned unchanged.
     */
    public String baseName() {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * Output file name: same base name, JPEG extension.
     */
    public String outputName() {
        return baseName() + "." + OUTPUT_EXTENSION;
    }
}

package com.largomodo.rawconvert.core;

import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Facade abstracting image conversion services for dependency inversion.
 * <p>
 * Core package depends on abstraction, service package provides implementation.
 * Enables WorkItemProcessor orchestration logic to remain independent of the raw decoder
 * and the JPEG encoder in use.
 */
public interface ConversionFacade {

    /**
     * Decode a raw camera file into an RGB image.
     *
     * @param source raw source file
     * @return decoded image
     * @throws IOException if the file cannot be read or decoded
     */
    BufferedImage decode(Path source) throws IOException;

    /**
     * Encode a small preview of an image, fitting inside the given box.
     *
     * @param image     decoded image
     * @param maxWidth  maximum preview width
     * @param maxHeight maximum preview height
     * @return JPEG-encoded preview
     * @throws IOException if encoding fails
     */
    byte[] thumbnail(BufferedImage image, int maxWidth, int maxHeight) throws IOException;

    /**
     * Encode an image as JPEG and write it to the target file.
     *
     * @param image    decoded image
     * @param target   output file, replaced if present
     * @param resizeTo exact output dimensions, or null to keep the image size
     * @param quality  JPEG quality, 1-100
     * @throws IOException if encoding or writing fails
     */
    void write(BufferedImage image, Path target, Dimension resizeTo, int quality) throws IOException;
}

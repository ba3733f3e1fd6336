package com.largomodo.rawconvert.service;

import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Service interface for scaling and encoding decoded images.
 * <p>
 * <b>Contract Guarantees:</b>
 * <ul>
 *   <li>The source image is never modified</li>
 *   <li>Deterministic: identical image and settings produce identical bytes</li>
 *   <li>Safe to call concurrently from several workers</li>
 * </ul>
 */
public interface ImageEncoder {

    /**
     * Encode a preview that fits inside {@code maxWidth x maxHeight}, keeping the aspect
     * ratio. Images already inside the box are not enlarged.
     *
     * @return encoded preview bytes
     * @throws IOException if encoding fails
     */
    byte[] thumbnail(BufferedImage image, int maxWidth, int maxHeight) throws IOException;

    /**
     * Encode an image and write it to {@code target}, replacing any existing file.
     *
     * @param resizeTo exact output dimensions, or null to keep the source size
     * @param quality  1 (smallest file) to 100 (best quality)
     * @throws IOException if encoding or writing fails
     */
    void write(BufferedImage image, Path target, Dimension resizeTo, int quality) throws IOException;
}

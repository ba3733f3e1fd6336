package com.largomodo.rawconvert.service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Service interface for decoding raw camera files into pixel buffers.
 * <p>
 * Abstracts the decoding step to enable alternative implementations:
 * <ul>
 *   <li>Production: dcraw-based decoding ({@link DcrawDecoder})</li>
 *   <li>Pure Java: formats readable by ImageIO ({@link ImageIoDecoder})</li>
 *   <li>Testing: Mock implementations for unit testing without external dependencies</li>
 * </ul>
 * <p>
 * <b>Contract Guarantees:</b>
 * <ul>
 *   <li>Input file remains unmodified (read-only access)</li>
 *   <li>Returned image is fully decoded and owned by the caller</li>
 *   <li>Safe to call concurrently from several workers on different files</li>
 *   <li>Fail-fast: throw IOException on any read or decode failure, never return null</li>
 * </ul>
 */
public interface RawDecoder {

    /**
     * Decode a raw file into an RGB image.
     *
     * @param source raw camera file
     * @return decoded image
     * @throws IOException              if the file cannot be read or is not a supported format
     * @throws IllegalArgumentException if source does not exist
     */
    BufferedImage decode(Path source) throws IOException;
}

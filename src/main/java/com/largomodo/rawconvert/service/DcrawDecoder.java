package com.largomodo.rawconvert.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Wrapper for the dcraw raw decoder.
 * <p>
 * Executes {@code dcraw -c <file>}: dcraw demosaics the raw data with its default settings
 * and writes an 8-bit binary PPM to stdout, which is parsed by {@link PpmReader}.
 * Works with every camera format dcraw supports, NEF included.
 * <p>
 * Timeout protection prevents hung processes on corrupted files (120s default).
 */
public class DcrawDecoder extends ExternalProcessDriver implements RawDecoder {

    private static final Logger log = LoggerFactory.getLogger(DcrawDecoder.class);

    private final String dcrawPath;
    private final long timeoutMs;

    public DcrawDecoder(String dcrawPath) {
        this(dcrawPath, DEFAULT_TIMEOUT_MS);
    }

    public DcrawDecoder(String dcrawPath, long timeoutMs) {
        this.dcrawPath = dcrawPath;
        this.timeoutMs = timeoutMs;
    }

    /**
     * Decode a raw file through dcraw.
     * <p>
     * Uses the absolute path of the source so the result does not depend on the working
     * directory of the child process.
     *
     * @param source raw camera file
     * @return decoded RGB image
     * @throws IOException if dcraw fails, times out or produces no parsable image
     */
    @Override
    public BufferedImage decode(Path source) throws IOException {
        if (!Files.exists(source)) {
            throw new IllegalArgumentException("Raw file does not exist: " + source);
        }

        String[] decodeCmd = {
                dcrawPath,
                "-c",
                source.toAbsolutePath().toString()
        };

        byte[] ppm = executeCommand(decodeCmd, timeoutMs);
        if (ppm.length == 0) {
            // dcraw exits 0 on some unsupported files and only prints a warning to stderr
            throw new IOException("dcraw produced no image for " + source.getFileName());
        }
        log.debug("dcraw decoded {} ({} bytes PPM)", source.getFileName(), ppm.length);

        return PpmReader.read(ppm);
    }

    public String dcrawPath() {
        return dcrawPath;
    }
}

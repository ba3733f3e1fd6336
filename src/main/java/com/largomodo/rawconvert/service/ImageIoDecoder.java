package com.largomodo.rawconvert.service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Decoder for files the JDK's ImageIO readers understand (JPEG, PNG, BMP, GIF, TIFF).
 * <p>
 * Needs no external tool. Detection is by content, not by file extension, so it also
 * handles raw containers whose primary image is stored in a format ImageIO reads.
 */
public class ImageIoDecoder implements RawDecoder {

    @Override
    public BufferedImage decode(Path source) throws IOException {
        if (!Files.exists(source)) {
            throw new IllegalArgumentException("Raw file does not exist: " + source);
        }

        BufferedImage image = ImageIO.read(source.toFile());
        if (image == null) {
            throw new IOException("Unsupported image format: " + source.getFileName());
        }
        return image;
    }
}

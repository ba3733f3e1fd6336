package com.largomodo.rawconvert.service;

import com.largomodo.rawconvert.core.ConversionFacade;

import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Default implementation delegating to raw decoder and image encoder services.
 * <p>
 * Pure delegation without additional logic - service implementations contain business logic.
 */
public class DefaultConversionFacade implements ConversionFacade {

    private final RawDecoder decoder;
    private final ImageEncoder encoder;

    /**
     * Construct facade with service dependencies.
     */
    public DefaultConversionFacade(RawDecoder decoder, ImageEncoder encoder) {
        this.decoder = decoder;
        this.encoder = encoder;
    }

    @Override
    public BufferedImage decode(Path source) throws IOException {
        return decoder.decode(source);
    }

    @Override
    public byte[] thumbnail(BufferedImage image, int maxWidth, int maxHeight) throws IOException {
        return encoder.thumbnail(image, maxWidth, maxHeight);
    }

    @Override
    public void write(BufferedImage image, Path target, Dimension resizeTo, int quality) throws IOException {
        encoder.write(image, target, resizeTo, quality);
    }
}

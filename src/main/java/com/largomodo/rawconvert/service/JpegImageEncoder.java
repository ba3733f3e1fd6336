package com.largomodo.rawconvert.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.MemoryCacheImageOutputStream;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * JPEG encoder based on the JDK ImageIO writer.
 * <p>
 * Scaling uses bicubic interpolation with quality rendering hints. Images are flattened to
 * opaque RGB before encoding since JPEG carries no alpha channel.
 * <p>
 * Thread-safe: a new ImageWriter is obtained for every encode.
 */
public class JpegImageEncoder implements ImageEncoder {

    private static final Logger log = LoggerFactory.getLogger(JpegImageEncoder.class);

    /** Quality of preview thumbnails (matches the common JPEG library default). */
    static final int THUMBNAIL_QUALITY = 75;

    @Override
    public byte[] thumbnail(BufferedImage image, int maxWidth, int maxHeight) throws IOException {
        if (maxWidth <= 0 || maxHeight <= 0) {
            throw new IllegalArgumentException("Thumbnail bounds must be positive: " + maxWidth + "x" + maxHeight);
        }
        Dimension size = fitWithin(image.getWidth(), image.getHeight(), maxWidth, maxHeight);
        return encodeAsJpeg(scaleImage(image, size.width, size.height), THUMBNAIL_QUALITY);
    }

    @Override
    public void write(BufferedImage image, Path target, Dimension resizeTo, int quality) throws IOException {
        if (quality < 1 || quality > 100) {
            throw new IllegalArgumentException("Quality must be between 1 and 100, got: " + quality);
        }
        BufferedImage output = resizeTo == null
                ? scaleImage(image, image.getWidth(), image.getHeight())
                : scaleImage(image, resizeTo.width, resizeTo.height);

        byte[] encoded = encodeAsJpeg(output, quality);
        Files.write(target, encoded);
        log.debug("Encoded {}x{} JPEG q={} -> {} ({} bytes)",
                output.getWidth(), output.getHeight(), quality, target.getFileName(), encoded.length);
    }

    /**
     * Largest size inside the box with the source aspect ratio; never larger than the source.
     */
    static Dimension fitWithin(int width, int height, int maxWidth, int maxHeight) {
        if (width <= maxWidth && height <= maxHeight) {
            return new Dimension(width, height);
        }
        double scale = Math.min((double) maxWidth / width, (double) maxHeight / height);
        int newWidth = Math.max(1, (int) Math.round(width * scale));
        int newHeight = Math.max(1, (int) Math.round(height * scale));
        return new Dimension(Math.min(newWidth, maxWidth), Math.min(newHeight, maxHeight));
    }

    private BufferedImage scaleImage(BufferedImage original, int newWidth, int newHeight) {
        if (newWidth <= 0 || newHeight <= 0) {
            throw new IllegalArgumentException("Target size must be positive: " + newWidth + "x" + newHeight);
        }

        if (newWidth == original.getWidth() && newHeight == original.getHeight()) {
            // Convert to RGB if needed, but don't scale
            if (original.getType() == BufferedImage.TYPE_INT_RGB) {
                return original;
            }
            BufferedImage rgb = new BufferedImage(newWidth, newHeight, BufferedImage.TYPE_INT_RGB);
            Graphics2D g = rgb.createGraphics();
            g.drawImage(original, 0, 0, null);
            g.dispose();
            return rgb;
        }

        BufferedImage scaled = new BufferedImage(newWidth, newHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = scaled.createGraphics();
        g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
        g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g.drawImage(original, 0, 0, newWidth, newHeight, null);
        g.dispose();

        return scaled;
    }

    private byte[] encodeAsJpeg(BufferedImage image, int quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");

        if (!writers.hasNext()) {
            throw new IOException("No JPEG encoder available");
        }

        ImageWriter jpegWriter = writers.next();

        try (var outputStream = new ByteArrayOutputStream();
             var imageOutputStream = new MemoryCacheImageOutputStream(outputStream)) {

            ImageWriteParam params = jpegWriter.getDefaultWriteParam();
            params.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            params.setCompressionQuality(quality / 100f);

            jpegWriter.setOutput(imageOutputStream);
            jpegWriter.write(null, new IIOImage(image, null, null), params);
            imageOutputStream.flush();

            return outputStream.toByteArray();
        } finally {
            jpegWriter.dispose();
        }
    }
}

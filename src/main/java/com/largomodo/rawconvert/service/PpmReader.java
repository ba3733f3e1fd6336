package com.largomodo.rawconvert.service;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Reader for binary PPM (P6) images, the format dcraw writes to stdout with {@code -c}.
 * <p>
 * Supports 8-bit (maxval &lt;= 255) and 16-bit big-endian (maxval &lt;= 65535) samples;
 * 16-bit samples are scaled down to 8 bits. Header comments ({@code #} to end of line) are
 * skipped. Produces {@link BufferedImage#TYPE_INT_RGB}.
 * <p>
 * Stateless utility. Safe for concurrent use.
 */
public final class PpmReader {

    private static final int MAX_DIMENSION = 1 << 16;

    private PpmReader() {
        // Static utility class - prevent instantiation
    }

    /**
     * Decode a P6 image held in memory.
     *
     * @param data complete PPM file content
     * @return decoded RGB image
     * @throws IOException if the header is malformed or the pixel data is truncated
     */
    public static BufferedImage read(byte[] data) throws IOException {
        if (data == null || data.length < 2 || data[0] != 'P' || data[1] != '6') {
            throw new IOException("Not a binary PPM (P6) image");
        }

        Cursor cursor = new Cursor(data, 2);
        int width = cursor.nextInt("width");
        int height = cursor.nextInt("height");
        int maxval = cursor.nextInt("maxval");

        if (width <= 0 || height <= 0 || width > MAX_DIMENSION || height > MAX_DIMENSION) {
            throw new IOException("Invalid PPM dimensions: " + width + "x" + height);
        }
        if (maxval <= 0 || maxval > 65535) {
            throw new IOException("Invalid PPM maxval: " + maxval);
        }

        // Exactly one whitespace byte separates the header from the raster
        int offset = cursor.position + 1;
        int bytesPerSample = maxval > 255 ? 2 : 1;
        long expected = (long) width * height * 3 * bytesPerSample;
        if (data.length - offset < expected) {
            throw new IOException("Truncated PPM raster: expected " + expected + " bytes, got "
                    + Math.max(0, data.length - offset));
        }

        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] row = new int[width];
        int p = offset;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int r;
                int g;
                int b;
                if (bytesPerSample == 1) {
                    r = scale(data[p] & 0xFF, maxval);
                    g = scale(data[p + 1] & 0xFF, maxval);
                    b = scale(data[p + 2] & 0xFF, maxval);
                    p += 3;
                } else {
                    r = scale(((data[p] & 0xFF) << 8) | (data[p + 1] & 0xFF), maxval);
                    g = scale(((data[p + 2] & 0xFF) << 8) | (data[p + 3] & 0xFF), maxval);
                    b = scale(((data[p + 4] & 0xFF) << 8) | (data[p + 5] & 0xFF), maxval);
                    p += 6;
                }
                row[x] = (r << 16) | (g << 8) | b;
            }
            image.setRGB(0, y, width, 1, row, 0, width);
        }
        return image;
    }

    private static int scale(int sample, int maxval) {
        if (maxval == 255) {
            return sample;
        }
        return (int) Math.min(255, Math.round(sample * 255.0 / maxval));
    }

    /**
     * Walks the ASCII header: whitespace-separated decimal fields with optional comments.
     */
    private static final class Cursor {

        private final byte[] data;
        private int position;

        Cursor(byte[] data, int position) {
            this.data = data;
            this.position = position;
        }

        int nextInt(String field) throws IOException {
            skipWhitespaceAndComments();
            int start = position;
            long value = 0;
            while (position < data.length && Character.isDigit(data[position])) {
                value = value * 10 + (data[position] - '0');
                if (value > Integer.MAX_VALUE) {
                    throw new IOException("PPM " + field + " out of range");
                }
                position++;
            }
            if (position == start) {
                throw new IOException("Malformed PPM header: missing " + field);
            }
            if (position >= data.length) {
                throw new IOException("Malformed PPM header: no raster after " + field);
            }
            return (int) value;
        }

        private void skipWhitespaceAndComments() {
            while (position < data.length) {
                byte c = data[position];
                if (c == '#') {
                    while (position < data.length && data[position] != '\n' && data[position] != '\r') {
                        position++;
                    }
                } else if (Character.isWhitespace(c)) {
                    position++;
                } else {
                    return;
                }
            }
        }
    }
}

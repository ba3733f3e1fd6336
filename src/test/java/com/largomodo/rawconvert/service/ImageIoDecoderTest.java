package com.largomodo.rawconvert.service;

import com.largomodo.rawconvert.TestImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ImageIoDecoderTest {

    private final ImageIoDecoder decoder = new ImageIoDecoder();

    @Test
    void testDecodesByContentRegardlessOfExtension(@TempDir Path tempDir) throws IOException {
        Path file = TestImages.writePng(tempDir, "DSC_0001.NEF", 64, 48);

        BufferedImage image = decoder.decode(file);

        assertEquals(64, image.getWidth());
        assertEquals(48, image.getHeight());
    }

    @Test
    void testUnreadableContentFails(@TempDir Path tempDir) throws IOException {
        Path file = TestImages.writeCorrupt(tempDir, "broken.nef");

        IOException e = assertThrows(IOException.class, () -> decoder.decode(file));
        assertEquals("Unsupported image format: broken.nef", e.getMessage());
    }

    @Test
    void testMissingFileFails(@TempDir Path tempDir) {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> decoder.decode(tempDir.resolve("missing.nef")));
        assertTrue(e.getMessage().contains("Raw file does not exist"));
    }
}

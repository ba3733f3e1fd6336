package com.largomodo.rawconvert.core.event;

import com.largomodo.rawconvert.core.ConversionObserver;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ConversionEventTest {

    @Test
    void testEachVariantDispatchesToItsCallback() {
        ConversionObserver observer = mock(ConversionObserver.class);

        new ConversionEvent.Status("Found 2 raw files. Using 4 threads.").dispatchTo(observer);
        new ConversionEvent.Progress(1, 2).dispatchTo(observer);
        new ConversionEvent.Preview("a.nef", new byte[]{1, 2, 3}).dispatchTo(observer);

        verify(observer).onStatus("Found 2 raw files. Using 4 threads.");
        verify(observer).onProgress(1, 2);
        verify(observer).onPreview("a.nef", new byte[]{1, 2, 3});
        verifyNoMoreInteractions(observer);
    }

    @Test
    void testObserverDefaultsIgnoreEvents() {
        ConversionObserver ignoring = new ConversionObserver() {
        };

        assertDoesNotThrow(() -> new ConversionEvent.Progress(0, 0).dispatchTo(ignoring));
        assertDoesNotThrow(() -> new ConversionEvent.Status("x").dispatchTo(ignoring));
        assertDoesNotThrow(() -> new ConversionEvent.Preview("a.nef", new byte[0]).dispatchTo(ignoring));
    }

    @Test
    void testProgressRejectsInconsistentCounts() {
        assertThrows(IllegalArgumentException.class, () -> new ConversionEvent.Progress(3, 2));
        assertThrows(IllegalArgumentException.class, () -> new ConversionEvent.Progress(-1, 2));
        assertThrows(IllegalArgumentException.class, () -> new ConversionEvent.Progress(0, -1));
    }

    @Test
    void testProgressFraction() {
        assertEquals(0.5, new ConversionEvent.Progress(2, 4).fraction(), 1e-9);
        assertEquals(1.0, new ConversionEvent.Progress(4, 4).fraction(), 1e-9);
        assertEquals(0.0, new ConversionEvent.Progress(0, 0).fraction(), 1e-9);
    }

    @Test
    void testPreviewCopiesImageBytes() {
        byte[] source = {10, 20, 30};
        ConversionEvent.Preview preview = new ConversionEvent.Preview("a.nef", source);

        source[0] = 99;
        assertEquals(10, preview.image()[0], "Producer must not alter a published preview");

        preview.image()[1] = 99;
        assertEquals(20, preview.image()[1], "Reader must not alter a published preview");
    }

    @Test
    void testPreviewValueSemantics() {
        ConversionEvent.Preview a = new ConversionEvent.Preview("a.nef", new byte[]{1, 2});
        ConversionEvent.Preview same = new ConversionEvent.Preview("a.nef", new byte[]{1, 2});
        ConversionEvent.Preview other = new ConversionEvent.Preview("b.nef", new byte[]{1, 2});

        assertEquals(a, same);
        assertEquals(a.hashCode(), same.hashCode());
        assertNotEquals(a, other);
        assertEquals("Preview[fileName=a.nef, size=2]", a.toString());
        assertEquals(2, a.size());
    }

    @Test
    void testPreviewBase64() {
        byte[] jpegStart = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
        ConversionEvent.Preview preview = new ConversionEvent.Preview("a.nef", jpegStart);

        assertArrayEquals(jpegStart, Base64.getDecoder().decode(preview.toBase64()));
    }

    @Test
    void testNullPayloadsRejected() {
        assertThrows(NullPointerException.class, () -> new ConversionEvent.Status(null));
        assertThrows(NullPointerException.class, () -> new ConversionEvent.Preview(null, new byte[0]));
        assertThrows(NullPointerException.class, () -> new ConversionEvent.Preview("a.nef", null));
    }
}

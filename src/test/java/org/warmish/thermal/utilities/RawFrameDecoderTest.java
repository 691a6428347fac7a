package org.warmish.thermal.utilities;

import org.junit.jupiter.api.Test;
import org.warmish.thermal.model.RawThermalFrame;

import java.nio.ByteOrder;

import static org.junit.jupiter.api.Assertions.*;

class RawFrameDecoderTest {

    // Two pixels: 0x4B86 (19334) and 0xFFFF
    private static final byte[] LITTLE = {(byte) 0x86, 0x4B, (byte) 0xFF, (byte) 0xFF};

    @Test
    void testDecode_LittleEndianDefault() {
        RawThermalFrame frame = RawFrameDecoder.decode(LITTLE, 2, 1, null);

        assertEquals(0x4B86, frame.getCount(0, 0));
        assertEquals(65535, frame.getCount(1, 0));
    }

    @Test
    void testDecode_BigEndian() {
        RawThermalFrame frame = RawFrameDecoder.decode(LITTLE, 1, 2, ByteOrder.BIG_ENDIAN);

        assertEquals(0x864B, frame.getCount(0, 0));
        assertEquals(1, frame.getWidth());
        assertEquals(2, frame.getHeight());
    }

    @Test
    void testDecode_RejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> RawFrameDecoder.decode(LITTLE, 3, 1, null));
        assertThrows(IllegalArgumentException.class, () -> RawFrameDecoder.decode(LITTLE, 0, 2, null));
        assertThrows(IllegalArgumentException.class, () -> RawFrameDecoder.decode(null, 2, 1, null));
    }

    @Test
    void testByteSwap() {
        RawThermalFrame little = RawFrameDecoder.decode(LITTLE, 2, 1, ByteOrder.LITTLE_ENDIAN);

        RawThermalFrame swapped = RawFrameDecoder.byteSwap(little);

        assertEquals(RawFrameDecoder.decode(LITTLE, 2, 1, ByteOrder.BIG_ENDIAN), swapped);
        assertEquals(little, RawFrameDecoder.byteSwap(swapped));
    }
}

package org.warmish.thermal.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.warmish.thermal.model.RawThermalFrame;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Decodes an uncompressed 16-bit raw thermal payload into a {@link RawThermalFrame}.
 *
 * <p>Camera containers store counts as unsigned 16-bit values, little-endian for raw binary
 * blobs and big-endian inside PNG-wrapped payloads. The caller passes the declared byte
 * order along with the dimensions from the metadata.</p>
 */
public final class RawFrameDecoder {
    private static final Logger logger = LoggerFactory.getLogger(RawFrameDecoder.class);

    private RawFrameDecoder() {
    }

    /**
     * @throws IllegalArgumentException if the dimensions are not positive or the payload length
     *                                  is not {@code width * height * 2}
     */
    public static RawThermalFrame decode(byte[] payload, int width, int height, ByteOrder order) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions not found or invalid: " + width + "x" + height);
        }
        if (payload == null) {
            throw new IllegalArgumentException("Raw thermal payload is null");
        }
        long expected = (long) width * height * Short.BYTES;
        if (payload.length != expected) {
            throw new IllegalArgumentException(String.format(
                    "Raw payload has %d bytes, expected %d for %dx%d 16-bit counts",
                    payload.length, expected, width, height));
        }
        ByteBuffer buffer = ByteBuffer.wrap(payload).order(order == null ? ByteOrder.LITTLE_ENDIAN : order);
        int[] counts = new int[width * height];
        for (int i = 0; i < counts.length; i++) {
            counts[i] = Short.toUnsignedInt(buffer.getShort());
        }
        logger.debug("Decoded {}x{} raw frame ({} byte order)", width, height, buffer.order());
        return RawThermalFrame.of(width, height, counts);
    }

    /**
     * Swaps the byte order of every count, for frames that were read with the wrong order.
     */
    public static RawThermalFrame byteSwap(RawThermalFrame frame) {
        int[] counts = frame.getCounts();
        for (int i = 0; i < counts.length; i++) {
            counts[i] = Short.toUnsignedInt(Short.reverseBytes((short) counts[i]));
        }
        return RawThermalFrame.of(frame.getWidth(), frame.getHeight(), counts);
    }
}

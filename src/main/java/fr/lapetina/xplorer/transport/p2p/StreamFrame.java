package fr.lapetina.xplorer.transport.p2p;

import java.nio.ByteBuffer;

/**
 * Stream framing: a 4-byte big-endian length prefix followed by exactly that many
 * payload bytes. One request frame and one response frame per stream.
 */
public final class StreamFrame {

    public static final int PREFIX_LENGTH = 4;

    /**
     * Largest accepted payload; valid lengths satisfy {@code 0 < length < 100_000_000}.
     */
    public static final int MAX_FRAME_LENGTH = 99_999_999;

    private StreamFrame() {
    }

    /**
     * @throws ProtocolException if {@code length} is zero, negative or above {@link #MAX_FRAME_LENGTH}
     */
    public static void validateLength(long length) {
        if (length <= 0) {
            throw new ProtocolException("Invalid frame length " + length + ": empty frame");
        }
        if (length > MAX_FRAME_LENGTH) {
            throw new ProtocolException("Invalid frame length " + length + ": exceeds " + MAX_FRAME_LENGTH);
        }
    }

    /**
     * Reads the prefix at {@code offset} as an unsigned 32-bit length.
     */
    public static long readLength(byte[] prefix, int offset) {
        return Integer.toUnsignedLong(ByteBuffer.wrap(prefix, offset, PREFIX_LENGTH).getInt());
    }

    public static byte[] encodeLength(int length) {
        return ByteBuffer.allocate(PREFIX_LENGTH).putInt(length).array();
    }

    /**
     * Returns prefix and payload as one frame.
     */
    public static byte[] encode(byte[] payload) {
        validateLength(payload.length);
        return ByteBuffer.allocate(PREFIX_LENGTH + payload.length)
                .putInt(payload.length)
                .put(payload)
                .array();
    }
}

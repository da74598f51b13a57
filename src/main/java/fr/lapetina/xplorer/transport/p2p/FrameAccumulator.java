package fr.lapetina.xplorer.transport.p2p;

import io.netty.buffer.ByteBuf;

import java.io.ByteArrayOutputStream;

/**
 * Reassembles one frame from the chunks of a stream.
 * <p>
 * The length prefix is validated as soon as its four bytes arrived, before any
 * payload is buffered. Bytes past the end of the frame are a protocol violation.
 * Not thread-safe; each stream owns its accumulator.
 */
public final class FrameAccumulator {

    private static final int INITIAL_CAPACITY = 64 * 1024;

    private final byte[] prefix = new byte[StreamFrame.PREFIX_LENGTH];
    private int prefixRead;
    private int length = -1;
    private ByteArrayOutputStream payload;

    /**
     * Consumes every readable byte of {@code chunk}.
     *
     * @return whether the frame is now complete
     * @throws ProtocolException on an invalid prefix or bytes beyond the frame
     */
    public boolean feed(ByteBuf chunk) {
        while (chunk.isReadable()) {
            if (length < 0) {
                int n = Math.min(chunk.readableBytes(), StreamFrame.PREFIX_LENGTH - prefixRead);
                chunk.readBytes(prefix, prefixRead, n);
                prefixRead += n;
                if (prefixRead == StreamFrame.PREFIX_LENGTH) {
                    long declared = StreamFrame.readLength(prefix, 0);
                    StreamFrame.validateLength(declared);
                    length = (int) declared;
                    payload = new ByteArrayOutputStream(Math.min(length, INITIAL_CAPACITY));
                }
            } else {
                int remaining = length - payload.size();
                if (remaining == 0) {
                    throw new ProtocolException("Unexpected " + chunk.readableBytes() + " bytes after frame");
                }
                int n = Math.min(chunk.readableBytes(), remaining);
                byte[] bytes = new byte[n];
                chunk.readBytes(bytes);
                payload.write(bytes, 0, n);
            }
        }
        return isComplete();
    }

    public boolean isComplete() {
        return length > 0 && payload.size() == length;
    }

    /**
     * Declared payload length, or -1 while the prefix is incomplete.
     */
    public int declaredLength() {
        return length;
    }

    /**
     * Returns the payload once the stream ended.
     *
     * @throws ProtocolException if the stream ended before the frame was complete
     */
    public byte[] finish() {
        if (!isComplete()) {
            throw new ProtocolException(length < 0
                    ? "Stream ended inside the length prefix"
                    : "Stream ended after " + payload.size() + " of " + length + " payload bytes");
        }
        return payload.toByteArray();
    }
}

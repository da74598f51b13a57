package fr.lapetina.xplorer.transport.p2p;

/**
 * A peer violated the stream protocol: bad length prefix, trailing bytes, or a
 * malformed wire document. Aborts the affected stream only.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}

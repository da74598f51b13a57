package fr.lapetina.xplorer.transport.p2p;

/**
 * A P2P call failed on the client side: connection refused, stream reset,
 * premature end of stream, or a peer that could not prove its node id.
 */
public class P2pClientException extends RuntimeException {

    public P2pClientException(String message) {
        super(message);
    }

    public P2pClientException(String message, Throwable cause) {
        super(message, cause);
    }
}

package fr.lapetina.xplorer.transport;

/**
 * Thrown by {@link TransportAdapter#start()} when the transport cannot come online.
 */
public class TransportStartException extends Exception {

    public TransportStartException(String message) {
        super(message);
    }

    public TransportStartException(String message, Throwable cause) {
        super(message, cause);
    }
}

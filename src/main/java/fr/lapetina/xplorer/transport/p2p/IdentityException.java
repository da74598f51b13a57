package fr.lapetina.xplorer.transport.p2p;

/**
 * Invalid key material, or an identity operation attempted while the adapter runs.
 */
public class IdentityException extends RuntimeException {

    public IdentityException(String message) {
        super(message);
    }

    public IdentityException(String message, Throwable cause) {
        super(message, cause);
    }
}

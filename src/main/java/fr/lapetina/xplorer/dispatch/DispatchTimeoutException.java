package fr.lapetina.xplorer.dispatch;

/**
 * Thrown when a handler did not complete within the configured dispatch timeout.
 */
public class DispatchTimeoutException extends RuntimeException {

    public DispatchTimeoutException(String path, long timeoutMs) {
        super("Handler for " + path + " did not complete within " + timeoutMs + "ms");
    }
}

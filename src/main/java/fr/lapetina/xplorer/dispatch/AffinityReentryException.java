package fr.lapetina.xplorer.dispatch;

/**
 * Thrown when an affinity handler is dispatched from the affinity thread itself.
 * Waiting would deadlock, since the only thread able to run the handler is the waiting one.
 */
public class AffinityReentryException extends RuntimeException {

    public AffinityReentryException(String path) {
        super("Re-entrant dispatch of affinity endpoint " + path + " from the affinity thread");
    }
}

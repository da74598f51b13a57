package fr.lapetina.xplorer.routing;

/**
 * Thrown when a registration or mount would leave the endpoint tree invalid:
 * duplicate paths, prefix collisions, cycles, or changes after the router was frozen.
 */
public class RouterConfigurationException extends RuntimeException {

    public RouterConfigurationException(String message) {
        super(message);
    }
}

package fr.lapetina.xplorer.transport;

import fr.lapetina.xplorer.infrastructure.metrics.XplorerMetrics;
import fr.lapetina.xplorer.routing.Router;

/**
 * A physical transport delivering requests to a {@link Router}.
 *
 * Contract:
 * - {@link #start()} is idempotent and synchronous: the transport is fully listening when it returns.
 * - {@link #stop()} is idempotent and best effort: failures are logged, never thrown.
 * - An adapter is bound to one router for its lifetime.
 */
public interface TransportAdapter extends AutoCloseable {

    /**
     * Short transport name, used in logs, metrics and request metadata.
     */
    String name();

    /**
     * Binds the router answering this transport's requests.
     *
     * @throws IllegalStateException if a different router is already bound
     */
    void bind(Router router);

    /**
     * Starts accepting requests. No-op if already running.
     *
     * @throws TransportStartException if no router is bound or the transport cannot come online
     */
    void start() throws TransportStartException;

    /**
     * Releases everything acquired by {@link #start()}. No-op if not running.
     */
    void stop();

    boolean isRunning();

    /**
     * Sets the registry recording this transport's traffic.
     */
    default void bindMetrics(XplorerMetrics metrics) {
    }

    @Override
    default void close() {
        stop();
    }
}

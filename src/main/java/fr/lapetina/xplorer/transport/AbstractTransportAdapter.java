package fr.lapetina.xplorer.transport;

import fr.lapetina.xplorer.domain.model.Request;
import fr.lapetina.xplorer.domain.model.Response;
import fr.lapetina.xplorer.infrastructure.metrics.XplorerMetrics;
import fr.lapetina.xplorer.routing.Router;

import java.util.Objects;
import java.util.Optional;

/**
 * Holds the bound router and the metrics shared by every transport.
 */
public abstract class AbstractTransportAdapter implements TransportAdapter {

    private volatile Router router;
    private volatile XplorerMetrics metrics;

    @Override
    public synchronized void bind(Router router) {
        Objects.requireNonNull(router, "Router is required");
        if (this.router != null && this.router != router) {
            throw new IllegalStateException(name() + " transport is already bound to another router");
        }
        this.router = router;
    }

    @Override
    public void bindMetrics(XplorerMetrics metrics) {
        this.metrics = metrics;
    }

    public Optional<Router> router() {
        return Optional.ofNullable(router);
    }

    protected XplorerMetrics metrics() {
        XplorerMetrics m = metrics;
        if (m == null) {
            synchronized (this) {
                if (metrics == null) {
                    metrics = XplorerMetrics.disabled();
                }
                m = metrics;
            }
        }
        return m;
    }

    /**
     * Fails start-up when no router was bound.
     */
    protected Router requireRouter() throws TransportStartException {
        Router r = router;
        if (r == null) {
            throw new TransportStartException("No router bound to " + name() + " transport");
        }
        return r;
    }

    /**
     * Routes a decoded request and records the outcome.
     */
    protected Response dispatch(Router target, Request request) {
        Response response = target.handle(request);
        metrics().incrementRequestCount(name(), response.status());
        return response;
    }
}

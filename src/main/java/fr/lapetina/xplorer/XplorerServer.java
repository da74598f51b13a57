package fr.lapetina.xplorer;

import fr.lapetina.xplorer.dispatch.AffinityDispatcher;
import fr.lapetina.xplorer.domain.model.ParameterInfo;
import fr.lapetina.xplorer.domain.model.Response;
import fr.lapetina.xplorer.infrastructure.config.ConfigLoader;
import fr.lapetina.xplorer.infrastructure.config.XplorerConfig;
import fr.lapetina.xplorer.infrastructure.metrics.XplorerMetrics;
import fr.lapetina.xplorer.routing.IndexEndpoint;
import fr.lapetina.xplorer.routing.RouteHandler;
import fr.lapetina.xplorer.routing.Router;
import fr.lapetina.xplorer.transport.TransportAdapter;
import fr.lapetina.xplorer.transport.TransportStartException;
import fr.lapetina.xplorer.transport.http.HttpTransportAdapter;
import fr.lapetina.xplorer.transport.p2p.P2pTransportAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Wires the root router, the affinity dispatcher, metrics and the transports together.
 *
 * Endpoints and mounts are added before {@link #start()}; starting freezes the
 * router and then brings every transport online in the order they were added.
 */
public final class XplorerServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(XplorerServer.class);

    public static final String METRICS_PATH = "/metrics";

    private final XplorerMetrics metrics;
    private final AffinityDispatcher dispatcher;
    private final Router router;
    private final List<TransportAdapter> transports = new CopyOnWriteArrayList<>();

    public XplorerServer(XplorerConfig config) {
        this.metrics = config.getMetrics().isEnabled()
                ? new XplorerMetrics(config.getMetrics().getPrefix())
                : XplorerMetrics.disabled();

        this.dispatcher = AffinityDispatcher.builder()
                .fromConfig(config.getDispatch())
                .metrics(metrics)
                .build();
        dispatcher.start();

        this.router = new Router(config.getServer().getDescription(), dispatcher);
        IndexEndpoint.register(router);
        router.register(METRICS_PATH, "Prometheus metrics of this agent.", List.of(), false,
                request -> Response.text(metrics.scrape()));
    }

    public XplorerServer() {
        this(ConfigLoader.createDefault());
    }

    /**
     * Server answering on the configured HTTP transport, if enabled.
     */
    public static XplorerServer withHttp(XplorerConfig config) {
        XplorerServer server = new XplorerServer(config);
        if (config.getHttp().isEnabled()) {
            server.addTransport(new HttpTransportAdapter(config.getHttp()));
        }
        return server;
    }

    /**
     * Server answering on the configured HTTP and P2P transports, each if enabled.
     */
    public static XplorerServer withHttpAndP2p(XplorerConfig config) {
        XplorerServer server = withHttp(config);
        if (config.getP2p().isEnabled()) {
            server.addTransport(new P2pTransportAdapter(config.getP2p()));
        }
        return server;
    }

    // ==================== TRANSPORTS ====================

    public XplorerServer addTransport(TransportAdapter transport) {
        transport.bind(router);
        transport.bindMetrics(metrics);
        transports.add(transport);
        log.debug("Transport added: {}", transport.name());
        return this;
    }

    /**
     * Stops and forgets {@code transport}.
     *
     * @return whether the transport belonged to this server
     */
    public boolean removeTransport(TransportAdapter transport) {
        if (!transports.remove(transport)) {
            return false;
        }
        transport.stop();
        log.debug("Transport removed: {}", transport.name());
        return true;
    }

    public List<TransportAdapter> transports() {
        return List.copyOf(transports);
    }

    // ==================== LIFECYCLE ====================

    /**
     * Freezes the router and starts every transport. If one fails, the ones already
     * started are stopped again before the failure propagates.
     */
    public void start() throws TransportStartException {
        router.freeze();

        List<TransportAdapter> started = new ArrayList<>();
        for (TransportAdapter transport : transports) {
            try {
                transport.start();
                started.add(transport);
            } catch (TransportStartException | RuntimeException e) {
                log.error("Failed to start {} transport, rolling back", transport.name(), e);
                for (TransportAdapter s : started) {
                    s.stop();
                }
                throw e;
            }
        }
        log.info("Xplorer server started: {} endpoints, transports={}",
                router.totalEndpointCount(), transports.stream().map(TransportAdapter::name).toList());
    }

    public void stop() {
        for (TransportAdapter transport : transports) {
            try {
                transport.stop();
            } catch (RuntimeException e) {
                log.warn("Error stopping {} transport", transport.name(), e);
            }
        }
        log.info("Xplorer server stopped");
    }

    /**
     * Returns whether any transport is running.
     */
    public boolean isRunning() {
        return transports.stream().anyMatch(TransportAdapter::isRunning);
    }

    // ==================== ROUTING ====================

    public void register(String path, String description, List<ParameterInfo> parameters,
                         boolean runsOnAffinityThread, RouteHandler handler) {
        router.register(path, description, parameters, runsOnAffinityThread, handler);
    }

    public void register(String path, String description, RouteHandler handler) {
        router.register(path, description, handler);
    }

    public void register(String path, RouteHandler handler) {
        router.register(path, handler);
    }

    public void put(String path, RouteHandler handler) {
        router.put(path, handler);
    }

    public void mount(String prefix, Router subRouter) {
        router.mount(prefix, subRouter);
    }

    public Router router() {
        return router;
    }

    public AffinityDispatcher dispatcher() {
        return dispatcher;
    }

    public XplorerMetrics metrics() {
        return metrics;
    }

    @Override
    public void close() {
        stop();
        dispatcher.close();
        metrics.close();
    }
}

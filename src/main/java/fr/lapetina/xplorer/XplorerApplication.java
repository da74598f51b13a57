package fr.lapetina.xplorer;

import fr.lapetina.xplorer.domain.model.ParameterInfo;
import fr.lapetina.xplorer.domain.model.Response;
import fr.lapetina.xplorer.infrastructure.config.ConfigLoader;
import fr.lapetina.xplorer.infrastructure.config.XplorerConfig;
import fr.lapetina.xplorer.transport.TransportAdapter;
import fr.lapetina.xplorer.transport.TransportStartException;
import fr.lapetina.xplorer.transport.p2p.NodeAddr;
import fr.lapetina.xplorer.transport.p2p.P2pTransportAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point of a standalone Xplorer agent.
 */
public class XplorerApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(XplorerApplication.class);

    private final XplorerServer server;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public XplorerApplication(String configPath) {
        log.info("Starting Xplorer agent...");

        XplorerConfig config = new ConfigLoader(configPath).load();
        this.server = XplorerServer.withHttpAndP2p(config);

        server.register("/echo", "Echoes the 'name' query parameter.",
                List.of(ParameterInfo.required("name", "Text to echo back")),
                false,
                request -> request.queryParam("name")
                        .map(Response::text)
                        .orElseGet(() -> Response.badRequest("Missing 'name' parameter")));

        log.info("Xplorer agent initialized");
    }

    public void start() throws TransportStartException {
        server.start();
        for (TransportAdapter transport : server.transports()) {
            if (transport instanceof P2pTransportAdapter p2p) {
                p2p.nodeAddr().map(NodeAddr::toTicket).ifPresent(ticket -> {
                    log.info("P2P ticket: {}", ticket);
                    System.out.println("Xplorer P2P ticket: " + ticket);
                });
            }
        }
        log.info("Xplorer agent started");
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public XplorerServer getServer() {
        return server;
    }

    @Override
    public void close() {
        log.info("Shutting down Xplorer agent...");

        try {
            server.close();
        } catch (Exception e) {
            log.warn("Error closing server", e);
        }

        log.info("Xplorer agent shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "xplorer.yaml";

        try {
            XplorerApplication app = new XplorerApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start Xplorer agent", e);
            System.exit(1);
        }
    }
}

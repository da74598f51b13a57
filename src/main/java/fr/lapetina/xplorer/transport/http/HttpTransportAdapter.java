package fr.lapetina.xplorer.transport.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.xplorer.domain.model.Request;
import fr.lapetina.xplorer.domain.model.Response;
import fr.lapetina.xplorer.domain.model.ResponseStatus;
import fr.lapetina.xplorer.infrastructure.config.XplorerConfig;
import fr.lapetina.xplorer.routing.Router;
import fr.lapetina.xplorer.transport.AbstractTransportAdapter;
import fr.lapetina.xplorer.transport.TransportStartException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP transport using the JDK's built-in HttpServer.
 *
 * Every method is treated as a routed call: the URL path becomes the request path,
 * the query string the query parameters, the body the request body and the headers
 * the metadata. The response maps directly onto status code, Content-Type and body.
 */
public final class HttpTransportAdapter extends AbstractTransportAdapter {

    private static final Logger log = LoggerFactory.getLogger(HttpTransportAdapter.class);

    public static final String NAME = "http";

    private final String host;
    private final int port;
    private final int backlog;
    private final int stopDelaySeconds;

    private HttpServer server;
    private ExecutorService executor;
    private volatile boolean running;

    public HttpTransportAdapter(String host, int port, int backlog, int stopDelaySeconds) {
        this.host = host;
        this.port = port;
        this.backlog = backlog;
        this.stopDelaySeconds = stopDelaySeconds;
    }

    public HttpTransportAdapter(int port) {
        this("127.0.0.1", port, 100, 0);
    }

    public HttpTransportAdapter(XplorerConfig.HttpConfig config) {
        this(config.getHost(), config.getPort(), config.getBacklog(), config.getStopDelaySeconds());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public synchronized void start() throws TransportStartException {
        if (running) {
            return;
        }
        Router router = requireRouter();

        HttpServer created;
        try {
            created = HttpServer.create(new InetSocketAddress(host, port), backlog);
        } catch (IOException e) {
            throw new TransportStartException("Failed to bind HTTP transport on " + host + ":" + port, e);
        }

        ExecutorService pool = Executors.newCachedThreadPool(new HttpThreadFactory());
        created.setExecutor(pool);
        created.createContext("/", new RoutingHandler(router));
        created.start();

        this.server = created;
        this.executor = pool;
        this.running = true;
        log.info("HTTP transport started on {}:{}", host, getPort());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            server.stop(stopDelaySeconds);
        } catch (RuntimeException e) {
            log.warn("Error stopping HTTP server", e);
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        server = null;
        executor = null;
        log.info("HTTP transport stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Returns the bound port, which differs from the configured one when it was 0.
     */
    public synchronized int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    // ==================== ROUTING HANDLER ====================

    private class RoutingHandler implements HttpHandler {
        private final Router router;

        RoutingHandler(Router router) {
            this.router = router;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            MDC.put("transport", NAME);
            try {
                Response response;
                try {
                    response = dispatch(router, toRequest(exchange));
                } catch (IllegalArgumentException e) {
                    log.warn("Malformed HTTP request {}: {}", exchange.getRequestURI(), e.getMessage());
                    response = Response.badRequest("Malformed request: " + e.getMessage());
                } catch (RuntimeException e) {
                    log.error("Failed to process HTTP request: {}", exchange.getRequestURI(), e);
                    response = Response.error("Internal error: " + e.getMessage(), ResponseStatus.INTERNAL_ERROR);
                }
                send(exchange, response);
            } finally {
                MDC.remove("transport");
                exchange.close();
            }
        }
    }

    static Request toRequest(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }

        byte[] body;
        try (InputStream is = exchange.getRequestBody()) {
            body = is.readAllBytes();
        }

        Request.Builder builder = Request.builder(path)
                .queryParams(parseQuery(exchange.getRequestURI().getRawQuery()));
        if (body.length > 0) {
            builder.body(body);
        }
        for (Map.Entry<String, List<String>> header : exchange.getRequestHeaders().entrySet()) {
            if (!header.getValue().isEmpty()) {
                builder.metadata(header.getKey().toLowerCase(Locale.ROOT), header.getValue().get(0));
            }
        }
        builder.metadata("transport", NAME);
        if (exchange.getRemoteAddress() != null) {
            builder.metadata("remote-address", exchange.getRemoteAddress().toString());
        }
        return builder.build();
    }

    /**
     * Decodes a raw query string. The first occurrence of a repeated key wins;
     * a key without {@code =} maps to an empty value.
     */
    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = decode(eq >= 0 ? pair.substring(0, eq) : pair);
            String value = eq >= 0 ? decode(pair.substring(eq + 1)) : "";
            params.putIfAbsent(key, value);
        }
        return params;
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }

    private static void send(HttpExchange exchange, Response response) throws IOException {
        byte[] bytes = response.body();
        exchange.getResponseHeaders().set("Content-Type", response.contentType().mimeType());
        // -1 tells the JDK server there is no body
        exchange.sendResponseHeaders(response.status().code(), bytes.length > 0 ? bytes.length : -1);
        if (bytes.length > 0) {
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    private static final class HttpThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "xplorer-http-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}

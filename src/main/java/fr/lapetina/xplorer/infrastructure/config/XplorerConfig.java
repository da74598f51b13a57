package fr.lapetina.xplorer.infrastructure.config;

/**
 * Root configuration object for the debug server.
 * Designed to be populated from YAML.
 */
public class XplorerConfig {

    private ServerConfig server = new ServerConfig();
    private HttpConfig http = new HttpConfig();
    private P2pConfig p2p = new P2pConfig();
    private DispatchConfig dispatch = new DispatchConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public HttpConfig getHttp() { return http; }
    public void setHttp(HttpConfig http) { this.http = http; }

    public P2pConfig getP2p() { return p2p; }
    public void setP2p(P2pConfig p2p) { this.p2p = p2p; }

    public DispatchConfig getDispatch() { return dispatch; }
    public void setDispatch(DispatchConfig dispatch) { this.dispatch = dispatch; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Root router settings.
     */
    public static class ServerConfig {
        private String description = "Xplorer Debug Server";

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
    }

    /**
     * HTTP transport configuration.
     */
    public static class HttpConfig {
        private boolean enabled = true;
        private String host = "127.0.0.1";
        private int port = 8080;
        private int backlog = 100;
        private int stopDelaySeconds = 1;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getStopDelaySeconds() { return stopDelaySeconds; }
        public void setStopDelaySeconds(int stopDelaySeconds) { this.stopDelaySeconds = stopDelaySeconds; }
    }

    /**
     * P2P transport configuration. A null storage path keeps the identity in memory only.
     */
    public static class P2pConfig {
        private boolean enabled = false;
        private String host = "0.0.0.0";
        private int port = 0;
        private String storagePath;
        private boolean forceNewIdentity = false;
        private long startupTimeoutMs = 30_000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getStoragePath() { return storagePath; }
        public void setStoragePath(String storagePath) { this.storagePath = storagePath; }

        public boolean isForceNewIdentity() { return forceNewIdentity; }
        public void setForceNewIdentity(boolean forceNewIdentity) { this.forceNewIdentity = forceNewIdentity; }

        public long getStartupTimeoutMs() { return startupTimeoutMs; }
        public void setStartupTimeoutMs(long startupTimeoutMs) { this.startupTimeoutMs = startupTimeoutMs; }
    }

    /**
     * Affinity dispatch configuration.
     */
    public static class DispatchConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private long timeoutMs = 0;

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "xplorer";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}

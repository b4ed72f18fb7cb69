package fr.lapetina.tr064.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for a router connection.
 * Designed to be populated from YAML.
 */
public class RouterConfig {

    private RouterEndpointConfig router = new RouterEndpointConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private DiscoveryConfig discovery = new DiscoveryConfig();
    private CacheConfig cache = new CacheConfig();
    private MonitorConfig monitor = new MonitorConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public RouterEndpointConfig getRouter() { return router; }
    public void setRouter(RouterEndpointConfig router) { this.router = router; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public DiscoveryConfig getDiscovery() { return discovery; }
    public void setDiscovery(DiscoveryConfig discovery) { this.discovery = discovery; }

    public CacheConfig getCache() { return cache; }
    public void setCache(CacheConfig cache) { this.cache = cache; }

    public MonitorConfig getMonitor() { return monitor; }
    public void setMonitor(MonitorConfig monitor) { this.monitor = monitor; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Router address and credentials.
     */
    public static class RouterEndpointConfig {
        private String address = "169.254.1.1";
        private Integer port;
        private Integer webPort;
        private boolean useTls = false;
        private String user = "dslf-config";
        private String password = "";

        public String getAddress() { return address; }
        public void setAddress(String address) { this.address = address; }

        /**
         * Returns the configured port, or null to use the protocol default.
         */
        public Integer getPort() { return port; }
        public void setPort(Integer port) { this.port = port; }

        /**
         * Returns the web interface port, or null for the scheme's standard port.
         */
        public Integer getWebPort() { return webPort; }
        public void setWebPort(Integer webPort) { this.webPort = webPort; }

        public boolean isUseTls() { return useTls; }
        public void setUseTls(boolean useTls) { this.useTls = useTls; }

        public String getUser() { return user; }
        public void setUser(String user) { this.user = user; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long connectTimeoutMs = 10000;
        private long requestTimeoutMs = 30000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    /**
     * Descriptor documents read during discovery.
     * Secondary descriptors are only requested when a password is configured.
     */
    public static class DiscoveryConfig {
        private String primaryDescriptor = "tr64desc.xml";
        private List<String> secondaryDescriptors = new ArrayList<>(List.of("igddesc.xml"));

        public String getPrimaryDescriptor() { return primaryDescriptor; }
        public void setPrimaryDescriptor(String primaryDescriptor) { this.primaryDescriptor = primaryDescriptor; }

        public List<String> getSecondaryDescriptors() { return secondaryDescriptors; }
        public void setSecondaryDescriptors(List<String> secondaryDescriptors) { this.secondaryDescriptors = secondaryDescriptors; }
    }

    /**
     * Local schema cache configuration.
     */
    public static class CacheConfig {
        private boolean enabled = false;
        private boolean verify = true;
        private String directory;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public boolean isVerify() { return verify; }
        public void setVerify(boolean verify) { this.verify = verify; }

        /**
         * Returns the cache directory, or null for the default under the user home.
         */
        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
    }

    /**
     * Call monitor configuration.
     */
    public static class MonitorConfig {
        private int port = 1012;
        private int queueSize = 256;
        private String queueFullPolicy = "drop";
        private int chunkSize = 4096;
        private long connectTimeoutMs = 10000;
        private long readTimeoutMs = 10000;
        private String encoding = "utf-8";
        private RetryConfig retry = new RetryConfig();

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public int getQueueSize() { return queueSize; }
        public void setQueueSize(int queueSize) { this.queueSize = queueSize; }

        public String getQueueFullPolicy() { return queueFullPolicy; }
        public void setQueueFullPolicy(String queueFullPolicy) { this.queueFullPolicy = queueFullPolicy; }

        public int getChunkSize() { return chunkSize; }
        public void setChunkSize(int chunkSize) { this.chunkSize = chunkSize; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getReadTimeoutMs() { return readTimeoutMs; }
        public void setReadTimeoutMs(long readTimeoutMs) { this.readTimeoutMs = readTimeoutMs; }

        public String getEncoding() { return encoding; }
        public void setEncoding(String encoding) { this.encoding = encoding; }

        public RetryConfig getRetry() { return retry; }
        public void setRetry(RetryConfig retry) { this.retry = retry; }
    }

    /**
     * Reconnect policy of the call monitor.
     */
    public static class RetryConfig {
        private int maxRetries = 10;
        private long initialBackoffMs = 20;
        private long maxBackoffMs = 60000;
        private double backoffMultiplier = 10.0;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }

        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "tr064";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}

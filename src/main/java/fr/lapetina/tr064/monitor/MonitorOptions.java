package fr.lapetina.tr064.monitor;

import fr.lapetina.tr064.infrastructure.config.RouterConfig;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection, queue and reconnect settings of a {@link CallMonitor}.
 */
public final class MonitorOptions {

    public static final int DEFAULT_PORT = 1012;

    private final String host;
    private final int port;
    private final int queueSize;
    private final QueueFullPolicy queueFullPolicy;
    private final int chunkSize;
    private final Duration connectTimeout;
    private final Duration readTimeout;
    private final Charset charset;
    private final int maxRetries;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final double backoffMultiplier;

    private MonitorOptions(Builder builder) {
        this.host = Objects.requireNonNull(builder.host, "Host is required");
        this.port = builder.port;
        this.queueSize = builder.queueSize;
        this.queueFullPolicy = builder.queueFullPolicy;
        this.chunkSize = builder.chunkSize;
        this.connectTimeout = builder.connectTimeout;
        this.readTimeout = builder.readTimeout;
        this.charset = builder.charset;
        this.maxRetries = builder.maxRetries;
        this.initialBackoff = builder.initialBackoff;
        this.maxBackoff = builder.maxBackoff;
        this.backoffMultiplier = builder.backoffMultiplier;

        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
        if (queueSize <= 0) {
            throw new IllegalArgumentException("Queue size must be positive: " + queueSize);
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries must not be negative: " + maxRetries);
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be at least 1: " + backoffMultiplier);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates options for {@code host} from the monitor configuration section.
     */
    public static MonitorOptions fromConfig(String host, RouterConfig.MonitorConfig config) {
        RouterConfig.RetryConfig retry = config.getRetry();
        return builder()
                .host(host)
                .port(config.getPort())
                .queueSize(config.getQueueSize())
                .queueFullPolicy(QueueFullPolicy.fromName(config.getQueueFullPolicy()))
                .chunkSize(config.getChunkSize())
                .connectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                .readTimeout(Duration.ofMillis(config.getReadTimeoutMs()))
                .charset(Charset.forName(config.getEncoding()))
                .maxRetries(retry.getMaxRetries())
                .initialBackoff(Duration.ofMillis(retry.getInitialBackoffMs()))
                .maxBackoff(Duration.ofMillis(retry.getMaxBackoffMs()))
                .backoffMultiplier(retry.getBackoffMultiplier())
                .build();
    }

    public String getHost() { return host; }
    public int getPort() { return port; }
    public int getQueueSize() { return queueSize; }
    public QueueFullPolicy getQueueFullPolicy() { return queueFullPolicy; }
    public int getChunkSize() { return chunkSize; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public Duration getReadTimeout() { return readTimeout; }
    public Charset getCharset() { return charset; }
    public int getMaxRetries() { return maxRetries; }
    public Duration getInitialBackoff() { return initialBackoff; }
    public Duration getMaxBackoff() { return maxBackoff; }
    public double getBackoffMultiplier() { return backoffMultiplier; }

    @Override
    public String toString() {
        return "MonitorOptions{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", queueSize=" + queueSize +
                ", queueFullPolicy=" + queueFullPolicy +
                ", maxRetries=" + maxRetries +
                '}';
    }

    public static final class Builder {
        private String host;
        private int port = DEFAULT_PORT;
        private int queueSize = 256;
        private QueueFullPolicy queueFullPolicy = QueueFullPolicy.DROP;
        private int chunkSize = 4096;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(10);
        private Charset charset = StandardCharsets.UTF_8;
        private int maxRetries = 10;
        private Duration initialBackoff = Duration.ofMillis(20);
        private Duration maxBackoff = Duration.ofSeconds(60);
        private double backoffMultiplier = 10.0;

        private Builder() {
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder queueSize(int queueSize) {
            this.queueSize = queueSize;
            return this;
        }

        public Builder queueFullPolicy(QueueFullPolicy queueFullPolicy) {
            this.queueFullPolicy = queueFullPolicy;
            return this;
        }

        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder readTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder charset(Charset charset) {
            this.charset = charset;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public MonitorOptions build() {
            return new MonitorOptions(this);
        }
    }
}

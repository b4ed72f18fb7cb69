package fr.lapetina.tr064.monitor;

import fr.lapetina.tr064.domain.error.RouterConnectionException;
import fr.lapetina.tr064.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Real-time client for the router's call monitor port.
 *
 * A single daemon thread reads the socket, reassembles lines and hands them to
 * a bounded queue returned by {@link #start}. Lost connections are re-established
 * with growing delays until the retry budget is spent, after which the thread ends
 * and {@link #isAlive()} turns false. A stopped or exhausted monitor can be started again.
 *
 * <p>The call monitor must be enabled on the router, e.g. by dialing {@code #96*5*}.
 */
public final class CallMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CallMonitor.class);

    static final Duration BLOCK_POLL_INTERVAL = Duration.ofMillis(100);

    private final MonitorOptions defaultOptions;
    private final SocketConnector connector;
    private final MetricsRegistry metricsRegistry;

    private final AtomicReference<Thread> thread = new AtomicReference<>();
    private final AtomicReference<MonitorState> state = new AtomicReference<>(MonitorState.IDLE);
    private volatile CountDownLatch stopSignal;
    private volatile MonitorSocket socket;

    public CallMonitor(MonitorOptions defaultOptions, SocketConnector connector, MetricsRegistry metricsRegistry) {
        this.defaultOptions = defaultOptions;
        this.connector = connector;
        this.metricsRegistry = metricsRegistry;
    }

    public CallMonitor(MonitorOptions defaultOptions) {
        this(defaultOptions, new TcpSocketConnector(), null);
    }

    /**
     * Starts monitoring with the options given at construction.
     */
    public BlockingQueue<String> start() {
        return start(defaultOptions);
    }

    /**
     * Connects and starts the reader thread.
     *
     * @return the queue receiving one entry per call monitor line
     * @throws IllegalStateException     if the monitor is already running
     * @throws RouterConnectionException if the connection cannot be established
     */
    public synchronized BlockingQueue<String> start(MonitorOptions options) {
        if (thread.get() != null) {
            throw new IllegalStateException("Call monitor is already running");
        }

        state.set(MonitorState.CONNECTING);
        CountDownLatch signal = new CountDownLatch(1);
        MonitorSocket connected;
        try {
            connected = connect(options);
        } catch (IOException e) {
            state.set(MonitorState.STOPPED);
            log.error("Call monitor connection failed: host={}, port={}, error={}",
                    options.getHost(), options.getPort(), e.getMessage());
            throw new RouterConnectionException("Unable to connect to the call monitor at "
                    + options.getHost() + ":" + options.getPort()
                    + ". Is the call monitor enabled (dial #96*5*)?", e);
        }

        BlockingQueue<String> queue = new ArrayBlockingQueue<>(options.getQueueSize());
        this.stopSignal = signal;
        this.socket = connected;

        Thread reader = new Thread(() -> listen(connected, options, queue, signal), "call-monitor");
        reader.setDaemon(true);
        thread.set(reader);
        state.set(MonitorState.LISTENING);
        reader.start();

        log.info("Call monitor started: host={}, port={}, queueSize={}, policy={}",
                options.getHost(), options.getPort(), options.getQueueSize(), options.getQueueFullPolicy());
        return queue;
    }

    /**
     * Stops the reader thread and waits for it to end. Does nothing when not running.
     */
    public synchronized void stop() {
        Thread reader = thread.get();
        CountDownLatch signal = stopSignal;
        if (signal != null) {
            signal.countDown();
        }
        closeSocket(socket);

        if (reader != null && reader != Thread.currentThread()) {
            try {
                reader.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for the call monitor to stop");
            }
        }
        if (state.get() != MonitorState.IDLE) {
            state.set(MonitorState.STOPPED);
        }
        log.info("Call monitor stopped");
    }

    /**
     * Returns whether the reader thread is running.
     */
    public boolean isAlive() {
        Thread reader = thread.get();
        return reader != null && reader.isAlive();
    }

    public MonitorOptions getOptions() {
        return defaultOptions;
    }

    public MonitorState getState() {
        return state.get();
    }

    @Override
    public void close() {
        stop();
    }

    private void listen(MonitorSocket initial, MonitorOptions options, BlockingQueue<String> queue,
                        CountDownLatch signal) {
        LineReassembler reassembler = new LineReassembler(options.getCharset());
        EventHandOff handOff = new EventHandOff(queue, options.getQueueFullPolicy(),
                () -> signal.getCount() == 0, BLOCK_POLL_INTERVAL);
        ReconnectBackoff backoff = new ReconnectBackoff(options.getInitialBackoff(),
                options.getBackoffMultiplier(), options.getMaxBackoff(), options.getMaxRetries());
        byte[] buffer = new byte[options.getChunkSize()];
        MonitorSocket current = initial;

        try {
            while (signal.getCount() > 0) {
                int read;
                try {
                    read = current.read(buffer);
                } catch (SocketTimeoutException e) {
                    continue;
                } catch (IOException e) {
                    if (signal.getCount() == 0) {
                        break;
                    }
                    log.warn("Call monitor read failed: error={}", e.getMessage());
                    read = -1;
                }

                if (read < 0) {
                    log.info("Call monitor connection lost, reconnecting: host={}", options.getHost());
                    closeSocket(current);
                    reassembler.reset();
                    current = reconnect(options, backoff, signal);
                    if (current == null) {
                        break;
                    }
                    socket = current;
                    continue;
                }

                List<String> lines = reassembler.feed(buffer, read);
                for (String line : lines) {
                    if (metricsRegistry != null) {
                        metricsRegistry.incrementMonitorEvents();
                    }
                    if (!handOff.offer(line)) {
                        if (signal.getCount() == 0) {
                            break;
                        }
                        log.debug("Call monitor queue full, line dropped: {}", line);
                        if (metricsRegistry != null) {
                            metricsRegistry.incrementMonitorDropped();
                        }
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Call monitor reader interrupted");
        } catch (RuntimeException e) {
            log.error("Call monitor reader failed", e);
        } finally {
            closeSocket(current);
            state.set(MonitorState.STOPPED);
            thread.compareAndSet(Thread.currentThread(), null);
            log.debug("Call monitor reader ended");
        }
    }

    /**
     * Re-establishes the connection. Returns null when stopped or when all attempts failed.
     */
    private MonitorSocket reconnect(MonitorOptions options, ReconnectBackoff backoff, CountDownLatch signal)
            throws InterruptedException {
        state.set(MonitorState.RECONNECTING);
        for (int attempt = 0; attempt < backoff.getMaxRetries(); attempt++) {
            Duration delay = backoff.delayFor(attempt);
            if (signal.await(delay.toMillis(), TimeUnit.MILLISECONDS)) {
                return null;
            }
            if (metricsRegistry != null) {
                metricsRegistry.incrementMonitorReconnects();
            }
            try {
                MonitorSocket connected = connect(options);
                state.set(MonitorState.LISTENING);
                log.info("Call monitor reconnected: host={}, attempt={}", options.getHost(), attempt + 1);
                return connected;
            } catch (IOException e) {
                log.warn("Call monitor reconnect failed: host={}, attempt={}, nextDelayMs={}, error={}",
                        options.getHost(), attempt + 1, backoff.delayFor(attempt + 1).toMillis(), e.getMessage());
            }
        }
        log.error("Call monitor gave up after {} reconnect attempts: host={}",
                backoff.getMaxRetries(), options.getHost());
        return null;
    }

    private MonitorSocket connect(MonitorOptions options) throws IOException {
        return connector.connect(options.getHost(), options.getPort(),
                options.getConnectTimeout(), options.getReadTimeout());
    }

    private static void closeSocket(MonitorSocket target) {
        if (target == null) {
            return;
        }
        try {
            target.close();
        } catch (IOException e) {
            log.debug("Error closing call monitor socket: {}", e.getMessage());
        }
    }
}

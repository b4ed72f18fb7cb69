package fr.lapetina.tr064.monitor;

import java.io.IOException;
import java.time.Duration;

/**
 * Opens call monitor connections.
 */
@FunctionalInterface
public interface SocketConnector {

    MonitorSocket connect(String host, int port, Duration connectTimeout, Duration readTimeout) throws IOException;
}

package fr.lapetina.tr064.monitor;

import java.io.Closeable;
import java.io.IOException;

/**
 * Connected call monitor stream.
 */
public interface MonitorSocket extends Closeable {

    /**
     * Reads up to {@code buffer.length} bytes.
     *
     * @return the number of bytes read, or -1 when the peer closed the connection
     * @throws java.net.SocketTimeoutException when no data arrived within the read timeout
     * @throws IOException                     on any other transport failure
     */
    int read(byte[] buffer) throws IOException;
}

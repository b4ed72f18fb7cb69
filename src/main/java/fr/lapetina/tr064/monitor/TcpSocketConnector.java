package fr.lapetina.tr064.monitor;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/**
 * Plain TCP connector with keep-alive, bounded connect time and a read timeout.
 */
public final class TcpSocketConnector implements SocketConnector {

    @Override
    public MonitorSocket connect(String host, int port, Duration connectTimeout, Duration readTimeout)
            throws IOException {
        Socket socket = new Socket();
        try {
            socket.setKeepAlive(true);
            socket.connect(new InetSocketAddress(host, port), (int) connectTimeout.toMillis());
            socket.setSoTimeout((int) readTimeout.toMillis());
            return new TcpMonitorSocket(socket);
        } catch (IOException e) {
            socket.close();
            throw e;
        }
    }

    private static final class TcpMonitorSocket implements MonitorSocket {

        private final Socket socket;
        private final InputStream input;

        TcpMonitorSocket(Socket socket) throws IOException {
            this.socket = socket;
            this.input = socket.getInputStream();
        }

        @Override
        public int read(byte[] buffer) throws IOException {
            return input.read(buffer);
        }

        @Override
        public void close() throws IOException {
            socket.close();
        }

        @Override
        public String toString() {
            return "TcpMonitorSocket{" + socket.getRemoteSocketAddress() + '}';
        }
    }
}

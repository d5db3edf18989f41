package benchgrid.net;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Blocking client for the one-message-per-connection protocols. Every call
 * opens a fresh connection, sends one line and optionally reads one line back.
 */
public final class LineClient {

    private final String host;
    private final int port;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;

    public LineClient(String host, int port, Duration connectTimeout, Duration readTimeout) {
        this.host = host;
        this.port = port;
        this.connectTimeoutMs = (int) connectTimeout.toMillis();
        this.readTimeoutMs = (int) readTimeout.toMillis();
    }

    /**
     * Send a line and wait for the reply line.
     *
     * @return the reply without its terminator, or null if the peer closed
     *         without replying
     */
    public String exchange(String message) throws IOException {
        try (Socket socket = connect()) {
            write(socket, message);
            BufferedReader reader = new BufferedReader(
                    new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            return reader.readLine();
        }
    }

    /**
     * Send a line and wait for the peer to close; the close is the
     * acknowledgment that the message was processed.
     */
    public void send(String message) throws IOException {
        try (Socket socket = connect()) {
            write(socket, message);
            socket.shutdownOutput();
            InputStream in = socket.getInputStream();
            while (in.read() != -1) {
                // no reply expected, drain until EOF
            }
        }
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    private Socket connect() throws IOException {
        Socket socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            socket.setSoTimeout(readTimeoutMs);
            socket.connect(new InetSocketAddress(host, port), connectTimeoutMs);
            return socket;
        } catch (IOException e) {
            socket.close();
            throw e;
        }
    }

    private static void write(Socket socket, String message) throws IOException {
        OutputStream out = socket.getOutputStream();
        out.write((message + "\n").getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}

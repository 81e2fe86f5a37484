package io.llmops.platform.runtime.role;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;

/**
 * Checks local TCP ports.
 */
public class PortProbe {

    /**
     * Check if a port can be bound on all interfaces.
     *
     * @param port the port
     * @return false if something else holds it, or binding is not permitted
     */
    public boolean isFree(int port) {
        try (ServerSocket socket = new ServerSocket()) {
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(port));
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * Check if something accepts connections on a port.
     *
     * @param host host to connect to
     * @param port the port
     * @param timeout connect timeout
     * @return true if a connection was accepted
     */
    public boolean isListening(@Nonnull String host, int port, @Nonnull Duration timeout) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), (int) timeout.toMillis());
            return true;
        } catch (IOException e) {
            return false;
        }
    }
}

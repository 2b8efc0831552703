package org.chatrelay.client;

import org.chatrelay.codec.MessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;

/**
 * A blocking connection to a chat relay. {@link #send} and {@link #receive} may be used from
 * two different threads, one each.
 */
public class ChatClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ChatClient.class);

    private final ClientConfig config;
    private final MessageCodec codec;
    private Socket socket;
    private InputStream in;
    private OutputStream out;

    public ChatClient(ClientConfig config) {
        this.config = config;
        this.codec = config.codec().create(config.maxMessageBytes());
    }

    public ChatClient connect() throws IOException {
        if (socket != null) {
            throw new IllegalStateException("Already connected");
        }
        Socket s = new Socket();
        try {
            s.connect(new InetSocketAddress(config.host(), config.port()));
        } catch (IOException e) {
            s.close();
            throw e;
        }
        socket = s;
        in = new BufferedInputStream(s.getInputStream());
        out = new BufferedOutputStream(s.getOutputStream());
        log.debug("Connected to {}:{}", config.host(), config.port());
        return this;
    }

    public void send(String text) throws IOException {
        requireConnected();
        codec.send(out, text);
    }

    /**
     * Blocks until the relay delivers the next message.
     */
    public String receive() throws IOException {
        requireConnected();
        return codec.receive(in);
    }

    /**
     * Like {@link #receive()} but gives up after the timeout.
     *
     * @throws SocketTimeoutException if nothing arrived in time
     */
    public String receive(Duration timeout) throws IOException {
        requireConnected();
        int previous = socket.getSoTimeout();
        socket.setSoTimeout(soTimeoutMillis(timeout));
        try {
            return codec.receive(in);
        } finally {
            if (!socket.isClosed()) {
                socket.setSoTimeout(previous);
            }
        }
    }

    static int soTimeoutMillis(Duration timeout) {
        long millis = timeout.toMillis();
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, millis));
    }

    public boolean isConnected() {
        return socket != null && !socket.isClosed();
    }

    @Override
    public void close() throws IOException {
        if (socket != null) {
            socket.close();
        }
    }

    private void requireConnected() throws IOException {
        if (socket == null) {
            throw new IllegalStateException("Not connected");
        }
        if (socket.isClosed()) {
            throw new IOException("Connection closed");
        }
    }
}

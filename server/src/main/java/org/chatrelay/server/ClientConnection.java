package org.chatrelay.server;

import org.chatrelay.codec.Message;
import org.chatrelay.codec.MessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketAddress;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One accepted client. Reads belong to the connection's {@link Receiver}, writes to the
 * {@link Broadcaster}, so each direction has a single user and needs no extra locking.
 */
public class ClientConnection implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ClientConnection.class);

    public enum State { OPEN, CLOSED }

    private final String id;
    private final Socket socket;
    private final MessageCodec codec;
    private final InputStream in;
    private final OutputStream out;
    private final SocketAddress remoteAddress;
    private final AtomicReference<State> state = new AtomicReference<>(State.OPEN);

    public ClientConnection(String id, Socket socket, MessageCodec codec) throws IOException {
        this.id = id;
        this.socket = socket;
        this.codec = codec;
        this.in = new BufferedInputStream(socket.getInputStream());
        this.out = new BufferedOutputStream(socket.getOutputStream());
        this.remoteAddress = socket.getRemoteSocketAddress();
    }

    public Message read() throws IOException {
        ensureOpen();
        return new Message(codec.receive(in));
    }

    public void write(Message message) throws IOException {
        ensureOpen();
        codec.send(out, message.text());
    }

    /**
     * Moves the connection to {@link State#CLOSED} and closes the socket, which also unblocks
     * a Receiver waiting in {@link #read()}.
     *
     * @return true for the one call that performed the transition
     */
    public boolean closeIfOpen() {
        if (!state.compareAndSet(State.OPEN, State.CLOSED)) {
            return false;
        }
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing socket of {}", this, e);
        }
        return true;
    }

    @Override
    public void close() {
        closeIfOpen();
    }

    public boolean isOpen() {
        return state.get() == State.OPEN;
    }

    public State state() {
        return state.get();
    }

    public String id() {
        return id;
    }

    public SocketAddress remoteAddress() {
        return remoteAddress;
    }

    private void ensureOpen() throws IOException {
        if (state.get() != State.OPEN) {
            throw new IOException("Connection " + id + " is closed");
        }
    }

    @Override
    public String toString() {
        return id + "(" + remoteAddress + ")";
    }
}

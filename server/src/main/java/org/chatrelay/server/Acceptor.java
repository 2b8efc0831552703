package org.chatrelay.server;

import org.chatrelay.codec.Message;
import org.chatrelay.codec.MessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Accepts clients on an already bound listener, registers each one and starts its Receiver.
 * A failed accept is logged and the loop carries on; only closing the listener ends it.
 */
public class Acceptor implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(Acceptor.class);

    private static final long MAX_BACKOFF_MS = TimeUnit.SECONDS.toMillis(1);

    private final ServerSocket listener;
    private final MessageCodec codec;
    private final ConnectionRegistry registry;
    private final BlockingQueue<Message> inbound;
    private final ExecutorService receivers;
    private final AtomicLong nextId = new AtomicLong(1);

    public Acceptor(ServerSocket listener, MessageCodec codec, ConnectionRegistry registry,
                    BlockingQueue<Message> inbound, ExecutorService receivers) {
        this.listener = listener;
        this.codec = codec;
        this.registry = registry;
        this.inbound = inbound;
        this.receivers = receivers;
    }

    @Override
    public void run() {
        int consecutiveFailures = 0;
        while (!listener.isClosed() && !Thread.currentThread().isInterrupted()) {
            Socket socket;
            try {
                socket = listener.accept();
                consecutiveFailures = 0;
            } catch (IOException e) {
                if (listener.isClosed()) {
                    break;
                }
                consecutiveFailures++;
                logger.warn("Accept failed ({} in a row): {}", consecutiveFailures, e.toString());
                if (!pause(consecutiveFailures)) {
                    break;
                }
                continue;
            }
            register(socket);
        }
        logger.info("Acceptor stopped");
    }

    private void register(Socket socket) {
        ClientConnection connection;
        try {
            connection = new ClientConnection("conn-" + nextId.getAndIncrement(), socket, codec);
        } catch (IOException e) {
            logger.warn("Could not set up accepted socket {}: {}", socket.getRemoteSocketAddress(), e.toString());
            closeQuietly(socket);
            return;
        }
        registry.add(connection);
        try {
            receivers.execute(new Receiver(connection, inbound, registry));
        } catch (RejectedExecutionException e) {
            logger.info("Server is shutting down, dropping {}", connection);
            registry.retire(connection);
            return;
        }
        logger.info("Accepted {}. Live connections: {}", connection, registry.size());
    }

    // Linear backoff so a persistent failure such as fd exhaustion does not spin the CPU.
    private boolean pause(int consecutiveFailures) {
        if (consecutiveFailures < 2) {
            return true;
        }
        try {
            Thread.sleep(Math.min(MAX_BACKOFF_MS, 50L * consecutiveFailures));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing rejected socket", e);
        }
    }
}

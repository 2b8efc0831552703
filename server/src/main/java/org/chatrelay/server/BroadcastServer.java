package org.chatrelay.server;

import org.chatrelay.codec.Message;
import org.chatrelay.codec.MessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the relay together: one Acceptor thread, one Broadcaster thread and one Receiver
 * thread per client, sharing a {@link ConnectionRegistry} and an unbounded inbound queue.
 */
public class BroadcastServer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BroadcastServer.class);

    private final ServerConfig config;
    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final BlockingQueue<Message> inbound = new LinkedBlockingQueue<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private ServerSocket listener;
    private ExecutorService acceptorExecutor;
    private ExecutorService broadcasterExecutor;
    private ExecutorService receiverExecutor;

    public BroadcastServer(ServerConfig config) {
        this.config = config;
    }

    /**
     * Binds the listener and starts all loops.
     *
     * @throws ServerStartupException if the address cannot be bound
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Server already started");
        }
        try {
            listener = new ServerSocket();
            listener.setReuseAddress(true);
            listener.bind(new InetSocketAddress(config.host(), config.port()));
        } catch (IOException e) {
            closeListener();
            throw new ServerStartupException("Could not bind " + config.host() + ":" + config.port(), e);
        }

        MessageCodec codec = config.codec().create(config.maxMessageBytes());
        acceptorExecutor = Executors.newSingleThreadExecutor(namedDaemon("acceptor"));
        broadcasterExecutor = Executors.newSingleThreadExecutor(namedDaemon("broadcaster"));
        receiverExecutor = Executors.newCachedThreadPool(numberedDaemon("receiver-"));

        broadcasterExecutor.execute(new Broadcaster(inbound, registry));
        acceptorExecutor.execute(new Acceptor(listener, codec, registry, inbound, receiverExecutor));

        logger.info("Chat relay listening on {}:{} using {} framing", config.host(), getLocalPort(), config.codec());
    }

    public int getLocalPort() {
        ServerSocket socket = listener;
        if (socket == null) {
            throw new IllegalStateException("Server not started");
        }
        return socket.getLocalPort();
    }

    public int connectionCount() {
        return registry.size();
    }

    ConnectionRegistry registry() {
        return registry;
    }

    /**
     * Stops accepting, stops the loops and closes every client. Safe to call more than once.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        closeListener();
        stop(acceptorExecutor);
        stop(broadcasterExecutor);
        stop(receiverExecutor);
        awaitTermination(acceptorExecutor);
        // closing the sockets is what unblocks receivers parked in a read
        int retired = registry.retireAll();
        awaitTermination(broadcasterExecutor);
        awaitTermination(receiverExecutor);
        logger.info("Chat relay stopped, closed {} connection(s)", retired);
    }

    private void closeListener() {
        if (listener == null) {
            return;
        }
        try {
            listener.close();
        } catch (IOException e) {
            logger.warn("Error closing listener", e);
        }
    }

    private static void stop(ExecutorService executor) {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private static void awaitTermination(ExecutorService executor) {
        if (executor == null) {
            return;
        }
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                logger.warn("Threads still running after shutdown: {}", executor);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedDaemon(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    private static ThreadFactory numberedDaemon(String prefix) {
        AtomicInteger counter = new AtomicInteger(1);
        return r -> {
            Thread t = new Thread(r, prefix + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}

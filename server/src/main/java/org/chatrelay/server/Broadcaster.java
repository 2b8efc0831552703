package org.chatrelay.server;

import org.chatrelay.codec.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.BlockingQueue;

/**
 * The single consumer of the inbound queue. Every message goes to every connection registered
 * at the moment it is taken off the queue.
 */
public class Broadcaster implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(Broadcaster.class);

    private final BlockingQueue<Message> inbound;
    private final ConnectionRegistry registry;

    public Broadcaster(BlockingQueue<Message> inbound, ConnectionRegistry registry) {
        this.inbound = inbound;
        this.registry = registry;
    }

    @Override
    public void run() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                Message message = inbound.take();
                try {
                    broadcast(message);
                } catch (RuntimeException e) {
                    logger.warn("Broadcast of {} aborted", message, e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("Broadcaster stopped");
    }

    /**
     * Delivers one message to the current registry snapshot. A failed write retires that
     * connection only; the rest of the round still goes out. A message the codec refuses is
     * skipped for that connection without retiring it.
     *
     * @return number of connections the message was written to
     */
    public int broadcast(Message message) {
        List<ClientConnection> targets = registry.snapshot();
        int delivered = 0;
        for (ClientConnection connection : targets) {
            try {
                connection.write(message);
                delivered++;
            } catch (IOException e) {
                if (registry.retire(connection)) {
                    logger.warn("Write to {} failed, connection removed: {}", connection, e.toString());
                }
            } catch (RuntimeException e) {
                // the message was refused, not the connection: skip it and keep the client
                logger.warn("Could not write {} to {}", message, connection, e);
            }
        }
        logger.debug("Broadcast {} to {}/{} connections", message, delivered, targets.size());
        return delivered;
    }
}

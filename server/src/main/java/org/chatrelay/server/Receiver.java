package org.chatrelay.server;

import org.chatrelay.codec.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.util.concurrent.BlockingQueue;

/**
 * Reads messages from one connection and hands them to the Broadcaster. Runs until the first
 * read error, then retires the connection.
 */
public class Receiver implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(Receiver.class);

    private final ClientConnection connection;
    private final BlockingQueue<Message> inbound;
    private final ConnectionRegistry registry;

    public Receiver(ClientConnection connection, BlockingQueue<Message> inbound, ConnectionRegistry registry) {
        this.connection = connection;
        this.inbound = inbound;
        this.registry = registry;
    }

    @Override
    public void run() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                Message message = connection.read();
                logger.debug("Received from {}: {}", connection, message.text());
                // unbounded queue, offer never fails
                inbound.offer(message);
            }
            registry.retire(connection);
        } catch (EOFException e) {
            if (registry.retire(connection)) {
                logger.info("Client {} disconnected", connection);
            }
        } catch (IOException e) {
            if (registry.retire(connection)) {
                logger.warn("Read from {} failed, connection removed: {}", connection, e.toString());
            }
        }
    }
}

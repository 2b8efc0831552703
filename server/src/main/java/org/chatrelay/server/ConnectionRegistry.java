package org.chatrelay.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The set of live connections a broadcast fans out to.
 * <p>
 * Backed by a CopyOnWriteArrayList: the Acceptor adds and Receivers remove rarely, while the
 * Broadcaster takes a snapshot for every message. A snapshot is the array the list held at that
 * moment, so it stays in insertion order and is never affected by later changes.
 */
public class ConnectionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final CopyOnWriteArrayList<ClientConnection> connections = new CopyOnWriteArrayList<>();

    public void add(ClientConnection connection) {
        connections.add(connection);
        logger.debug("Registered {}. Live connections: {}", connection, connections.size());
    }

    /**
     * @return true if this call removed the connection
     */
    public boolean remove(ClientConnection connection) {
        boolean removed = connections.remove(connection);
        if (removed) {
            logger.debug("Deregistered {}. Live connections: {}", connection, connections.size());
        }
        return removed;
    }

    /**
     * Closes the connection and removes it. Both the Receiver and the Broadcaster may notice a
     * dead connection; only the first of them gets true back.
     */
    public boolean retire(ClientConnection connection) {
        boolean closed = connection.closeIfOpen();
        remove(connection);
        return closed;
    }

    public List<ClientConnection> snapshot() {
        return List.copyOf(connections);
    }

    public int size() {
        return connections.size();
    }

    /**
     * Retires every connection, used on shutdown.
     */
    public int retireAll() {
        int retired = 0;
        for (ClientConnection connection : connections) {
            if (retire(connection)) {
                retired++;
            }
        }
        return retired;
    }
}

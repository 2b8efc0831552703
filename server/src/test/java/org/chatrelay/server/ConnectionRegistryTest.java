package org.chatrelay.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.chatrelay.codec.LineMessageCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ConnectionRegistryTest {

    private final List<SocketPair> pairs = new ArrayList<>();
    private final ConnectionRegistry registry = new ConnectionRegistry();

    @AfterEach
    void tearDown() throws Exception {
        for (SocketPair pair : pairs) {
            pair.close();
        }
    }

    @Test
    void snapshotKeepsInsertionOrder() throws Exception {
        ClientConnection a = connection("a");
        ClientConnection b = connection("b");
        ClientConnection c = connection("c");
        registry.add(a);
        registry.add(b);
        registry.add(c);

        assertEquals(List.of(a, b, c), registry.snapshot());
        assertEquals(3, registry.size());
    }

    @Test
    void snapshotIsUnaffectedByLaterChanges() throws Exception {
        ClientConnection a = connection("a");
        ClientConnection b = connection("b");
        registry.add(a);
        List<ClientConnection> before = registry.snapshot();

        registry.add(b);
        registry.remove(a);

        assertEquals(List.of(a), before);
        assertEquals(List.of(b), registry.snapshot());
        assertThrows(UnsupportedOperationException.class, () -> before.add(b));
    }

    @Test
    void removeReportsOnlyTheEffectiveCall() throws Exception {
        ClientConnection a = connection("a");
        registry.add(a);

        assertTrue(registry.remove(a));
        assertFalse(registry.remove(a));
        assertFalse(registry.remove(connection("never-added")));
    }

    @Test
    void retireClosesAndRemovesExactlyOnce() throws Exception {
        ClientConnection a = connection("a");
        registry.add(a);

        assertTrue(registry.retire(a));
        assertFalse(registry.retire(a));
        assertEquals(ClientConnection.State.CLOSED, a.state());
        assertEquals(0, registry.size());
    }

    @Test
    void retireAllEmptiesTheRegistry() throws Exception {
        registry.add(connection("a"));
        registry.add(connection("b"));

        assertEquals(2, registry.retireAll());
        assertEquals(0, registry.size());
    }

    @Test
    void concurrentAddsAndSnapshotsAreSafe() throws Exception {
        int writers = 8;
        int perWriter = 10;
        List<ClientConnection> connections = new ArrayList<>();
        for (int i = 0; i < writers * perWriter; i++) {
            connections.add(connection("c" + i));
        }

        ExecutorService pool = Executors.newFixedThreadPool(writers + 1);
        CountDownLatch go = new CountDownLatch(1);
        for (int w = 0; w < writers; w++) {
            List<ClientConnection> slice = connections.subList(w * perWriter, (w + 1) * perWriter);
            pool.execute(() -> {
                await(go);
                slice.forEach(registry::add);
            });
        }
        pool.execute(() -> {
            await(go);
            for (int i = 0; i < 200; i++) {
                for (ClientConnection connection : registry.snapshot()) {
                    assertTrue(connection.id().startsWith("c"));
                }
            }
        });
        go.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(writers * perWriter, registry.size());
        assertTrue(registry.snapshot().containsAll(connections));
    }

    private ClientConnection connection(String id) throws Exception {
        SocketPair pair = SocketPair.open();
        pairs.add(pair);
        return new ClientConnection(id, pair.server, new LineMessageCodec(1024));
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

package org.chatrelay.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

public class Server {
    private static final Logger log = LoggerFactory.getLogger(Server.class);

    public static void main(String[] args) throws InterruptedException {
        ServerConfig config;
        try {
            config = ServerConfig.load(args);
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }

        BroadcastServer server = new BroadcastServer(config);
        try {
            server.start();
        } catch (ServerStartupException e) {
            log.error("{}: {}", e.getMessage(), e.getCause().toString());
            System.exit(1);
            return;
        }

        // The main thread parks on the latch until the JVM is asked to exit (e.g. CTRL+C).
        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.close();
                log.info("Server shut down gracefully.");
            } catch (RuntimeException e) {
                log.error("Error during shutdown", e);
            }
            latch.countDown();
        }, "shutdown-hook"));

        log.info("Server running. Press CTRL+C to stop.");
        latch.await();
    }
}

package org.chatrelay.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Console client: every line typed is sent to the relay, every broadcast is printed.
 * {@code /quit} or end of input leaves.
 */
public class Client {
    private static final Logger log = LoggerFactory.getLogger(Client.class);

    static final String QUIT = "/quit";

    public static void main(String[] args) throws IOException {
        ClientConfig config;
        try {
            config = ClientConfig.load(args);
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }
        try (ChatClient client = new ChatClient(config).connect()) {
            Thread reader = new Thread(() -> printIncoming(client), "relay-reader");
            reader.setDaemon(true);
            reader.start();

            BufferedReader console = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            System.out.println("Connected to " + config.host() + ":" + config.port() + ". Type " + QUIT + " to leave.");
            pump(console, client);
        }
    }

    static int pump(BufferedReader console, ChatClient client) throws IOException {
        int sent = 0;
        String line;
        while ((line = console.readLine()) != null) {
            if (QUIT.equals(line.trim())) {
                break;
            }
            try {
                client.send(line);
                sent++;
            } catch (IllegalArgumentException e) {
                log.warn("Line not sent: {}", e.getMessage());
            }
        }
        return sent;
    }

    private static void printIncoming(ChatClient client) {
        try {
            while (true) {
                System.out.println("> " + client.receive());
            }
        } catch (EOFException e) {
            System.out.println("Server closed the connection.");
        } catch (IOException e) {
            if (client.isConnected()) {
                log.warn("Lost connection to the relay: {}", e.toString());
            }
        }
    }
}

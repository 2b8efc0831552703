package org.chatrelay.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Layers chat settings: a classpath properties file first, then JVM system properties for
 * the same keys. Command-line arguments are applied by the caller on top.
 */
public final class ConfigLoader {

    public static final String HOST_KEY = "chat.server.host";
    public static final String PORT_KEY = "chat.server.port";
    public static final String CODEC_KEY = "chat.codec";
    public static final String MAX_MESSAGE_BYTES_KEY = "chat.max-message-bytes";

    public static final String DEFAULT_RESOURCE = "chat-relay.properties";
    public static final int DEFAULT_PORT = 12345;
    public static final int DEFAULT_MAX_MESSAGE_BYTES = 64 * 1024;

    private static final String[] KEYS = {HOST_KEY, PORT_KEY, CODEC_KEY, MAX_MESSAGE_BYTES_KEY};

    private ConfigLoader() {
    }

    public static Properties load() {
        return load(DEFAULT_RESOURCE, System.getProperties());
    }

    public static Properties load(String resource, Properties overrides) {
        Properties merged = new Properties();
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in != null) {
                merged.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
        for (String key : KEYS) {
            String value = overrides.getProperty(key);
            if (value != null) {
                merged.setProperty(key, value);
            }
        }
        return merged;
    }

    public static int port(String value) {
        int port = integer(PORT_KEY, value);
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range 0..65535: " + port);
        }
        return port;
    }

    public static int maxMessageBytes(String value) {
        int max = integer(MAX_MESSAGE_BYTES_KEY, value);
        if (max < 1) {
            throw new IllegalArgumentException(MAX_MESSAGE_BYTES_KEY + " must be at least 1: " + max);
        }
        return max;
    }

    public static String host(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Host must not be blank");
        }
        return value.trim();
    }

    private static int integer(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + value, e);
        }
    }
}

package org.chatrelay.client;

import org.chatrelay.codec.CodecType;
import org.chatrelay.config.ConfigLoader;

import java.util.Objects;
import java.util.Properties;

public record ClientConfig(String host, int port, CodecType codec, int maxMessageBytes) {

    public static final String DEFAULT_HOST = "localhost";

    public ClientConfig {
        host = ConfigLoader.host(host);
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Port out of range 1..65535: " + port);
        }
        Objects.requireNonNull(codec, "codec");
        if (maxMessageBytes < 1) {
            throw new IllegalArgumentException("maxMessageBytes must be at least 1: " + maxMessageBytes);
        }
    }

    public ClientConfig(String host, int port) {
        this(host, port, CodecType.LINE, ConfigLoader.DEFAULT_MAX_MESSAGE_BYTES);
    }

    /**
     * Same layering as the server, except positional arguments are {@code [host] [port]}.
     */
    public static ClientConfig load(String[] args) {
        return from(ConfigLoader.load(), args);
    }

    static ClientConfig from(Properties props, String[] args) {
        String host = props.getProperty(ConfigLoader.HOST_KEY, DEFAULT_HOST);
        int port = props.containsKey(ConfigLoader.PORT_KEY)
                ? ConfigLoader.port(props.getProperty(ConfigLoader.PORT_KEY))
                : ConfigLoader.DEFAULT_PORT;
        CodecType codec = props.containsKey(ConfigLoader.CODEC_KEY)
                ? CodecType.parse(props.getProperty(ConfigLoader.CODEC_KEY))
                : CodecType.LINE;
        int maxMessageBytes = props.containsKey(ConfigLoader.MAX_MESSAGE_BYTES_KEY)
                ? ConfigLoader.maxMessageBytes(props.getProperty(ConfigLoader.MAX_MESSAGE_BYTES_KEY))
                : ConfigLoader.DEFAULT_MAX_MESSAGE_BYTES;

        if (args.length > 0) {
            host = args[0];
        }
        if (args.length > 1) {
            port = ConfigLoader.port(args[1]);
        }
        return new ClientConfig(host, port, codec, maxMessageBytes);
    }
}

package org.chatrelay.server;

import org.chatrelay.codec.CodecType;
import org.chatrelay.config.ConfigLoader;

import java.util.Objects;
import java.util.Properties;

/**
 * Listen address and wire settings of the relay.
 */
public record ServerConfig(String host, int port, CodecType codec, int maxMessageBytes) {

    public static final String DEFAULT_HOST = "0.0.0.0";

    public ServerConfig {
        host = ConfigLoader.host(host);
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range 0..65535: " + port);
        }
        Objects.requireNonNull(codec, "codec");
        if (maxMessageBytes < 1) {
            throw new IllegalArgumentException("maxMessageBytes must be at least 1: " + maxMessageBytes);
        }
    }

    public static ServerConfig defaults() {
        return new ServerConfig(DEFAULT_HOST, ConfigLoader.DEFAULT_PORT, CodecType.LINE, ConfigLoader.DEFAULT_MAX_MESSAGE_BYTES);
    }

    /**
     * Resolves defaults, then {@code chat-relay.properties}, then system properties, then
     * the positional arguments {@code [port] [host]}.
     */
    public static ServerConfig load(String[] args) {
        return from(ConfigLoader.load(), args);
    }

    static ServerConfig from(Properties props, String[] args) {
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
            port = ConfigLoader.port(args[0]);
        }
        if (args.length > 1) {
            host = args[1];
        }
        return new ServerConfig(host, port, codec, maxMessageBytes);
    }

    public ServerConfig withPort(int newPort) {
        return new ServerConfig(host, newPort, codec, maxMessageBytes);
    }

    public ServerConfig withCodec(CodecType newCodec) {
        return new ServerConfig(host, port, newCodec, maxMessageBytes);
    }
}

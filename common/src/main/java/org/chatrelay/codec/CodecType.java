package org.chatrelay.codec;

import java.util.Locale;

/**
 * The wire framings a relay and its clients can agree on.
 */
public enum CodecType {
    LINE {
        @Override
        public MessageCodec create(int maxMessageBytes) {
            return new LineMessageCodec(maxMessageBytes);
        }
    },
    LENGTH_PREFIXED {
        @Override
        public MessageCodec create(int maxMessageBytes) {
            return new LengthPrefixedMessageCodec(maxMessageBytes);
        }
    };

    public abstract MessageCodec create(int maxMessageBytes);

    /**
     * Case-insensitive lookup that also accepts {@code length-prefixed}.
     */
    public static CodecType parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Codec name is empty");
        }
        String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (CodecType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown codec: " + name);
    }
}

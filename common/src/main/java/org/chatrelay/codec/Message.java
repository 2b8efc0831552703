package org.chatrelay.codec;

import java.util.Objects;

/**
 * One chat message as it travels through the relay. The sender is not part of the payload.
 */
public record Message(String text) {

    public Message {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String toString() {
        return "Message[" + text + "]";
    }
}

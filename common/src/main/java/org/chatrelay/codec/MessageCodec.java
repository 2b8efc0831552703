package org.chatrelay.codec;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Frames text messages on a byte stream. Implementations hold no per-stream state,
 * so one instance can serve every connection.
 */
public interface MessageCodec {

    /**
     * Writes exactly one message and flushes the stream.
     */
    void send(OutputStream out, String text) throws IOException;

    /**
     * Blocks until one whole message has been read.
     *
     * @throws EOFException if the stream ends cleanly before the first byte of a message
     * @throws IOException  on a truncated or oversized frame, or any transport failure
     */
    String receive(InputStream in) throws IOException;
}

package org.chatrelay.codec;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Newline-terminated UTF-8 text, one message per line. A trailing carriage return is dropped
 * on receive so that telnet-style clients work as well.
 */
public class LineMessageCodec implements MessageCodec {

    private final int maxMessageBytes;

    public LineMessageCodec(int maxMessageBytes) {
        if (maxMessageBytes < 1) {
            throw new IllegalArgumentException("maxMessageBytes must be positive: " + maxMessageBytes);
        }
        this.maxMessageBytes = maxMessageBytes;
    }

    @Override
    public void send(OutputStream out, String text) throws IOException {
        if (text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("A line message cannot contain a line break");
        }
        byte[] payload = text.getBytes(StandardCharsets.UTF_8);
        if (payload.length > maxMessageBytes) {
            throw new IllegalArgumentException("Message of " + payload.length + " bytes exceeds limit of " + maxMessageBytes);
        }
        out.write(payload);
        out.write('\n');
        out.flush();
    }

    @Override
    public String receive(InputStream in) throws IOException {
        byte[] bytes = new byte[Math.min(256, maxMessageBytes + 1)];
        int len = 0;
        while (true) {
            int next = in.read();
            if (next == -1) {
                if (len == 0) {
                    throw new EOFException("Stream closed");
                }
                throw new EOFException("Stream closed in the middle of a line");
            }
            if (next == '\n') {
                if (len > 0 && bytes[len - 1] == '\r') {
                    len--;
                }
                if (len > maxMessageBytes) {
                    throw new IOException("Line exceeds limit of " + maxMessageBytes + " bytes");
                }
                return Utf8.decode(bytes, len);
            }
            if (len > 0 && bytes[len - 1] == '\r') {
                throw new IOException("Carriage return inside a line");
            }
            // one spare byte for a '\r' that may precede the terminator
            if (len > maxMessageBytes) {
                throw new IOException("Line exceeds limit of " + maxMessageBytes + " bytes");
            }
            if (len >= bytes.length) {
                bytes = Arrays.copyOf(bytes, Math.min(len * 2, maxMessageBytes + 1));
            }
            bytes[len++] = (byte) next;
        }
    }
}

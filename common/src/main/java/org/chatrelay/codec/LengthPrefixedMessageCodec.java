package org.chatrelay.codec;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * A 4-byte big-endian length followed by that many bytes of UTF-8. Round-trips any text,
 * line breaks included.
 */
public class LengthPrefixedMessageCodec implements MessageCodec {

    private final int maxMessageBytes;

    public LengthPrefixedMessageCodec(int maxMessageBytes) {
        if (maxMessageBytes < 1) {
            throw new IllegalArgumentException("maxMessageBytes must be positive: " + maxMessageBytes);
        }
        this.maxMessageBytes = maxMessageBytes;
    }

    @Override
    public void send(OutputStream out, String text) throws IOException {
        byte[] payload = text.getBytes(StandardCharsets.UTF_8);
        if (payload.length > maxMessageBytes) {
            throw new IllegalArgumentException("Message of " + payload.length + " bytes exceeds limit of " + maxMessageBytes);
        }
        ByteBuffer frame = ByteBuffer.allocate(Integer.BYTES + payload.length);
        frame.putInt(payload.length);
        frame.put(payload);
        out.write(frame.array());
        out.flush();
    }

    @Override
    public String receive(InputStream in) throws IOException {
        int first = in.read();
        if (first == -1) {
            throw new EOFException("Stream closed");
        }
        DataInputStream data = new DataInputStream(in);
        byte[] rest = new byte[Integer.BYTES - 1];
        data.readFully(rest);
        int length = (first << 24) | ((rest[0] & 0xFF) << 16) | ((rest[1] & 0xFF) << 8) | (rest[2] & 0xFF);
        if (length < 0 || length > maxMessageBytes) {
            throw new IOException("Frame length " + length + " outside 0.." + maxMessageBytes);
        }
        byte[] payload = new byte[length];
        data.readFully(payload);
        return Utf8.decode(payload, length);
    }
}

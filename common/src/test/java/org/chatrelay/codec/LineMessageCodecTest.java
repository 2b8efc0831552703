package org.chatrelay.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class LineMessageCodecTest {

    private final LineMessageCodec codec = new LineMessageCodec(16);

    @Test
    void sendAppendsNewline() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        codec.send(out, "héllo");
        assertEquals("héllo\n", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void receiveReadsConsecutiveLines() throws IOException {
        InputStream in = stream("first\nsecond\r\n\n");
        assertEquals("first", codec.receive(in));
        assertEquals("second", codec.receive(in));
        assertEquals("", codec.receive(in));
        assertThrows(EOFException.class, () -> codec.receive(in));
    }

    @Test
    void receiveRejectsTruncatedLine() {
        EOFException error = assertThrows(EOFException.class, () -> codec.receive(stream("partial")));
        assertEquals("Stream closed in the middle of a line", error.getMessage());
    }

    @Test
    void receiveAcceptsLineAtLimitWithCarriageReturn() throws IOException {
        assertEquals("0123456789abcdef", codec.receive(stream("0123456789abcdef\r\n")));
    }

    @Test
    void receiveRejectsOversizedLine() {
        assertThrows(IOException.class, () -> codec.receive(stream("0123456789abcdefg\n")));
        assertThrows(IOException.class, () -> codec.receive(stream("0123456789abcdefghijklmnop\n")));
    }

    @Test
    void receiveRejectsCarriageReturnInsideLine() {
        IOException error = assertThrows(IOException.class, () -> codec.receive(stream("a\rb\n")));
        assertEquals("Carriage return inside a line", error.getMessage());
        assertThrows(IOException.class, () -> codec.receive(stream("a\r\r\n")));
    }

    @Test
    void receiveRejectsMalformedUtf8AtLimit() {
        byte[] raw = new byte[17];
        Arrays.fill(raw, 0, 16, (byte) 0xFF);
        raw[16] = '\n';
        IOException error = assertThrows(IOException.class, () -> codec.receive(new ByteArrayInputStream(raw)));
        assertEquals("Message is not valid UTF-8", error.getMessage());
    }

    @Test
    void receivedLinesCanBeSentAgainUnchanged() throws IOException {
        // "é" is two bytes, so eight of them fill the 16 byte limit exactly
        for (String wire : List.of("plain\n", "éééééééé\n", "éééééééé\r\n", "\n", "tab\there\n")) {
            String text = codec.receive(stream(wire));
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            codec.send(out, text);
            assertEquals(wire.replace("\r\n", "\n"), out.toString(StandardCharsets.UTF_8));
        }
    }

    @Test
    void sendRejectsLineBreaks() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        assertThrows(IllegalArgumentException.class, () -> codec.send(out, "two\nlines"));
        assertThrows(IllegalArgumentException.class, () -> codec.send(out, "carriage\rreturn"));
        assertEquals(0, out.size());
    }

    @Test
    void sendRejectsOversizedMessage() {
        assertThrows(IllegalArgumentException.class,
                () -> codec.send(new ByteArrayOutputStream(), "0123456789abcdefg"));
    }

    @Test
    void constructorRejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> new LineMessageCodec(0));
    }

    private static InputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}

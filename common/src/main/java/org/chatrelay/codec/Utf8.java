package org.chatrelay.codec;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Strict UTF-8 decoding. Malformed input is a framing error instead of U+FFFD, so a decoded
 * message always re-encodes to the bytes it came from.
 */
final class Utf8 {

    private Utf8() {
    }

    static String decode(byte[] bytes, int length) throws IOException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes, 0, length))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new IOException("Message is not valid UTF-8", e);
        }
    }
}

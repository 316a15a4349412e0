package de.mirkosertic.mcp.knowledgebase.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Strict UTF-8 decoding. Unlike {@code new String(bytes, UTF_8)}, malformed input is
 * reported instead of being replaced with U+FFFD, so binary files are recognized as
 * not being text.
 */
public final class TextDecoder {

    private TextDecoder() {
    }

    /**
     * Decode the given bytes as UTF-8.
     *
     * @param bytes raw file or body bytes
     * @return the decoded text
     * @throws CharacterCodingException if the bytes are not valid UTF-8
     */
    public static String decodeUtf8(final byte[] bytes) throws CharacterCodingException {
        final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        return decoder.decode(ByteBuffer.wrap(bytes)).toString();
    }
}

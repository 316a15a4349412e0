package de.mirkosertic.mcp.knowledgebase.util;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Computes the content digest used for every "did this source change" decision.
 */
public final class ContentHasher {

    private ContentHasher() {
    }

    /**
     * Normalize the given text and return the lowercase hex SHA-256 digest of its UTF-8 bytes.
     *
     * @param text raw decoded text
     * @return 64 character hex digest
     */
    public static String hash(final String text) {
        return hashNormalized(ContentNormalizer.normalize(text));
    }

    /**
     * Digest of text that has already been passed through {@link ContentNormalizer#normalize(String)}.
     */
    public static String hashNormalized(final String normalizedText) {
        return Hashing.sha256().hashString(normalizedText, StandardCharsets.UTF_8).toString();
    }
}

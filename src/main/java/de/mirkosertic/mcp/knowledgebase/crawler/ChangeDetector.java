package de.mirkosertic.mcp.knowledgebase.crawler;

import de.mirkosertic.mcp.knowledgebase.cache.CacheRecord;
import de.mirkosertic.mcp.knowledgebase.util.ContentHasher;
import de.mirkosertic.mcp.knowledgebase.util.TextDecoder;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.util.Objects;

/**
 * Classifies a file against its cached record. The size and modification time
 * fingerprint is checked first so that untouched files are never read.
 */
public class ChangeDetector {

    private final long maxSourceBytes;

    public ChangeDetector(final long maxSourceBytes) {
        this.maxSourceBytes = maxSourceBytes;
    }

    /**
     * @throws CharacterCodingException the file is not valid UTF-8 text
     * @throws SourceRejectedException  the file exceeds the configured maximum size
     * @throws IOException              the file could not be read
     */
    public FileChange detect(final FileSource source, final @Nullable CacheRecord cached) throws IOException {
        if (cached != null
                && Objects.equals(cached.getSizeBytes(), source.sizeBytes())
                && Objects.equals(cached.getMtimeNs(), source.mtimeNs())) {
            return new FileChange(FileChange.Kind.UNCHANGED, source, null, cached.getContentHash());
        }

        if (source.sizeBytes() > maxSourceBytes) {
            throw new SourceRejectedException("File has " + source.sizeBytes()
                    + " bytes, more than the allowed " + maxSourceBytes);
        }

        final String text = TextDecoder.decodeUtf8(Files.readAllBytes(source.path()));
        final String hash = ContentHasher.hash(text);

        if (cached == null) {
            return new FileChange(FileChange.Kind.NEW, source, text, hash);
        }
        if (hash.equals(cached.getContentHash())) {
            return new FileChange(FileChange.Kind.METADATA_ONLY, source, text, hash);
        }
        return new FileChange(FileChange.Kind.CHANGED, source, text, hash);
    }

    /**
     * A source that is readable but must not enter the knowledge base.
     */
    public static class SourceRejectedException extends IOException {

        public SourceRejectedException(final String message) {
            super(message);
        }
    }
}

package de.mirkosertic.mcp.knowledgebase.crawler;

import java.nio.file.Path;

/**
 * A file found by the {@link SourceEnumerator}, with the fingerprint taken during the walk.
 */
public record FileSource(
        /** Path relative to the sources directory, always with '/' separators. */
        String sourceId,
        Path path,
        long sizeBytes,
        /** Modification time in nanoseconds since the epoch. */
        long mtimeNs
) {
}

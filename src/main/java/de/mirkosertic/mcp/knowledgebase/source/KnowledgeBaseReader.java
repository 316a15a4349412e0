package de.mirkosertic.mcp.knowledgebase.source;

import de.mirkosertic.mcp.knowledgebase.cache.FetchStatus;
import de.mirkosertic.mcp.knowledgebase.index.IndexEntry;
import de.mirkosertic.mcp.knowledgebase.index.IndexParser;
import de.mirkosertic.mcp.knowledgebase.util.TextDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * Read side of the knowledge base. Only looks at the persisted index and at the sources
 * themselves, never at the in-flight state of an update pass.
 */
public class KnowledgeBaseReader {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeBaseReader.class);

    private final Path sourcesDir;
    private final Path indexPath;
    private final ContentFetcher fetcher;

    public KnowledgeBaseReader(final Path sourcesDir, final Path indexPath, final ContentFetcher fetcher) {
        this.sourcesDir = sourcesDir;
        this.indexPath = indexPath;
        this.fetcher = fetcher;
    }

    /**
     * @return the persisted index text, or an empty string if no index was written yet
     */
    public String loadIndexText() throws IOException {
        if (!Files.exists(indexPath)) {
            return "";
        }
        return Files.readString(indexPath, StandardCharsets.UTF_8);
    }

    public List<IndexEntry> loadIndexEntries() throws IOException {
        return IndexParser.parse(loadIndexText());
    }

    /**
     * Load the full text of a source named in the index.
     *
     * @param sourceId a URL, or a file path relative to the sources directory
     * @return the current text of the source
     * @throws NoSuchFileException      the file does not exist
     * @throws CharacterCodingException the file is not valid UTF-8
     * @throws IOException              the source is empty or could not be read or fetched
     * @throws IllegalArgumentException the path points outside the sources directory
     */
    public SourceContent loadSourceContent(final String sourceId) throws IOException {
        final String trimmed = sourceId.strip();
        if (isUrl(trimmed)) {
            return loadUrl(trimmed);
        }
        return loadFile(trimmed);
    }

    static boolean isUrl(final String sourceId) {
        return sourceId.startsWith("http://") || sourceId.startsWith("https://");
    }

    private SourceContent loadUrl(final String url) throws IOException {
        final FetchResult result = fetcher.fetch(url, null, null);
        if (result.status() != FetchStatus.SUCCESS || result.bodyText() == null || result.bodyText().isBlank()) {
            logger.warn("Failed to load URL source {}: status={}, error={}", url, result.status(), result.errorMessage());
            throw new IOException("Failed to load URL source content: " + url);
        }
        return new SourceContent(url, result.bodyText());
    }

    private SourceContent loadFile(final String sourceId) throws IOException {
        final Path root = sourcesDir.toAbsolutePath().normalize();
        final Path file = resolveFile(root, sourceId);

        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(sourceId, null, "Knowledge base file source not found");
        }

        final String text;
        try {
            text = TextDecoder.decodeUtf8(Files.readAllBytes(file));
        } catch (final CharacterCodingException e) {
            logger.warn("Source {} is not valid UTF-8", sourceId);
            throw e;
        }
        if (text.isBlank()) {
            throw new IOException("Knowledge base file source is empty: " + sourceId);
        }
        return new SourceContent(sourceId, text);
    }

    private Path resolveFile(final Path root, final String sourceId) {
        final Path raw = Path.of(sourceId).normalize();
        if (raw.isAbsolute() && raw.startsWith(root)) {
            return raw;
        }
        // Everything else, including "/docs/a.md", is taken as relative to the root
        final Path resolved = root.resolve(normalizeSourceId(sourceId)).normalize();
        if (!resolved.startsWith(root)) {
            logger.warn("Rejected source {} outside of sources directory {}", sourceId, root);
            throw new IllegalArgumentException("File source is outside the sources directory: " + sourceId);
        }
        return resolved;
    }

    /**
     * Turn a possibly sloppy file identifier into a path relative to the sources directory:
     * backslashes become slashes, leading slashes are dropped and a leading copy of the
     * sources directory path is removed.
     */
    String normalizeSourceId(final String sourceId) {
        String normalized = sourceId.strip().replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        String prefix = sourcesDir.toString().replace('\\', '/');
        while (prefix.startsWith("/")) {
            prefix = prefix.substring(1);
        }
        while (prefix.endsWith("/")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        if (!prefix.isEmpty() && normalized.startsWith(prefix + "/")) {
            normalized = normalized.substring(prefix.length() + 1);
        }
        return normalized;
    }
}

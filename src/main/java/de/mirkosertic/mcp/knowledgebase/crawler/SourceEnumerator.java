package de.mirkosertic.mcp.knowledgebase.crawler;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Lists the sources that currently make up the knowledge base: the files below the
 * sources directory and the URLs of the link list. Enumeration never reads file
 * contents and never touches the cache.
 */
public class SourceEnumerator {

    private static final Logger logger = LoggerFactory.getLogger(SourceEnumerator.class);

    private final Path sourcesDir;
    private final Path linksFile;
    private final FilePatternMatcher matcher;

    public SourceEnumerator(final Path sourcesDir, final Path linksFile, final FilePatternMatcher matcher) {
        this.sourcesDir = sourcesDir.toAbsolutePath().normalize();
        this.linksFile = linksFile.toAbsolutePath().normalize();
        this.matcher = matcher;
    }

    /**
     * All knowledge base files below the sources directory.
     *
     * @throws NoSuchFileException if the sources directory does not exist
     */
    public List<FileSource> listFiles() throws IOException {
        if (!Files.isDirectory(sourcesDir)) {
            throw new NoSuchFileException(sourcesDir.toString(), null, "Sources directory does not exist");
        }
        return walk(sourcesDir);
    }

    /**
     * Knowledge base files at or below the given relative path. A path that no longer
     * exists yields an empty list, which the caller treats as a deletion.
     */
    public List<FileSource> listFiles(final String relativePath) throws IOException {
        if (!Files.isDirectory(sourcesDir)) {
            throw new NoSuchFileException(sourcesDir.toString(), null, "Sources directory does not exist");
        }
        final Path target = sourcesDir.resolve(relativePath).normalize();
        if (!target.startsWith(sourcesDir)) {
            throw new IllegalArgumentException("Path is outside the sources directory: " + relativePath);
        }
        if (Files.isDirectory(target)) {
            final Path relative = sourcesDir.relativize(target);
            if (!matcher.shouldDescend(relative)) {
                return List.of();
            }
            return walk(target);
        }
        if (!Files.isRegularFile(target)) {
            return List.of();
        }
        final BasicFileAttributes attrs = Files.readAttributes(target, BasicFileAttributes.class);
        final List<FileSource> result = new ArrayList<>(1);
        accept(target, attrs, result);
        return result;
    }

    private List<FileSource> walk(final Path start) throws IOException {
        final List<FileSource> result = new ArrayList<>();
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) {
                if (matcher.shouldDescend(sourcesDir.relativize(dir))) {
                    return FileVisitResult.CONTINUE;
                }
                logger.debug("Skipping directory {}", dir);
                return FileVisitResult.SKIP_SUBTREE;
            }

            @Override
            public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    accept(file, attrs, result);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(final Path file, final IOException exc) {
                logger.warn("Cannot access {}, skipping: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        return result;
    }

    private void accept(final Path file, final BasicFileAttributes attrs, final List<FileSource> result) {
        final Path absolute = file.toAbsolutePath().normalize();
        if (absolute.equals(linksFile)) {
            return;
        }
        final Path relative = sourcesDir.relativize(absolute);
        if (!matcher.shouldInclude(relative)) {
            return;
        }
        result.add(new FileSource(
                toSourceId(relative),
                absolute,
                attrs.size(),
                attrs.lastModifiedTime().to(TimeUnit.NANOSECONDS)));
    }

    static String toSourceId(final Path relative) {
        final StringBuilder id = new StringBuilder();
        for (final Path segment : relative) {
            if (!id.isEmpty()) {
                id.append('/');
            }
            id.append(segment);
        }
        return id.toString();
    }

    /**
     * URLs of the link list in file order. Blank lines and lines starting with '#' are
     * ignored, repeated URLs are listed once. A missing link list means no URLs.
     */
    public List<String> listUrls() throws IOException {
        if (!Files.exists(linksFile)) {
            logger.debug("No link list at {}", linksFile);
            return List.of();
        }
        final Set<String> urls = new LinkedHashSet<>();
        for (final String line : Files.readAllLines(linksFile, StandardCharsets.UTF_8)) {
            final String url = line.strip();
            if (!url.isEmpty() && !url.startsWith("#")) {
                urls.add(url);
            }
        }
        return new ArrayList<>(urls);
    }

    /**
     * Source id of an absolute path below the sources directory, or null if it is outside.
     */
    public @Nullable String sourceIdOf(final Path absolutePath) {
        final Path normalized = absolutePath.toAbsolutePath().normalize();
        if (!normalized.startsWith(sourcesDir) || normalized.equals(sourcesDir)) {
            return null;
        }
        return toSourceId(sourcesDir.relativize(normalized));
    }

    public Path getSourcesDir() {
        return sourcesDir;
    }

    public Path getLinksFile() {
        return linksFile;
    }
}

package de.mirkosertic.mcp.knowledgebase.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Replaces a file so that readers observe either the complete old or the complete new
 * content. The data goes to a temporary sibling first, is forced to disk and is then
 * renamed over the target.
 */
public class AtomicFileWriter {

    private static final Logger logger = LoggerFactory.getLogger(AtomicFileWriter.class);

    public void writeString(final Path target, final String content) throws IOException {
        write(target, content.getBytes(StandardCharsets.UTF_8));
    }

    public void write(final Path target, final byte[] content) throws IOException {
        final Path absoluteTarget = target.toAbsolutePath();
        final Path directory = absoluteTarget.getParent();
        Files.createDirectories(directory);

        final Path temp = Files.createTempFile(directory, "." + absoluteTarget.getFileName() + ".", ".tmp");
        boolean moved = false;
        try {
            try (final FileChannel channel = FileChannel.open(temp,
                    StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                final ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            move(temp, absoluteTarget);
            moved = true;
        } finally {
            if (!moved) {
                try {
                    Files.deleteIfExists(temp);
                } catch (final IOException e) {
                    logger.warn("Could not remove temporary file {}", temp, e);
                }
            }
        }
    }

    /**
     * Rename step, separate so that tests can simulate a crash between writing and renaming.
     */
    protected void move(final Path source, final Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (final AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, falling back to plain replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}

package de.mirkosertic.mcp.knowledgebase.crawler;

import java.nio.file.Path;

public interface FileChangeListener {

    /**
     * A file or directory appeared.
     */
    void onFileCreated(Path path);

    void onFileModified(Path path);

    void onFileDeleted(Path path);
}

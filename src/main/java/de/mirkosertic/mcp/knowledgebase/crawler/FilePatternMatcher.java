package de.mirkosertic.mcp.knowledgebase.crawler;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;

/**
 * Decides which files below the sources directory belong to the knowledge base.
 * Include patterns are matched against the file name and the relative path, exclude
 * patterns against the relative path, both bare and rooted at "/" so that patterns like
 * {@code **}{@code /node_modules/**} also hit top level directories. Hidden files and directories
 * (any path segment starting with a dot) never belong to the knowledge base.
 */
public class FilePatternMatcher {

    private final List<PathMatcher> includeMatchers;
    private final List<PathMatcher> excludeMatchers;

    public FilePatternMatcher(final List<String> includePatterns, final List<String> excludePatterns) {
        this.includeMatchers = includePatterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
        this.excludeMatchers = excludePatterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
    }

    /**
     * @param relativePath candidate file, relative to the sources directory
     */
    public boolean shouldInclude(final Path relativePath) {
        if (isHidden(relativePath) || isExcluded(relativePath)) {
            return false;
        }

        // If no include patterns specified, include all (except excluded)
        if (includeMatchers.isEmpty()) {
            return true;
        }

        final Path fileName = relativePath.getFileName();
        for (final PathMatcher includeMatcher : includeMatchers) {
            if ((fileName != null && includeMatcher.matches(fileName)) || includeMatcher.matches(relativePath)) {
                return true;
            }
        }

        return false;
    }

    /**
     * Whether the walk should enter the given directory at all.
     */
    public boolean shouldDescend(final Path relativePath) {
        if (relativePath.toString().isEmpty()) {
            return true;
        }
        return !isHidden(relativePath) && !isExcluded(relativePath);
    }

    private boolean isExcluded(final Path relativePath) {
        final Path rooted = relativePath.getFileSystem().getPath("/").resolve(relativePath);
        for (final PathMatcher excludeMatcher : excludeMatchers) {
            if (excludeMatcher.matches(relativePath) || excludeMatcher.matches(rooted)) {
                return true;
            }
        }
        return false;
    }

    static boolean isHidden(final Path relativePath) {
        for (final Path segment : relativePath) {
            if (segment.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}

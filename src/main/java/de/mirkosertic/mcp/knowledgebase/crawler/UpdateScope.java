package de.mirkosertic.mcp.knowledgebase.crawler;

import org.jspecify.annotations.Nullable;

/**
 * What an update pass looks at. All triggers run the same pass, only the scope differs.
 */
public record UpdateScope(Kind kind, @Nullable String relativePath, boolean refreshUrls) {

    public enum Kind {
        /** Manual reindex or startup sync: all files, link list diff, manual URL budget. */
        FULL,
        /** Debounced file event: one file or subtree, no URLs. */
        FILE,
        /** Debounced link list event: link list diff only, new URLs are not fetched yet. */
        LINK_LIST,
        /** Scheduler tick: link list diff plus refresh within the tick budget. */
        REFRESH_TICK
    }

    public static UpdateScope full() {
        return new UpdateScope(Kind.FULL, null, true);
    }

    public static UpdateScope full(final boolean refreshUrls) {
        return new UpdateScope(Kind.FULL, null, refreshUrls);
    }

    public static UpdateScope file(final String relativePath) {
        return new UpdateScope(Kind.FILE, relativePath, false);
    }

    public static UpdateScope linkList() {
        return new UpdateScope(Kind.LINK_LIST, null, false);
    }

    public static UpdateScope refreshTick() {
        return new UpdateScope(Kind.REFRESH_TICK, null, true);
    }

    public boolean includesFiles() {
        return kind == Kind.FULL || kind == Kind.FILE;
    }

    public boolean includesLinkList() {
        return kind != Kind.FILE;
    }

    @Override
    public String toString() {
        return relativePath == null ? kind.name() : kind.name() + "(" + relativePath + ")";
    }
}

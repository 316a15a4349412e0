package de.mirkosertic.mcp.knowledgebase.source;

import de.mirkosertic.mcp.knowledgebase.cache.FetchStatus;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of one fetch. {@code bodyText} is only present for {@link FetchStatus#SUCCESS};
 * the validators are whatever the server sent with that response.
 */
public record FetchResult(
        FetchStatus status,
        @Nullable String bodyText,
        @Nullable String etag,
        @Nullable String lastModified,
        @Nullable String errorMessage
) {

    public static FetchResult success(final String bodyText, final @Nullable String etag,
                                      final @Nullable String lastModified) {
        return new FetchResult(FetchStatus.SUCCESS, bodyText, etag, lastModified, null);
    }

    public static FetchResult notModified(final @Nullable String etag, final @Nullable String lastModified) {
        return new FetchResult(FetchStatus.NOT_MODIFIED, null, etag, lastModified, null);
    }

    public static FetchResult timeout(final String message) {
        return new FetchResult(FetchStatus.TIMEOUT, null, null, null, message);
    }

    public static FetchResult error(final String message) {
        return new FetchResult(FetchStatus.ERROR, null, null, null, message);
    }
}

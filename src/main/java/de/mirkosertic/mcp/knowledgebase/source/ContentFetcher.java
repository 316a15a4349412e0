package de.mirkosertic.mcp.knowledgebase.source;

import org.jspecify.annotations.Nullable;

/**
 * Retrieves the text of a web source. Passing the validators of the previous response
 * turns the request into a conditional one.
 */
public interface ContentFetcher {

    /**
     * Fetch the given URL. Implementations report every outcome through the result and
     * do not throw.
     *
     * @param url          the URL exactly as listed
     * @param etag         entity tag of the previous successful response, if any
     * @param lastModified Last-Modified value of the previous successful response, if any
     */
    FetchResult fetch(String url, @Nullable String etag, @Nullable String lastModified);
}

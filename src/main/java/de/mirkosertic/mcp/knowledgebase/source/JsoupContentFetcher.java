package de.mirkosertic.mcp.knowledgebase.source;

import org.jspecify.annotations.Nullable;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;

/**
 * {@link ContentFetcher} backed by jsoup. HTML pages are reduced to their visible text,
 * other content types are passed through as text.
 */
public class JsoupContentFetcher implements ContentFetcher {

    private static final Logger logger = LoggerFactory.getLogger(JsoupContentFetcher.class);

    private static final int HTTP_NOT_MODIFIED = 304;

    private final String userAgent;
    private final int timeoutMs;
    private final long maxBodyBytes;

    public JsoupContentFetcher(final String userAgent, final long timeoutMs, final long maxBodyBytes) {
        this.userAgent = userAgent;
        this.timeoutMs = (int) Math.min(Integer.MAX_VALUE, timeoutMs);
        this.maxBodyBytes = maxBodyBytes;
    }

    @Override
    public FetchResult fetch(final String url, final @Nullable String etag, final @Nullable String lastModified) {
        try {
            final Connection connection = Jsoup.connect(url)
                    .userAgent(userAgent)
                    .timeout(timeoutMs)
                    // One byte above the limit so oversized bodies can be detected instead of silently truncated
                    .maxBodySize((int) Math.min(Integer.MAX_VALUE - 1L, maxBodyBytes) + 1)
                    .ignoreHttpErrors(true)
                    .ignoreContentType(true)
                    .followRedirects(true);
            if (etag != null) {
                connection.header("If-None-Match", etag);
            }
            if (lastModified != null) {
                connection.header("If-Modified-Since", lastModified);
            }

            final Connection.Response response = connection.execute();
            final int status = response.statusCode();
            final String responseEtag = response.header("ETag");
            final String responseLastModified = response.header("Last-Modified");

            if (status == HTTP_NOT_MODIFIED) {
                logger.debug("Not modified: {}", url);
                return FetchResult.notModified(responseEtag, responseLastModified);
            }
            if (status < 200 || status >= 300) {
                return FetchResult.error("HTTP " + status + " " + response.statusMessage());
            }

            final byte[] body = response.bodyAsBytes();
            if (body.length > maxBodyBytes) {
                return FetchResult.error("Response body exceeds " + maxBodyBytes + " bytes");
            }

            final String text = isHtml(response.contentType()) ? htmlToText(response.parse()) : response.body();
            return FetchResult.success(text, responseEtag, responseLastModified);
        } catch (final SocketTimeoutException e) {
            return FetchResult.timeout("Timed out after " + timeoutMs + "ms: " + e.getMessage());
        } catch (final IOException | IllegalArgumentException e) {
            return FetchResult.error(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static boolean isHtml(final @Nullable String contentType) {
        return contentType == null || contentType.toLowerCase().contains("html");
    }

    static String htmlToText(final Document document) {
        document.select("script, style, noscript, template").remove();
        final StringBuilder text = new StringBuilder();
        final String title = document.title();
        if (!title.isBlank()) {
            text.append(title.strip()).append("\n\n");
        }
        final Element body = document.body();
        text.append(body != null ? body.text() : document.text());
        return text.toString();
    }
}

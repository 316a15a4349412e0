package de.mirkosertic.mcp.knowledgebase.cache;

/**
 * An update pass could not run to completion. The durable cache and index are left
 * exactly as they were before the pass started.
 */
public class UpdateAbortedException extends Exception {

    public UpdateAbortedException(final String message) {
        super(message);
    }

    public UpdateAbortedException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

package de.mirkosertic.mcp.knowledgebase.source;

public class SummarizationException extends Exception {

    public SummarizationException(final String message) {
        super(message);
    }

    public SummarizationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

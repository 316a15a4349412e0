package de.mirkosertic.mcp.knowledgebase.source;

/**
 * Produces the short description of a source that ends up in the knowledge base index.
 * Implementations are typically slow and may be backed by a paid service, so the update
 * pass only calls them when a source's normalized content actually changed.
 */
public interface Summarizer {

    /**
     * @param sourceId identifier of the source (relative file path or URL)
     * @param text     full decoded text of the source
     * @return the summary, never blank
     * @throws SummarizationException when no summary could be produced this time
     */
    String summarize(String sourceId, String text) throws SummarizationException;
}

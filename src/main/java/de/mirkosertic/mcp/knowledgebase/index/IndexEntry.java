package de.mirkosertic.mcp.knowledgebase.index;

/**
 * One block of the knowledge base index: the source identifier and its summary.
 */
public record IndexEntry(String sourceId, String description) {
}

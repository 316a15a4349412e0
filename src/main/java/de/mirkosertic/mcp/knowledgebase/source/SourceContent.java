package de.mirkosertic.mcp.knowledgebase.source;

public record SourceContent(String sourceId, String text) {
}

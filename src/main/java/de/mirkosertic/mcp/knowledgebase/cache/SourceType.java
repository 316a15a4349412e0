package de.mirkosertic.mcp.knowledgebase.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum SourceType {
    @JsonProperty("file")
    FILE,
    @JsonProperty("url")
    URL
}

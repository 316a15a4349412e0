package de.mirkosertic.mcp.knowledgebase.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of the most recent fetch of a URL source.
 */
public enum FetchStatus {
    @JsonProperty("success")
    SUCCESS,
    @JsonProperty("not_modified")
    NOT_MODIFIED,
    @JsonProperty("timeout")
    TIMEOUT,
    @JsonProperty("error")
    ERROR;

    public boolean isFailure() {
        return this == TIMEOUT || this == ERROR;
    }
}

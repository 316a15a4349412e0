package de.mirkosertic.mcp.knowledgebase.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.RecordComponent;
import java.util.List;

/**
 * Wraps response records into MCP tool results. Responses are serialized to JSON; a
 * {@code success} component that is false marks the result as an error.
 */
public final class ToolResultHelper {

    private static final Logger logger = LoggerFactory.getLogger(ToolResultHelper.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ToolResultHelper() {
    }

    public static McpSchema.CallToolResult createResult(final Object response) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(toJson(response))))
                .isError(isErrorResponse(response))
                .build();
    }

    public static String toJson(final Object obj) {
        try {
            return OBJECT_MAPPER.writeValueAsString(obj);
        } catch (final JsonProcessingException e) {
            logger.error("Failed to serialize tool response of type {}", obj.getClass().getName(), e);
            return "{\"success\":false,\"error\":\"JSON serialization error: " + escapeJson(e.getMessage()) + "\"}";
        }
    }

    static boolean isErrorResponse(final Object response) {
        if (!(response instanceof Record record)) {
            return false;
        }
        for (final RecordComponent component : record.getClass().getRecordComponents()) {
            if (!"success".equals(component.getName())) {
                continue;
            }
            try {
                final Object value = component.getAccessor().invoke(record);
                return value instanceof Boolean success && !success;
            } catch (final ReflectiveOperationException e) {
                logger.warn("Cannot read success flag of {}", record.getClass().getName(), e);
                return false;
            }
        }
        return false;
    }

    private static String escapeJson(final String str) {
        if (str == null) {
            return "";
        }
        return str.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}

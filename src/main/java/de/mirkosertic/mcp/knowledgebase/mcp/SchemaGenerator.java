package de.mirkosertic.mcp.knowledgebase.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives MCP tool input schemas from request records. Components annotated with
 * {@link Nullable} are optional, all others are required.
 */
public final class SchemaGenerator {

    private SchemaGenerator() {
    }

    public static McpSchema.JsonSchema generateSchema(final Class<? extends Record> recordClass) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        final List<String> required = new ArrayList<>();

        for (final RecordComponent component : recordClass.getRecordComponents()) {
            properties.put(component.getName(), propertySchema(component));
            if (!isNullable(component)) {
                required.add(component.getName());
            }
        }

        return new McpSchema.JsonSchema("object", properties, required, null, null, null);
    }

    /**
     * Schema for tools that take no parameters.
     */
    public static McpSchema.JsonSchema emptySchema() {
        return new McpSchema.JsonSchema("object", Map.of(), List.of(), null, null, null);
    }

    private static boolean isNullable(final RecordComponent component) {
        // jspecify's @Nullable is a type-use annotation, so look at the annotated type as well
        return component.isAnnotationPresent(Nullable.class)
                || component.getAnnotatedType().isAnnotationPresent(Nullable.class);
    }

    private static Map<String, Object> propertySchema(final RecordComponent component) {
        final Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", jsonType(component.getType()));

        if (component.getType().isEnum()) {
            final List<String> values = new ArrayList<>();
            for (final Object constant : component.getType().getEnumConstants()) {
                values.add(((Enum<?>) constant).name());
            }
            schema.put("enum", values);
        }

        final Description description = component.getAnnotation(Description.class);
        if (description != null) {
            schema.put("description", description.value());
        }
        return schema;
    }

    static String jsonType(final Class<?> clazz) {
        if (clazz == String.class || clazz.isEnum()) {
            return "string";
        }
        if (clazz == Integer.class || clazz == int.class || clazz == Long.class || clazz == long.class) {
            return "integer";
        }
        if (clazz == Double.class || clazz == double.class || clazz == Float.class || clazz == float.class) {
            return "number";
        }
        if (clazz == Boolean.class || clazz == boolean.class) {
            return "boolean";
        }
        if (List.class.isAssignableFrom(clazz) || clazz.isArray()) {
            return "array";
        }
        return "object";
    }
}

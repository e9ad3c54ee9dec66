package de.mirkosertic.mcp.reranklearn.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates the JSON input schema of a tool from a request record.
 * <p>
 * Only flat records are supported; tool requests never nest. Components annotated with
 * {@link Nullable} are optional, all others are required.
 */
public final class SchemaGenerator {

    private SchemaGenerator() {
    }

    public static McpSchema.JsonSchema generateSchema(final Class<? extends Record> requestClass) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        final List<String> required = new ArrayList<>();

        for (final RecordComponent component : requestClass.getRecordComponents()) {
            properties.put(component.getName(), propertySchema(component));
            if (!isNullable(component)) {
                required.add(component.getName());
            }
        }

        return new McpSchema.JsonSchema("object", properties, required, false, null, null);
    }

    /**
     * jspecify's {@link Nullable} is a type-use annotation, so it sits on the component type.
     */
    private static boolean isNullable(final RecordComponent component) {
        return component.getAnnotatedType().isAnnotationPresent(Nullable.class)
                || component.isAnnotationPresent(Nullable.class);
    }

    /**
     * Schema for tools without parameters.
     */
    public static McpSchema.JsonSchema emptySchema() {
        return new McpSchema.JsonSchema("object", Map.of(), List.of(), false, null, null);
    }

    private static Map<String, Object> propertySchema(final RecordComponent component) {
        final Map<String, Object> schema = new LinkedHashMap<>();
        final Class<?> type = component.getType();
        schema.put("type", jsonType(type));

        final ToolParam param = component.getAnnotation(ToolParam.class);
        if (param != null) {
            schema.put("description", param.value());
            if (!Double.isNaN(param.minimum())) {
                schema.put("minimum", param.minimum());
            }
            if (!Double.isNaN(param.maximum())) {
                schema.put("maximum", param.maximum());
            }
        }
        if (type.isEnum()) {
            final List<String> names = new ArrayList<>();
            for (final Object constant : type.getEnumConstants()) {
                names.add(((Enum<?>) constant).name());
            }
            schema.put("enum", names);
        }
        return schema;
    }

    private static String jsonType(final Class<?> type) {
        if (type == Integer.class || type == int.class || type == Long.class || type == long.class) {
            return "integer";
        }
        if (type == Double.class || type == double.class || type == Float.class || type == float.class) {
            return "number";
        }
        if (type == Boolean.class || type == boolean.class) {
            return "boolean";
        }
        if (type == String.class || type.isEnum()) {
            return "string";
        }
        throw new IllegalArgumentException("Unsupported tool parameter type: " + type.getName());
    }
}

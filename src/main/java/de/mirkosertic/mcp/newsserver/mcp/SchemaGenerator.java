package de.mirkosertic.mcp.newsserver.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Generates the JSON Schema of an MCP tool input from a request record.
 * <p>
 * Components annotated with {@link Nullable} are optional, all others are required.
 * Enum values are published in lower case, request records parse them case-insensitively.
 */
public final class SchemaGenerator {

    private SchemaGenerator() {
    }

    public static McpSchema.JsonSchema generateSchema(final Class<? extends Record> recordClass) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        final List<String> required = new ArrayList<>();

        for (final RecordComponent component : recordClass.getRecordComponents()) {
            properties.put(component.getName(), generatePropertySchema(component));
            if (!component.isAnnotationPresent(Nullable.class)
                    && !component.getAnnotatedType().isAnnotationPresent(Nullable.class)) {
                required.add(component.getName());
            }
        }

        return new McpSchema.JsonSchema("object", properties, required, null, null, null);
    }

    /**
     * Schema for tools without parameters.
     */
    public static McpSchema.JsonSchema emptySchema() {
        return new McpSchema.JsonSchema("object", Map.of(), List.of(), null, null, null);
    }

    private static Map<String, Object> generatePropertySchema(final RecordComponent component) {
        final Map<String, Object> schema = new LinkedHashMap<>();

        final Description description = component.getAnnotation(Description.class);
        if (description != null) {
            schema.put("description", description.value());
        }

        final Type type = component.getGenericType();
        if (type instanceof Class<?> clazz) {
            addTypeSchema(schema, clazz);
        } else if (type instanceof ParameterizedType paramType
                && paramType.getRawType() instanceof Class<?> rawClass
                && List.class.isAssignableFrom(rawClass)) {
            schema.put("type", "array");
            final Map<String, Object> itemSchema = new LinkedHashMap<>();
            final Type itemType = paramType.getActualTypeArguments()[0];
            if (itemType instanceof Class<?> itemClass) {
                addTypeSchema(itemSchema, itemClass);
            } else {
                itemSchema.put("type", "string");
            }
            schema.put("items", itemSchema);
        } else {
            schema.put("type", "string");
        }

        return schema;
    }

    private static void addTypeSchema(final Map<String, Object> schema, final Class<?> clazz) {
        if (clazz == String.class) {
            schema.put("type", "string");
        } else if (clazz == Integer.class || clazz == int.class || clazz == Long.class || clazz == long.class) {
            schema.put("type", "integer");
        } else if (clazz == Double.class || clazz == double.class) {
            schema.put("type", "number");
        } else if (clazz == Boolean.class || clazz == boolean.class) {
            schema.put("type", "boolean");
        } else if (clazz.isEnum()) {
            schema.put("type", "string");
            final List<String> enumValues = new ArrayList<>();
            for (final Object constant : clazz.getEnumConstants()) {
                enumValues.add(((Enum<?>) constant).name().toLowerCase(Locale.ROOT));
            }
            schema.put("enum", enumValues);
        } else {
            schema.put("type", "object");
        }
    }
}

package de.mirkosertic.mcp.medialibrary.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates the JSON input schema of a tool from its request record.
 * <p>
 * Components annotated {@code @Nullable} are optional, all others are required.
 */
public final class SchemaGenerator {

    private SchemaGenerator() {
    }

    public static McpSchema.JsonSchema generateSchema(final Class<? extends Record> recordClass) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        final List<String> required = new ArrayList<>();

        for (final RecordComponent component : recordClass.getRecordComponents()) {
            final Map<String, Object> property = new LinkedHashMap<>();
            final Description description = component.getAnnotation(Description.class);
            if (description != null) {
                property.put("description", description.value());
            }
            addTypeSchema(property, component.getGenericType());
            properties.put(component.getName(), property);

            if (!isNullable(component)) {
                required.add(component.getName());
            }
        }

        return new McpSchema.JsonSchema("object", properties, required, null, null, null);
    }

    public static McpSchema.JsonSchema emptySchema() {
        return new McpSchema.JsonSchema("object", Map.of(), List.of(), null, null, null);
    }

    // jspecify's @Nullable is a type-use annotation, it sits on the component's type
    private static boolean isNullable(final RecordComponent component) {
        return component.getAnnotatedType().isAnnotationPresent(Nullable.class)
                || component.isAnnotationPresent(Nullable.class);
    }

    private static void addTypeSchema(final Map<String, Object> schema, final Type type) {
        if (type instanceof ParameterizedType parameterized
                && parameterized.getRawType() instanceof Class<?> raw
                && Collection.class.isAssignableFrom(raw)) {
            schema.put("type", "array");
            final Map<String, Object> items = new LinkedHashMap<>();
            addTypeSchema(items, parameterized.getActualTypeArguments()[0]);
            schema.put("items", items);
            return;
        }
        if (!(type instanceof Class<?> clazz)) {
            schema.put("type", "object");
            return;
        }
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
            final List<String> values = new ArrayList<>();
            for (final Object constant : clazz.getEnumConstants()) {
                values.add(((Enum<?>) constant).name());
            }
            schema.put("enum", values);
        } else {
            schema.put("type", "object");
        }
    }
}

package org.kpa.tap.models.enums;

import java.util.List;
import java.util.Map;

public enum SchemaType {
    BOOLEAN,
    INTEGER,
    DATETIME,
    STRING_ARRAY,
    OBJECT_OR_STRING_ARRAY,
    STRING,
    EMAIL,
    OBJECT,
    STRING_OBJECT;

    public boolean isStringTyped() {
        return this == STRING || this == EMAIL || this == DATETIME;
    }

    public Map<String, Object> toJsonSchema() {
        return switch (this) {
            case BOOLEAN -> Map.of("type", List.of("boolean", "null"));
            case INTEGER -> Map.of("type", List.of("integer", "null"));
            case DATETIME -> Map.of("type", List.of("string", "null"), "format", "date-time");
            case STRING_ARRAY -> Map.of("type", List.of("array", "null"),
                    "items", Map.of("type", List.of("string")));
            case OBJECT_OR_STRING_ARRAY -> Map.of("type", List.of("array", "null"),
                    "items", Map.of("type", List.of("object", "string")));
            case STRING -> Map.of("type", List.of("string", "null"));
            case EMAIL -> Map.of("type", List.of("string", "null"), "format", "email");
            case OBJECT -> Map.of("type", List.of("object", "null"),
                    "additionalProperties", Map.of("type", List.of("object", "string")));
            case STRING_OBJECT -> Map.of("type", List.of("object", "null"),
                    "properties", Map.of(
                            "firstname", STRING.toJsonSchema(),
                            "lastname", STRING.toJsonSchema(),
                            "id", STRING.toJsonSchema()));
        };
    }
}

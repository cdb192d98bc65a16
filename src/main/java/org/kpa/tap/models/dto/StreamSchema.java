package org.kpa.tap.models.dto;

import org.kpa.tap.models.enums.SchemaType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class StreamSchema {

    private final Map<String, SchemaType> properties;

    public StreamSchema(List<SchemaProperty> properties) {
        Map<String, SchemaType> ordered = new LinkedHashMap<>();
        for (SchemaProperty property : properties) {
            ordered.put(property.name(), property.type());
        }
        this.properties = Collections.unmodifiableMap(ordered);
    }

    public static StreamSchema of(SchemaProperty... properties) {
        return new StreamSchema(List.of(properties));
    }

    public Map<String, SchemaType> properties() {
        return properties;
    }

    public Optional<SchemaType> typeOf(String name) {
        return Optional.ofNullable(properties.get(name));
    }

    public Map<String, Object> toJsonSchema() {
        Map<String, Object> jsonProperties = new LinkedHashMap<>();
        properties.forEach((name, type) -> jsonProperties.put(name, type.toJsonSchema()));
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", jsonProperties);
        return schema;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof StreamSchema schema && properties.equals(schema.properties);
    }

    @Override
    public int hashCode() {
        return properties.hashCode();
    }

    @Override
    public String toString() {
        return "StreamSchema" + properties;
    }
}

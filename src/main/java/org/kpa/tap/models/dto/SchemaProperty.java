package org.kpa.tap.models.dto;

import org.kpa.tap.models.enums.SchemaType;

public record SchemaProperty(
        String name,
        SchemaType type
) {
}

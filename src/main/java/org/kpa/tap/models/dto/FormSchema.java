package org.kpa.tap.models.dto;

import java.util.List;

public record FormSchema(
        List<FormField> fields,
        StreamSchema schema,
        FieldNameResolution resolution
) {
}

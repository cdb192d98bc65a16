package org.kpa.tap.service.schema;

import org.kpa.tap.models.dto.FieldNameResolution;
import org.kpa.tap.models.dto.FormField;
import org.kpa.tap.models.dto.FormSchema;
import org.kpa.tap.models.dto.SchemaProperty;
import org.kpa.tap.models.dto.StreamSchema;
import org.kpa.tap.models.enums.SchemaType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class SchemaInferenceService {

    public static final String ID_PROPERTY = "kpa_id";
    public static final String CREATED_PROPERTY = "kpa_created";
    public static final String UPDATED_PROPERTY = "kpa_updated";

    private static final Set<String> ARRAY_FIELD_TYPES = Set.of("sketch", "attachments");

    public FormSchema infer(List<FormField> fields) {
        List<SchemaProperty> properties = new ArrayList<>();
        properties.add(new SchemaProperty(ID_PROPERTY, SchemaType.INTEGER));
        properties.add(new SchemaProperty(CREATED_PROPERTY, SchemaType.DATETIME));
        properties.add(new SchemaProperty(UPDATED_PROPERTY, SchemaType.DATETIME));

        Map<String, String> titlesById = new LinkedHashMap<>();
        Set<String> usedTitles = new HashSet<>();
        for (FormField field : fields) {
            String title = field.strippedTitle();
            if (!usedTitles.add(title)) {
                title = title + "_" + field.id();
                usedTitles.add(title);
            }
            titlesById.put(field.id(), title);
            properties.add(new SchemaProperty(title, typeOf(field)));
        }
        return new FormSchema(List.copyOf(fields), new StreamSchema(properties), new FieldNameResolution(titlesById));
    }

    public SchemaType typeOf(FormField field) {
        Object inputType = field.setting("inputtype");
        if ("checkbox".equals(inputType)
                || ("switch".equals(inputType) && field.setting("defaulted") instanceof Boolean)) {
            return SchemaType.BOOLEAN;
        }
        if ("list".equals(field.setting("style")) && isTruthy(field.setting("multiple"))) {
            return SchemaType.STRING_ARRAY;
        }
        if ("datetime".equals(field.type())) {
            return SchemaType.DATETIME;
        }
        if ("counter".equals(field.type())) {
            return SchemaType.INTEGER;
        }
        if (ARRAY_FIELD_TYPES.contains(field.type())) {
            return SchemaType.OBJECT_OR_STRING_ARRAY;
        }
        return SchemaType.STRING;
    }

    private boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0;
        }
        if (value instanceof String text) {
            return !text.isEmpty();
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }
}

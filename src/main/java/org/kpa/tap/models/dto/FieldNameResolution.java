package org.kpa.tap.models.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class FieldNameResolution {

    private final Map<String, String> titlesById;

    public FieldNameResolution(Map<String, String> titlesById) {
        this.titlesById = Collections.unmodifiableMap(new LinkedHashMap<>(titlesById));
    }

    public Optional<String> titleFor(String fieldId) {
        return Optional.ofNullable(titlesById.get(fieldId));
    }

    @Override
    public String toString() {
        return "FieldNameResolution" + titlesById;
    }
}

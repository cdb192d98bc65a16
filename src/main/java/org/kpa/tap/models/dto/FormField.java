package org.kpa.tap.models.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FormField(
        String id,
        String title,
        String type,
        Map<String, Object> settings
) {
    public FormField {
        settings = settings == null ? Map.of() : settings;
    }

    public String strippedTitle() {
        return title == null ? "" : title.strip();
    }

    public Object setting(String key) {
        return settings.get(key);
    }
}

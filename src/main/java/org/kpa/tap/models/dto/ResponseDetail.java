package org.kpa.tap.models.dto;

import java.util.LinkedHashMap;
import java.util.Map;

public record ResponseDetail(
        Object id,
        Long created,
        Long updated,
        Map<String, Object> values
) {

    public static ResponseDetail from(Map<String, Object> response) {
        Map<String, Object> values = new LinkedHashMap<>();
        Object latest = response.get("latest");
        Object nested = latest instanceof Map<?, ?> latestMap ? latestMap.get("responses") : null;
        Object source = nested instanceof Map<?, ?> ? nested : response.get("values");
        if (source instanceof Map<?, ?> map) {
            map.forEach((key, value) -> values.put(String.valueOf(key), value));
        }
        return new ResponseDetail(response.get("id"), toLong(response.get("created")), toLong(response.get("updated")), values);
    }

    private static Long toLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            return Long.parseLong(text.trim());
        }
        return null;
    }
}

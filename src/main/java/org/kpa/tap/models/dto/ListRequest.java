package org.kpa.tap.models.dto;

import java.util.Map;

public record ListRequest(
        String path,
        Map<String, Object> body,
        boolean paginated
) {
    public ListRequest {
        body = body == null ? Map.of() : Map.copyOf(body);
    }
}

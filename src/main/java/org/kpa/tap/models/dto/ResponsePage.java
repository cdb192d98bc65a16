package org.kpa.tap.models.dto;

import java.util.Map;

public record ResponsePage(
        Map<String, Object> payload,
        int page,
        Integer nextPage
) {
    public boolean hasNext() {
        return nextPage != null;
    }
}

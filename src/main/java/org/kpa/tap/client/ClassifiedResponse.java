package org.kpa.tap.client;

import java.util.Map;

public record ClassifiedResponse(
        ResponseClassification classification,
        int statusCode,
        String body,
        String url,
        Map<String, Object> payload
) {

    public String describe() {
        return "Error status code: " + statusCode + ", response: " + body + ", response url: " + url;
    }
}

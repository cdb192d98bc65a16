package org.kpa.tap.client;

import lombok.Getter;

@Getter
public abstract class ApiException extends RuntimeException {

    private final int statusCode;
    private final String responseBody;
    private final String url;

    protected ApiException(String message, int statusCode, String responseBody, String url, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
        this.url = url;
    }

    protected ApiException(ClassifiedResponse response) {
        this(response.describe(), response.statusCode(), response.body(), response.url(), null);
    }
}

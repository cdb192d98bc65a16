package org.kpa.tap.client;

public class RetriableApiException extends ApiException {

    public RetriableApiException(ClassifiedResponse response) {
        super(response);
    }

    public RetriableApiException(String message, String url, Throwable cause) {
        super(message, -1, null, url, cause);
    }
}

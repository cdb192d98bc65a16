package org.kpa.tap.client;

public class FatalApiException extends ApiException {

    public FatalApiException(ClassifiedResponse response) {
        super(response);
    }
}

package org.kpa.tap.service.discovery;

import lombok.Getter;

@Getter
public class FormDiscoveryException extends RuntimeException {

    private final String formId;

    public FormDiscoveryException(String formId, String message, Throwable cause) {
        super(message, cause);
        this.formId = formId;
    }
}

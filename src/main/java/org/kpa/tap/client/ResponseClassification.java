package org.kpa.tap.client;

public enum ResponseClassification {
    SUCCESS,
    RETRIABLE,
    FATAL
}

package org.kpa.tap.models.enums;

public enum StreamKind {
    RESPONSE_LIST,
    RESPONSE_DETAIL
}

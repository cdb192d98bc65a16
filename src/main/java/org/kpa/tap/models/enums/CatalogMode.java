package org.kpa.tap.models.enums;

public enum CatalogMode {
    DISCOVERY,
    SYNC
}

package org.kpa.tap.service.extraction;

import java.time.Instant;

public final class EpochTimestamps {

    private EpochTimestamps() {
    }

    public static String toIso(Object epochMillis) {
        Instant instant = toInstant(epochMillis);
        return instant == null ? null : instant.toString();
    }

    public static Instant toInstant(Object epochMillis) {
        if (epochMillis == null) {
            return null;
        }
        if (epochMillis instanceof Number number) {
            return Instant.ofEpochMilli(number.longValue());
        }
        String text = epochMillis.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        return Instant.ofEpochMilli((long) Double.parseDouble(text));
    }
}

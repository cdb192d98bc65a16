package org.kpa.tap.models.dto;

import java.time.Instant;

public record StreamResult(
        String stream,
        int recordsRead,
        int recordsStored,
        Instant bookmark,
        String error
) {
    public static StreamResult failed(String stream, String error) {
        return new StreamResult(stream, 0, 0, null, error);
    }

    public boolean isFailed() {
        return error != null;
    }
}

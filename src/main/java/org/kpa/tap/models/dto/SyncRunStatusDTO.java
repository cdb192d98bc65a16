package org.kpa.tap.models.dto;

import org.kpa.tap.models.enums.RunStatus;

import java.time.Instant;
import java.util.Map;

public record SyncRunStatusDTO(
        String id,
        RunStatus status, // QUEUED, RUNNING, SUCCESS, PARTIAL, FAILED
        int recordsRead,
        int recordsStored,
        String errorMessage,
        Map<String, Object> streamResults,
        Instant startedAt,
        Instant endedAt
) {
}

package org.kpa.tap.models.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RecordSummary(
        Long id,
        Long created,
        Long updated
) {
}

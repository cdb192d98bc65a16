package org.kpa.tap.models.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CatalogEntry(
        @JsonProperty("tap_stream_id") String tapStreamId,
        String stream,
        Map<String, Object> schema,
        @JsonProperty("key_properties") List<String> keyProperties,
        @JsonProperty("replication_key") String replicationKey,
        @JsonProperty("parent_stream") String parentStream
) {
}

package org.kpa.tap.service.extraction;

import org.kpa.tap.models.dto.StreamSchema;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

public interface RecordStream {

    String name();

    StreamSchema schema();

    List<String> keyProperties();

    Stream<Map<String, Object>> records(Instant startingBound);

    default String replicationKey() {
        return null;
    }

    default Optional<Instant> bookmark() {
        return Optional.empty();
    }
}

package org.kpa.tap.service.extraction;

import lombok.RequiredArgsConstructor;
import org.kpa.tap.models.dto.ListRequest;
import org.kpa.tap.models.dto.ResponsePage;
import org.kpa.tap.models.dto.StreamSchema;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

@RequiredArgsConstructor
public class AuxiliaryListStream implements RecordStream {

    private final AuxiliaryStream definition;
    private final Paginator paginator;

    @Override
    public String name() {
        return definition.streamName();
    }

    @Override
    public StreamSchema schema() {
        return definition.schema();
    }

    @Override
    public List<String> keyProperties() {
        return List.of("id");
    }

    @Override
    public Stream<Map<String, Object>> records(Instant startingBound) {
        return paginator.paginate(new ListRequest(definition.path(), Map.of(), true), null)
                .flatMap(this::pageRecords);
    }

    private Stream<Map<String, Object>> pageRecords(ResponsePage page) {
        if (!(page.payload().get(definition.recordsKey()) instanceof List<?> items)) {
            return Stream.empty();
        }
        return items.stream()
                .filter(Map.class::isInstance)
                .map(item -> {
                    Map<String, Object> record = new LinkedHashMap<>();
                    ((Map<?, ?>) item).forEach((key, value) -> record.put(String.valueOf(key), value));
                    return record;
                });
    }
}

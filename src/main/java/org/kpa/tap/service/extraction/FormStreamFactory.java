package org.kpa.tap.service.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.kpa.tap.client.KpaRequestExecutor;
import org.kpa.tap.models.dto.Form;
import org.kpa.tap.models.dto.StreamDescriptor;
import org.kpa.tap.service.schema.FormSchemaCache;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

@Component
@RequiredArgsConstructor
public class FormStreamFactory {

    private final Paginator paginator;
    private final KpaRequestExecutor requestExecutor;
    private final FormSchemaCache schemaCache;
    private final RecordNormalizer normalizer;
    private final ObjectMapper objectMapper;

    public FormStreamPair create(Form form) {
        FormResponseStream list = create(StreamDescriptor.listOf(form), null);
        FormResponseStream detail = create(StreamDescriptor.detailOf(form), list);
        return new FormStreamPair(form, list, detail);
    }

    public FormResponseStream create(StreamDescriptor descriptor, FormResponseStream parent) {
        return new FormResponseStream(descriptor, parent, paginator, requestExecutor, schemaCache, normalizer, objectMapper);
    }

    public List<AuxiliaryListStream> auxiliaryStreams() {
        return Arrays.stream(AuxiliaryStream.values())
                .map(definition -> new AuxiliaryListStream(definition, paginator))
                .toList();
    }
}

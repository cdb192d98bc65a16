package org.kpa.tap.service.discovery;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.kpa.tap.models.dto.CatalogEntry;
import org.kpa.tap.models.dto.Form;
import org.kpa.tap.models.enums.CatalogMode;
import org.kpa.tap.service.extraction.FormStreamFactory;
import org.kpa.tap.service.extraction.FormStreamPair;
import org.kpa.tap.service.extraction.RecordStream;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogService {

    private final FormDiscoveryService discoveryService;
    private final FormStreamFactory streamFactory;

    public List<CatalogEntry> catalog(CatalogMode mode) {
        List<CatalogEntry> entries = new ArrayList<>();
        for (RecordStream stream : streamFactory.auxiliaryStreams()) {
            entries.add(toEntry(stream, null));
        }

        for (Form form : discoveryService.listForms()) {
            FormStreamPair pair = streamFactory.create(form);
            CatalogEntry detailEntry;
            try {
                detailEntry = toEntry(pair.detail(), pair.list().name());
            } catch (FormDiscoveryException exception) {
                log.warn("Leaving form {} ({}) out of the catalog: {}", form.name(), form.id(), exception.getMessage());
                continue;
            }
            if (mode == CatalogMode.SYNC) {
                entries.add(toEntry(pair.list(), null));
            }
            entries.add(detailEntry);
        }
        return entries;
    }

    private CatalogEntry toEntry(RecordStream stream, String parentStream) {
        return new CatalogEntry(
                stream.name(),
                stream.name(),
                stream.schema().toJsonSchema(),
                stream.keyProperties(),
                stream.replicationKey(),
                parentStream);
    }
}

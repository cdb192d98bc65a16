package org.kpa.tap.service.schema;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.kpa.tap.models.dto.FormSchema;
import org.kpa.tap.service.discovery.FormDiscoveryService;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
@RequiredArgsConstructor
public class FormSchemaCache {

    private final FormDiscoveryService discoveryService;
    private final SchemaInferenceService inferenceService;
    private final Map<String, FormSchema> schemasByFormId = new ConcurrentHashMap<>();

    public FormSchema get(String formId) {
        FormSchema cached = schemasByFormId.get(formId);
        if (cached != null) {
            return cached;
        }
        // fetched outside the map, no bin lock is held during retries
        FormSchema loaded = load(formId);
        FormSchema raced = schemasByFormId.putIfAbsent(formId, loaded);
        return raced == null ? loaded : raced;
    }

    private FormSchema load(String formId) {
        FormSchema schema = inferenceService.infer(discoveryService.fetchFields(formId));
        log.info("Inferred {} properties for form {}", schema.schema().properties().size(), formId);
        return schema;
    }
}

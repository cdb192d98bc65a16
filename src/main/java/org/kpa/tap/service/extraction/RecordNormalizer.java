package org.kpa.tap.service.extraction;

import org.kpa.tap.models.dto.FormSchema;
import org.kpa.tap.models.dto.ResponseDetail;
import org.kpa.tap.models.enums.SchemaType;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.kpa.tap.service.schema.SchemaInferenceService.CREATED_PROPERTY;
import static org.kpa.tap.service.schema.SchemaInferenceService.ID_PROPERTY;
import static org.kpa.tap.service.schema.SchemaInferenceService.UPDATED_PROPERTY;

/**
 * Flattens a {@code responses.info} payload into one record shaped by the form's schema.
 * <p>
 * Each entry of the payload's values is a holder {@code {"value": container}}. The container
 * is reduced to a single value in this order: first element of {@code values} for string-typed
 * properties, {@code attachments} as-is, {@code utc_time} as an ISO timestamp, otherwise the
 * value under the container's first key.
 */
@Component
public class RecordNormalizer {

    /**
     * @return the flattened record, or {@code null} when {@code seenIds} already holds the response id
     */
    public Map<String, Object> normalize(ResponseDetail raw, FormSchema formSchema, Set<Object> seenIds) {
        if (!seenIds.add(identity(raw.id()))) {
            return null;
        }

        Map<String, Object> record = new LinkedHashMap<>();
        record.put(ID_PROPERTY, raw.id());
        record.put(CREATED_PROPERTY, EpochTimestamps.toIso(raw.created()));
        record.put(UPDATED_PROPERTY, EpochTimestamps.toIso(raw.updated()));

        for (Map.Entry<String, Object> entry : raw.values().entrySet()) {
            Optional<String> title = formSchema.resolution().titleFor(entry.getKey());
            if (title.isEmpty()) {
                // value of a field that is not in the current metadata snapshot
                continue;
            }
            Map<?, ?> container = container(entry.getValue());
            if (container == null || container.isEmpty()) {
                continue;
            }
            SchemaType type = formSchema.schema().typeOf(title.get()).orElse(SchemaType.STRING);
            record.put(title.get(), extract(container, type));
        }
        return record;
    }

    Object extract(Map<?, ?> container, SchemaType type) {
        if (type.isStringTyped() && container.get("values") instanceof List<?> values && !values.isEmpty()) {
            return values.get(0);
        }
        if (container.get("attachments") != null) {
            return container.get("attachments");
        }
        if (container.get("utc_time") != null) {
            return EpochTimestamps.toIso(container.get("utc_time"));
        }
        Iterator<?> keys = container.keySet().iterator();
        return container.get(keys.next());
    }

    private Map<?, ?> container(Object holder) {
        if (holder instanceof Map<?, ?> holderMap && holderMap.get("value") instanceof Map<?, ?> value) {
            return value;
        }
        return null;
    }

    private Object identity(Object id) {
        if (id instanceof Number number) {
            return number.longValue();
        }
        return id == null ? null : id.toString();
    }
}

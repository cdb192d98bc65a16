package org.kpa.tap.service.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.kpa.tap.client.KpaRequestExecutor;
import org.kpa.tap.models.dto.FormSchema;
import org.kpa.tap.models.dto.ListRequest;
import org.kpa.tap.models.dto.RecordSummary;
import org.kpa.tap.models.dto.ResponseDetail;
import org.kpa.tap.models.dto.ResponsePage;
import org.kpa.tap.models.dto.SchemaProperty;
import org.kpa.tap.models.dto.StreamDescriptor;
import org.kpa.tap.models.dto.StreamSchema;
import org.kpa.tap.models.enums.SchemaType;
import org.kpa.tap.models.enums.StreamKind;
import org.kpa.tap.service.schema.FormSchemaCache;
import org.kpa.tap.service.schema.SchemaInferenceService;

import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Form-backed stream, behaving as the form's response list or response detail stream
 * depending on its descriptor.
 * <p>
 * The list stream pages through {@code responses.list} and tracks the highest {@code updated}
 * value it emitted. The detail stream consumes the list stream of the same form, issues one
 * {@code responses.info} request per response id and normalizes it against the form's cached
 * schema. Response ids already emitted by this instance are dropped, so each instance is meant
 * for a single sync run.
 */
@Slf4j
public class FormResponseStream implements RecordStream {

    public static final String REPLICATION_KEY = "updated";
    static final String RESPONSES_LIST_PATH = "/responses.list";
    static final String RESPONSES_INFO_PATH = "/responses.info";
    static final String LOWER_BOUND_PARAM = "updated_after";
    static final String RESPONSE_ID = "response_id";

    private static final StreamSchema LIST_SCHEMA = StreamSchema.of(
            new SchemaProperty("id", SchemaType.INTEGER),
            new SchemaProperty("created", SchemaType.DATETIME),
            new SchemaProperty("updated", SchemaType.DATETIME));

    private final StreamDescriptor descriptor;
    private final FormResponseStream parent;
    private final Paginator paginator;
    private final KpaRequestExecutor requestExecutor;
    private final FormSchemaCache schemaCache;
    private final RecordNormalizer normalizer;
    private final ObjectMapper objectMapper;

    private final Set<Object> seenIds = new HashSet<>();
    private Instant maxUpdated;
    private int listed;

    FormResponseStream(StreamDescriptor descriptor,
                       FormResponseStream parent,
                       Paginator paginator,
                       KpaRequestExecutor requestExecutor,
                       FormSchemaCache schemaCache,
                       RecordNormalizer normalizer,
                       ObjectMapper objectMapper) {
        if (descriptor.kind() == StreamKind.RESPONSE_DETAIL && parent == null) {
            throw new IllegalArgumentException("Detail stream " + descriptor.name() + " requires its list stream");
        }
        this.descriptor = descriptor;
        this.parent = parent;
        this.paginator = paginator;
        this.requestExecutor = requestExecutor;
        this.schemaCache = schemaCache;
        this.normalizer = normalizer;
        this.objectMapper = objectMapper;
    }

    public int listedCount() {
        return listed;
    }

    @Override
    public String name() {
        return descriptor.name();
    }

    @Override
    public StreamSchema schema() {
        if (descriptor.isList()) {
            return LIST_SCHEMA;
        }
        return schemaCache.get(descriptor.formId()).schema();
    }

    @Override
    public List<String> keyProperties() {
        return descriptor.isList() ? List.of("id") : List.of(SchemaInferenceService.ID_PROPERTY);
    }

    @Override
    public String replicationKey() {
        return descriptor.isList() ? REPLICATION_KEY : null;
    }

    @Override
    public Optional<Instant> bookmark() {
        return descriptor.isList() ? Optional.ofNullable(maxUpdated) : Optional.empty();
    }

    @Override
    public Stream<Map<String, Object>> records(Instant startingBound) {
        if (descriptor.isList()) {
            return summaries(startingBound).map(this::toRecord);
        }
        FormSchema formSchema = schemaCache.get(descriptor.formId());
        return parent.childContexts(startingBound)
                .map(this::fetchDetail)
                .map(detail -> normalizer.normalize(detail, formSchema, seenIds))
                .filter(Objects::nonNull);
    }

    public Stream<Map<String, Object>> childContexts(Instant startingBound) {
        return summaries(startingBound)
                .filter(summary -> {
                    if (summary.id() == null) {
                        log.warn("Stream {} listed a response without id, skipping it: {}", name(), summary);
                        return false;
                    }
                    return true;
                })
                .map(summary -> Map.<String, Object>of(RESPONSE_ID, summary.id()));
    }

    Stream<RecordSummary> summaries(Instant startingBound) {
        return paginator.paginate(listRequest(startingBound), null)
                .flatMap(this::pageSummaries)
                .peek(this::track);
    }

    ListRequest listRequest(Instant startingBound) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("form_id", descriptor.formId());
        if (startingBound != null) {
            body.put(LOWER_BOUND_PARAM, startingBound.toEpochMilli());
        }
        return new ListRequest(RESPONSES_LIST_PATH, body, true);
    }

    ResponseDetail fetchDetail(Map<String, Object> context) {
        Object responseId = context.get(RESPONSE_ID);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("form_id", descriptor.formId());
        body.put(RESPONSE_ID, responseId);
        Map<String, Object> payload = requestExecutor.post(RESPONSES_INFO_PATH, body);
        if (!(payload.get("response") instanceof Map<?, ?> response)) {
            throw new IllegalStateException("responses.info returned no response for id " + responseId
                    + " of form " + descriptor.formId());
        }
        Map<String, Object> detail = new LinkedHashMap<>();
        response.forEach((key, value) -> detail.put(String.valueOf(key), value));
        return ResponseDetail.from(detail);
    }

    private Stream<RecordSummary> pageSummaries(ResponsePage page) {
        Object responses = page.payload().get("responses");
        if (!(responses instanceof List<?> items)) {
            return Stream.empty();
        }
        log.debug("Stream {} page {} holds {} responses", name(), page.page(), items.size());
        return items.stream().map(item -> objectMapper.convertValue(item, RecordSummary.class));
    }

    private void track(RecordSummary summary) {
        listed++;
        if (summary.updated() == null) {
            return;
        }
        Instant updated = Instant.ofEpochMilli(summary.updated());
        if (maxUpdated == null || updated.isAfter(maxUpdated)) {
            maxUpdated = updated;
        }
    }

    private Map<String, Object> toRecord(RecordSummary summary) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("id", summary.id());
        record.put("created", EpochTimestamps.toIso(summary.created()));
        record.put("updated", EpochTimestamps.toIso(summary.updated()));
        return record;
    }
}

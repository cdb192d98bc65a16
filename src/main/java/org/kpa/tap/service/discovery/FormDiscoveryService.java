package org.kpa.tap.service.discovery;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.kpa.tap.client.ApiException;
import org.kpa.tap.client.KpaRequestExecutor;
import org.kpa.tap.models.dto.Form;
import org.kpa.tap.models.dto.FormField;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class FormDiscoveryService {

    static final String FORMS_LIST_PATH = "/forms.list";
    static final String FORMS_INFO_PATH = "/forms.info";

    private static final TypeReference<List<Form>> FORM_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<FormField>> FIELD_LIST = new TypeReference<>() {
    };

    private final KpaRequestExecutor requestExecutor;
    private final ObjectMapper objectMapper;

    public List<Form> listForms() {
        Map<String, Object> payload;
        try {
            payload = requestExecutor.post(FORMS_LIST_PATH, Map.of());
        } catch (ApiException exception) {
            throw new FormDiscoveryException(null,
                    "Request to get forms has failed with status code " + exception.getStatusCode()
                            + " and response " + exception.getResponseBody(), exception);
        }
        if (!Boolean.TRUE.equals(payload.get("ok"))) {
            throw new FormDiscoveryException(null, "Request to get forms has failed with response " + payload, null);
        }
        List<Form> forms = objectMapper.convertValue(payload.getOrDefault("forms", List.of()), FORM_LIST);
        log.info("Discovered {} forms", forms.size());
        return forms;
    }

    public List<FormField> fetchFields(String formId) {
        Map<String, Object> payload;
        try {
            payload = requestExecutor.post(FORMS_INFO_PATH, Map.of("form_id", formId));
        } catch (ApiException exception) {
            throw new FormDiscoveryException(formId,
                    "Error while trying to fetch fields for form id " + formId + ". Error: " + exception.getMessage(), exception);
        }
        if (!Boolean.TRUE.equals(payload.get("ok"))) {
            throw new FormDiscoveryException(formId,
                    "Error while trying to fetch fields for form id " + formId + ". Error: " + payload, null);
        }
        Object fields = nested(payload, "form", "latest", "fields");
        List<FormField> result = fields == null ? List.of() : objectMapper.convertValue(fields, FIELD_LIST);
        log.debug("Form {} declares {} fields", formId, result.size());
        return result;
    }

    private Object nested(Map<String, Object> payload, String... path) {
        Object current = payload;
        for (String key : path) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(key);
        }
        return current;
    }
}

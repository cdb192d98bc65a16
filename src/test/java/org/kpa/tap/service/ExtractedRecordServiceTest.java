package org.kpa.tap.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.kpa.tap.models.entity.ExtractedRecord;
import org.kpa.tap.models.entity.SyncRun;
import org.kpa.tap.repository.ExtractedRecordRepository;
import org.kpa.tap.repository.ExtractedRecordRepository.RecordVersion;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExtractedRecordServiceTest {

    @Mock
    private ExtractedRecordRepository recordRepository;

    private ExtractedRecordService recordService;

    @BeforeEach
    void setUp() {
        recordService = new ExtractedRecordService(recordRepository, new ObjectMapper());
    }

    @Test
    void storesOneVersionPerKeyAndPayload() {
        when(recordRepository.findByStreamNameAndRecordKeyIn("Audit", Set.of("1", "2"))).thenReturn(List.of());

        int stored = recordService.write(new SyncRun(), "Audit", "kpa_id", List.of(
                detail(1, "x"),
                detail(1, "x"),
                detail(2, "y")));

        List<ExtractedRecord> saved = captureSaved();
        assertThat(stored).isEqualTo(2);
        assertThat(saved).extracting(ExtractedRecord::getRecordKey).containsExactly("1", "2");
        assertThat(saved).allSatisfy(record -> assertThat(record.getPayloadHash()).hasSize(64));
    }

    @Test
    void unchangedResponseIsSkippedAndEditedOneStoredAgain() {
        Map<String, Object> unchanged = detail(1, "x");
        recordService.write(new SyncRun(), "Audit", "kpa_id", List.of(unchanged));
        String storedHash = captureSaved().get(0).getPayloadHash();
        when(recordRepository.findByStreamNameAndRecordKeyIn(eq("Audit"), anyCollection()))
                .thenReturn(List.of(version("1", storedHash)));

        int stored = recordService.write(new SyncRun(), "Audit", "kpa_id", List.of(unchanged, detail(1, "edited")));

        assertThat(stored).isEqualTo(1);
    }

    @Test
    void recordsWithoutKeyAreKeyedByPayload() {
        when(recordRepository.findByStreamNameAndRecordKeyIn(eq("roles"), anyCollection())).thenReturn(List.of());

        recordService.write(new SyncRun(), "roles", null, List.of(Map.of("name", "Admin")));

        ExtractedRecord saved = captureSaved().get(0);
        assertThat(saved.getRecordKey()).isEqualTo(saved.getPayloadHash());
    }

    @Test
    void emptyBatchTouchesNothing() {
        assertThat(recordService.write(new SyncRun(), "roles", "id", List.of())).isZero();
        verify(recordRepository, never()).findByStreamNameAndRecordKeyIn(anyString(), anyCollection());
        verify(recordRepository, never()).saveAll(any());
    }

    private List<ExtractedRecord> captureSaved() {
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Iterable<ExtractedRecord>> saved = ArgumentCaptor.forClass(Iterable.class);
        verify(recordRepository).saveAll(saved.capture());
        return List.copyOf((Collection<ExtractedRecord>) saved.getValue());
    }

    private Map<String, Object> detail(int id, String inspector) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("kpa_id", id);
        record.put("Inspector", inspector);
        return record;
    }

    private RecordVersion version(String recordKey, String payloadHash) {
        return new RecordVersion() {
            @Override
            public String getRecordKey() {
                return recordKey;
            }

            @Override
            public String getPayloadHash() {
                return payloadHash;
            }
        };
    }
}

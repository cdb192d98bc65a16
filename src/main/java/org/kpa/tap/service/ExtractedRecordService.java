package org.kpa.tap.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.kpa.tap.models.entity.ExtractedRecord;
import org.kpa.tap.models.entity.SyncRun;
import org.kpa.tap.repository.ExtractedRecordRepository;
import org.kpa.tap.repository.ExtractedRecordRepository.RecordVersion;
import org.springframework.stereotype.Component;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Component
@RequiredArgsConstructor
public class ExtractedRecordService {

    private final ExtractedRecordRepository recordRepository;
    private final ObjectMapper objectMapper;

    /**
     * Stores each record as a version of its key. A key whose stored payload is unchanged is
     * skipped, an edited response is stored again. Records without a key are keyed by payload.
     *
     * @return number of versions stored
     */
    public int write(SyncRun run, String streamName, String keyProperty, List<Map<String, Object>> records) {
        Map<String, ExtractedRecord> versions = new LinkedHashMap<>();
        for (Map<String, Object> record : records) {
            String payloadHash = hash(record);
            Object key = keyProperty == null ? null : record.get(keyProperty);
            String recordKey = key == null ? payloadHash : key.toString();
            versions.putIfAbsent(recordKey + ":" + payloadHash, toEntity(run, streamName, recordKey, payloadHash, record));
        }
        if (versions.isEmpty()) {
            return 0;
        }

        Set<String> recordKeys = versions.values().stream()
                .map(ExtractedRecord::getRecordKey)
                .collect(Collectors.toSet());
        for (RecordVersion stored : recordRepository.findByStreamNameAndRecordKeyIn(streamName, recordKeys)) {
            versions.remove(stored.getRecordKey() + ":" + stored.getPayloadHash());
        }
        if (versions.isEmpty()) {
            log.debug("Stream {}: {} records unchanged since last sync", streamName, records.size());
            return 0;
        }

        recordRepository.saveAll(versions.values());
        return versions.size();
    }

    private ExtractedRecord toEntity(SyncRun run, String streamName, String recordKey, String payloadHash,
                                     Map<String, Object> record) {
        ExtractedRecord entity = new ExtractedRecord();
        entity.setRecordUid(UUID.randomUUID().toString());
        entity.setSyncRun(run);
        entity.setStreamName(streamName);
        entity.setRecordKey(recordKey);
        entity.setPayload(record);
        entity.setPayloadHash(payloadHash);
        entity.setCreatedAt(Instant.now());
        return entity;
    }

    private String hash(Map<String, Object> record) {
        try {
            byte[] json = objectMapper.writeValueAsBytes(record);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(json));
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Could not fingerprint record", e);
        }
    }
}

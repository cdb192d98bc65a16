package org.kpa.tap.service;

import lombok.RequiredArgsConstructor;
import org.kpa.tap.models.dto.StreamResult;
import org.kpa.tap.models.dto.SyncRunStatusDTO;
import org.kpa.tap.models.entity.SyncRun;
import org.kpa.tap.models.enums.RunStatus;
import org.kpa.tap.repository.SyncRunRepository;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class SyncRunService {

    private final SyncRunRepository syncRunRepository;

    public SyncRun createQueued() {
        SyncRun run = new SyncRun();
        run.setRunUid(UUID.randomUUID().toString());
        run.setRunStatus(RunStatus.QUEUED);
        run.setRecordsRead(0);
        run.setRecordsStored(0);
        return syncRunRepository.save(run);
    }

    public SyncRun markRunning(SyncRun run) {
        run.setRunStatus(RunStatus.RUNNING);
        run.setStartedAt(run.getStartedAt() == null ? Instant.now() : run.getStartedAt());
        return syncRunRepository.save(run);
    }

    public SyncRun markFinished(SyncRun run, Collection<StreamResult> results) {
        String failedStreams = results.stream()
                .filter(StreamResult::isFailed)
                .map(StreamResult::stream)
                .collect(Collectors.joining(", "));
        run.setRunStatus(failedStreams.isEmpty() ? RunStatus.SUCCESS : RunStatus.PARTIAL);
        run.setErrorMessage(failedStreams.isEmpty() ? null : "Failed streams: " + failedStreams);
        applyTotals(run, results);
        run.setEndedAt(Instant.now());
        return syncRunRepository.save(run);
    }

    public SyncRun markFailure(SyncRun run, String message, Collection<StreamResult> results) {
        run.setRunStatus(RunStatus.FAILED);
        run.setErrorMessage(message);
        applyTotals(run, results);
        run.setEndedAt(Instant.now());
        return syncRunRepository.save(run);
    }

    public SyncRunStatusDTO toStatus(SyncRun run) {
        return new SyncRunStatusDTO(
                run.getRunUid(),
                run.getRunStatus(),
                run.getRecordsRead() == null ? 0 : run.getRecordsRead(),
                run.getRecordsStored() == null ? 0 : run.getRecordsStored(),
                run.getErrorMessage(),
                run.getStreamResults() == null ? Map.of() : run.getStreamResults(),
                run.getStartedAt(),
                run.getEndedAt());
    }

    private void applyTotals(SyncRun run, Collection<StreamResult> results) {
        Map<String, Object> byStream = new LinkedHashMap<>();
        int read = 0;
        int stored = 0;
        for (StreamResult result : results) {
            read += result.recordsRead();
            stored += result.recordsStored();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("recordsRead", result.recordsRead());
            entry.put("recordsStored", result.recordsStored());
            if (result.bookmark() != null) {
                entry.put("bookmark", result.bookmark().toString());
            }
            if (result.error() != null) {
                entry.put("error", result.error());
            }
            byStream.put(result.stream(), entry);
        }
        run.setRecordsRead(read);
        run.setRecordsStored(stored);
        run.setStreamResults(byStream);
    }
}

package org.kpa.tap.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.kpa.tap.configuration.KpaProperties;
import org.kpa.tap.models.dto.Form;
import org.kpa.tap.models.dto.StreamResult;
import org.kpa.tap.models.entity.SyncRun;
import org.kpa.tap.repository.SyncRunRepository;
import org.kpa.tap.service.discovery.FormDiscoveryException;
import org.kpa.tap.service.discovery.FormDiscoveryService;
import org.kpa.tap.service.extraction.FormResponseStream;
import org.kpa.tap.service.extraction.FormStreamFactory;
import org.kpa.tap.service.extraction.FormStreamPair;
import org.kpa.tap.service.extraction.RecordStream;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

@Slf4j
@Service
@RequiredArgsConstructor
public class SyncService {

    private final FormDiscoveryService discoveryService;
    private final FormStreamFactory streamFactory;
    private final BookmarkService bookmarkService;
    private final ExtractedRecordService recordService;
    private final SyncRunService syncRunService;
    private final SyncRunRepository syncRunRepository;
    private final KpaProperties properties;

    public SyncRun queueRun() {
        return syncRunService.createQueued();
    }

    @Async
    public void startSyncAsync(Long syncRunId) {
        syncRunRepository.findById(syncRunId)
                .ifPresentOrElse(this::executeSync, () -> log.warn("Sync run {} not found", syncRunId));
    }

    public SyncRun executeSync(SyncRun run) {
        SyncRun persisted = syncRunService.markRunning(run);
        List<StreamResult> results = new ArrayList<>();
        try {
            List<Form> forms = discoveryService.listForms();

            for (RecordStream stream : streamFactory.auxiliaryStreams()) {
                results.add(syncIsolated(persisted, stream));
            }
            results.addAll(syncForms(persisted, forms));

            SyncRun finished = syncRunService.markFinished(persisted, results);
            log.info("Sync {} finished with status {}: {} records read, {} stored",
                    finished.getRunUid(), finished.getRunStatus(), finished.getRecordsRead(), finished.getRecordsStored());
            return finished;
        } catch (Exception exception) {
            log.error("Sync {} failed", persisted.getRunUid(), exception);
            return syncRunService.markFailure(persisted, exception.getMessage(), results);
        }
    }

    private List<StreamResult> syncForms(SyncRun run, List<Form> forms) {
        int parallelism = Math.min(properties.getSync().getParallelism(), Math.max(forms.size(), 1));
        if (parallelism <= 1) {
            List<StreamResult> results = new ArrayList<>();
            for (Form form : forms) {
                results.addAll(syncForm(run, form));
            }
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(parallelism);
        try {
            List<Future<List<StreamResult>>> futures = new ArrayList<>();
            for (Form form : forms) {
                futures.add(executor.submit(() -> syncForm(run, form)));
            }
            List<StreamResult> results = new ArrayList<>();
            for (Future<List<StreamResult>> future : futures) {
                results.addAll(future.get());
            }
            return results;
        } catch (ExecutionException exception) {
            throw new IllegalStateException("Form sync failed unexpectedly", exception.getCause());
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            CancellationException cancellation = new CancellationException("Sync " + run.getRunUid() + " was interrupted");
            cancellation.initCause(exception);
            throw cancellation;
        } finally {
            executor.shutdownNow();
        }
    }

    List<StreamResult> syncForm(SyncRun run, Form form) {
        FormStreamPair pair = streamFactory.create(form);
        FormResponseStream list = pair.list();
        FormResponseStream detail = pair.detail();
        try {
            Instant startingBound = bookmarkService.startingBound(list.name());
            log.info("Syncing form {} ({}) from {}", form.name(), form.id(), startingBound);

            StreamResult detailResult = syncStream(run, detail, startingBound);
            Instant bookmark = list.bookmark().orElse(null);
            if (bookmark != null) {
                bookmarkService.advance(list.name(), form.id(), list.replicationKey(), bookmark);
            }
            StreamResult listResult = new StreamResult(list.name(), list.listedCount(), 0, bookmark, null);
            return List.of(listResult, detailResult);
        } catch (CancellationException exception) {
            throw exception;
        } catch (RuntimeException exception) {
            if (exception instanceof FormDiscoveryException discovery) {
                log.warn("Skipping streams of form {}: fields of form {} are unavailable: {}",
                        form.name(), discovery.getFormId(), discovery.getMessage());
            } else {
                log.warn("Skipping streams of form {} ({}): {}", form.name(), form.id(), exception.getMessage(), exception);
            }
            return List.of(
                    StreamResult.failed(list.name(), exception.getMessage()),
                    StreamResult.failed(detail.name(), exception.getMessage()));
        }
    }

    private StreamResult syncIsolated(SyncRun run, RecordStream stream) {
        try {
            return syncStream(run, stream, null);
        } catch (CancellationException exception) {
            throw exception;
        } catch (RuntimeException exception) {
            log.warn("Stream {} failed: {}", stream.name(), exception.getMessage(), exception);
            return StreamResult.failed(stream.name(), exception.getMessage());
        }
    }

    StreamResult syncStream(SyncRun run, RecordStream stream, Instant startingBound) {
        int batchSize = properties.getSync().getWriteBatchSize();
        String keyProperty = stream.keyProperties().isEmpty() ? null : stream.keyProperties().get(0);
        int read = 0;
        int stored = 0;
        List<Map<String, Object>> batch = new ArrayList<>(batchSize);
        try (Stream<Map<String, Object>> records = stream.records(startingBound)) {
            Iterator<Map<String, Object>> iterator = records.iterator();
            while (iterator.hasNext()) {
                batch.add(iterator.next());
                read++;
                if (batch.size() >= batchSize) {
                    stored += recordService.write(run, stream.name(), keyProperty, new ArrayList<>(batch));
                    batch.clear();
                }
            }
        }
        if (!batch.isEmpty()) {
            stored += recordService.write(run, stream.name(), keyProperty, batch);
        }
        log.info("Stream {}: {} records read, {} stored", stream.name(), read, stored);
        return new StreamResult(stream.name(), read, stored, stream.bookmark().orElse(null), null);
    }
}

package org.kpa.tap.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.kpa.tap.configuration.KpaProperties;
import org.kpa.tap.models.dto.Form;
import org.kpa.tap.models.dto.StreamResult;
import org.kpa.tap.models.entity.SyncRun;
import org.kpa.tap.repository.SyncRunRepository;
import org.kpa.tap.service.discovery.FormDiscoveryException;
import org.kpa.tap.service.discovery.FormDiscoveryService;
import org.kpa.tap.service.extraction.AuxiliaryListStream;
import org.kpa.tap.service.extraction.FormResponseStream;
import org.kpa.tap.service.extraction.FormStreamFactory;
import org.kpa.tap.service.extraction.FormStreamPair;
import org.kpa.tap.service.extraction.RecordStream;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SyncServiceTest {

    @Mock
    private FormDiscoveryService discoveryService;
    @Mock
    private FormStreamFactory streamFactory;
    @Mock
    private BookmarkService bookmarkService;
    @Mock
    private ExtractedRecordService recordService;
    @Mock
    private SyncRunService syncRunService;
    @Mock
    private SyncRunRepository syncRunRepository;

    private KpaProperties properties;
    private SyncService syncService;
    private SyncRun run;

    @BeforeEach
    void setUp() {
        properties = new KpaProperties();
        properties.setAccessToken("token");
        syncService = new SyncService(discoveryService, streamFactory, bookmarkService, recordService,
                syncRunService, syncRunRepository, properties);
        run = new SyncRun();
        run.setRunUid("run-1");
    }

    @Test
    void formListingFailureFailsTheRun() {
        when(syncRunService.markRunning(run)).thenReturn(run);
        when(discoveryService.listForms()).thenThrow(new FormDiscoveryException(null, "forms unavailable", null));
        when(syncRunService.markFailure(eq(run), eq("forms unavailable"), anyList())).thenReturn(run);

        assertThat(syncService.executeSync(run)).isSameAs(run);

        verify(syncRunService, never()).markFinished(any(), anyList());
        verify(streamFactory, never()).create(any(Form.class));
    }

    @Test
    void failingFormDoesNotStopOtherForms() {
        Form audit = new Form("f1", "Audit");
        Form broken = new Form("f2", "Broken");
        Instant latest = Instant.parse("2024-03-01T10:00:00Z");
        when(syncRunService.markRunning(run)).thenReturn(run);
        when(discoveryService.listForms()).thenReturn(List.of(audit, broken));
        when(streamFactory.auxiliaryStreams()).thenReturn(List.of());
        FormStreamPair auditPair = pair(audit, "Audit", Stream.of(Map.of("kpa_id", 1)), latest);
        when(streamFactory.create(audit)).thenReturn(auditPair);
        FormStreamPair brokenPair = pair(broken, "Broken", null, null);
        when(brokenPair.detail().records(null)).thenThrow(new IllegalStateException("responses.info failed"));
        when(streamFactory.create(broken)).thenReturn(brokenPair);
        when(recordService.write(eq(run), eq("Audit"), eq("kpa_id"), anyList())).thenReturn(1);
        when(syncRunService.markFinished(eq(run), anyList())).thenReturn(run);

        syncService.executeSync(run);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<StreamResult>> results = ArgumentCaptor.forClass(List.class);
        verify(syncRunService).markFinished(eq(run), results.capture());
        assertThat(results.getValue()).extracting(StreamResult::stream)
                .containsExactly("Audit_responses_list", "Audit", "Broken_responses_list", "Broken");
        assertThat(results.getValue().get(0).bookmark()).isEqualTo(latest);
        assertThat(results.getValue().get(1).recordsStored()).isEqualTo(1);
        assertThat(results.getValue().get(3).error()).isEqualTo("responses.info failed");
        verify(bookmarkService).advance("Audit_responses_list", "f1", "updated", latest);
        verify(bookmarkService, never()).advance(eq("Broken_responses_list"), anyString(), anyString(), any());
    }

    @Test
    void failingAuxiliaryStreamIsIsolated() {
        AuxiliaryListStream roles = mock(AuxiliaryListStream.class);
        when(roles.name()).thenReturn("roles");
        when(roles.records(null)).thenThrow(new IllegalStateException("roles.list failed"));
        when(syncRunService.markRunning(run)).thenReturn(run);
        when(discoveryService.listForms()).thenReturn(List.of());
        when(streamFactory.auxiliaryStreams()).thenReturn(List.of(roles));
        when(syncRunService.markFinished(eq(run), anyList())).thenReturn(run);

        syncService.executeSync(run);

        verify(syncRunService).markFinished(run, List.of(StreamResult.failed("roles", "roles.list failed")));
    }

    @Test
    void formsRunOnParallelWorkersWhenConfigured() {
        properties.getSync().setParallelism(2);
        Form audit = new Form("f1", "Audit");
        Form incident = new Form("f2", "Incident");
        Instant auditLatest = Instant.parse("2024-03-01T10:00:00Z");
        Instant incidentLatest = Instant.parse("2024-03-02T10:00:00Z");
        Set<String> workerThreads = ConcurrentHashMap.newKeySet();
        when(syncRunService.markRunning(run)).thenReturn(run);
        when(discoveryService.listForms()).thenReturn(List.of(audit, incident));
        when(streamFactory.auxiliaryStreams()).thenReturn(List.of());
        FormStreamPair auditPair = pair(audit, "Audit", Stream.of(Map.of("kpa_id", 1)), auditLatest);
        FormStreamPair incidentPair = pair(incident, "Incident", Stream.of(Map.of("kpa_id", 2)), incidentLatest);
        when(streamFactory.create(any(Form.class))).thenAnswer(invocation -> {
            workerThreads.add(Thread.currentThread().getName());
            return invocation.getArgument(0).equals(audit) ? auditPair : incidentPair;
        });
        when(recordService.write(eq(run), anyString(), eq("kpa_id"), anyList())).thenReturn(1);
        when(syncRunService.markFinished(eq(run), anyList())).thenReturn(run);

        syncService.executeSync(run);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<StreamResult>> results = ArgumentCaptor.forClass(List.class);
        verify(syncRunService).markFinished(eq(run), results.capture());
        assertThat(results.getValue()).extracting(StreamResult::stream)
                .containsExactly("Audit_responses_list", "Audit", "Incident_responses_list", "Incident");
        assertThat(results.getValue()).noneMatch(StreamResult::isFailed);
        assertThat(workerThreads).doesNotContain(Thread.currentThread().getName());
        verify(bookmarkService).advance("Audit_responses_list", "f1", "updated", auditLatest);
        verify(bookmarkService).advance("Incident_responses_list", "f2", "updated", incidentLatest);
    }

    @Test
    void unavailableFieldsFailOnlyThatForm() {
        Form broken = new Form("f2", "Broken");
        FormStreamPair brokenPair = pair(broken, "Broken", null, null);
        when(brokenPair.detail().records(null)).thenThrow(new FormDiscoveryException("f2", "no fields", null));
        when(streamFactory.create(broken)).thenReturn(brokenPair);

        List<StreamResult> results = syncService.syncForm(run, broken);

        assertThat(results).extracting(StreamResult::error).containsExactly("no fields", "no fields");
        verify(bookmarkService, never()).advance(anyString(), anyString(), anyString(), any());
    }

    @Test
    void writesRecordsInBatches() {
        properties.getSync().setWriteBatchSize(2);
        RecordStream stream = mock(RecordStream.class);
        when(stream.name()).thenReturn("users");
        when(stream.keyProperties()).thenReturn(List.of("id"));
        when(stream.records(null)).thenReturn(IntStream.range(0, 5).mapToObj(i -> Map.<String, Object>of("id", i)));
        when(recordService.write(eq(run), eq("users"), eq("id"), anyList()))
                .thenAnswer(invocation -> ((List<?>) invocation.getArgument(3)).size());

        StreamResult result = syncService.syncStream(run, stream, null);

        verify(recordService, times(3)).write(eq(run), eq("users"), eq("id"), anyList());
        assertThat(result.recordsRead()).isEqualTo(5);
        assertThat(result.recordsStored()).isEqualTo(5);
        assertThat(result.isFailed()).isFalse();
    }

    private FormStreamPair pair(Form form, String name, Stream<Map<String, Object>> records, Instant bookmark) {
        FormResponseStream list = mock(FormResponseStream.class);
        FormResponseStream detail = mock(FormResponseStream.class);
        when(list.name()).thenReturn(name + "_responses_list");
        when(detail.name()).thenReturn(name);
        if (records != null) {
            when(detail.keyProperties()).thenReturn(List.of("kpa_id"));
            when(detail.records(null)).thenReturn(records);
            when(list.bookmark()).thenReturn(Optional.ofNullable(bookmark));
            when(list.replicationKey()).thenReturn("updated");
            when(list.listedCount()).thenReturn(1);
        }
        return new FormStreamPair(form, list, detail);
    }
}

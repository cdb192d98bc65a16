package org.kpa.tap.service;

import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.kpa.tap.models.dto.StreamResult;
import org.kpa.tap.models.dto.SyncRunStatusDTO;
import org.kpa.tap.models.entity.SyncRun;
import org.kpa.tap.models.enums.RunStatus;
import org.kpa.tap.repository.SyncRunRepository;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SyncRunServiceTest {

    @Mock
    private SyncRunRepository syncRunRepository;

    private SyncRunService syncRunService;

    @BeforeEach
    void setUp() {
        syncRunService = new SyncRunService(syncRunRepository);
        when(syncRunRepository.save(any(SyncRun.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void queuedRunGetsUid() {
        SyncRun run = syncRunService.createQueued();

        assertThat(run.getRunUid()).isNotBlank();
        assertThat(run.getRunStatus()).isEqualTo(RunStatus.QUEUED);
    }

    @Test
    void allStreamsSucceeding() {
        SyncRun run = syncRunService.markFinished(new SyncRun(), List.of(
                new StreamResult("roles", 3, 3, null, null),
                new StreamResult("Audit_responses_list", 2, 0, Instant.parse("2024-01-01T00:00:00Z"), null)));

        assertThat(run.getRunStatus()).isEqualTo(RunStatus.SUCCESS);
        assertThat(run.getRecordsRead()).isEqualTo(5);
        assertThat(run.getRecordsStored()).isEqualTo(3);
        assertThat(run.getErrorMessage()).isNull();
        assertThat(run.getEndedAt()).isNotNull();
        assertThat(run.getStreamResults()).containsKeys("roles", "Audit_responses_list");
    }

    @Test
    void failedStreamMakesRunPartial() {
        SyncRun run = syncRunService.markFinished(new SyncRun(), List.of(
                new StreamResult("roles", 1, 1, null, null),
                StreamResult.failed("Audit", "boom")));

        assertThat(run.getRunStatus()).isEqualTo(RunStatus.PARTIAL);
        assertThat(run.getErrorMessage()).isEqualTo("Failed streams: Audit");
        assertThat(run.getStreamResults()).extractingByKey("Audit")
                .asInstanceOf(InstanceOfAssertFactories.MAP)
                .containsEntry("error", "boom");
    }

    @Test
    void statusOfFailedRun() {
        SyncRun run = syncRunService.markFailure(new SyncRun(), "forms unavailable", List.of());
        run.setRunUid("run-1");

        SyncRunStatusDTO status = syncRunService.toStatus(run);

        assertThat(status.id()).isEqualTo("run-1");
        assertThat(status.status()).isEqualTo(RunStatus.FAILED);
        assertThat(status.errorMessage()).isEqualTo("forms unavailable");
        assertThat(status.streamResults()).isEmpty();
    }
}

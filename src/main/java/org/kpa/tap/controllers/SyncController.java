package org.kpa.tap.controllers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.kpa.tap.client.ApiException;
import org.kpa.tap.models.dto.CatalogEntry;
import org.kpa.tap.models.dto.SyncRunStatusDTO;
import org.kpa.tap.models.entity.SyncRun;
import org.kpa.tap.models.enums.CatalogMode;
import org.kpa.tap.repository.SyncRunRepository;
import org.kpa.tap.service.SyncRunService;
import org.kpa.tap.service.SyncService;
import org.kpa.tap.service.discovery.CatalogService;
import org.kpa.tap.service.discovery.FormDiscoveryException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/sync")
@RequiredArgsConstructor
public class SyncController {

    private final SyncService syncService;
    private final SyncRunService syncRunService;
    private final SyncRunRepository syncRunRepository;
    private final CatalogService catalogService;

    @PostMapping("/runs")
    public ResponseEntity<SyncRunStatusDTO> startRun() {
        SyncRun run = syncService.queueRun();
        log.info("Queued sync run {}", run.getRunUid());
        syncService.startSyncAsync(run.getId());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(syncRunService.toStatus(run));
    }

    @GetMapping("/runs/{uid}")
    public ResponseEntity<SyncRunStatusDTO> getRun(@PathVariable String uid) {
        SyncRun run = syncRunRepository.findByRunUid(uid)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Sync run not found: " + uid));
        return ResponseEntity.ok(syncRunService.toStatus(run));
    }

    @GetMapping("/runs")
    public ResponseEntity<List<SyncRunStatusDTO>> listRuns() {
        List<SyncRunStatusDTO> runs = syncRunRepository.findTop10ByOrderByStartedAtDesc().stream()
                .map(syncRunService::toStatus)
                .toList();
        return ResponseEntity.ok(runs);
    }

    @GetMapping("/catalog")
    public ResponseEntity<Map<String, Object>> getCatalog(@RequestParam(defaultValue = "discovery") String mode) {
        CatalogMode catalogMode = parseMode(mode);
        log.info("Building {} catalog", catalogMode);

        try {
            List<CatalogEntry> streams = catalogService.catalog(catalogMode);
            Map<String, Object> response = new HashMap<>();
            response.put("mode", catalogMode.name().toLowerCase(Locale.ROOT));
            response.put("streams", streams);
            return ResponseEntity.ok(response);
        } catch (ApiException e) {
            log.error("KPA API call failed while building catalog: {}", e.getMessage(), e);
            return error(HttpStatus.BAD_GATEWAY, e.getMessage());
        } catch (FormDiscoveryException e) {
            log.error("Form discovery failed while building catalog: {}", e.getMessage(), e);
            return error(HttpStatus.BAD_GATEWAY, e.getMessage());
        } catch (Exception e) {
            log.error("Error while building catalog: {}", e.getMessage(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    private CatalogMode parseMode(String mode) {
        try {
            return CatalogMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown catalog mode: " + mode, e);
        }
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("success", false);
        errorResponse.put("error", message);
        return ResponseEntity.status(status).body(errorResponse);
    }
}

package org.caureq.caureqmonitor.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.caureq.caureqmonitor.api.dto.SnapshotDTO;
import org.caureq.caureqmonitor.api.dto.SnapshotFilter;
import org.caureq.caureqmonitor.api.dto.SnapshotIngestDTO;
import org.caureq.caureqmonitor.service.SnapshotIngestService;
import org.caureq.caureqmonitor.service.SnapshotQueryService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot APIs: the agents' ingestion endpoint plus list/retrieve/delete.
 *
 * A snapshot is immutable once stored; there is no update endpoint.
 */
@RestController
@RequestMapping("/snapshots")
@RequiredArgsConstructor
public class SnapshotController {
    private final SnapshotIngestService ingestService;
    private final SnapshotQueryService queryService;

    /**
     * Store one agent report with its whole inventory/metrics tree, atomically.
     *
     * @return the stored snapshot, nested, with generated ids
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SnapshotDTO ingest(@Valid @RequestBody SnapshotIngestDTO body) {
        return ingestService.ingest(body);
    }

    /**
     * List snapshots, newest first.
     *
     * @param hostname exact host name, case-insensitive
     * @param timestampGte only snapshots taken at or after this instant
     * @param timestampLte only snapshots taken at or before this instant
     */
    @GetMapping
    public List<SnapshotDTO> list(
            @RequestParam(value = "hostname", required = false) String hostname,
            @RequestParam(value = "timestamp_gte", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant timestampGte,
            @RequestParam(value = "timestamp_lte", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant timestampLte,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "offset", required = false) Integer offset) {
        return queryService.list(new SnapshotFilter(hostname, timestampGte, timestampLte), limit, offset);
    }

    @GetMapping("/{id}")
    public SnapshotDTO get(@PathVariable Long id) {
        return queryService.get(id);
    }

    /** Removes the snapshot and everything collected with it. */
    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable Long id) {
        ingestService.delete(id);
    }
}

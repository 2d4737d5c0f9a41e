package org.caureq.caureqmonitor.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqmonitor.api.dto.SnapshotDTO;
import org.caureq.caureqmonitor.api.dto.SnapshotIngestDTO;
import org.caureq.caureqmonitor.domain.Snapshot;
import org.caureq.caureqmonitor.repo.SnapshotRepo;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Write side for snapshots.
 *
 * The payload is validated before it gets here; this service assembles the entity graph
 * and saves the root once. The cascade inserts every child row in the same transaction,
 * so a constraint violation on any of them rolls the whole snapshot back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SnapshotIngestService {
    private final SnapshotRepo snapshotRepo;
    private final SnapshotAssembler assembler;
    private final SnapshotMapper mapper;

    @Transactional
    public SnapshotDTO ingest(SnapshotIngestDTO d) {
        Snapshot snapshot = assembler.assemble(d);
        // flush here so unique-key violations surface as DataIntegrityViolationException from the repo call
        snapshotRepo.saveAndFlush(snapshot);

        var asset = snapshot.getAssetInfo();
        var metrics = snapshot.getMetricData();
        log.debug("ingested {} ts={} disks={} nics={} updates={} diskUsage={} topConsumers={} processes={}",
                snapshot.getHostname(), snapshot.getTimestamp(),
                asset.getDisks().size(), asset.getNetworkInterfaces().size(), asset.getWindowsUpdates().size(),
                metrics.getDiskUsage().size(), metrics.getTopDiskConsumers().size(),
                metrics.getTopProcesses().getProcesses().size());
        return mapper.toDto(snapshot);
    }

    @Transactional
    public void delete(Long id) {
        var snapshot = snapshotRepo.findById(id)
                .orElseThrow(() -> new NotFoundException("snapshot", id));
        snapshotRepo.delete(snapshot);
        log.info("deleted snapshot {} ({} @ {})", id, snapshot.getHostname(), snapshot.getTimestamp());
    }
}

package org.caureq.caureqmonitor.repo;

import org.caureq.caureqmonitor.domain.Snapshot;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.Optional;

public interface SnapshotRepo extends JpaRepository<Snapshot, Long>, JpaSpecificationExecutor<Snapshot> {

    @EntityGraph(attributePaths = {"assetInfo", "metricData"})
    Page<Snapshot> findAll(Specification<Snapshot> spec, Pageable pageable);

    @EntityGraph(attributePaths = {"assetInfo", "metricData"})
    Optional<Snapshot> findWithDetailsById(Long id);
}

package org.caureq.caureqmonitor.repo;

import org.caureq.caureqmonitor.domain.WindowsUpdate;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.Optional;

public interface WindowsUpdateRepo extends JpaRepository<WindowsUpdate, Long>, JpaSpecificationExecutor<WindowsUpdate> {

    @EntityGraph(attributePaths = {"assetInfo", "assetInfo.snapshot"})
    Page<WindowsUpdate> findAll(Specification<WindowsUpdate> spec, Pageable pageable);

    @EntityGraph(attributePaths = {"assetInfo", "assetInfo.snapshot"})
    Optional<WindowsUpdate> findWithDetailsById(Long id);
}

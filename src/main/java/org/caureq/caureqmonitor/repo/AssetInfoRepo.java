package org.caureq.caureqmonitor.repo;

import org.caureq.caureqmonitor.domain.AssetInfo;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.Optional;

/**
 * One-to-one children come in with the asset row through the entity graph; the
 * disk/interface/update collections are batch-loaded (hibernate.default_batch_fetch_size).
 */
public interface AssetInfoRepo extends JpaRepository<AssetInfo, Long>, JpaSpecificationExecutor<AssetInfo> {

    @EntityGraph(attributePaths = {"snapshot", "os", "system", "cpu", "memory", "virtualization"})
    Page<AssetInfo> findAll(Specification<AssetInfo> spec, Pageable pageable);

    @EntityGraph(attributePaths = {"snapshot", "os", "system", "cpu", "memory", "virtualization"})
    Optional<AssetInfo> findWithDetailsById(Long id);
}

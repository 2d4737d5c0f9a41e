package org.caureq.caureqmonitor.repo;

import jakarta.persistence.criteria.Predicate;
import org.caureq.caureqmonitor.api.dto.AssetFilter;
import org.caureq.caureqmonitor.domain.AssetInfo;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;

import static org.caureq.caureqmonitor.repo.SnapshotSpecs.containsPattern;
import static org.caureq.caureqmonitor.repo.SnapshotSpecs.hasText;

public final class AssetInfoSpecs {
    private AssetInfoSpecs() {}

    public static Specification<AssetInfo> matching(AssetFilter f) {
        return (root, query, cb) -> {
            var predicates = new ArrayList<Predicate>();
            if (hasText(f.osPrettyName())) {
                predicates.add(cb.like(cb.lower(root.join("os").<String>get("prettyName")),
                        containsPattern(f.osPrettyName()), '\\'));
            }
            if (hasText(f.systemManufacturer())) {
                predicates.add(cb.like(cb.lower(root.join("system").<String>get("manufacturer")),
                        containsPattern(f.systemManufacturer()), '\\'));
            }
            if (f.memoryTotalMbGte() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.join("memory").<Integer>get("totalMb"), f.memoryTotalMbGte()));
            }
            if (f.isVm() != null) {
                predicates.add(cb.equal(root.join("virtualization").<Boolean>get("vm"), f.isVm()));
            }
            return cb.and(predicates.toArray(Predicate[]::new));
        };
    }
}

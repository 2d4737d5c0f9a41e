package org.caureq.caureqmonitor.repo;

import jakarta.persistence.criteria.Predicate;
import org.caureq.caureqmonitor.api.dto.WindowsUpdateFilter;
import org.caureq.caureqmonitor.domain.WindowsUpdate;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.ArrayList;

import static org.caureq.caureqmonitor.repo.SnapshotSpecs.containsPattern;
import static org.caureq.caureqmonitor.repo.SnapshotSpecs.hasText;

public final class WindowsUpdateSpecs {
    private WindowsUpdateSpecs() {}

    public static Specification<WindowsUpdate> matching(WindowsUpdateFilter f) {
        return (root, query, cb) -> {
            var predicates = new ArrayList<Predicate>();
            if (hasText(f.kbId())) {
                predicates.add(cb.like(cb.lower(root.<String>get("kbId")), containsPattern(f.kbId()), '\\'));
            }
            if (hasText(f.title())) {
                predicates.add(cb.like(cb.lower(root.<String>get("title")), containsPattern(f.title()), '\\'));
            }
            if (f.installedOnGte() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<Instant>get("installedOn"), f.installedOnGte()));
            }
            if (f.installedOnLte() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.<Instant>get("installedOn"), f.installedOnLte()));
            }
            if (hasText(f.status())) {
                predicates.add(cb.equal(root.<String>get("status"), f.status().trim()));
            }
            return cb.and(predicates.toArray(Predicate[]::new));
        };
    }
}

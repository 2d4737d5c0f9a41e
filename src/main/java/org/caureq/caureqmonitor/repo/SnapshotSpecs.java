package org.caureq.caureqmonitor.repo;

import jakarta.persistence.criteria.Predicate;
import org.caureq.caureqmonitor.api.dto.SnapshotFilter;
import org.caureq.caureqmonitor.domain.Snapshot;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Locale;

public final class SnapshotSpecs {
    private SnapshotSpecs() {}

    public static Specification<Snapshot> matching(SnapshotFilter f) {
        return (root, query, cb) -> {
            var predicates = new ArrayList<Predicate>();
            if (hasText(f.hostname())) {
                predicates.add(cb.equal(cb.lower(root.<String>get("hostname")), f.hostname().trim().toLowerCase(Locale.ROOT)));
            }
            if (f.timestampGte() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<Instant>get("timestamp"), f.timestampGte()));
            }
            if (f.timestampLte() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.<Instant>get("timestamp"), f.timestampLte()));
            }
            return cb.and(predicates.toArray(Predicate[]::new));
        };
    }

    static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }

    static String containsPattern(String s) {
        var escaped = s.trim().toLowerCase(Locale.ROOT)
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return "%" + escaped + "%";
    }
}

package org.caureq.caureqmonitor.service;

import lombok.RequiredArgsConstructor;
import org.caureq.caureqmonitor.api.dto.SnapshotDTO;
import org.caureq.caureqmonitor.api.dto.SnapshotFilter;
import org.caureq.caureqmonitor.config.AppProps;
import org.caureq.caureqmonitor.repo.SnapshotRepo;
import org.caureq.caureqmonitor.repo.SnapshotSpecs;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SnapshotQueryService {
    static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("timestamp"), Sort.Order.desc("id"));

    private final SnapshotRepo snapshotRepo;
    private final SnapshotMapper mapper;
    private final AppProps props;

    public List<SnapshotDTO> list(SnapshotFilter filter, Integer limit, Integer offset) {
        var pageable = Paging.of(limit, offset, NEWEST_FIRST, props.query());
        return snapshotRepo.findAll(SnapshotSpecs.matching(filter), pageable)
                .getContent().stream()
                .map(mapper::toDto)
                .toList();
    }

    public SnapshotDTO get(Long id) {
        return snapshotRepo.findWithDetailsById(id)
                .map(mapper::toDto)
                .orElseThrow(() -> new NotFoundException("snapshot", id));
    }
}

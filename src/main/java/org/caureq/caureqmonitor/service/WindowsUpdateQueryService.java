package org.caureq.caureqmonitor.service;

import lombok.RequiredArgsConstructor;
import org.caureq.caureqmonitor.api.dto.WindowsUpdateDTO;
import org.caureq.caureqmonitor.api.dto.WindowsUpdateFilter;
import org.caureq.caureqmonitor.config.AppProps;
import org.caureq.caureqmonitor.repo.WindowsUpdateRepo;
import org.caureq.caureqmonitor.repo.WindowsUpdateSpecs;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class WindowsUpdateQueryService {
    static final Sort NEWEST_INSTALLED_FIRST = Sort.by(
            Sort.Order.desc("installedOn"),
            Sort.Order.asc("assetInfo.snapshot.hostname"),
            Sort.Order.asc("id"));

    private final WindowsUpdateRepo updateRepo;
    private final SnapshotMapper mapper;
    private final AppProps props;

    public List<WindowsUpdateDTO> list(WindowsUpdateFilter filter, Integer limit, Integer offset) {
        var pageable = Paging.of(limit, offset, NEWEST_INSTALLED_FIRST, props.query());
        return updateRepo.findAll(WindowsUpdateSpecs.matching(filter), pageable)
                .getContent().stream()
                .map(mapper::toDto)
                .toList();
    }

    public WindowsUpdateDTO get(Long id) {
        return updateRepo.findWithDetailsById(id)
                .map(mapper::toDto)
                .orElseThrow(() -> new NotFoundException("windows update", id));
    }
}

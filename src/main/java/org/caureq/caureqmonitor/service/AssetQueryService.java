package org.caureq.caureqmonitor.service;

import lombok.RequiredArgsConstructor;
import org.caureq.caureqmonitor.api.dto.AssetFilter;
import org.caureq.caureqmonitor.api.dto.AssetInfoDTO;
import org.caureq.caureqmonitor.config.AppProps;
import org.caureq.caureqmonitor.repo.AssetInfoRepo;
import org.caureq.caureqmonitor.repo.AssetInfoSpecs;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read side for asset inventories.
 *
 * Responsibilities
 * - Filter assets on OS name, manufacturer, installed memory and VM flag.
 * - Load each page with its one-to-one children joined in and the disk/interface/update
 *   collections batch-fetched, so mapping a page costs a fixed number of queries.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AssetQueryService {
    static final Sort BY_HOSTNAME = Sort.by(Sort.Order.asc("snapshot.hostname"), Sort.Order.asc("id"));

    private final AssetInfoRepo assetRepo;
    private final SnapshotMapper mapper;
    private final AppProps props;

    public List<AssetInfoDTO> list(AssetFilter filter, Integer limit, Integer offset) {
        var pageable = Paging.of(limit, offset, BY_HOSTNAME, props.query());
        return assetRepo.findAll(AssetInfoSpecs.matching(filter), pageable)
                .getContent().stream()
                .map(mapper::toDto)
                .toList();
    }

    public AssetInfoDTO get(Long id) {
        return assetRepo.findWithDetailsById(id)
                .map(mapper::toDto)
                .orElseThrow(() -> new NotFoundException("asset", id));
    }
}

package org.caureq.caureqmonitor.api.dto;

import java.time.OffsetDateTime;

public record SnapshotDTO(
        Long id,
        OffsetDateTime timestamp,
        String hostname,
        AssetInfoDTO assetInfo,
        MetricDataDTO metrics
) {}
